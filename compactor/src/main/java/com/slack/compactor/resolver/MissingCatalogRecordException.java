package com.slack.compactor.resolver;

import java.util.OptionalInt;

/**
 * The catalog answered, but the topic or shard this process is configured for does not exist.
 * Retrying does not help, the process has to be reconfigured.
 */
public class MissingCatalogRecordException extends Exception {
  public enum Kind {
    TOPIC,
    SHARD
  }

  private final Kind kind;
  private final String topicName;
  private final Integer shardIndex;

  private MissingCatalogRecordException(
      Kind kind, String topicName, Integer shardIndex, String message) {
    super(message);
    this.kind = kind;
    this.topicName = topicName;
    this.shardIndex = shardIndex;
  }

  public static MissingCatalogRecordException missingTopic(String topicName) {
    return new MissingCatalogRecordException(
        Kind.TOPIC, topicName, null, String.format("Topic %s not found", topicName));
  }

  public static MissingCatalogRecordException missingShard(String topicName, int shardIndex) {
    return new MissingCatalogRecordException(
        Kind.SHARD,
        topicName,
        shardIndex,
        String.format("Topic %s and Shard Index %d not found", topicName, shardIndex));
  }

  public Kind getKind() {
    return kind;
  }

  public String getTopicName() {
    return topicName;
  }

  public OptionalInt getShardIndex() {
    return shardIndex == null ? OptionalInt.empty() : OptionalInt.of(shardIndex);
  }
}
