package com.slack.compactor.metadata.topic;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.compactor.metadata.core.CompactorMetadata;

/**
 * A topic registered in the catalog. The node name is the human assigned topic name, the topic id
 * is the durable identifier shards refer to.
 */
public class TopicMetadata extends CompactorMetadata {
  public final long topicId;

  public TopicMetadata(String name, long topicId) {
    super(name);
    checkArgument(topicId >= 0, "topicId can't be negative");
    this.topicId = topicId;
  }

  public long getTopicId() {
    return topicId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TopicMetadata that)) return false;
    if (!super.equals(o)) return false;
    return topicId == that.topicId;
  }

  @Override
  public int hashCode() {
    int result = super.hashCode();
    result = 31 * result + Long.hashCode(topicId);
    return result;
  }

  @Override
  public String toString() {
    return "TopicMetadata{" + "name='" + name + '\'' + ", topicId=" + topicId + '}';
  }
}
