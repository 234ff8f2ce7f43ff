package com.slack.compactor.metadata.shard;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.compactor.metadata.core.CompactorMetadata;

/**
 * A shard of a topic. A shard is addressed by the id of its topic and its index within that topic,
 * and both are folded into the node name so a lookup is a single read.
 */
public class ShardMetadata extends CompactorMetadata {
  public final long shardId;
  public final long topicId;
  public final int shardIndex;

  public ShardMetadata(long shardId, long topicId, int shardIndex) {
    super(toNodeName(topicId, shardIndex));
    checkArgument(shardId >= 0, "shardId can't be negative");
    checkArgument(topicId >= 0, "topicId can't be negative");
    this.shardId = shardId;
    this.topicId = topicId;
    this.shardIndex = shardIndex;
  }

  public static String toNodeName(long topicId, int shardIndex) {
    return topicId + "_" + shardIndex;
  }

  public long getShardId() {
    return shardId;
  }

  public long getTopicId() {
    return topicId;
  }

  public int getShardIndex() {
    return shardIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ShardMetadata that)) return false;
    if (!super.equals(o)) return false;
    return shardId == that.shardId && topicId == that.topicId && shardIndex == that.shardIndex;
  }

  @Override
  public int hashCode() {
    int result = super.hashCode();
    result = 31 * result + Long.hashCode(shardId);
    result = 31 * result + Long.hashCode(topicId);
    result = 31 * result + shardIndex;
    return result;
  }

  @Override
  public String toString() {
    return "ShardMetadata{"
        + "name='"
        + name
        + '\''
        + ", shardId="
        + shardId
        + ", topicId="
        + topicId
        + ", shardIndex="
        + shardIndex
        + '}';
  }
}
