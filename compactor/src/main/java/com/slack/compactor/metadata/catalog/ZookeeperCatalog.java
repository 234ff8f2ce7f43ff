package com.slack.compactor.metadata.catalog;

import com.slack.compactor.metadata.shard.ShardMetadata;
import com.slack.compactor.metadata.shard.ShardMetadataStore;
import com.slack.compactor.metadata.topic.TopicMetadata;
import com.slack.compactor.metadata.topic.TopicMetadataStore;
import com.slack.compactor.proto.config.CompactorConfigs;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.apache.zookeeper.common.PathUtils;

/** Catalog backed by the topic and shard stores in Zookeeper. */
public class ZookeeperCatalog implements Catalog {
  private final TopicMetadataStore topicMetadataStore;
  private final ShardMetadataStore shardMetadataStore;

  public ZookeeperCatalog(
      AsyncCuratorFramework curatorFramework,
      CompactorConfigs.ZookeeperConfig zkConfig,
      MeterRegistry meterRegistry) {
    this(
        new TopicMetadataStore(curatorFramework, zkConfig, meterRegistry),
        new ShardMetadataStore(curatorFramework, zkConfig, meterRegistry));
  }

  public ZookeeperCatalog(
      TopicMetadataStore topicMetadataStore, ShardMetadataStore shardMetadataStore) {
    this.topicMetadataStore = topicMetadataStore;
    this.shardMetadataStore = shardMetadataStore;
  }

  @Override
  public Optional<TopicMetadata> getTopicByName(String topicName) {
    if (!isValidNodeName(topicName)) {
      return Optional.empty();
    }
    return topicMetadataStore.findSync(topicName);
  }

  @Override
  public Optional<ShardMetadata> getShardByTopicIdAndShardIndex(long topicId, int shardIndex) {
    return shardMetadataStore.findSync(ShardMetadataStore.shardPath(topicId, shardIndex));
  }

  public void createTopic(TopicMetadata topicMetadata) {
    topicMetadataStore.createSync(topicMetadata);
  }

  public void createShard(ShardMetadata shardMetadata) {
    shardMetadataStore.createSync(shardMetadata);
  }

  // a topic is one node under the topic store, so "/", "." and ".." can never name one
  private static boolean isValidNodeName(String name) {
    if (name == null || name.isEmpty() || name.contains("/")) {
      return false;
    }
    try {
      PathUtils.validatePath("/" + name);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
