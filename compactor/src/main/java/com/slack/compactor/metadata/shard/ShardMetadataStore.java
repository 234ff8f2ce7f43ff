package com.slack.compactor.metadata.shard;

import com.slack.compactor.metadata.core.ZookeeperMetadataStore;
import com.slack.compactor.proto.config.CompactorConfigs;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.apache.zookeeper.CreateMode;

public class ShardMetadataStore extends ZookeeperMetadataStore<ShardMetadata> {
  public static final String SHARD_METADATA_STORE_ZK_PATH = "/shard";

  public ShardMetadataStore(
      AsyncCuratorFramework curatorFramework,
      CompactorConfigs.ZookeeperConfig zkConfig,
      MeterRegistry meterRegistry) {
    super(
        curatorFramework,
        zkConfig,
        CreateMode.PERSISTENT,
        new ShardMetadataSerializer().toModelSerializer(),
        SHARD_METADATA_STORE_ZK_PATH,
        meterRegistry);
  }

  public static String shardPath(long topicId, int shardIndex) {
    return ShardMetadata.toNodeName(topicId, shardIndex);
  }
}
