package com.slack.compactor.metadata.topic;

import com.slack.compactor.metadata.core.ZookeeperMetadataStore;
import com.slack.compactor.proto.config.CompactorConfigs;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.curator.x.async.AsyncCuratorFramework;
import org.apache.zookeeper.CreateMode;

public class TopicMetadataStore extends ZookeeperMetadataStore<TopicMetadata> {
  public static final String TOPIC_METADATA_STORE_ZK_PATH = "/topic";

  public TopicMetadataStore(
      AsyncCuratorFramework curatorFramework,
      CompactorConfigs.ZookeeperConfig zkConfig,
      MeterRegistry meterRegistry) {
    super(
        curatorFramework,
        zkConfig,
        CreateMode.PERSISTENT,
        new TopicMetadataSerializer().toModelSerializer(),
        TOPIC_METADATA_STORE_ZK_PATH,
        meterRegistry);
  }
}
