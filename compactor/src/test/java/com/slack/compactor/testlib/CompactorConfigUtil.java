package com.slack.compactor.testlib;

import com.slack.compactor.proto.config.CompactorConfigs;

public class CompactorConfigUtil {
  public static CompactorConfigs.ZookeeperConfig makeZookeeperConfig(String zkConnectString) {
    return CompactorConfigs.ZookeeperConfig.newBuilder()
        .setZkConnectString(zkConnectString)
        .setZkPathPrefix("compactorTest")
        .setZkSessionTimeoutMs(10000)
        .setZkConnectionTimeoutMs(1000)
        .setSleepBetweenRetriesMs(500)
        .build();
  }

  public static CompactorConfigs.CompactorConfig makeCompactorConfig(
      String zkConnectString, String topicName, int shardIndex) {
    return CompactorConfigs.CompactorConfig.newBuilder()
        .setClusterConfig(
            CompactorConfigs.ClusterConfig.newBuilder()
                .setClusterName("test_cluster")
                .setEnv("test")
                .build())
        .setZookeeperConfig(makeZookeeperConfig(zkConnectString))
        .setBackoffConfig(
            CompactorConfigs.BackoffConfig.newBuilder()
                .setInitBackoffMs(10)
                .setMaxBackoffMs(100)
                .setBase(2.0)
                .build())
        .setTopicName(topicName)
        .setShardIndex(shardIndex)
        .setPartitionConcurrency(4)
        .setJobConcurrency(2)
        .build();
  }
}
