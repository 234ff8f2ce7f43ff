package com.slack.compactor.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.slack.compactor.backoff.BackoffConfig;
import com.slack.compactor.proto.config.CompactorConfigs;

/**
 * ValidateCompactorConfig rejects a config the compactor can't run with, before any connection to
 * the catalog is made. Tuning values left unset (zero) are valid, they fall back to the defaults in
 * {@link CompactorRuntimeConfig}.
 */
public class ValidateCompactorConfig {

  public static void validateConfig(CompactorConfigs.CompactorConfig compactorConfig) {
    checkArgument(
        !Strings.isNullOrEmpty(compactorConfig.getTopicName()),
        "CompactorConfig topicName can't be empty");
    validateZookeeperConfig(compactorConfig.getZookeeperConfig());
    validateBackoffConfig(compactorConfig.getBackoffConfig());
    validateTuning(compactorConfig);
  }

  private static void validateZookeeperConfig(CompactorConfigs.ZookeeperConfig zkConfig) {
    checkArgument(
        !Strings.isNullOrEmpty(zkConfig.getZkConnectString()),
        "ZookeeperConfig zkConnectString can't be empty");
    checkArgument(
        !Strings.isNullOrEmpty(zkConfig.getZkPathPrefix()),
        "ZookeeperConfig zkPathPrefix can't be empty");
    checkArgument(
        zkConfig.getZkConnectionTimeoutMs() > 0,
        "ZookeeperConfig zkConnectionTimeoutMs must be positive");
    checkArgument(
        zkConfig.getZkSessionTimeoutMs() >= zkConfig.getZkConnectionTimeoutMs(),
        "ZookeeperConfig zkSessionTimeoutMs cannot be less than zkConnectionTimeoutMs");
    checkArgument(
        zkConfig.getSleepBetweenRetriesMs() >= 0,
        "ZookeeperConfig sleepBetweenRetriesMs cannot be negative");
  }

  private static void validateBackoffConfig(CompactorConfigs.BackoffConfig backoffConfig) {
    checkArgument(
        backoffConfig.getInitBackoffMs() >= 0, "BackoffConfig initBackoffMs cannot be negative");
    checkArgument(
        backoffConfig.getMaxBackoffMs() >= 0, "BackoffConfig maxBackoffMs cannot be negative");
    checkArgument(
        backoffConfig.getBase() == 0 || backoffConfig.getBase() >= 1.0,
        "BackoffConfig base must be at least 1.0");
    checkArgument(
        backoffConfig.getDeadlineMs() >= 0, "BackoffConfig deadlineMs cannot be negative");
    checkArgument(
        backoffConfig.getMaxAttempts() >= 0, "BackoffConfig maxAttempts cannot be negative");
    // defaults are filled in here, so this also catches a max backoff below the default init
    BackoffConfig.fromConfig(backoffConfig);
  }

  private static void validateTuning(CompactorConfigs.CompactorConfig compactorConfig) {
    checkArgument(
        compactorConfig.getPartitionConcurrency() >= 0,
        "CompactorConfig partitionConcurrency cannot be negative");
    checkArgument(
        compactorConfig.getJobConcurrency() >= 0,
        "CompactorConfig jobConcurrency cannot be negative");
    checkArgument(
        compactorConfig.getPartitionMinuteThreshold() >= 0,
        "CompactorConfig partitionMinuteThreshold cannot be negative");
    checkArgument(
        compactorConfig.getMaxDesiredFileSizeBytes() >= 0,
        "CompactorConfig maxDesiredFileSizeBytes cannot be negative");
    checkArgument(
        isPercentageOrUnset(compactorConfig.getPercentageMaxFileSize()),
        "CompactorConfig percentageMaxFileSize must be between 0 and 100, exclusive");
    checkArgument(
        isPercentageOrUnset(compactorConfig.getSplitPercentage()),
        "CompactorConfig splitPercentage must be between 0 and 100, exclusive");
    checkArgument(
        compactorConfig.getPartitionTimeoutSecs() >= 0,
        "CompactorConfig partitionTimeoutSecs cannot be negative");
  }

  private static boolean isPercentageOrUnset(int value) {
    return value >= 0 && value < 100;
  }
}
