package com.slack.compactor.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.compactor.backoff.BackoffConfig;
import com.slack.compactor.proto.config.CompactorConfigs;
import java.time.Duration;
import java.util.Objects;

/**
 * CompactorRuntimeConfig is everything the compaction components need to run, built once the shard
 * id has been resolved against the catalog. It is never modified afterwards.
 */
public class CompactorRuntimeConfig {
  public static final int DEFAULT_PARTITION_CONCURRENCY = 10;
  public static final int DEFAULT_JOB_CONCURRENCY = 5;
  public static final long DEFAULT_PARTITION_MINUTE_THRESHOLD = 10;
  public static final long DEFAULT_MAX_DESIRED_FILE_SIZE_BYTES = 100L * 1024 * 1024;
  public static final int DEFAULT_PERCENTAGE_MAX_FILE_SIZE = 20;
  public static final int DEFAULT_SPLIT_PERCENTAGE = 80;
  public static final long DEFAULT_PARTITION_TIMEOUT_SECS = 1800;

  public final long shardId;
  public final BackoffConfig backoffConfig;

  // Number of partitions compacted in parallel. Usually larger than the job concurrency since one
  // partition can spawn multiple compaction jobs.
  public final int partitionConcurrency;
  public final int jobConcurrency;

  public final long partitionMinuteThreshold;

  // A target, not a guarantee.
  public final long maxDesiredFileSizeBytes;

  // A compacted result smaller than this percentage of the max desired file size is not split.
  public final int percentageMaxFileSize;

  // Split point for a result that is neither too small nor larger than the max desired file size.
  public final int splitPercentage;

  public final Duration partitionTimeout;

  public CompactorRuntimeConfig(
      long shardId,
      BackoffConfig backoffConfig,
      int partitionConcurrency,
      int jobConcurrency,
      long partitionMinuteThreshold,
      long maxDesiredFileSizeBytes,
      int percentageMaxFileSize,
      int splitPercentage,
      Duration partitionTimeout) {
    checkArgument(shardId >= 0, "shardId can't be negative");
    checkArgument(backoffConfig != null, "backoffConfig can't be null");
    checkArgument(partitionConcurrency > 0, "partitionConcurrency must be positive");
    checkArgument(jobConcurrency > 0, "jobConcurrency must be positive");
    checkArgument(partitionMinuteThreshold > 0, "partitionMinuteThreshold must be positive");
    checkArgument(maxDesiredFileSizeBytes > 0, "maxDesiredFileSizeBytes must be positive");
    checkArgument(
        percentageMaxFileSize > 0 && percentageMaxFileSize < 100,
        "percentageMaxFileSize must be between 0 and 100, exclusive");
    checkArgument(
        splitPercentage > 0 && splitPercentage < 100,
        "splitPercentage must be between 0 and 100, exclusive");
    checkArgument(
        partitionTimeout != null && !partitionTimeout.isNegative() && !partitionTimeout.isZero(),
        "partitionTimeout must be positive");

    this.shardId = shardId;
    this.backoffConfig = backoffConfig;
    this.partitionConcurrency = partitionConcurrency;
    this.jobConcurrency = jobConcurrency;
    this.partitionMinuteThreshold = partitionMinuteThreshold;
    this.maxDesiredFileSizeBytes = maxDesiredFileSizeBytes;
    this.percentageMaxFileSize = percentageMaxFileSize;
    this.splitPercentage = splitPercentage;
    this.partitionTimeout = partitionTimeout;
  }

  /** Unset (zero) tuning values in the proto fall back to the defaults above. */
  public static CompactorRuntimeConfig fromConfig(
      long shardId, CompactorConfigs.CompactorConfig compactorConfig) {
    return new CompactorRuntimeConfig(
        shardId,
        BackoffConfig.fromConfig(compactorConfig.getBackoffConfig()),
        orDefault(compactorConfig.getPartitionConcurrency(), DEFAULT_PARTITION_CONCURRENCY),
        orDefault(compactorConfig.getJobConcurrency(), DEFAULT_JOB_CONCURRENCY),
        orDefault(
            compactorConfig.getPartitionMinuteThreshold(), DEFAULT_PARTITION_MINUTE_THRESHOLD),
        orDefault(
            compactorConfig.getMaxDesiredFileSizeBytes(), DEFAULT_MAX_DESIRED_FILE_SIZE_BYTES),
        orDefault(compactorConfig.getPercentageMaxFileSize(), DEFAULT_PERCENTAGE_MAX_FILE_SIZE),
        orDefault(compactorConfig.getSplitPercentage(), DEFAULT_SPLIT_PERCENTAGE),
        Duration.ofSeconds(
            orDefault(compactorConfig.getPartitionTimeoutSecs(), DEFAULT_PARTITION_TIMEOUT_SECS)));
  }

  private static int orDefault(int value, int defaultValue) {
    return value == 0 ? defaultValue : value;
  }

  private static long orDefault(long value, long defaultValue) {
    return value == 0 ? defaultValue : value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CompactorRuntimeConfig that = (CompactorRuntimeConfig) o;
    return shardId == that.shardId
        && partitionConcurrency == that.partitionConcurrency
        && jobConcurrency == that.jobConcurrency
        && partitionMinuteThreshold == that.partitionMinuteThreshold
        && maxDesiredFileSizeBytes == that.maxDesiredFileSizeBytes
        && percentageMaxFileSize == that.percentageMaxFileSize
        && splitPercentage == that.splitPercentage
        && backoffConfig.equals(that.backoffConfig)
        && partitionTimeout.equals(that.partitionTimeout);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        shardId,
        backoffConfig,
        partitionConcurrency,
        jobConcurrency,
        partitionMinuteThreshold,
        maxDesiredFileSizeBytes,
        percentageMaxFileSize,
        splitPercentage,
        partitionTimeout);
  }

  @Override
  public String toString() {
    return "CompactorRuntimeConfig{"
        + "shardId="
        + shardId
        + ", backoffConfig="
        + backoffConfig
        + ", partitionConcurrency="
        + partitionConcurrency
        + ", jobConcurrency="
        + jobConcurrency
        + ", partitionMinuteThreshold="
        + partitionMinuteThreshold
        + ", maxDesiredFileSizeBytes="
        + maxDesiredFileSizeBytes
        + ", percentageMaxFileSize="
        + percentageMaxFileSize
        + ", splitPercentage="
        + splitPercentage
        + ", partitionTimeout="
        + partitionTimeout
        + '}';
  }
}
