package com.slack.compactor.resolver;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.slack.compactor.backoff.BackoffConfig;
import com.slack.compactor.backoff.RetryingInvoker;
import com.slack.compactor.metadata.catalog.Catalog;
import com.slack.compactor.metadata.shard.ShardMetadata;
import com.slack.compactor.metadata.topic.TopicMetadata;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ShardIdResolver turns the configured topic name and shard index into the shard id held by the
 * catalog.
 *
 * <p>The topic is looked up first, and only its topic id is used to look up the shard. Each lookup
 * runs in its own retry loop, so a failure while fetching the shard never repeats the topic
 * lookup. Failing to reach the catalog is retried according to the backoff config. A catalog that
 * answers without a record ends the resolution with a {@link MissingCatalogRecordException}.
 *
 * <p>Nothing is cached between calls.
 */
public class ShardIdResolver {
  private static final Logger LOG = LoggerFactory.getLogger(ShardIdResolver.class);

  public static final String TOPIC_LOOKUP_TASK = "topic_of_given_name";
  public static final String SHARD_LOOKUP_TASK = "shard_of_given_index";

  private final Catalog catalog;
  private final RetryingInvoker retryingInvoker;

  public ShardIdResolver(Catalog catalog, RetryingInvoker retryingInvoker) {
    this.catalog = catalog;
    this.retryingInvoker = retryingInvoker;
  }

  public static long fetchShardId(
      Catalog catalog,
      BackoffConfig backoffConfig,
      MeterRegistry meterRegistry,
      String topicName,
      int shardIndex)
      throws MissingCatalogRecordException {
    return new ShardIdResolver(catalog, new RetryingInvoker(backoffConfig, meterRegistry))
        .resolve(topicName, shardIndex);
  }

  public long resolve(String topicName, int shardIndex) throws MissingCatalogRecordException {
    checkArgument(!Strings.isNullOrEmpty(topicName), "topicName can't be null or empty");

    Optional<TopicMetadata> topic =
        retryingInvoker.retryAllErrors(TOPIC_LOOKUP_TASK, () -> catalog.getTopicByName(topicName));
    if (topic.isEmpty()) {
      throw MissingCatalogRecordException.missingTopic(topicName);
    }
    long topicId = topic.get().topicId;
    LOG.info("Resolved topic {} to topic id {}", topicName, topicId);

    Optional<ShardMetadata> shard =
        retryingInvoker.retryAllErrors(
            SHARD_LOOKUP_TASK, () -> catalog.getShardByTopicIdAndShardIndex(topicId, shardIndex));
    if (shard.isEmpty()) {
      throw MissingCatalogRecordException.missingShard(topicName, shardIndex);
    }

    long shardId = shard.get().shardId;
    LOG.info(
        "Resolved topic {} and shard index {} to shard id {}", topicName, shardIndex, shardId);
    return shardId;
  }
}
