package com.slack.compactor.metadata.catalog;

import com.slack.compactor.metadata.core.InternalMetadataStoreException;
import com.slack.compactor.metadata.shard.ShardMetadata;
import com.slack.compactor.metadata.topic.TopicMetadata;
import java.util.Optional;

/**
 * Read access to the catalog of topics and shards.
 *
 * <p>A lookup that reaches the catalog and finds nothing returns an empty optional. A lookup that
 * fails to reach the catalog throws {@link InternalMetadataStoreException}; retrying it may
 * succeed.
 *
 * <p>A topic name that can never be stored, such as an empty name, {@code "."}, {@code ".."}, or
 * one holding a {@code '/'} or a control character, is reported as not found rather than as a
 * failure.
 */
public interface Catalog {
  Optional<TopicMetadata> getTopicByName(String topicName);

  Optional<ShardMetadata> getShardByTopicIdAndShardIndex(long topicId, int shardIndex);
}
