package com.slack.compactor.metadata.shard;

import com.google.protobuf.InvalidProtocolBufferException;
import com.slack.compactor.metadata.core.MetadataSerializer;
import com.slack.compactor.proto.metadata.Metadata;

public class ShardMetadataSerializer implements MetadataSerializer<ShardMetadata> {
  private static Metadata.ShardMetadata toShardMetadataProto(ShardMetadata shardMetadata) {
    return Metadata.ShardMetadata.newBuilder()
        .setName(shardMetadata.name)
        .setShardId(shardMetadata.shardId)
        .setTopicId(shardMetadata.topicId)
        .setShardIndex(shardMetadata.shardIndex)
        .build();
  }

  private static ShardMetadata fromShardMetadataProto(Metadata.ShardMetadata shardMetadata) {
    return new ShardMetadata(
        shardMetadata.getShardId(), shardMetadata.getTopicId(), shardMetadata.getShardIndex());
  }

  @Override
  public String toJsonStr(ShardMetadata metadata) throws InvalidProtocolBufferException {
    if (metadata == null) throw new IllegalArgumentException("metadata object can't be null");

    return printer.print(toShardMetadataProto(metadata));
  }

  @Override
  public ShardMetadata fromJsonStr(String data) throws InvalidProtocolBufferException {
    Metadata.ShardMetadata.Builder shardMetadataBuilder = Metadata.ShardMetadata.newBuilder();
    parser.merge(data, shardMetadataBuilder);
    return fromShardMetadataProto(shardMetadataBuilder.build());
  }
}
