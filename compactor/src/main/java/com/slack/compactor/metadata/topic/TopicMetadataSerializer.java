package com.slack.compactor.metadata.topic;

import com.google.protobuf.InvalidProtocolBufferException;
import com.slack.compactor.metadata.core.MetadataSerializer;
import com.slack.compactor.proto.metadata.Metadata;

public class TopicMetadataSerializer implements MetadataSerializer<TopicMetadata> {
  private static Metadata.TopicMetadata toTopicMetadataProto(TopicMetadata topicMetadata) {
    return Metadata.TopicMetadata.newBuilder()
        .setName(topicMetadata.name)
        .setTopicId(topicMetadata.topicId)
        .build();
  }

  private static TopicMetadata fromTopicMetadataProto(Metadata.TopicMetadata topicMetadata) {
    return new TopicMetadata(topicMetadata.getName(), topicMetadata.getTopicId());
  }

  @Override
  public String toJsonStr(TopicMetadata metadata) throws InvalidProtocolBufferException {
    if (metadata == null) throw new IllegalArgumentException("metadata object can't be null");

    return printer.print(toTopicMetadataProto(metadata));
  }

  @Override
  public TopicMetadata fromJsonStr(String data) throws InvalidProtocolBufferException {
    Metadata.TopicMetadata.Builder topicMetadataBuilder = Metadata.TopicMetadata.newBuilder();
    parser.merge(data, topicMetadataBuilder);
    return fromTopicMetadataProto(topicMetadataBuilder.build());
  }
}
