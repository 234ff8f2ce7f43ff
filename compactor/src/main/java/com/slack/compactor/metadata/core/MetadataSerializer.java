package com.slack.compactor.metadata.core;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import org.apache.curator.x.async.modeled.ModelSerializer;

/**
 * An interface that helps us covert catalog metadata to and from json, going through the protobuf
 * representation of the node.
 */
public interface MetadataSerializer<T extends CompactorMetadata> {
  JsonFormat.Printer printer = JsonFormat.printer().includingDefaultValueFields();
  JsonFormat.Parser parser = JsonFormat.parser().ignoringUnknownFields();

  String toJsonStr(T metadata) throws InvalidProtocolBufferException;

  T fromJsonStr(String data) throws InvalidProtocolBufferException;

  default ModelSerializer<T> toModelSerializer() {
    return new ModelSerializer<>() {
      @Override
      public byte[] serialize(T model) {
        if (model == null) {
          return null;
        }

        try {
          return toJsonStr(model).getBytes(UTF_8);
        } catch (Exception e) {
          throw new IllegalArgumentException(e);
        }
      }

      @Override
      public T deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
          return null;
        }

        try {
          return fromJsonStr(new String(bytes, UTF_8));
        } catch (Exception e) {
          throw new IllegalStateException(e);
        }
      }
    };
  }
}
