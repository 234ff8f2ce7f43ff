package com.slack.compactor.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.slack.compactor.proto.config.CompactorConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * CompactorConfig loads the config file of a compactor process. The file is either json or yaml,
 * and yaml files may refer to environment variables as ${NAME}.
 */
public class CompactorConfig {

  // Parse a json string as a CompactorConfig proto struct.
  @VisibleForTesting
  static CompactorConfigs.CompactorConfig fromJsonConfig(String jsonStr)
      throws InvalidProtocolBufferException {
    CompactorConfigs.CompactorConfig.Builder compactorConfigBuilder =
        CompactorConfigs.CompactorConfig.newBuilder();
    JsonFormat.parser().ignoringUnknownFields().merge(jsonStr, compactorConfigBuilder);
    CompactorConfigs.CompactorConfig compactorConfig = compactorConfigBuilder.build();
    ValidateCompactorConfig.validateConfig(compactorConfig);
    return compactorConfig;
  }

  // Parse a yaml string as a CompactorConfig proto struct
  public static CompactorConfigs.CompactorConfig fromYamlConfig(String yamlStr)
      throws InvalidProtocolBufferException, JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static CompactorConfigs.CompactorConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver)
      throws InvalidProtocolBufferException, JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  public static CompactorConfigs.CompactorConfig fromFile(Path cfgFilePath) throws IOException {
    if (Files.notExists(cfgFilePath)) {
      throw new IllegalArgumentException("Missing config file at: " + cfgFilePath.toAbsolutePath());
    }

    String filename = cfgFilePath.getFileName().toString();
    if (filename.endsWith(".yaml") || filename.endsWith(".yml")) {
      return fromYamlConfig(Files.readString(cfgFilePath));
    } else if (filename.endsWith(".json")) {
      return fromJsonConfig(Files.readString(cfgFilePath));
    } else {
      throw new IllegalArgumentException(
          "Invalid config file format provided - must be either .json or .yaml");
    }
  }

  private CompactorConfig() {}
}
