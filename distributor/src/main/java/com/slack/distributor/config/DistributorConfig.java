package com.slack.distributor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.slack.distributor.ring.IngesterDesc;
import com.slack.distributor.ring.IngesterState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/** DistributorConfig contains the config params of the read path. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DistributorConfig {

  private static final ObjectMapper JSON_READER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public QueryConfig queryConfig = new QueryConfig();
  public RingConfig ringConfig = new RingConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class QueryConfig {
    // When true writes were sharded by the full label set, so a metric name can't narrow a read
    public boolean shardByAllLabels = false;
    public long extraQueryDelayMs = 0;
    public long queryTimeoutMs = 30000;

    public Duration getExtraQueryDelay() {
      return Duration.ofMillis(extraQueryDelayMs);
    }

    public Duration getQueryTimeout() {
      return Duration.ofMillis(queryTimeoutMs);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class RingConfig {
    public int replicationFactor = 3;
    public List<IngesterConfig> ingesters = new ArrayList<>();

    public List<IngesterDesc> toIngesterDescs() {
      return ingesters.stream()
          .map(
              ingester ->
                  new IngesterDesc(ingester.addr, ingester.zone, ingester.state, ingester.tokens))
          .collect(Collectors.toList());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class IngesterConfig {
    public String addr;
    public String zone = "";
    public IngesterState state = IngesterState.ACTIVE;
    public List<Long> tokens = new ArrayList<>();
  }

  // Parse a json string as a DistributorConfig.
  @VisibleForTesting
  static DistributorConfig fromJsonConfig(String jsonStr) throws JsonProcessingException {
    DistributorConfig config = JSON_READER.readValue(jsonStr, DistributorConfig.class);
    ValidateDistributorConfig.validateConfig(config);
    return config;
  }

  // Parse a yaml string as a DistributorConfig, substituting ${VAR} with environment variables.
  public static DistributorConfig fromYamlConfig(String yamlStr) throws JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static DistributorConfig fromYamlConfig(String yamlStr, StringLookup variableResolver)
      throws JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  public static DistributorConfig fromFile(Path cfgFilePath) throws IOException {
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
}
