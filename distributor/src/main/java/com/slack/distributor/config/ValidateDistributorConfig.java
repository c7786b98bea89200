package com.slack.distributor.config;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.HashSet;
import java.util.Set;

public class ValidateDistributorConfig {

  /**
   * ValidateConfig ensures that the config values are consistent with each other. The classes
   * using a config are still expected to check the values they depend on.
   */
  public static void validateConfig(DistributorConfig config) {
    checkArgument(config.queryConfig != null, "queryConfig can't be null");
    checkArgument(config.ringConfig != null, "ringConfig can't be null");
    validateQueryConfig(config.queryConfig);
    validateRingConfig(config.ringConfig);
  }

  private static void validateQueryConfig(DistributorConfig.QueryConfig queryConfig) {
    checkArgument(
        queryConfig.extraQueryDelayMs >= 0, "QueryConfig extraQueryDelayMs cannot be negative");
    checkArgument(
        queryConfig.queryTimeoutMs >= 1000, "QueryConfig queryTimeoutMs cannot less than 1000ms");
    checkArgument(
        queryConfig.queryTimeoutMs > queryConfig.extraQueryDelayMs,
        "QueryConfig queryTimeoutMs must be higher than extraQueryDelayMs");
  }

  private static void validateRingConfig(DistributorConfig.RingConfig ringConfig) {
    checkArgument(
        ringConfig.replicationFactor >= 1, "RingConfig replicationFactor must be at least 1");
    checkArgument(ringConfig.ingesters != null, "RingConfig ingesters can't be null");

    Set<String> addresses = new HashSet<>();
    for (DistributorConfig.IngesterConfig ingester : ringConfig.ingesters) {
      checkArgument(
          ingester.addr != null && !ingester.addr.isEmpty(),
          "RingConfig ingester addr can't be empty");
      checkArgument(
          addresses.add(ingester.addr), "RingConfig has duplicate ingester %s", ingester.addr);
      checkArgument(ingester.state != null, "RingConfig ingester %s has no state", ingester.addr);
      checkArgument(
          ingester.tokens != null, "RingConfig ingester %s has no tokens", ingester.addr);
    }
  }
}
