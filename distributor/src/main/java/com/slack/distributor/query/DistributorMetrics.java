package com.slack.distributor.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Metrics of the read path, registered on the injected registry. */
public class DistributorMetrics {
  public static final String INGESTER_QUERIES = "distributor_ingester_queries_total";
  public static final String INGESTER_QUERY_FAILURES = "distributor_ingester_query_failures_total";
  public static final String QUERY_DURATION = "distributor_query_duration_seconds";

  public static final String INGESTER_TAG = "ingester";
  public static final String METHOD_TAG = "method";
  public static final String STATUS_CODE_TAG = "status_code";

  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_ERROR = "error";
  public static final String STATUS_CANCEL = "cancel";

  private final MeterRegistry meterRegistry;

  public DistributorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordQueryAttempt(String ingesterAddr) {
    meterRegistry.counter(INGESTER_QUERIES, INGESTER_TAG, ingesterAddr).increment();
  }

  /** Cancelled calls are not failures and must not be recorded here. */
  public void recordQueryFailure(String ingesterAddr) {
    meterRegistry.counter(INGESTER_QUERY_FAILURES, INGESTER_TAG, ingesterAddr).increment();
  }

  public void recordQueryDuration(String method, String statusCode, long durationNanos) {
    Timer.builder(QUERY_DURATION)
        .description("Time spent executing queries against ingesters.")
        .serviceLevelObjectives(
            Duration.ofMillis(10),
            Duration.ofMillis(50),
            Duration.ofMillis(100),
            Duration.ofMillis(500),
            Duration.ofSeconds(1),
            Duration.ofSeconds(5),
            Duration.ofSeconds(10))
        .tags(METHOD_TAG, method, STATUS_CODE_TAG, statusCode)
        .register(meterRegistry)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }
}
