package com.slack.distributor.ring;

/** Work done against a single replica. Failures are reported by throwing. */
@FunctionalInterface
public interface ReplicaCallback<T> {
  T call(IngesterDesc ingester) throws Exception;
}
