package com.slack.distributor.query;

import java.util.List;

/**
 * Merges the answers of several replicas into one result with a single entry per series. Runs
 * after all replica calls have settled, on one thread.
 */
public interface ReplicaResultMerger<T, R> {
  R merge(List<T> replicaResults);
}
