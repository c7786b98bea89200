package com.slack.distributor.ring;

import io.grpc.Context;
import java.time.Duration;
import java.util.List;

/**
 * Runs a callback against every replica of a replication set in parallel and waits for quorum.
 *
 * <p>Implementations return the results of the successful replicas once {@link
 * ReplicationSet#minSuccess()} of them succeeded. They throw {@link
 * com.slack.distributor.errors.QuorumFailureException} once more than {@link
 * ReplicationSet#maxErrors} replicas failed, and {@link
 * com.slack.distributor.errors.QueryCancelledException} when the calling context is cancelled.
 * Replica outcomes that are themselves cancellations never count as failures.
 */
public interface ReplicaExecutor {
  <T> List<T> execute(
      Context context,
      ReplicationSet replicationSet,
      Duration extraDelay,
      ReplicaCallback<T> callback);
}
