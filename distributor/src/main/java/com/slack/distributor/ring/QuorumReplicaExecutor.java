package com.slack.distributor.ring;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slack.distributor.errors.QueryCancelledException;
import com.slack.distributor.errors.QuorumFailureException;
import io.grpc.Context;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ReplicaExecutor}. Every replica call runs on its own pooled thread inside a child
 * of the caller's gRPC context, so cancelling the caller, or the caller's deadline expiring,
 * reaches every in-flight call. The child context is cancelled as soon as {@link #execute}
 * returns, which aborts the calls that were not needed for quorum.
 *
 * <p>With a positive extra delay only the first {@link ReplicationSet#minSuccess()} replicas are
 * queried right away. Each remaining replica starts once the delay has passed or once one of the
 * started calls has failed, whichever happens first.
 */
public class QuorumReplicaExecutor implements ReplicaExecutor, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(QuorumReplicaExecutor.class);

  private final ListeningExecutorService executorService;

  public QuorumReplicaExecutor() {
    this(
        MoreExecutors.listeningDecorator(
            Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                    .setNameFormat("replica-query-%d")
                    .setDaemon(true)
                    .build())));
  }

  @VisibleForTesting
  QuorumReplicaExecutor(ListeningExecutorService executorService) {
    this.executorService = executorService;
  }

  @Override
  public <T> List<T> execute(
      Context context,
      ReplicationSet replicationSet,
      Duration extraDelay,
      ReplicaCallback<T> callback) {
    if (context.isCancelled()) {
      throw cancelled(context);
    }

    List<IngesterDesc> ingesters = replicationSet.ingesters;
    int minSuccess = replicationSet.minSuccess();
    if (minSuccess == 0) {
      return List.of();
    }

    BlockingQueue<Outcome<T>> outcomes = new LinkedBlockingQueue<>();
    Semaphore forceStart = new Semaphore(0);
    boolean delayExtraReplicas = extraDelay != null && extraDelay.toNanos() > 0;

    Context.CancellableContext replicaContext = context.withCancellation();
    Context.CancellationListener callerCancelled =
        (ctx) -> outcomes.offer(Outcome.callerCancelled());
    context.addListener(callerCancelled, MoreExecutors.directExecutor());

    List<ListenableFuture<T>> futures = new ArrayList<>(ingesters.size());
    try {
      for (int i = 0; i < ingesters.size(); i++) {
        final int index = i;
        final IngesterDesc ingester = ingesters.get(i);
        final boolean delayed = delayExtraReplicas && index >= minSuccess;

        ListenableFuture<T> future =
            executorService.submit(
                replicaContext.wrap(
                    () -> {
                      if (delayed
                          && !forceStart.tryAcquire(extraDelay.toNanos(), TimeUnit.NANOSECONDS)) {
                        LOG.debug("Extra delay elapsed, querying ingester {}", ingester.addr);
                      }
                      return callback.call(ingester);
                    }));
        Futures.addCallback(
            future,
            new FutureCallback<>() {
              @Override
              public void onSuccess(@Nullable T result) {
                outcomes.offer(Outcome.success(index, result));
              }

              @Override
              public void onFailure(@NonNull Throwable t) {
                outcomes.offer(Outcome.failure(index, t));
              }
            },
            MoreExecutors.directExecutor());
        futures.add(future);
      }

      return awaitQuorum(context, replicationSet, outcomes, forceStart);
    } finally {
      context.removeListener(callerCancelled);
      replicaContext.cancel(null);
      // stop work on replicas whose answers are no longer needed
      futures.forEach(future -> future.cancel(true));
    }
  }

  private <T> List<T> awaitQuorum(
      Context context,
      ReplicationSet replicationSet,
      BlockingQueue<Outcome<T>> outcomes,
      Semaphore forceStart) {
    int replicaCount = replicationSet.ingesters.size();
    int minSuccess = replicationSet.minSuccess();
    List<Outcome<T>> successes = new ArrayList<>(replicaCount);
    int numErrors = 0;
    int settled = 0;

    while (successes.size() < minSuccess) {
      if (settled == replicaCount) {
        throw new QuorumFailureException(
            String.format(
                "only %d of %d ingesters answered, %d required",
                successes.size(), replicaCount, minSuccess));
      }

      Outcome<T> outcome;
      try {
        outcome = outcomes.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new QueryCancelledException("interrupted while waiting for ingesters", e);
      }

      if (outcome.callerCancelled) {
        throw cancelled(context);
      }
      settled++;

      if (outcome.error == null) {
        successes.add(outcome);
        continue;
      }

      if (isCancellation(outcome.error)) {
        LOG.debug("Ingester call was cancelled", outcome.error);
        if (context.isCancelled()) {
          throw cancelled(context);
        }
        forceStart.release();
        continue;
      }

      numErrors++;
      if (numErrors > replicationSet.maxErrors) {
        throw new QuorumFailureException(
            String.format(
                "%d of %d ingesters failed, at most %d failures tolerated",
                numErrors, replicaCount, replicationSet.maxErrors),
            outcome.error);
      }
      // a failed or cancelled replica lets one of the delayed replicas start right away
      forceStart.release();
    }

    successes.sort((a, b) -> Integer.compare(a.index, b.index));
    List<T> results = new ArrayList<>(successes.size());
    for (Outcome<T> success : successes) {
      results.add(success.result);
    }
    return results;
  }

  private static boolean isCancellation(Throwable t) {
    return t instanceof QueryCancelledException || t instanceof CancellationException;
  }

  private static QueryCancelledException cancelled(Context context) {
    Throwable cause = context.cancellationCause();
    return new QueryCancelledException("query was cancelled by the caller", cause);
  }

  @Override
  public void close() {
    executorService.shutdownNow();
  }

  private static final class Outcome<T> {
    final int index;
    final T result;
    final Throwable error;
    final boolean callerCancelled;

    private Outcome(int index, T result, Throwable error, boolean callerCancelled) {
      this.index = index;
      this.result = result;
      this.error = error;
      this.callerCancelled = callerCancelled;
    }

    static <T> Outcome<T> success(int index, T result) {
      return new Outcome<>(index, result, null, false);
    }

    static <T> Outcome<T> failure(int index, Throwable error) {
      return new Outcome<>(index, null, error, false);
    }

    static <T> Outcome<T> callerCancelled() {
      return new Outcome<>(-1, null, null, true);
    }
  }
}
