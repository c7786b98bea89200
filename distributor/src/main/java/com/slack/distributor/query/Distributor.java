package com.slack.distributor.query;

import brave.ScopedSpan;
import brave.Tracing;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slack.distributor.client.IngesterClient;
import com.slack.distributor.client.IngesterClientPool;
import com.slack.distributor.client.IngesterQueryStream;
import com.slack.distributor.config.DistributorConfig;
import com.slack.distributor.errors.QueryCancelledException;
import com.slack.distributor.errors.ReplicaStreamException;
import com.slack.distributor.errors.ReplicaUnavailableException;
import com.slack.distributor.errors.StorageException;
import com.slack.distributor.model.ChunkSeries;
import com.slack.distributor.model.Matcher;
import com.slack.distributor.model.QueryRequest;
import com.slack.distributor.model.QueryResponse;
import com.slack.distributor.model.QueryStreamResponse;
import com.slack.distributor.model.SampleStream;
import com.slack.distributor.model.TimeSeries;
import com.slack.distributor.ring.IngesterDesc;
import com.slack.distributor.ring.QuorumReplicaExecutor;
import com.slack.distributor.ring.ReadRing;
import com.slack.distributor.ring.ReplicaExecutor;
import com.slack.distributor.ring.StaticRing;
import io.grpc.Context;
import io.grpc.Status;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read path of the distributor. A query is sent to every replica that could hold matching series,
 * in parallel, and succeeds once a quorum of them answered. The answers overlap, since each series
 * is held by several replicas, and are merged into one result with a single entry per series.
 *
 * <p>Two response shapes are supported: {@link #query} returns samples, {@link #queryStream}
 * returns encoded chunks and raw samples as sent by the ingesters' streaming API.
 *
 * <p>Every error is thrown as a {@link StorageException} whose cause tells what went wrong.
 */
public class Distributor implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Distributor.class);

  public static final String QUERY_METHOD = "Distributor.Query";
  public static final String QUERY_STREAM_METHOD = "Distributor.QueryStream";

  private final QueryPreparer queryPreparer;
  private final IngesterClientPool ingesterPool;
  private final ReplicaExecutor replicaExecutor;
  private final DistributorMetrics metrics;
  private final SampleMerger sampleMerger = new SampleMerger();
  private final StreamMerger streamMerger = new StreamMerger();

  private final Duration extraQueryDelay;
  private final Duration queryTimeout;
  private final ScheduledExecutorService deadlineScheduler =
      Executors.newSingleThreadScheduledExecutor(
          new ThreadFactoryBuilder()
              .setNameFormat("distributor-deadline-%d")
              .setDaemon(true)
              .build());

  public Distributor(
      DistributorConfig.QueryConfig queryConfig,
      ReadRing ingestersRing,
      IngesterClientPool ingesterPool,
      ReplicaExecutor replicaExecutor,
      MeterRegistry meterRegistry) {
    this.queryPreparer = new QueryPreparer(ingestersRing, queryConfig.shardByAllLabels);
    this.ingesterPool = ingesterPool;
    this.replicaExecutor = replicaExecutor;
    this.metrics = new DistributorMetrics(meterRegistry);
    this.extraQueryDelay = queryConfig.getExtraQueryDelay();
    this.queryTimeout = queryConfig.getQueryTimeout();
  }

  /** Wires a distributor over the static ring and the default executor described by the config. */
  public static Distributor fromConfig(
      DistributorConfig config, IngesterClientPool ingesterPool, MeterRegistry meterRegistry) {
    StaticRing ring =
        new StaticRing(config.ringConfig.replicationFactor, config.ringConfig.toIngesterDescs());
    return new Distributor(
        config.queryConfig, ring, ingesterPool, new QuorumReplicaExecutor(), meterRegistry);
  }

  /** Queries the ingesters using the older, sample based API and returns the merged series. */
  public List<SampleStream> query(Context context, long from, long to, Matcher... matchers) {
    return instrument(
        QUERY_METHOD,
        context,
        (queryContext) -> {
          QueryPlan plan = queryPreparer.prepare(queryContext, from, to, asList(matchers));
          return sampleMerger.merge(queryIngesters(queryContext, plan));
        });
  }

  /** Queries the ingesters using the streaming API and returns the merged chunks and samples. */
  public QueryStreamResponse queryStream(
      Context context, long from, long to, Matcher... matchers) {
    return instrument(
        QUERY_STREAM_METHOD,
        context,
        (queryContext) -> {
          QueryPlan plan = queryPreparer.prepare(queryContext, from, to, asList(matchers));
          return streamMerger.merge(queryIngesterStream(queryContext, plan));
        });
  }

  // a null array is passed on so request validation rejects it
  private static List<Matcher> asList(Matcher[] matchers) {
    return matchers == null ? null : Arrays.asList(matchers);
  }

  private <R> R instrument(String method, Context context, Function<Context, R> work) {
    ScopedSpan span = Tracing.currentTracer().startScopedSpan(method);
    long startNanos = System.nanoTime();
    String statusCode = DistributorMetrics.STATUS_ERROR;
    Context.CancellableContext queryContext =
        context.withDeadlineAfter(
            queryTimeout.toMillis(), TimeUnit.MILLISECONDS, deadlineScheduler);
    try {
      R result = work.apply(queryContext);
      statusCode = DistributorMetrics.STATUS_SUCCESS;
      return result;
    } catch (RuntimeException e) {
      StorageException storageException = StorageException.wrap(e);
      if (storageException.isCancellation()) {
        statusCode = DistributorMetrics.STATUS_CANCEL;
        LOG.debug("{} was cancelled", method, e);
      } else {
        LOG.error("{} failed", method, e);
      }
      span.error(e);
      throw storageException;
    } finally {
      queryContext.cancel(null);
      metrics.recordQueryDuration(method, statusCode, System.nanoTime() - startNanos);
      span.finish();
    }
  }

  private List<QueryResponse> queryIngesters(Context queryContext, QueryPlan plan) {
    ScopedSpan span = Tracing.currentTracer().startScopedSpan("Distributor.queryIngesters");
    span.tag("ingesterCount", String.valueOf(plan.replicationSet().ingesters.size()));
    QueryRequest request = plan.request();
    try {
      return replicaExecutor.execute(
          queryContext,
          plan.replicationSet(),
          extraQueryDelay,
          (ingester) -> {
            IngesterClient client = getClientFor(ingester);
            metrics.recordQueryAttempt(ingester.addr);
            try {
              return client.query(request);
            } catch (RuntimeException e) {
              throw replicaFailure(ingester, e);
            }
          });
    } finally {
      span.finish();
    }
  }

  private List<QueryStreamResponse> queryIngesterStream(Context queryContext, QueryPlan plan) {
    ScopedSpan span = Tracing.currentTracer().startScopedSpan("Distributor.queryIngesterStream");
    span.tag("ingesterCount", String.valueOf(plan.replicationSet().ingesters.size()));
    QueryRequest request = plan.request();
    try {
      return replicaExecutor.execute(
          queryContext,
          plan.replicationSet(),
          extraQueryDelay,
          (ingester) -> {
            IngesterClient client = getClientFor(ingester);
            metrics.recordQueryAttempt(ingester.addr);
            try (IngesterQueryStream stream = openStream(client, ingester, request)) {
              return drainStream(ingester, stream);
            }
          });
    } finally {
      span.finish();
    }
  }

  private IngesterClient getClientFor(IngesterDesc ingester) {
    try {
      return ingesterPool.getClientFor(ingester.addr);
    } catch (RuntimeException e) {
      if (isContextCancelled(e)) {
        throw new QueryCancelledException(
            "client lookup for ingester " + ingester.addr + " was cancelled", e);
      }
      metrics.recordQueryAttempt(ingester.addr);
      metrics.recordQueryFailure(ingester.addr);
      LOG.warn("Could not get a client for ingester {}", ingester.addr, e);
      throw new ReplicaUnavailableException(ingester.addr, e);
    }
  }

  private IngesterQueryStream openStream(
      IngesterClient client, IngesterDesc ingester, QueryRequest request) {
    try {
      return client.queryStream(request);
    } catch (RuntimeException e) {
      throw replicaFailure(ingester, e);
    }
  }

  private QueryStreamResponse drainStream(IngesterDesc ingester, IngesterQueryStream stream) {
    List<ChunkSeries> chunkseries = new ArrayList<>();
    List<TimeSeries> timeseries = new ArrayList<>();
    while (true) {
      QueryStreamResponse response;
      try {
        response = stream.recv();
      } catch (RuntimeException e) {
        if (isContextCancelled(e)) {
          throw new QueryCancelledException(
              "stream from ingester " + ingester.addr + " was cancelled", e);
        }
        metrics.recordQueryFailure(ingester.addr);
        LOG.warn("Stream from ingester {} failed", ingester.addr, e);
        throw new ReplicaStreamException(ingester.addr, e);
      }

      if (response == null) {
        break;
      }
      chunkseries.addAll(response.chunkseries);
      timeseries.addAll(response.timeseries);
    }
    return new QueryStreamResponse(chunkseries, timeseries);
  }

  private RuntimeException replicaFailure(IngesterDesc ingester, RuntimeException e) {
    if (isContextCancelled(e)) {
      return new QueryCancelledException(
          "query to ingester " + ingester.addr + " was cancelled", e);
    }
    metrics.recordQueryFailure(ingester.addr);
    LOG.warn("Query to ingester {} failed", ingester.addr, e);
    return new ReplicaUnavailableException(ingester.addr, e);
  }

  /**
   * An error is a cancellation, not an ingester failure, when the call's context was cancelled or
   * ran past its deadline, or when the transport reports the call as cancelled.
   */
  @VisibleForTesting
  static boolean isContextCancelled(Throwable t) {
    if (Context.current().isCancelled() || t instanceof CancellationException) {
      return true;
    }
    return Status.fromThrowable(t).getCode() == Status.Code.CANCELLED;
  }

  @Override
  public void close() throws IOException {
    deadlineScheduler.shutdownNow();
    if (replicaExecutor instanceof Closeable closeable) {
      closeable.close();
    }
  }
}
