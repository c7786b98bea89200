package com.slack.distributor.query;

import static com.slack.distributor.testlib.IngesterUtil.awaitCancellation;
import static com.slack.distributor.testlib.IngesterUtil.ingester;
import static com.slack.distributor.testlib.IngesterUtil.sampleStream;
import static com.slack.distributor.testlib.IngesterUtil.samples;
import static com.slack.distributor.testlib.MetricsUtil.getCount;
import static com.slack.distributor.testlib.MetricsUtil.getTimerCount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import brave.Tracing;
import com.slack.distributor.client.IngesterClient;
import com.slack.distributor.client.IngesterClientPool;
import com.slack.distributor.config.DistributorConfig;
import com.slack.distributor.errors.InvalidRequestException;
import com.slack.distributor.errors.MergeFailureException;
import com.slack.distributor.errors.MissingTenantException;
import com.slack.distributor.errors.QueryCancelledException;
import com.slack.distributor.errors.QuorumFailureException;
import com.slack.distributor.errors.ReplicaStreamException;
import com.slack.distributor.errors.ReplicaUnavailableException;
import com.slack.distributor.errors.StorageException;
import com.slack.distributor.model.Chunk;
import com.slack.distributor.model.ChunkSeries;
import com.slack.distributor.model.Labels;
import com.slack.distributor.model.Matcher;
import com.slack.distributor.model.QueryRequest;
import com.slack.distributor.model.QueryResponse;
import com.slack.distributor.model.QueryStreamResponse;
import com.slack.distributor.model.SampleStream;
import com.slack.distributor.model.TimeSeries;
import com.slack.distributor.ring.Operation;
import com.slack.distributor.ring.QuorumReplicaExecutor;
import com.slack.distributor.ring.ReadRing;
import com.slack.distributor.ring.ReplicationSet;
import com.slack.distributor.testlib.IngesterUtil.BlockingQueryStream;
import com.slack.distributor.testlib.IngesterUtil.ScriptedQueryStream;
import io.grpc.Context;
import io.grpc.Status;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DistributorTest {
  private static final Labels METRIC = Labels.of(Labels.METRIC_NAME, "m");
  private static final Matcher METRIC_MATCHER = Matcher.equal(Labels.METRIC_NAME, "m");

  private SimpleMeterRegistry metricsRegistry;
  private ReadRing ring;
  private IngesterClientPool pool;
  private IngesterClient clientA;
  private IngesterClient clientB;
  private IngesterClient clientC;
  private DistributorConfig.QueryConfig queryConfig;
  private Distributor distributor;
  private Context userContext;

  @BeforeEach
  public void setUp() {
    Tracing.newBuilder().build();
    metricsRegistry = new SimpleMeterRegistry();
    ring = mock(ReadRing.class);
    pool = mock(IngesterClientPool.class);
    clientA = mock(IngesterClient.class);
    clientB = mock(IngesterClient.class);
    clientC = mock(IngesterClient.class);
    when(pool.getClientFor("A")).thenReturn(clientA);
    when(pool.getClientFor("B")).thenReturn(clientB);
    when(pool.getClientFor("C")).thenReturn(clientC);
    when(ring.get(anyInt(), eq(Operation.READ)))
        .thenReturn(new ReplicationSet(List.of(ingester("A"), ingester("B"), ingester("C")), 1));

    queryConfig = new DistributorConfig.QueryConfig();
    distributor = newDistributor();
    userContext = TenantContext.withTenantId(Context.ROOT, "user");
  }

  private Distributor newDistributor() {
    return new Distributor(queryConfig, ring, pool, new QuorumReplicaExecutor(), metricsRegistry);
  }

  @AfterEach
  public void tearDown() throws IOException {
    distributor.close();
    metricsRegistry.close();
  }

  private double failures(String addr) {
    return getCount(
        DistributorMetrics.INGESTER_QUERY_FAILURES,
        metricsRegistry,
        DistributorMetrics.INGESTER_TAG,
        addr);
  }

  private double attempts(String addr) {
    return getCount(
        DistributorMetrics.INGESTER_QUERIES,
        metricsRegistry,
        DistributorMetrics.INGESTER_TAG,
        addr);
  }

  private long queries(String method, String status) {
    return getTimerCount(
        DistributorMetrics.QUERY_DURATION,
        metricsRegistry,
        DistributorMetrics.METHOD_TAG,
        method,
        DistributorMetrics.STATUS_CODE_TAG,
        status);
  }

  private void singleReplica(String addr) {
    when(ring.get(anyInt(), eq(Operation.READ)))
        .thenReturn(new ReplicationSet(List.of(ingester(addr)), 0));
  }

  @Test
  public void testQueryToleratesOneUnreachableReplica() {
    when(clientA.query(any(QueryRequest.class)))
        .thenAnswer(
            (invocation) -> {
              // hold the answer until B's failure is recorded so the quorum can't finish first
              await().until(() -> failures("B") == 1);
              return new QueryResponse(List.of(sampleStream(METRIC, 10, 1, 20, 2)));
            });
    when(clientB.query(any(QueryRequest.class)))
        .thenThrow(Status.UNAVAILABLE.withDescription("connection refused").asRuntimeException());
    when(clientC.query(any(QueryRequest.class)))
        .thenAnswer(
            (invocation) -> {
              await().until(() -> failures("B") == 1);
              return new QueryResponse(List.of(sampleStream(METRIC, 20, 2, 30, 3)));
            });

    List<SampleStream> result = distributor.query(userContext, 0, 100, METRIC_MATCHER);

    assertThat(result).containsExactly(sampleStream(METRIC, 10, 1, 20, 2, 30, 3));
    assertThat(failures("A")).isEqualTo(0);
    assertThat(failures("B")).isEqualTo(1);
    assertThat(failures("C")).isEqualTo(0);
    assertThat(attempts("A")).isEqualTo(1);
    assertThat(attempts("B")).isEqualTo(1);
    assertThat(queries(Distributor.QUERY_METHOD, DistributorMetrics.STATUS_SUCCESS)).isEqualTo(1);
  }

  @Test
  public void testQueryFailsWithoutQuorum() {
    singleReplica("A");
    when(clientA.query(any(QueryRequest.class)))
        .thenThrow(Status.UNAVAILABLE.asRuntimeException());

    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(userContext, 0, 100, METRIC_MATCHER))
        .satisfies(e -> assertThat(e.isCancellation()).isFalse())
        .havingCause()
        .isInstanceOf(QuorumFailureException.class)
        .havingCause()
        .isInstanceOf(ReplicaUnavailableException.class);

    assertThat(failures("A")).isEqualTo(1);
    assertThat(queries(Distributor.QUERY_METHOD, DistributorMetrics.STATUS_ERROR)).isEqualTo(1);
  }

  @Test
  public void testClientLookupFailureCountsAsReplicaFailure() {
    singleReplica("D");
    when(pool.getClientFor("D")).thenThrow(new IllegalStateException("no such ingester"));

    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(userContext, 0, 100, METRIC_MATCHER))
        .withRootCauseInstanceOf(IllegalStateException.class);
    assertThat(attempts("D")).isEqualTo(1);
    assertThat(failures("D")).isEqualTo(1);
  }

  @Test
  public void testMissingTenant() {
    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(Context.ROOT, 0, 100, METRIC_MATCHER))
        .withCauseInstanceOf(MissingTenantException.class);
    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.queryStream(Context.ROOT, 0, 100, METRIC_MATCHER))
        .withCauseInstanceOf(MissingTenantException.class);
    verifyNoInteractions(ring, pool);
  }

  @Test
  public void testInvalidRequest() {
    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(
            () -> distributor.query(userContext, 0, 100, Matcher.regex(Labels.METRIC_NAME, "(")))
        .withCauseInstanceOf(InvalidRequestException.class);
    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(userContext, 100, 0, METRIC_MATCHER))
        .withCauseInstanceOf(InvalidRequestException.class);
    verifyNoInteractions(ring, pool);
  }

  @Test
  public void testMalformedReplicaDataFailsTheMerge() {
    singleReplica("A");
    when(clientA.query(any(QueryRequest.class)))
        .thenReturn(new QueryResponse(List.of(new SampleStream(null, samples(1, 1)))));

    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(userContext, 0, 100, METRIC_MATCHER))
        .withCauseInstanceOf(MergeFailureException.class);
  }

  @Test
  public void testQueryStreamMergesReplicas() {
    when(ring.get(anyInt(), eq(Operation.READ)))
        .thenReturn(new ReplicationSet(List.of(ingester("A"), ingester("B")), 0));
    Chunk first = new Chunk(0, 10, 1, new byte[] {1});
    Chunk second = new Chunk(10, 20, 1, new byte[] {2});
    ScriptedQueryStream streamA =
        new ScriptedQueryStream()
            .respond(
                new QueryStreamResponse(
                    List.of(new ChunkSeries(METRIC, List.of(first))), List.of()))
            .respond(
                new QueryStreamResponse(
                    List.of(new ChunkSeries(METRIC, List.of(second))),
                    List.of(new TimeSeries(METRIC, samples(30, 3, 40, 4)))));
    ScriptedQueryStream streamB =
        new ScriptedQueryStream()
            .respond(
                new QueryStreamResponse(
                    List.of(new ChunkSeries(METRIC, List.of(first, second, first))),
                    List.of(new TimeSeries(METRIC, samples(30, 3, 35, 5)))));
    when(clientA.queryStream(any(QueryRequest.class))).thenReturn(streamA);
    when(clientB.queryStream(any(QueryRequest.class))).thenReturn(streamB);

    QueryStreamResponse result = distributor.queryStream(userContext, 0, 100, METRIC_MATCHER);

    assertThat(result.chunkseries).hasSize(1);
    assertThat(result.chunkseries.get(0).chunks)
        .containsExactly(first, second, first, second, first);
    assertThat(result.timeseries).hasSize(1);
    assertThat(result.timeseries.get(0).samples)
        .containsExactlyElementsOf(samples(30, 3, 30, 3, 35, 5, 40, 4));
    assertThat(streamA.getCloseCount()).isEqualTo(1);
    assertThat(streamB.getCloseCount()).isEqualTo(1);
    assertThat(attempts("A")).isEqualTo(1);
    assertThat(attempts("B")).isEqualTo(1);
    assertThat(queries(Distributor.QUERY_STREAM_METHOD, DistributorMetrics.STATUS_SUCCESS))
        .isEqualTo(1);
  }

  @Test
  public void testStreamFailureMidReceive() {
    singleReplica("A");
    ScriptedQueryStream stream =
        new ScriptedQueryStream()
            .respond(QueryStreamResponse.empty())
            .fail(Status.UNAVAILABLE.withDescription("stream reset").asRuntimeException());
    when(clientA.queryStream(any(QueryRequest.class))).thenReturn(stream);

    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.queryStream(userContext, 0, 100, METRIC_MATCHER))
        .havingCause()
        .isInstanceOf(QuorumFailureException.class)
        .havingCause()
        .isInstanceOf(ReplicaStreamException.class);
    assertThat(stream.getCloseCount()).isEqualTo(1);
    assertThat(failures("A")).isEqualTo(1);
  }

  @Test
  public void testCancelledStreamIsNotAFailure() throws Exception {
    singleReplica("A");
    BlockingQueryStream stream = new BlockingQueryStream();
    when(clientA.queryStream(any(QueryRequest.class))).thenReturn(stream);

    Context.CancellableContext callerContext = userContext.withCancellation();
    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<QueryStreamResponse> result =
          caller.submit(() -> distributor.queryStream(callerContext, 0, 100, METRIC_MATCHER));
      await().until(stream::isReceiving);
      callerContext.cancel(null);

      assertThatExceptionOfType(ExecutionException.class)
          .isThrownBy(() -> result.get(10, TimeUnit.SECONDS))
          .havingCause()
          .isInstanceOfSatisfying(
              StorageException.class, e -> assertThat(e.isCancellation()).isTrue());
    } finally {
      caller.shutdownNow();
    }

    await().until(stream::isClosed);
    assertThat(attempts("A")).isEqualTo(1);
    assertThat(failures("A")).isEqualTo(0);
    assertThat(queries(Distributor.QUERY_STREAM_METHOD, DistributorMetrics.STATUS_CANCEL))
        .isEqualTo(1);
  }

  @Test
  public void testCancelledClientLookupIsNotAFailure() throws Exception {
    singleReplica("D");
    CountDownLatch connecting = new CountDownLatch(1);
    when(pool.getClientFor("D"))
        .thenAnswer(
            (invocation) -> {
              throw awaitCancellation(connecting);
            });

    Context.CancellableContext callerContext = userContext.withCancellation();
    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<QueryStreamResponse> result =
          caller.submit(() -> distributor.queryStream(callerContext, 0, 100, METRIC_MATCHER));
      assertThat(connecting.await(10, TimeUnit.SECONDS)).isTrue();
      callerContext.cancel(null);

      assertThatExceptionOfType(ExecutionException.class)
          .isThrownBy(() -> result.get(10, TimeUnit.SECONDS))
          .havingCause()
          .isInstanceOfSatisfying(
              StorageException.class, e -> assertThat(e.isCancellation()).isTrue());
    } finally {
      caller.shutdownNow();
    }

    assertThat(failures("D")).isEqualTo(0);
    assertThat(queries(Distributor.QUERY_STREAM_METHOD, DistributorMetrics.STATUS_CANCEL))
        .isEqualTo(1);
  }

  @Test
  public void testNullMatchersAreAnInvalidRequest() {
    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(userContext, 0, 100, (Matcher[]) null))
        .withCauseInstanceOf(InvalidRequestException.class);
    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.queryStream(userContext, 0, 100, (Matcher[]) null))
        .withCauseInstanceOf(InvalidRequestException.class);
    verifyNoInteractions(ring, pool);
  }

  @Test
  public void testCancelledLegacyCallIsNotAFailure() {
    singleReplica("A");
    when(clientA.query(any(QueryRequest.class)))
        .thenThrow(Status.CANCELLED.withDescription("client cancelled").asRuntimeException());

    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.query(userContext, 0, 100, METRIC_MATCHER))
        .withCauseInstanceOf(QuorumFailureException.class);
    assertThat(attempts("A")).isEqualTo(1);
    assertThat(failures("A")).isEqualTo(0);
  }

  @Test
  public void testQueryTimeout() throws IOException {
    distributor.close();
    queryConfig.queryTimeoutMs = 200;
    distributor = newDistributor();
    singleReplica("A");
    BlockingQueryStream stream = new BlockingQueryStream();
    when(clientA.queryStream(any(QueryRequest.class))).thenReturn(stream);

    assertThatExceptionOfType(StorageException.class)
        .isThrownBy(() -> distributor.queryStream(userContext, 0, 100, METRIC_MATCHER))
        .satisfies(e -> assertThat(e.isCancellation()).isTrue())
        .withCauseInstanceOf(QueryCancelledException.class);
    await().until(stream::isClosed);
    assertThat(failures("A")).isEqualTo(0);
  }

  @Test
  public void testFromConfig() throws IOException {
    String yaml =
        String.join(
            "\n",
            "queryConfig:",
            "  queryTimeoutMs: 5000",
            "ringConfig:",
            "  replicationFactor: 3",
            "  ingesters:",
            "    - addr: A",
            "      tokens: [1000]",
            "    - addr: B",
            "      tokens: [2000000000]",
            "    - addr: C",
            "      tokens: [3000000000]");
    DistributorConfig config = DistributorConfig.fromYamlConfig(yaml, (key) -> null);
    for (IngesterClient client : List.of(clientA, clientB, clientC)) {
      when(client.query(any(QueryRequest.class)))
          .thenReturn(new QueryResponse(List.of(sampleStream(METRIC, 10, 1))));
    }

    try (Distributor fromConfig = Distributor.fromConfig(config, pool, metricsRegistry)) {
      assertThat(fromConfig.query(userContext, 0, 100, METRIC_MATCHER))
          .containsExactly(sampleStream(METRIC, 10, 1));
    }
  }

  @Test
  public void testIsContextCancelled() {
    assertThat(Distributor.isContextCancelled(Status.CANCELLED.asRuntimeException())).isTrue();
    assertThat(Distributor.isContextCancelled(new CancellationException()))
        .isTrue();
    assertThat(Distributor.isContextCancelled(Status.UNAVAILABLE.asRuntimeException())).isFalse();
    assertThat(Distributor.isContextCancelled(new RuntimeException("boom"))).isFalse();
  }
}
