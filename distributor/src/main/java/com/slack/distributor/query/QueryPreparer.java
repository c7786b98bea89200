package com.slack.distributor.query;

import com.slack.distributor.hash.ShardKeys;
import com.slack.distributor.model.MatchType;
import com.slack.distributor.model.Matcher;
import com.slack.distributor.model.QueryRequest;
import com.slack.distributor.ring.Operation;
import com.slack.distributor.ring.ReadRing;
import com.slack.distributor.ring.ReplicationSet;
import io.grpc.Context;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the ingester request for a query and picks the replicas to send it to.
 *
 * <p>When series are sharded by metric name and the query pins the metric name with an equality
 * matcher, only the replica set owning that metric is asked. In every other case (regex or
 * negative matchers on the name, no name matcher, sharding by all labels) all ingesters are asked,
 * since narrowing would miss shards.
 */
public class QueryPreparer {
  private static final Logger LOG = LoggerFactory.getLogger(QueryPreparer.class);

  private final ReadRing ingestersRing;
  private final boolean shardByAllLabels;

  public QueryPreparer(ReadRing ingestersRing, boolean shardByAllLabels) {
    this.ingestersRing = ingestersRing;
    this.shardByAllLabels = shardByAllLabels;
  }

  public QueryPlan prepare(Context context, long from, long to, List<Matcher> matchers) {
    String tenantId = TenantContext.extractTenantId(context);
    QueryRequest request = QueryRequest.toQueryRequest(from, to, matchers);

    ReplicationSet replicationSet;
    Optional<Matcher> metricNameMatcher = Matcher.metricNameMatcher(request.matchers);
    if (!shardByAllLabels
        && metricNameMatcher.isPresent()
        && metricNameMatcher.get().type == MatchType.EQUAL) {
      int shardKey = ShardKeys.shardByMetricName(tenantId, metricNameMatcher.get().value);
      replicationSet = ingestersRing.get(shardKey, Operation.READ);
      LOG.debug(
          "Query for tenant={} metric={} sent to shard replicas",
          tenantId,
          metricNameMatcher.get().value);
    } else {
      replicationSet = ingestersRing.getAll();
      LOG.debug("Query for tenant={} sent to all ingesters", tenantId);
    }
    return new QueryPlan(replicationSet, request);
  }
}
