package com.slack.distributor.hash;

import com.slack.distributor.model.Label;
import com.slack.distributor.model.Labels;

/**
 * Ring keys used to pick the replica set that owns a series. The values are unsigned 32-bit
 * tokens carried in an {@code int}.
 *
 * <p>There are two independent schemes. Deployments that shard by metric name place every series
 * of a metric on the same replicas, so a read with an equality matcher on the metric name can be
 * sent to that replica set only. Deployments that shard by all labels spread a metric over the
 * whole ring, and reads have to go to every ingester. A key computed with one scheme is
 * meaningless under the other.
 */
public final class ShardKeys {
  private ShardKeys() {}

  public static int shardByUser(String tenantId) {
    return Fnv.add32(Fnv.OFFSET_32, tenantId);
  }

  public static int shardByMetricName(String tenantId, String metricName) {
    return Fnv.add32(shardByUser(tenantId), metricName);
  }

  public static int shardByAllLabels(String tenantId, Labels labels) {
    int h = shardByUser(tenantId);
    for (Label label : labels) {
      h = Fnv.add32(h, label.name());
      h = Fnv.add32(h, label.value());
    }
    return h;
  }
}
