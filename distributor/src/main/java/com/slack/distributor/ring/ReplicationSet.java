package com.slack.distributor.ring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The ordered replicas a query is sent to, and how many of them may fail before the query fails.
 * A snapshot taken once per query; later ring changes don't affect it.
 */
public class ReplicationSet {
  public final List<IngesterDesc> ingesters;
  public final int maxErrors;

  public ReplicationSet(List<IngesterDesc> ingesters, int maxErrors) {
    checkArgument(maxErrors >= 0, "maxErrors can't be negative");
    this.ingesters = ImmutableList.copyOf(ingesters);
    this.maxErrors = maxErrors;
  }

  /** Number of successful replica responses needed before a read succeeds. */
  public int minSuccess() {
    return Math.max(ingesters.size() - maxErrors, 0);
  }

  @Override
  public String toString() {
    return "ReplicationSet{" + "ingesters=" + ingesters + ", maxErrors=" + maxErrors + '}';
  }
}
