package com.slack.distributor.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** One ingester's answer to a legacy query. */
public final class QueryResponse {
  public final List<SampleStream> timeseries;

  public QueryResponse(List<SampleStream> timeseries) {
    this.timeseries = ImmutableList.copyOf(timeseries);
  }

  @Override
  public String toString() {
    return "QueryResponse{" + "timeseries=" + timeseries + '}';
  }
}
