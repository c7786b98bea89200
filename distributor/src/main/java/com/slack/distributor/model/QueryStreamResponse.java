package com.slack.distributor.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Streaming response envelope. Used for the partial responses an ingester sends, for the
 * accumulated answer of one ingester and for the merged answer across ingesters.
 */
public final class QueryStreamResponse {
  public final List<ChunkSeries> chunkseries;
  public final List<TimeSeries> timeseries;

  public QueryStreamResponse(List<ChunkSeries> chunkseries, List<TimeSeries> timeseries) {
    this.chunkseries = ImmutableList.copyOf(chunkseries);
    this.timeseries = ImmutableList.copyOf(timeseries);
  }

  public static QueryStreamResponse empty() {
    return new QueryStreamResponse(List.of(), List.of());
  }

  @Override
  public String toString() {
    return "QueryStreamResponse{"
        + "chunkseries="
        + chunkseries
        + ", timeseries="
        + timeseries
        + '}';
  }
}
