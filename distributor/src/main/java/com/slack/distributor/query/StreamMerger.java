package com.slack.distributor.query;

import com.slack.distributor.errors.MergeFailureException;
import com.slack.distributor.hash.Fingerprints;
import com.slack.distributor.model.Chunk;
import com.slack.distributor.model.ChunkSeries;
import com.slack.distributor.model.Fingerprint;
import com.slack.distributor.model.Labels;
import com.slack.distributor.model.QueryStreamResponse;
import com.slack.distributor.model.Sample;
import com.slack.distributor.model.TimeSeries;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges streaming responses. Chunk series from all replicas are concatenated per fingerprint
 * without looking into the chunks; overlapping chunks are resolved by whoever decodes them. Raw
 * time series are concatenated per fingerprint and stable sorted by timestamp. Samples reported by
 * several replicas are all kept.
 */
public class StreamMerger implements ReplicaResultMerger<QueryStreamResponse, QueryStreamResponse> {

  @Override
  public QueryStreamResponse merge(List<QueryStreamResponse> replicaResults) {
    Map<Fingerprint, MergedSeries<Chunk>> hashToChunkseries = new LinkedHashMap<>();
    Map<Fingerprint, MergedSeries<Sample>> hashToTimeSeries = new LinkedHashMap<>();

    for (QueryStreamResponse response : replicaResults) {
      for (ChunkSeries series : response.chunkseries) {
        hashToChunkseries
            .computeIfAbsent(fingerprint(series.labels), k -> new MergedSeries<>(series.labels))
            .values
            .addAll(series.chunks);
      }

      for (TimeSeries series : response.timeseries) {
        hashToTimeSeries
            .computeIfAbsent(fingerprint(series.labels), k -> new MergedSeries<>(series.labels))
            .values
            .addAll(series.samples);
      }
    }

    List<ChunkSeries> chunkseries = new ArrayList<>(hashToChunkseries.size());
    for (MergedSeries<Chunk> series : hashToChunkseries.values()) {
      chunkseries.add(new ChunkSeries(series.labels, series.values));
    }
    List<TimeSeries> timeseries = new ArrayList<>(hashToTimeSeries.size());
    for (MergedSeries<Sample> series : hashToTimeSeries.values()) {
      // List.sort is stable, so samples with equal timestamps keep the order they arrived in
      series.values.sort(Comparator.comparingLong(Sample::timestampMs));
      timeseries.add(new TimeSeries(series.labels, series.values));
    }
    return new QueryStreamResponse(chunkseries, timeseries);
  }

  private static Fingerprint fingerprint(Labels labels) {
    if (labels == null) {
      throw new MergeFailureException("ingester returned a series without labels");
    }
    return Fingerprints.fastFingerprint(labels);
  }

  private static final class MergedSeries<V> {
    final Labels labels;
    final List<V> values = new ArrayList<>();

    MergedSeries(Labels labels) {
      this.labels = labels;
    }
  }
}
