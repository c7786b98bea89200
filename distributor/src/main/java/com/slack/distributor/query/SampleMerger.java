package com.slack.distributor.query;

import com.google.common.annotations.VisibleForTesting;
import com.slack.distributor.errors.MergeFailureException;
import com.slack.distributor.hash.Fingerprints;
import com.slack.distributor.model.Fingerprint;
import com.slack.distributor.model.Labels;
import com.slack.distributor.model.QueryResponse;
import com.slack.distributor.model.Sample;
import com.slack.distributor.model.SampleStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges legacy responses. Series are matched across replicas by fingerprint and their samples
 * are unioned: the output is strictly ascending by timestamp and a timestamp reported by several
 * replicas appears once. Replicas received the same writes, so values at a shared timestamp agree
 * and the first one seen is kept.
 */
public class SampleMerger implements ReplicaResultMerger<QueryResponse, List<SampleStream>> {

  @Override
  public List<SampleStream> merge(List<QueryResponse> replicaResults) {
    Map<Fingerprint, MergedStream> fpToSampleStream = new LinkedHashMap<>();
    for (QueryResponse result : replicaResults) {
      for (SampleStream ss : result.timeseries) {
        if (ss.metric == null) {
          throw new MergeFailureException("ingester returned a series without labels");
        }
        Fingerprint fp = Fingerprints.fingerprint(ss.metric);
        MergedStream mss = fpToSampleStream.computeIfAbsent(fp, k -> new MergedStream(ss.metric));
        mss.values = mergeSampleSets(mss.values, ss.values);
      }
    }

    List<SampleStream> matrix = new ArrayList<>(fpToSampleStream.size());
    for (MergedStream mss : fpToSampleStream.values()) {
      matrix.add(new SampleStream(mss.metric, mss.values));
    }
    return matrix;
  }

  /**
   * Merges two sample sequences into one strictly ascending sequence. On equal timestamps the
   * sample from {@code a} is kept.
   */
  @VisibleForTesting
  static List<Sample> mergeSampleSets(List<Sample> a, List<Sample> b) {
    a = normalize(a);
    b = normalize(b);
    List<Sample> result = new ArrayList<>(a.size() + b.size());
    int i = 0;
    int j = 0;
    while (i < a.size() && j < b.size()) {
      long ta = a.get(i).timestampMs();
      long tb = b.get(j).timestampMs();
      if (ta < tb) {
        result.add(a.get(i++));
      } else if (ta > tb) {
        result.add(b.get(j++));
      } else {
        result.add(a.get(i++));
        j++;
      }
    }
    while (i < a.size()) {
      result.add(a.get(i++));
    }
    while (j < b.size()) {
      result.add(b.get(j++));
    }
    return result;
  }

  // Ingesters return samples in order; anything else is sorted and deduplicated first.
  private static List<Sample> normalize(List<Sample> samples) {
    boolean strictlyAscending = true;
    for (int i = 1; i < samples.size() && strictlyAscending; i++) {
      strictlyAscending = samples.get(i - 1).timestampMs() < samples.get(i).timestampMs();
    }
    if (strictlyAscending) {
      return samples;
    }

    List<Sample> sorted = new ArrayList<>(samples);
    sorted.sort(Comparator.comparingLong(Sample::timestampMs));
    List<Sample> deduped = new ArrayList<>(sorted.size());
    for (Sample sample : sorted) {
      if (deduped.isEmpty()
          || deduped.get(deduped.size() - 1).timestampMs() != sample.timestampMs()) {
        deduped.add(sample);
      }
    }
    return deduped;
  }

  private static final class MergedStream {
    final Labels metric;
    List<Sample> values = List.of();

    MergedStream(Labels metric) {
      this.metric = metric;
    }
  }
}
