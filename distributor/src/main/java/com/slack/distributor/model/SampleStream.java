package com.slack.distributor.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** A series in the legacy response shape: the label set and its samples ordered by time. */
public final class SampleStream {
  public final Labels metric;
  public final List<Sample> values;

  public SampleStream(Labels metric, List<Sample> values) {
    this.metric = metric;
    this.values = ImmutableList.copyOf(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SampleStream that)) return false;
    return Objects.equals(metric, that.metric) && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(metric, values);
  }

  @Override
  public String toString() {
    return "SampleStream{" + "metric=" + metric + ", values=" + values + '}';
  }
}
