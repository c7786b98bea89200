package com.slack.distributor.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** A raw sample series carried in a streaming response. */
public final class TimeSeries {
  public final Labels labels;
  public final List<Sample> samples;

  public TimeSeries(Labels labels, List<Sample> samples) {
    this.labels = labels;
    this.samples = ImmutableList.copyOf(samples);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TimeSeries that)) return false;
    return Objects.equals(labels, that.labels) && samples.equals(that.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hash(labels, samples);
  }

  @Override
  public String toString() {
    return "TimeSeries{" + "labels=" + labels + ", samples=" + samples + '}';
  }
}
