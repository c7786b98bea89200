package com.slack.distributor.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** A series whose samples are carried as encoded chunks. */
public final class ChunkSeries {
  public final Labels labels;
  public final List<Chunk> chunks;

  public ChunkSeries(Labels labels, List<Chunk> chunks) {
    this.labels = labels;
    this.chunks = ImmutableList.copyOf(chunks);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ChunkSeries that)) return false;
    return Objects.equals(labels, that.labels) && chunks.equals(that.chunks);
  }

  @Override
  public int hashCode() {
    return Objects.hash(labels, chunks);
  }

  @Override
  public String toString() {
    return "ChunkSeries{" + "labels=" + labels + ", chunks=" + chunks + '}';
  }
}
