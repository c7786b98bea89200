package com.slack.distributor.model;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/**
 * An immutable, pre-encoded block of consecutive samples. The distributor never decodes chunks, it
 * only forwards them to the query engine.
 */
public final class Chunk {
  public final long startTimestampMs;
  public final long endTimestampMs;
  public final int encoding;
  private final byte[] data;

  public Chunk(long startTimestampMs, long endTimestampMs, int encoding, byte[] data) {
    checkArgument(
        startTimestampMs <= endTimestampMs, "chunk start time must not be after its end time");
    checkArgument(data != null, "chunk data can't be null");
    this.startTimestampMs = startTimestampMs;
    this.endTimestampMs = endTimestampMs;
    this.encoding = encoding;
    this.data = data.clone();
  }

  public byte[] getData() {
    return data.clone();
  }

  public int size() {
    return data.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Chunk that)) return false;
    return startTimestampMs == that.startTimestampMs
        && endTimestampMs == that.endTimestampMs
        && encoding == that.encoding
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(startTimestampMs);
    result = 31 * result + Long.hashCode(endTimestampMs);
    result = 31 * result + encoding;
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "Chunk{"
        + "startTimestampMs="
        + startTimestampMs
        + ", endTimestampMs="
        + endTimestampMs
        + ", encoding="
        + encoding
        + ", bytes="
        + data.length
        + '}';
  }
}
