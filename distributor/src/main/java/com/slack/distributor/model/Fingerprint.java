package com.slack.distributor.model;

/** A 64-bit hash identifying a label set, used as the merge key across replicas. */
public record Fingerprint(long value) {
  @Override
  public String toString() {
    return String.format("%016x", value);
  }
}
