package com.slack.distributor.errors;

/** A streaming call to a single ingester failed after it was opened. */
public class ReplicaStreamException extends RuntimeException {
  public final String address;

  public ReplicaStreamException(String address, Throwable t) {
    super("stream from ingester " + address + " failed", t);
    this.address = address;
  }
}
