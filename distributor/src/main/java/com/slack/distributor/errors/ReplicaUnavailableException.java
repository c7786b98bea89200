package com.slack.distributor.errors;

/** A single ingester could not be reached or failed to answer. */
public class ReplicaUnavailableException extends RuntimeException {
  public final String address;

  public ReplicaUnavailableException(String address, Throwable t) {
    super("ingester " + address + " is unavailable", t);
    this.address = address;
  }
}
