package com.slack.distributor.errors;

/** Too many replicas failed, or too few were healthy, to satisfy the read quorum. */
public class QuorumFailureException extends RuntimeException {
  public QuorumFailureException(String msg) {
    super(msg);
  }

  public QuorumFailureException(String msg, Throwable t) {
    super(msg, t);
  }
}
