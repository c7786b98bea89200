package com.slack.distributor.errors;

/** Replica results could not be combined. The whole query fails, no partial result is returned. */
public class MergeFailureException extends RuntimeException {
  public MergeFailureException(String msg) {
    super(msg);
  }

  public MergeFailureException(String msg, Throwable t) {
    super(msg, t);
  }
}
