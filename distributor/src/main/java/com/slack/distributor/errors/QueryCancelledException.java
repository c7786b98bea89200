package com.slack.distributor.errors;

/**
 * The caller cancelled the query or its deadline expired. Never counted as an ingester failure.
 */
public class QueryCancelledException extends RuntimeException {
  public QueryCancelledException(String msg) {
    super(msg);
  }

  public QueryCancelledException(String msg, Throwable t) {
    super(msg, t);
  }
}
