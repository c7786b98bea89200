package com.slack.distributor.errors;

/** Thrown when a time range or matcher can't be turned into an ingester request. */
public class InvalidRequestException extends RuntimeException {
  public InvalidRequestException(String msg) {
    super(msg);
  }

  public InvalidRequestException(String msg, Throwable t) {
    super(msg, t);
  }
}
