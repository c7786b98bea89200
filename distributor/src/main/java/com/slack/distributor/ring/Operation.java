package com.slack.distributor.ring;

/** The intent of a ring lookup, which decides which ingester states count as healthy. */
public enum Operation {
  READ,
  WRITE
}
