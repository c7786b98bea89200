package com.slack.distributor.model;

import com.google.common.collect.ImmutableList;
import com.slack.distributor.errors.InvalidRequestException;
import java.util.List;

/**
 * The request sent to every targeted ingester. Immutable once built, so a single instance is
 * shared by all replica calls of a query.
 */
public final class QueryRequest {
  public final long startTimestampMs;
  public final long endTimestampMs;
  public final List<Matcher> matchers;

  private QueryRequest(long startTimestampMs, long endTimestampMs, List<Matcher> matchers) {
    this.startTimestampMs = startTimestampMs;
    this.endTimestampMs = endTimestampMs;
    this.matchers = ImmutableList.copyOf(matchers);
  }

  /**
   * Validates the time range and matchers and builds the request.
   *
   * @throws InvalidRequestException if the range is inverted or a matcher is malformed
   */
  public static QueryRequest toQueryRequest(long from, long to, List<Matcher> matchers) {
    if (from > to) {
      throw new InvalidRequestException(
          String.format("invalid time range: start %d is after end %d", from, to));
    }
    if (matchers == null) {
      throw new InvalidRequestException("matchers can't be null");
    }
    for (Matcher matcher : matchers) {
      if (matcher == null) {
        throw new InvalidRequestException("matcher can't be null");
      }
      matcher.validate();
    }
    return new QueryRequest(from, to, matchers);
  }

  @Override
  public String toString() {
    return "QueryRequest{"
        + "startTimestampMs="
        + startTimestampMs
        + ", endTimestampMs="
        + endTimestampMs
        + ", matchers="
        + matchers
        + '}';
  }
}
