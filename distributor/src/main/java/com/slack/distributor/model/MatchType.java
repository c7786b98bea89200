package com.slack.distributor.model;

/** Comparison operator of a label matcher. */
public enum MatchType {
  EQUAL("="),
  NOT_EQUAL("!="),
  REGEX_MATCH("=~"),
  REGEX_NO_MATCH("!~");

  private final String operator;

  MatchType(String operator) {
    this.operator = operator;
  }

  public boolean isRegex() {
    return this == REGEX_MATCH || this == REGEX_NO_MATCH;
  }

  public String getOperator() {
    return operator;
  }
}
