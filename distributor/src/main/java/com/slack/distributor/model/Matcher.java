package com.slack.distributor.model;

import com.slack.distributor.errors.InvalidRequestException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A label matcher as supplied by the query engine. Construction does not validate the matcher;
 * validation happens when a {@link QueryRequest} is built from it.
 */
public final class Matcher {
  public final MatchType type;
  public final String name;
  public final String value;

  public Matcher(MatchType type, String name, String value) {
    this.type = type;
    this.name = name;
    this.value = value;
  }

  public static Matcher equal(String name, String value) {
    return new Matcher(MatchType.EQUAL, name, value);
  }

  public static Matcher notEqual(String name, String value) {
    return new Matcher(MatchType.NOT_EQUAL, name, value);
  }

  public static Matcher regex(String name, String value) {
    return new Matcher(MatchType.REGEX_MATCH, name, value);
  }

  public static Matcher notRegex(String name, String value) {
    return new Matcher(MatchType.REGEX_NO_MATCH, name, value);
  }

  /** Returns the first matcher on the metric name label, if any. */
  public static Optional<Matcher> metricNameMatcher(List<Matcher> matchers) {
    return matchers.stream()
        .filter(matcher -> matcher != null && Labels.METRIC_NAME.equals(matcher.name))
        .findFirst();
  }

  /**
   * Checks that the matcher can be sent to an ingester. Regular expressions are fully anchored, the
   * same way the ingesters evaluate them.
   */
  void validate() {
    if (type == null) {
      throw new InvalidRequestException("matcher type can't be null");
    }
    if (name == null || name.isEmpty()) {
      throw new InvalidRequestException("matcher label name can't be null or empty");
    }
    if (value == null) {
      throw new InvalidRequestException("matcher value can't be null for label " + name);
    }
    if (type.isRegex()) {
      try {
        Pattern.compile("^(?:" + value + ")$");
      } catch (PatternSyntaxException e) {
        throw new InvalidRequestException("invalid regular expression for label " + name, e);
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Matcher that)) return false;
    return type == that.type
        && Objects.equals(name, that.name)
        && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, value);
  }

  @Override
  public String toString() {
    return name + (type == null ? "?" : type.getOperator()) + "\"" + value + "\"";
  }
}
