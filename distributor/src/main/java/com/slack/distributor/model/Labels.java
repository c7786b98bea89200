package com.slack.distributor.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable label set identifying a series. Labels are kept sorted by name and names are
 * unique, so two label sets with the same pairs are always equal regardless of the order they were
 * supplied in.
 */
public final class Labels implements Iterable<Label> {
  public static final String METRIC_NAME = "__name__";

  private static final Labels EMPTY = new Labels(ImmutableList.of());

  private final ImmutableList<Label> labels;

  private Labels(ImmutableList<Label> labels) {
    this.labels = labels;
  }

  public static Labels empty() {
    return EMPTY;
  }

  /** Builds a label set from alternating name and value arguments. */
  public static Labels of(String... nameValuePairs) {
    checkArgument(nameValuePairs.length % 2 == 0, "expected an even number of name/value args");
    List<Label> labels = new ArrayList<>(nameValuePairs.length / 2);
    for (int i = 0; i < nameValuePairs.length; i += 2) {
      labels.add(new Label(nameValuePairs[i], nameValuePairs[i + 1]));
    }
    return fromList(labels);
  }

  public static Labels fromMap(Map<String, String> labelMap) {
    return fromList(
        labelMap.entrySet().stream()
            .map(entry -> new Label(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList()));
  }

  public static Labels fromList(List<Label> labels) {
    if (labels.isEmpty()) {
      return EMPTY;
    }
    List<Label> sorted = new ArrayList<>(labels);
    sorted.sort(Comparator.comparing(Label::name));
    for (int i = 1; i < sorted.size(); i++) {
      checkArgument(
          !sorted.get(i - 1).name().equals(sorted.get(i).name()),
          "duplicate label name %s",
          sorted.get(i).name());
    }
    return new Labels(ImmutableList.copyOf(sorted));
  }

  @Nullable
  public String get(String name) {
    for (Label label : labels) {
      if (label.name().equals(name)) {
        return label.value();
      }
    }
    return null;
  }

  public List<Label> asList() {
    return labels;
  }

  public int size() {
    return labels.size();
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  @Override
  public Iterator<Label> iterator() {
    return labels.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Labels that)) return false;
    return labels.equals(that.labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return labels.stream().map(Label::toString).collect(Collectors.joining(", ", "{", "}"));
  }
}
