package com.slack.distributor.model;

import static com.google.common.base.Preconditions.checkArgument;

/** A single name/value pair of a series label set. */
public record Label(String name, String value) {
  public Label {
    checkArgument(name != null && !name.isEmpty(), "label name can't be null or empty");
    checkArgument(value != null, "label value can't be null");
  }

  @Override
  public String toString() {
    return name + "=\"" + value + "\"";
  }
}
