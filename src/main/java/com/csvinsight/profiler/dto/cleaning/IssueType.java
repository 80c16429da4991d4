package com.csvinsight.profiler.dto.cleaning;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of data issue a suggestion addresses. {@link #INCONSISTENT} has no producer yet but is
 * accepted on input.
 */
public enum IssueType {
  MISSING,
  OUTLIER,
  INCONSISTENT,
  DUPLICATE;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static IssueType fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
