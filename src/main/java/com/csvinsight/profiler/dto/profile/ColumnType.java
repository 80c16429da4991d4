package com.csvinsight.profiler.dto.profile;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Semantic type inferred for a column. */
public enum ColumnType {
  NUMBER,
  BOOLEAN,
  DATE,
  STRING,
  MIXED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ColumnType fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }

  /** String and boolean columns carry a frequency table and a mode. */
  public boolean isCategorical() {
    return this == STRING || this == BOOLEAN;
  }
}
