package com.csvinsight.profiler.dto.profile;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Statistics for a single column. Numeric fields are only set for {@link ColumnType#NUMBER}
 * columns with at least one numeric value; {@code categories} and {@code mode} only for string and
 * boolean columns.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnProfile {

  @JsonProperty("name")
  String name;

  @JsonProperty("type")
  ColumnType type;

  @JsonProperty("unique_count")
  int uniqueCount;

  @JsonProperty("null_count")
  int nullCount;

  @JsonProperty("null_percentage")
  double nullPercentage;

  @JsonProperty("min")
  Double min;

  @JsonProperty("max")
  Double max;

  @JsonProperty("mean")
  Double mean;

  @JsonProperty("median")
  Double median;

  @JsonProperty("categories")
  Map<String, Integer> categories;

  @JsonProperty("mode")
  String mode;

  @JsonIgnore
  public boolean isNumeric() {
    return type == ColumnType.NUMBER;
  }
}
