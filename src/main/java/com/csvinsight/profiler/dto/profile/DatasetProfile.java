package com.csvinsight.profiler.dto.profile;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Statistical summary of one dataset snapshot. */
@Value
@Builder
@Jacksonized
public class DatasetProfile {

  @JsonProperty("row_count")
  int rowCount;

  @JsonProperty("column_count")
  int columnCount;

  @JsonProperty("columns")
  List<ColumnProfile> columns;

  @JsonProperty("null_values")
  int nullValues;

  @JsonProperty("null_percentage")
  double nullPercentage;

  @JsonProperty("duplicate_rows")
  int duplicateRows;

  @JsonProperty("duplicate_percentage")
  double duplicatePercentage;

  public Optional<ColumnProfile> findColumn(String name) {
    return columns.stream().filter(column -> column.getName().equals(name)).findFirst();
  }
}
