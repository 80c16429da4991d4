package com.csvinsight.profiler.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Chart axis grouping: numeric columns are measures, everything else is a dimension. */
@Value
@Builder
@Jacksonized
public class ColumnCategories {

  @JsonProperty("dimensions")
  List<String> dimensions;

  @JsonProperty("measures")
  List<String> measures;
}
