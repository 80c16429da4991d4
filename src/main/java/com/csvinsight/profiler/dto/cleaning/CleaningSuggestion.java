package com.csvinsight.profiler.dto.cleaning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A proposed cleaning action. Whether a suggestion is applied is decided by the caller, not stored
 * here.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CleaningSuggestion {

  /** Column value of suggestions that concern the whole dataset. */
  public static final String MULTIPLE_COLUMNS = "Multiple";

  @JsonProperty("column")
  String column;

  @NotNull
  @JsonProperty("issue")
  IssueType issue;

  @JsonProperty("description")
  String description;

  @JsonProperty("recommendation")
  String recommendation;

  @JsonProperty("auto_fix")
  Boolean autoFix;

  @JsonIgnore
  public boolean isAutoFixable() {
    return Boolean.TRUE.equals(autoFix);
  }
}
