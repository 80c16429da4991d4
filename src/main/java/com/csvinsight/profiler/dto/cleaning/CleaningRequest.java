package com.csvinsight.profiler.dto.cleaning;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleaningRequest {

  /** Suggestions to apply, in the order they should be applied. Elements may not be null. */
  @NotNull
  @JsonProperty("suggestions")
  private List<@NotNull @Valid CleaningSuggestion> suggestions;
}
