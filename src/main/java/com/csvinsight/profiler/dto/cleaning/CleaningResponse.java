package com.csvinsight.profiler.dto.cleaning;

import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CleaningResponse {

  @JsonProperty("dataset_id")
  private String datasetId;

  @JsonProperty("parent_dataset_id")
  private String parentDatasetId;

  @JsonProperty("applied_suggestions")
  private Integer appliedSuggestions;

  @JsonProperty("row_count")
  private Integer rowCount;

  @JsonProperty("profile")
  private DatasetProfile profile;
}
