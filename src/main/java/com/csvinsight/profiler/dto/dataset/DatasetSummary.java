package com.csvinsight.profiler.dto.dataset;

import java.time.LocalDateTime;
import java.util.List;

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
public class DatasetSummary {

  @JsonProperty("dataset_id")
  private String datasetId;

  @JsonProperty("parent_dataset_id")
  private String parentDatasetId;

  @JsonProperty("display_name")
  private String displayName;

  @JsonProperty("fields")
  private List<String> fields;

  @JsonProperty("row_count")
  private Integer rowCount;

  @JsonProperty("stored_at")
  private LocalDateTime storedAt;
}
