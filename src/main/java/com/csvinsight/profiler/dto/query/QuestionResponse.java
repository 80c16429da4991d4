package com.csvinsight.profiler.dto.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionResponse {

  @JsonProperty("question")
  private String question;

  @JsonProperty("answer")
  private String answer;
}
