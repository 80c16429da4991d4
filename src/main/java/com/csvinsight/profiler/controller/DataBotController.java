package com.csvinsight.profiler.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.csvinsight.profiler.dto.query.QuestionRequest;
import com.csvinsight.profiler.dto.query.QuestionResponse;
import com.csvinsight.profiler.service.query.DatasetQueryService;
import com.csvinsight.profiler.service.storage.DatasetStorageService;
import com.csvinsight.profiler.service.storage.DatasetStorageService.StoredDataset;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/datasets/{datasetId}")
@RequiredArgsConstructor
@Tag(name = "Data Bot", description = "Ask questions about a dataset")
public class DataBotController {

  private final DatasetStorageService storageService;
  private final DatasetQueryService queryService;

  @PostMapping(
      value = "/questions",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Ask a question",
      description =
          "Answers questions about row counts, columns and per-column statistics such as"
              + " maximum, minimum, average, unique and missing values")
  public ResponseEntity<QuestionResponse> ask(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId,
      @Valid @RequestBody QuestionRequest request) {
    StoredDataset stored = storageService.getDataset(datasetId);
    String answer =
        queryService.answer(request.getQuestion(), stored.getDataset(), stored.getProfile());
    return ResponseEntity.ok(
        QuestionResponse.builder().question(request.getQuestion()).answer(answer).build());
  }
}
