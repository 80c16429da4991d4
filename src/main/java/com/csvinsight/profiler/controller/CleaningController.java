package com.csvinsight.profiler.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.csvinsight.profiler.dto.cleaning.CleaningRequest;
import com.csvinsight.profiler.dto.cleaning.CleaningResponse;
import com.csvinsight.profiler.dto.cleaning.CleaningResult;
import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.service.cleaning.DatasetCleaningService;
import com.csvinsight.profiler.service.profiling.DatasetProfilerService;
import com.csvinsight.profiler.service.storage.DatasetStorageService;
import com.csvinsight.profiler.service.storage.DatasetStorageService.StoredDataset;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/datasets/{datasetId}")
@RequiredArgsConstructor
@Tag(name = "Cleaning", description = "Apply cleaning suggestions to a dataset")
public class CleaningController {

  private final DatasetStorageService storageService;
  private final DatasetCleaningService cleaningService;
  private final DatasetProfilerService profilerService;

  @PostMapping(
      value = "/clean",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Apply selected cleaning suggestions",
      description =
          "Applies the given suggestions in order and stores the result as a new dataset. The"
              + " source dataset is left unchanged.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "Cleaned dataset stored",
            content = @Content(schema = @Schema(implementation = CleaningResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content)
      })
  public ResponseEntity<CleaningResponse> cleanDataset(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId,
      @Valid @RequestBody CleaningRequest request) {
    StoredDataset source = storageService.getDataset(datasetId);

    CleaningResult result =
        cleaningService.clean(source.getDataset(), source.getProfile(), request.getSuggestions());
    Dataset cleaned = result.getDataset();
    DatasetProfile cleanedProfile = profilerService.profile(cleaned);
    StoredDataset stored = storageService.store(cleaned, cleanedProfile, datasetId);
    log.info("Cleaned dataset {} into {}", datasetId, stored.getDatasetId());

    CleaningResponse response =
        CleaningResponse.builder()
            .datasetId(stored.getDatasetId())
            .parentDatasetId(datasetId)
            .appliedSuggestions(result.getAppliedCount())
            .rowCount(cleaned.getRowCount())
            .profile(cleanedProfile)
            .build();
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }
}
