package com.csvinsight.profiler.controller;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.csvinsight.profiler.dto.cleaning.CleaningSuggestion;
import com.csvinsight.profiler.dto.profile.ColumnCategories;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.service.cleaning.SuggestionService;
import com.csvinsight.profiler.service.profiling.DatasetProfilerService;
import com.csvinsight.profiler.service.storage.DatasetStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/datasets/{datasetId}")
@RequiredArgsConstructor
@Tag(name = "Profiling", description = "Column statistics and cleaning suggestions")
public class ProfileController {

  private final DatasetStorageService storageService;
  private final DatasetProfilerService profilerService;
  private final SuggestionService suggestionService;

  @GetMapping(value = "/profile", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get the statistical profile of a dataset")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Profile of the stored dataset",
            content = @Content(schema = @Schema(implementation = DatasetProfile.class))),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content)
      })
  public ResponseEntity<DatasetProfile> getProfile(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    return ResponseEntity.ok(storageService.getDataset(datasetId).getProfile());
  }

  @GetMapping(value = "/categories", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Split columns into dimensions and measures",
      description = "Numeric columns are measures, all other columns are dimensions")
  public ResponseEntity<ColumnCategories> getCategories(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    return ResponseEntity.ok(
        profilerService.categorize(storageService.getDataset(datasetId).getProfile()));
  }

  @GetMapping(value = "/suggestions", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get cleaning suggestions derived from the dataset profile")
  public ResponseEntity<List<CleaningSuggestion>> getSuggestions(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    return ResponseEntity.ok(
        suggestionService.generateSuggestions(storageService.getDataset(datasetId).getProfile()));
  }
}
