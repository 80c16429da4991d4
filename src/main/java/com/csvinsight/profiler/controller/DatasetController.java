package com.csvinsight.profiler.controller;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.dataset.DatasetSummary;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.exception.DatasetNotFoundException;
import com.csvinsight.profiler.service.data_processing.CsvExportService;
import com.csvinsight.profiler.service.data_processing.CsvParsingService;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
@Tag(name = "Datasets", description = "Dataset upload, retrieval and export endpoints")
public class DatasetController {

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv}")
  private Set<String> allowedExtensions;

  private final CsvParsingService csvParsingService;
  private final CsvExportService csvExportService;
  private final DatasetProfilerService profilerService;
  private final DatasetStorageService storageService;

  @PostMapping(
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload a CSV file",
      description = "Parse an uploaded CSV file, profile it and keep it for later requests")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "201",
            description = "Dataset stored",
            content = @Content(schema = @Schema(implementation = DatasetSummary.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or request",
            content = @Content)
      })
  public ResponseEntity<DatasetSummary> uploadDataset(
      @Parameter(description = "CSV file to analyze", required = true) @RequestParam("file")
          MultipartFile file) {
    validateFile(file);

    Dataset dataset;
    try (InputStream in = file.getInputStream()) {
      dataset = csvParsingService.parseCsv(in, file.getOriginalFilename());
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to read uploaded file: " + e.getMessage(), e);
    }

    DatasetProfile profile = profilerService.profile(dataset);
    StoredDataset stored = storageService.store(dataset, profile);
    log.info(
        "Uploaded {} as dataset {} ({} rows)",
        file.getOriginalFilename(),
        stored.getDatasetId(),
        dataset.getRowCount());

    return ResponseEntity.status(HttpStatus.CREATED).body(stored.toSummary());
  }

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List stored datasets")
  public ResponseEntity<List<DatasetSummary>> listDatasets() {
    return ResponseEntity.ok(
        storageService.getAllDatasets().stream()
            .map(StoredDataset::toSummary)
            .collect(Collectors.toList()));
  }

  @GetMapping(value = "/{datasetId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get dataset summary")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Dataset found"),
        @ApiResponse(responseCode = "404", description = "Dataset not found", content = @Content)
      })
  public ResponseEntity<DatasetSummary> getDataset(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    return ResponseEntity.ok(storageService.getDataset(datasetId).toSummary());
  }

  @GetMapping(value = "/{datasetId}/rows", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get all rows of a dataset")
  public ResponseEntity<Dataset> getRows(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    return ResponseEntity.ok(storageService.getDataset(datasetId).getDataset());
  }

  @DeleteMapping("/{datasetId}")
  @Operation(summary = "Delete a stored dataset")
  public ResponseEntity<Void> deleteDataset(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    if (!storageService.deleteDataset(datasetId)) {
      throw new DatasetNotFoundException(datasetId);
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping(value = "/{datasetId}/export", produces = "text/csv")
  @Operation(
      summary = "Export dataset as CSV",
      description = "Download the dataset; cleaning results are named cleaned_<original name>")
  public ResponseEntity<byte[]> exportDataset(
      @Parameter(description = "Dataset ID", required = true) @PathVariable String datasetId) {
    StoredDataset stored = storageService.getDataset(datasetId);
    String csv = csvExportService.toCsv(stored.getDataset());
    String fileName = csvExportService.exportFileName(stored.getDataset(), stored.isCleaned());

    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(fileName, StandardCharsets.UTF_8)
                .build()
                .toString())
        .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
        .body(csv.getBytes(StandardCharsets.UTF_8));
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
