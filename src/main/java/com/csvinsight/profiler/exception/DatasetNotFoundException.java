package com.csvinsight.profiler.exception;

import lombok.Getter;

@Getter
public class DatasetNotFoundException extends ResourceNotFoundException {

  private final String datasetId;

  public DatasetNotFoundException(String datasetId) {
    super("Dataset not found: " + datasetId);
    this.datasetId = datasetId;
  }
}
