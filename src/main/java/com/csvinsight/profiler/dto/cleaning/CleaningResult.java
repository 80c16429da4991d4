package com.csvinsight.profiler.dto.cleaning;

import com.csvinsight.profiler.dto.dataset.Dataset;

import lombok.Value;

/** Outcome of a cleaning pass: the cleaned rows and how many suggestions actually changed them. */
@Value
public class CleaningResult {

  Dataset dataset;

  /** Suggestions that were applied; skipped ones are not counted. */
  int appliedCount;
}
