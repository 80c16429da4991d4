package com.csvinsight.profiler.dto.cleaning;

import lombok.Builder;
import lombok.Value;

/** Tunable constants shared by suggestion generation and cleaning. */
@Value
@Builder(toBuilder = true)
public class CleaningThresholds {

  /** A numeric column is flagged when {@code max > mean * outlierDetectionMultiplier}. */
  @Builder.Default double outlierDetectionMultiplier = 3.0;

  /** Outlier cells are capped at {@code median * outlierCapMultiplier}. */
  @Builder.Default double outlierCapMultiplier = 3.0;

  @Builder.Default double numericFillDefault = 0.0;

  @Builder.Default String textFillDefault = "Unknown";

  public static CleaningThresholds defaults() {
    return CleaningThresholds.builder().build();
  }
}
