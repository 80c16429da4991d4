package com.csvinsight.profiler.service.cleaning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.cleaning.CleaningSuggestion;
import com.csvinsight.profiler.dto.cleaning.CleaningThresholds;
import com.csvinsight.profiler.dto.cleaning.IssueType;
import com.csvinsight.profiler.dto.profile.ColumnProfile;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.util.CellValues;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives cleaning suggestions from a profile. Output order is fixed: missing values per column in
 * column order, then one duplicate-row suggestion, then outliers per numeric column in column
 * order.
 *
 * <p>The outlier rule ({@code max > mean * k}) is a cheap heuristic and only looks at the upper
 * tail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionService {

  private final CleaningThresholds thresholds;

  public List<CleaningSuggestion> generateSuggestions(DatasetProfile profile) {
    List<CleaningSuggestion> suggestions = new ArrayList<>();

    for (ColumnProfile column : profile.getColumns()) {
      if (column.getNullPercentage() > 0) {
        suggestions.add(missingValueSuggestion(column));
      }
    }

    if (profile.getDuplicatePercentage() > 0) {
      suggestions.add(
          CleaningSuggestion.builder()
              .column(CleaningSuggestion.MULTIPLE_COLUMNS)
              .issue(IssueType.DUPLICATE)
              .description(
                  String.format(
                      "%d duplicate rows (%s%%)",
                      profile.getDuplicateRows(),
                      CellValues.formatFixed(profile.getDuplicatePercentage())))
              .recommendation("Remove duplicate rows")
              .autoFix(true)
              .build());
    }

    for (ColumnProfile column : profile.getColumns()) {
      if (column.isNumeric() && isOutlierCandidate(column)) {
        suggestions.add(
            CleaningSuggestion.builder()
                .column(column.getName())
                .issue(IssueType.OUTLIER)
                .description(
                    String.format(
                        "Potential outliers detected (max value %s is far from mean %s)",
                        CellValues.formatNumber(column.getMax()),
                        CellValues.formatFixed(column.getMean())))
                .recommendation("Consider capping extreme values or removing outliers")
                .autoFix(true)
                .build());
      }
    }

    log.info("Generated {} cleaning suggestions", suggestions.size());
    return Collections.unmodifiableList(suggestions);
  }

  private CleaningSuggestion missingValueSuggestion(ColumnProfile column) {
    return CleaningSuggestion.builder()
        .column(column.getName())
        .issue(IssueType.MISSING)
        .description(
            String.format(
                "%d missing values (%s%%)",
                column.getNullCount(), CellValues.formatFixed(column.getNullPercentage())))
        .recommendation(fillRecommendation(column))
        .autoFix(true)
        .build();
  }

  private String fillRecommendation(ColumnProfile column) {
    if (column.isNumeric()) {
      return "Fill with mean or median value";
    }
    if (column.getType().isCategorical() && column.getMode() != null) {
      return "Fill with most common value: \"" + column.getMode() + "\"";
    }
    return "Remove rows or fill with placeholder";
  }

  private boolean isOutlierCandidate(ColumnProfile column) {
    if (column.getMin() == null || column.getMax() == null || column.getMean() == null) {
      return false;
    }
    double range = column.getMax() - column.getMin();
    return range > 0
        && column.getMax() > column.getMean() * thresholds.getOutlierDetectionMultiplier();
  }
}
