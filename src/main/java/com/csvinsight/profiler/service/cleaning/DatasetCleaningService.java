package com.csvinsight.profiler.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.cleaning.CleaningResult;
import com.csvinsight.profiler.dto.cleaning.CleaningSuggestion;
import com.csvinsight.profiler.dto.cleaning.CleaningThresholds;
import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.ColumnProfile;
import com.csvinsight.profiler.dto.profile.ColumnType;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.service.profiling.RowKeyEncoder;
import com.csvinsight.profiler.util.CellValues;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a caller-selected, ordered list of suggestions to a dataset. Each suggestion sees the
 * result of the ones before it. Fill and cap values come from the profile of the original dataset.
 *
 * <p>Null entries, suggestions that are not auto-fixable, and suggestions whose column is not in
 * the profile are skipped and left out of the applied count. The input dataset and profile are
 * never modified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetCleaningService {

  private final CleaningThresholds thresholds;
  private final RowKeyEncoder rowKeyEncoder;

  public CleaningResult clean(
      Dataset dataset, DatasetProfile profile, List<CleaningSuggestion> selectedSuggestions) {
    Dataset current = dataset;
    int applied = 0;

    for (CleaningSuggestion suggestion : selectedSuggestions) {
      if (suggestion == null) {
        log.debug("Skipped null cleaning suggestion");
        continue;
      }
      Optional<Dataset> result = apply(current, profile, suggestion);
      if (result.isPresent()) {
        current = result.get();
        applied++;
      } else {
        log.debug(
            "Skipped {} suggestion for column '{}'", suggestion.getIssue(), suggestion.getColumn());
      }
    }

    log.info(
        "Applied {} of {} cleaning suggestions to '{}': {} rows -> {} rows",
        applied,
        selectedSuggestions.size(),
        dataset.getDisplayName(),
        dataset.getRowCount(),
        current.getRowCount());
    return new CleaningResult(current, applied);
  }

  private Optional<Dataset> apply(
      Dataset dataset, DatasetProfile profile, CleaningSuggestion suggestion) {
    if (!suggestion.isAutoFixable() || suggestion.getIssue() == null) {
      return Optional.empty();
    }
    switch (suggestion.getIssue()) {
      case DUPLICATE:
        return Optional.of(removeDuplicates(dataset));
      case MISSING:
        return profile
            .findColumn(suggestion.getColumn())
            .map(column -> fillMissing(dataset, column));
      case OUTLIER:
        return profile
            .findColumn(suggestion.getColumn())
            .filter(column -> column.isNumeric() && column.getMedian() != null)
            .map(column -> capOutliers(dataset, column));
      default:
        // no automatic fix exists for inconsistent values
        return Optional.empty();
    }
  }

  /** Keeps the first row for each canonical key, in first-occurrence order. */
  Dataset removeDuplicates(Dataset dataset) {
    Map<String, Map<String, Object>> unique = new LinkedHashMap<>();
    for (Map<String, Object> row : dataset.getRows()) {
      unique.putIfAbsent(rowKeyEncoder.encode(dataset.getFields(), row), row);
    }
    return dataset.withRows(new ArrayList<>(unique.values()));
  }

  Dataset fillMissing(Dataset dataset, ColumnProfile column) {
    String field = column.getName();
    Object fill = fillValue(column);

    List<Map<String, Object>> rows = new ArrayList<>(dataset.getRowCount());
    for (Map<String, Object> row : dataset.getRows()) {
      rows.add(CellValues.isMissing(row.get(field)) ? Dataset.withValue(row, field, fill) : row);
    }
    return dataset.withRows(rows);
  }

  Dataset capOutliers(Dataset dataset, ColumnProfile column) {
    String field = column.getName();
    double cap = column.getMedian() * thresholds.getOutlierCapMultiplier();

    List<Map<String, Object>> rows = new ArrayList<>(dataset.getRowCount());
    for (Map<String, Object> row : dataset.getRows()) {
      Object value = row.get(field);
      if (CellValues.isNumeric(value) && (Double) value > cap) {
        rows.add(Dataset.withValue(row, field, cap));
      } else {
        rows.add(row);
      }
    }
    return dataset.withRows(rows);
  }

  private Object fillValue(ColumnProfile column) {
    if (column.isNumeric() && column.getMedian() != null) {
      return column.getMedian();
    }
    if (column.getMode() != null) {
      // the frequency table is keyed by text; restore the boolean so the column keeps its type
      return column.getType() == ColumnType.BOOLEAN
          ? Boolean.valueOf(column.getMode())
          : column.getMode();
    }
    return column.isNumeric()
        ? thresholds.getNumericFillDefault()
        : thresholds.getTextFillDefault();
  }
}
