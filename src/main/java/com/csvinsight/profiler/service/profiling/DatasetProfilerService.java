package com.csvinsight.profiler.service.profiling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.ColumnCategories;
import com.csvinsight.profiler.dto.profile.ColumnProfile;
import com.csvinsight.profiler.dto.profile.ColumnType;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.util.CellValues;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the {@link DatasetProfile} of a dataset: one {@link ColumnProfile} per field, in field
 * order, plus dataset-wide null and duplicate metrics. Profiling the same dataset twice yields
 * equal profiles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetProfilerService {

  private final ColumnTypeInferenceService typeInferenceService;
  private final ColumnProfilerService columnProfilerService;
  private final RowKeyEncoder rowKeyEncoder;

  public DatasetProfile profile(Dataset dataset) {
    List<String> fields = dataset.getFields();
    int rowCount = dataset.getRowCount();

    List<ColumnProfile> columns = new ArrayList<>(fields.size());
    int nullValues = 0;
    for (String field : fields) {
      List<Object> values = dataset.columnValues(field);
      ColumnType type = typeInferenceService.inferType(values);
      ColumnProfile column = columnProfilerService.profileColumn(field, values, type, rowCount);
      nullValues += column.getNullCount();
      columns.add(column);
    }

    int duplicateRows = countDuplicateRows(dataset);
    long totalCells = (long) rowCount * fields.size();

    DatasetProfile profile =
        DatasetProfile.builder()
            .rowCount(rowCount)
            .columnCount(fields.size())
            .columns(Collections.unmodifiableList(columns))
            .nullValues(nullValues)
            .nullPercentage(CellValues.percentage(nullValues, totalCells))
            .duplicateRows(duplicateRows)
            .duplicatePercentage(CellValues.percentage(duplicateRows, rowCount))
            .build();

    log.info(
        "Profiled dataset '{}': {} rows, {} columns, {} null cells, {} duplicate rows",
        dataset.getDisplayName(),
        rowCount,
        fields.size(),
        nullValues,
        duplicateRows);
    return profile;
  }

  /** Rows beyond the first occurrence of each canonical row key. */
  public int countDuplicateRows(Dataset dataset) {
    Set<String> seen = new HashSet<>();
    int duplicates = 0;
    for (Map<String, Object> row : dataset.getRows()) {
      if (!seen.add(rowKeyEncoder.encode(dataset.getFields(), row))) {
        duplicates++;
      }
    }
    return duplicates;
  }

  /** Splits columns into dimensions (non-numeric) and measures (numeric), keeping column order. */
  public ColumnCategories categorize(DatasetProfile profile) {
    List<String> dimensions = new ArrayList<>();
    List<String> measures = new ArrayList<>();
    for (ColumnProfile column : profile.getColumns()) {
      if (column.isNumeric()) {
        measures.add(column.getName());
      } else {
        dimensions.add(column.getName());
      }
    }
    return ColumnCategories.builder().dimensions(dimensions).measures(measures).build();
  }
}
