package com.csvinsight.profiler.service.profiling;

import java.util.Collection;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.profile.ColumnType;
import com.csvinsight.profiler.util.CellValues;

/**
 * Decides the semantic type of a column from its raw values. Missing cells are ignored; a column
 * with no remaining values is a string column. When the remaining values disagree the column is
 * {@link ColumnType#MIXED}.
 */
@Service
public class ColumnTypeInferenceService {

  // Prefix match only: "2024-01-15T10:00" is still a date.
  private static final Pattern DATE_PATTERN =
      Pattern.compile("^(?:\\d{4}-\\d{2}-\\d{2}|\\d{2}/\\d{2}/\\d{4}|\\d{2}-\\d{2}-\\d{4})");

  public ColumnType inferType(Collection<?> values) {
    ColumnType inferred = null;
    for (Object value : values) {
      if (CellValues.isMissing(value)) {
        continue;
      }
      ColumnType type = classify(value);
      if (inferred == null) {
        inferred = type;
      } else if (inferred != type) {
        return ColumnType.MIXED;
      }
    }
    return inferred == null ? ColumnType.STRING : inferred;
  }

  ColumnType classify(Object value) {
    if (CellValues.isNumeric(value)) {
      return ColumnType.NUMBER;
    }
    if (value instanceof Boolean) {
      return ColumnType.BOOLEAN;
    }
    if (value instanceof String && DATE_PATTERN.matcher((String) value).lookingAt()) {
      return ColumnType.DATE;
    }
    return ColumnType.STRING;
  }
}
