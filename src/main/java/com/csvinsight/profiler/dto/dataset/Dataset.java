package com.csvinsight.profiler.dto.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.csvinsight.profiler.util.CellValues;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Parsed tabular data: ordered field names plus ordered rows. Instances are immutable; every
 * transformation returns a new {@code Dataset}. Keys absent from a row are read as {@code null}.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "rows")
public final class Dataset {

  @JsonProperty("fields")
  private final List<String> fields;

  @JsonProperty("data")
  private final List<Map<String, Object>> rows;

  @JsonProperty("display_name")
  private final String displayName;

  @JsonCreator
  public Dataset(
      @JsonProperty("fields") List<String> fields,
      @JsonProperty("data") List<Map<String, Object>> rows,
      @JsonProperty("display_name") String displayName) {
    this.fields =
        fields == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(fields));
    this.rows = rows == null ? List.of() : copyRows(rows);
    this.displayName = displayName;
  }

  public static Dataset of(List<String> fields, List<Map<String, Object>> rows) {
    return new Dataset(fields, rows, null);
  }

  /** Same fields and display name over a different set of rows. */
  public Dataset withRows(List<Map<String, Object>> newRows) {
    return new Dataset(fields, newRows, displayName);
  }

  @JsonIgnore
  public int getRowCount() {
    return rows.size();
  }

  public Object valueAt(int rowIndex, String field) {
    return rows.get(rowIndex).get(field);
  }

  /** Values of one field across all rows, in row order. Absent keys yield {@code null}. */
  public List<Object> columnValues(String field) {
    List<Object> values = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(field));
    }
    return values;
  }

  /**
   * Copy of {@code row} with {@code field} set to {@code value}. The source row is left untouched,
   * so rows can be shared between dataset versions.
   */
  public static Map<String, Object> withValue(Map<String, Object> row, String field, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(row);
    copy.put(field, value);
    return Collections.unmodifiableMap(copy);
  }

  private static List<Map<String, Object>> copyRows(List<Map<String, Object>> source) {
    List<Map<String, Object>> copy = new ArrayList<>(source.size());
    for (Map<String, Object> row : source) {
      copy.add(copyRow(row));
    }
    return Collections.unmodifiableList(copy);
  }

  private static Map<String, Object> copyRow(Map<String, Object> row) {
    Map<String, Object> normalized = new LinkedHashMap<>();
    if (row != null) {
      row.forEach((key, value) -> normalized.put(key, CellValues.normalize(value)));
    }
    return Collections.unmodifiableMap(normalized);
  }
}
