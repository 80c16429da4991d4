package com.csvinsight.profiler.service.profiling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.profile.ColumnProfile;
import com.csvinsight.profiler.dto.profile.ColumnType;
import com.csvinsight.profiler.util.CellValues;

/**
 * Computes the statistics of one column given its values and inferred type. Never throws for
 * well-formed input; an empty column is reported as all-null with a zero null percentage.
 */
@Service
public class ColumnProfilerService {

  /**
   * @param name column name
   * @param values cell values in row order, missing cells included
   * @param type type inferred for the column
   * @param rowCount number of rows in the enclosing dataset, the denominator of the null
   *     percentage
   */
  public ColumnProfile profileColumn(
      String name, List<Object> values, ColumnType type, int rowCount) {
    int nullCount = 0;
    for (Object value : values) {
      if (CellValues.isMissing(value)) {
        nullCount++;
      }
    }

    ColumnProfile.ColumnProfileBuilder builder =
        ColumnProfile.builder()
            .name(name)
            .type(type)
            .nullCount(nullCount)
            .nullPercentage(CellValues.percentage(nullCount, rowCount))
            .uniqueCount(new HashSet<>(values).size());

    if (type == ColumnType.NUMBER) {
      applyNumericSummary(builder, values);
    }
    if (type.isCategorical()) {
      Map<String, Integer> categories = frequencyTable(values);
      builder.categories(Collections.unmodifiableMap(categories)).mode(mode(categories));
    }
    return builder.build();
  }

  private void applyNumericSummary(
      ColumnProfile.ColumnProfileBuilder builder, List<Object> values) {
    List<Double> numbers = new ArrayList<>();
    for (Object value : values) {
      if (CellValues.isNumeric(value)) {
        numbers.add((Double) value);
      }
    }
    if (numbers.isEmpty()) {
      return;
    }

    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sum = 0;
    for (double number : numbers) {
      min = Math.min(min, number);
      max = Math.max(max, number);
      sum += number;
    }

    builder.min(min).max(max).mean(mean(numbers, sum)).median(median(numbers));
  }

  /** Falls back to summing scaled terms when the plain sum overflows. */
  static double mean(List<Double> numbers, double sum) {
    int count = numbers.size();
    if (Double.isFinite(sum)) {
      return sum / count;
    }
    double mean = 0;
    for (double number : numbers) {
      mean += number / count;
    }
    return mean;
  }

  static double median(List<Double> numbers) {
    List<Double> sorted = new ArrayList<>(numbers);
    Collections.sort(sorted);
    int mid = sorted.size() / 2;
    if (sorted.size() % 2 == 0) {
      // halving each side first keeps the average finite near Double.MAX_VALUE
      return sorted.get(mid - 1) / 2 + sorted.get(mid) / 2;
    }
    return sorted.get(mid);
  }

  /** Counts non-missing values by string form, in first-seen order. */
  private Map<String, Integer> frequencyTable(List<Object> values) {
    Map<String, Integer> categories = new LinkedHashMap<>();
    for (Object value : values) {
      if (!CellValues.isMissing(value)) {
        categories.merge(CellValues.format(value), 1, Integer::sum);
      }
    }
    return categories;
  }

  /** Highest count wins; on a tie the key seen first is kept. */
  private String mode(Map<String, Integer> categories) {
    String mode = null;
    int maxCount = 0;
    for (Map.Entry<String, Integer> entry : categories.entrySet()) {
      if (entry.getValue() > maxCount) {
        maxCount = entry.getValue();
        mode = entry.getKey();
      }
    }
    return mode;
  }
}
