package com.csvinsight.profiler.service.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;

import com.csvinsight.profiler.util.CellValues;

/**
 * Questions about a single column. The subject is the first column, in column order, whose name
 * appears in the question. Sub-intents are tried in order; max, min and average fall through when
 * the column holds no numbers. Without a matching sub-intent a short summary of the column is
 * returned.
 *
 * <p>Every answer is computed from the dataset's current cells, not from the profile.
 */
class ColumnQuestionRule implements QueryRule {

  private final List<SubIntent> subIntents =
      List.of(
          new SubIntent(new String[] {"maximum", "max", "highest"}, this::maximum),
          new SubIntent(new String[] {"minimum", "min", "lowest"}, this::minimum),
          new SubIntent(new String[] {"average", "mean"}, this::average),
          new SubIntent(new String[] {"unique", "distinct"}, this::uniqueCount),
          new SubIntent(new String[] {"missing", "null", "empty"}, this::missingCount));

  @Override
  public Optional<String> answer(QueryContext context) {
    Optional<String> subject = findSubjectColumn(context);
    if (subject.isEmpty()) {
      return Optional.empty();
    }
    String column = subject.get();
    for (SubIntent intent : subIntents) {
      if (context.mentionsAny(intent.phrases)) {
        Optional<String> answer = intent.handler.apply(context, column);
        if (answer.isPresent()) {
          return answer;
        }
      }
    }
    return Optional.of(summary(context, column));
  }

  Optional<String> findSubjectColumn(QueryContext context) {
    for (String column : context.columnNames()) {
      if (context.getNormalizedQuestion().contains(column.toLowerCase(Locale.ROOT))) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  private Optional<String> maximum(QueryContext context, String column) {
    return numbersIfLeadingNumeric(context, column)
        .map(numbers -> numbers.stream().mapToDouble(Double::doubleValue).max().getAsDouble())
        .map(
            max ->
                String.format(
                    "The maximum value in the \"%s\" column is %s.",
                    column, CellValues.formatNumber(max)));
  }

  private Optional<String> minimum(QueryContext context, String column) {
    return numbersIfLeadingNumeric(context, column)
        .map(numbers -> numbers.stream().mapToDouble(Double::doubleValue).min().getAsDouble())
        .map(
            min ->
                String.format(
                    "The minimum value in the \"%s\" column is %s.",
                    column, CellValues.formatNumber(min)));
  }

  private Optional<String> average(QueryContext context, String column) {
    List<Double> numbers = numbers(context, column);
    if (numbers.isEmpty()) {
      return Optional.empty();
    }
    double sum = 0;
    for (double number : numbers) {
      sum += number;
    }
    return Optional.of(
        String.format(
            "The average value in the \"%s\" column is %s.",
            column, CellValues.formatFixed(sum / numbers.size())));
  }

  private Optional<String> uniqueCount(QueryContext context, String column) {
    int unique = new HashSet<>(context.getDataset().columnValues(column)).size();
    return Optional.of(
        String.format("There are %d unique values in the \"%s\" column.", unique, column));
  }

  private Optional<String> missingCount(QueryContext context, String column) {
    int missing = countMissing(context, column);
    double percentage = CellValues.percentage(missing, context.getDataset().getRowCount());
    return Optional.of(
        String.format(
            "There are %d missing values (%s%%) in the \"%s\" column.",
            missing, CellValues.formatFixed(percentage), column));
  }

  /**
   * The reported type is read from the first row only, so it can differ from the profiled type of
   * a mixed column.
   */
  private String summary(QueryContext context, String column) {
    List<Object> values = context.getDataset().columnValues(column);
    int unique = new HashSet<>(values).size();
    int missing = countMissing(context, column);
    double percentage = CellValues.percentage(missing, context.getDataset().getRowCount());
    String sampleType = values.isEmpty() ? "unknown" : typeName(values.get(0));

    return String.format(
        "Information about \"%s\":\n- %d unique values\n- %d missing values (%s%%)\n- Type: %s",
        column, unique, missing, CellValues.formatFixed(percentage), sampleType);
  }

  /** Numeric cells of the column, or empty when the first non-missing cell is not a number. */
  private Optional<List<Double>> numbersIfLeadingNumeric(QueryContext context, String column) {
    for (Object value : context.getDataset().columnValues(column)) {
      if (!CellValues.isMissing(value)) {
        return CellValues.isNumeric(value)
            ? Optional.of(numbers(context, column))
            : Optional.empty();
      }
    }
    return Optional.empty();
  }

  private List<Double> numbers(QueryContext context, String column) {
    List<Double> numbers = new ArrayList<>();
    for (Object value : context.getDataset().columnValues(column)) {
      if (CellValues.isNumeric(value)) {
        numbers.add((Double) value);
      }
    }
    return numbers;
  }

  private int countMissing(QueryContext context, String column) {
    int missing = 0;
    for (Object value : context.getDataset().columnValues(column)) {
      if (CellValues.isMissing(value)) {
        missing++;
      }
    }
    return missing;
  }

  private static String typeName(Object value) {
    if (value == null) {
      return "null";
    }
    if (CellValues.isNumeric(value)) {
      return "number";
    }
    if (value instanceof Boolean) {
      return "boolean";
    }
    return "string";
  }

  private static final class SubIntent {
    private final String[] phrases;
    private final BiFunction<QueryContext, String, Optional<String>> handler;

    private SubIntent(
        String[] phrases, BiFunction<QueryContext, String, Optional<String>> handler) {
      this.phrases = phrases;
      this.handler = handler;
    }
  }
}
