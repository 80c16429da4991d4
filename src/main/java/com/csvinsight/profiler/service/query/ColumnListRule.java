package com.csvinsight.profiler.service.query;

import java.util.List;
import java.util.Optional;

/** "How many columns/fields ..." and "What columns/fields ...". */
class ColumnListRule implements QueryRule {

  @Override
  public Optional<String> answer(QueryContext context) {
    List<String> columns = context.columnNames();
    if (context.mentionsAny("how many columns", "how many fields")) {
      return Optional.of(
          String.format(
              "There are %d columns in this dataset: %s.",
              columns.size(), String.join(", ", columns)));
    }
    if (context.mentionsAny("what columns", "what fields")) {
      return Optional.of(
          String.format("The columns in this dataset are: %s.", String.join(", ", columns)));
    }
    return Optional.empty();
  }
}
