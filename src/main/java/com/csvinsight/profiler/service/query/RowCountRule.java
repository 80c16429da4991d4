package com.csvinsight.profiler.service.query;

import java.util.Optional;

/** "How many rows/records ...". */
class RowCountRule implements QueryRule {

  @Override
  public Optional<String> answer(QueryContext context) {
    if (!context.mentionsAny("how many rows", "how many records")) {
      return Optional.empty();
    }
    return Optional.of(
        String.format("There are %d rows in this dataset.", context.getDataset().getRowCount()));
  }
}
