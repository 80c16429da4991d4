package com.csvinsight.profiler.service.query;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.DatasetProfile;

import lombok.extern.slf4j.Slf4j;

/**
 * Answers free-text questions about a dataset by keyword matching. Rules are tried in priority
 * order and the first answer wins; nothing is cached between calls.
 */
@Slf4j
@Service
public class DatasetQueryService {

  static final String FALLBACK_ANSWER =
      "I'm not sure how to answer that question about your data. Try asking about specific"
          + " columns, row counts, or statistics like maximum, minimum, or average values.";

  private final List<QueryRule> rules =
      List.of(new RowCountRule(), new ColumnListRule(), new ColumnQuestionRule());

  public String answer(String question, Dataset dataset, DatasetProfile profile) {
    QueryContext context = new QueryContext(question, dataset, profile);
    for (QueryRule rule : rules) {
      Optional<String> answer = rule.answer(context);
      if (answer.isPresent()) {
        log.debug("Question answered by {}", rule.getClass().getSimpleName());
        return answer.get();
      }
    }
    log.debug("No rule matched question: {}", question);
    return FALLBACK_ANSWER;
  }
}
