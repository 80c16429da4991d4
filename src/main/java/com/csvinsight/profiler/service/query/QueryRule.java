package com.csvinsight.profiler.service.query;

import java.util.Optional;

/**
 * One entry of the question rule chain. A rule that does not recognise the question returns an
 * empty answer and the next rule is tried.
 */
public interface QueryRule {

  Optional<String> answer(QueryContext context);
}
