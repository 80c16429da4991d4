package com.csvinsight.profiler.service.query;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.ColumnProfile;
import com.csvinsight.profiler.dto.profile.DatasetProfile;

import lombok.Getter;

/** One question asked against a dataset and its profile. */
@Getter
public class QueryContext {

  private final String question;
  private final String normalizedQuestion;
  private final Dataset dataset;
  private final DatasetProfile profile;

  public QueryContext(String question, Dataset dataset, DatasetProfile profile) {
    this.question = question;
    this.normalizedQuestion = question == null ? "" : question.toLowerCase(Locale.ROOT);
    this.dataset = dataset;
    this.profile = profile;
  }

  public boolean mentionsAny(String... phrases) {
    for (String phrase : phrases) {
      if (normalizedQuestion.contains(phrase)) {
        return true;
      }
    }
    return false;
  }

  public List<String> columnNames() {
    return profile.getColumns().stream().map(ColumnProfile::getName).collect(Collectors.toList());
  }
}
