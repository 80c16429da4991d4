package com.csvinsight.profiler.service.query;

import static com.csvinsight.profiler.fixtures.TestFixtures.row;
import static com.csvinsight.profiler.fixtures.TestFixtures.suggestion;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.csvinsight.profiler.dto.cleaning.CleaningThresholds;
import com.csvinsight.profiler.dto.cleaning.IssueType;
import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.fixtures.TestFixtures;
import com.csvinsight.profiler.service.cleaning.DatasetCleaningService;
import com.csvinsight.profiler.service.profiling.ColumnProfilerService;
import com.csvinsight.profiler.service.profiling.ColumnTypeInferenceService;
import com.csvinsight.profiler.service.profiling.DatasetProfilerService;
import com.csvinsight.profiler.service.profiling.RowKeyEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("Dataset questions")
class DatasetQueryServiceTest {

  private DatasetProfilerService profilerService;
  private DatasetQueryService queryService;

  @BeforeEach
  void setUp() {
    profilerService =
        new DatasetProfilerService(
            new ColumnTypeInferenceService(),
            new ColumnProfilerService(),
            new RowKeyEncoder(new ObjectMapper()));
    queryService = new DatasetQueryService();
  }

  private String ask(String question, Dataset dataset) {
    return queryService.answer(question, dataset, profilerService.profile(dataset));
  }

  @Nested
  @DisplayName("Dataset shape")
  class DatasetShape {

    @Test
    @DisplayName("Counts rows")
    void shouldAnswerRowCount() {
      assertThat(ask("How many rows are in this dataset?", TestFixtures.ageCityDataset()))
          .isEqualTo("There are 3 rows in this dataset.");
    }

    @Test
    void shouldIgnoreCase() {
      assertThat(ask("HOW MANY RECORDS DO WE HAVE", TestFixtures.ageCityDataset()))
          .isEqualTo("There are 3 rows in this dataset.");
    }

    @Test
    void shouldCountAndListColumns() {
      assertThat(ask("How many columns are there?", TestFixtures.ageCityDataset()))
          .isEqualTo("There are 2 columns in this dataset: age, city.");
    }

    @Test
    void shouldListColumns() {
      assertThat(ask("What fields does it have?", TestFixtures.employeeDataset()))
          .isEqualTo("The columns in this dataset are: name, salary, active, hired.");
    }

    @Test
    void rowCountShouldWinOverColumnQuestions() {
      assertThat(ask("How many rows have a missing age?", TestFixtures.ageCityDataset()))
          .isEqualTo("There are 3 rows in this dataset.");
    }
  }

  @Nested
  @DisplayName("Column statistics")
  class ColumnStatistics {

    @Test
    void shouldAnswerMaximum() {
      assertThat(ask("What is the highest salary?", TestFixtures.employeeDataset()))
          .isEqualTo("The maximum value in the \"salary\" column is 62000.");
    }

    @Test
    void shouldAnswerMinimum() {
      assertThat(ask("What is the min amount?", TestFixtures.outlierDataset()))
          .isEqualTo("The minimum value in the \"amount\" column is 10.");
    }

    @Test
    void shouldAnswerAverageWithTwoDecimals() {
      assertThat(ask("What's the mean salary?", TestFixtures.employeeDataset()))
          .isEqualTo("The average value in the \"salary\" column is 56666.67.");
    }

    @Test
    void shouldAnswerUniqueCount() {
      assertThat(ask("How many distinct values does city have?", TestFixtures.ageCityDataset()))
          .isEqualTo("There are 1 unique values in the \"city\" column.");
    }

    @Test
    void shouldAnswerMissingCount() {
      assertThat(ask("Are any age values missing?", TestFixtures.ageCityDataset()))
          .isEqualTo("There are 1 missing values (33.33%) in the \"age\" column.");
    }

    @Test
    @DisplayName("Falls back to the column summary when max is asked of a text column")
    void shouldSummarizeTextColumnWhenAskedForMaximum() {
      assertThat(ask("What is the maximum city?", TestFixtures.ageCityDataset()))
          .isEqualTo(
              "Information about \"city\":\n"
                  + "- 1 unique values\n"
                  + "- 0 missing values (0.00%)\n"
                  + "- Type: string");
    }

    @Test
    void shouldPickFirstMatchingColumnInColumnOrder() {
      assertThat(ask("Show me the max salary per name", TestFixtures.employeeDataset()))
          .startsWith("Information about \"name\":");
    }

    @Test
    void shouldReportNullTypeWhenFirstCellIsMissing() {
      Dataset dataset = Dataset.of(List.of("score"), List.of(row("score", null), row("score", 5)));

      assertThat(ask("tell me about score", dataset))
          .isEqualTo(
              "Information about \"score\":\n"
                  + "- 2 unique values\n"
                  + "- 1 missing values (50.00%)\n"
                  + "- Type: null");
    }

    @Test
    void shouldReadCurrentCellsRatherThanProfile() {
      Dataset original = TestFixtures.outlierDataset();
      DatasetProfile profile = profilerService.profile(original);
      DatasetCleaningService cleaningService =
          new DatasetCleaningService(
              CleaningThresholds.defaults(), new RowKeyEncoder(new ObjectMapper()));
      Dataset capped =
          cleaningService
              .clean(original, profile, List.of(suggestion(IssueType.OUTLIER, "amount")))
              .getDataset();

      assertThat(queryService.answer("max amount?", capped, profile))
          .isEqualTo("The maximum value in the \"amount\" column is 30.");
    }
  }

  @Test
  void shouldFallBackWhenNothingMatches() {
    assertThat(ask("Tell me a joke", TestFixtures.ageCityDataset()))
        .isEqualTo(DatasetQueryService.FALLBACK_ANSWER)
        .startsWith("I'm not sure how to answer that question about your data.");
  }
}
