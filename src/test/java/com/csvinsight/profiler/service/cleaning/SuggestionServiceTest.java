package com.csvinsight.profiler.service.cleaning;

import static com.csvinsight.profiler.fixtures.TestFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.csvinsight.profiler.dto.cleaning.CleaningSuggestion;
import com.csvinsight.profiler.dto.cleaning.CleaningThresholds;
import com.csvinsight.profiler.dto.cleaning.IssueType;
import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.fixtures.TestFixtures;
import com.csvinsight.profiler.service.profiling.ColumnProfilerService;
import com.csvinsight.profiler.service.profiling.ColumnTypeInferenceService;
import com.csvinsight.profiler.service.profiling.DatasetProfilerService;
import com.csvinsight.profiler.service.profiling.RowKeyEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;

class SuggestionServiceTest {

  private DatasetProfilerService profilerService;
  private SuggestionService suggestionService;

  @BeforeEach
  void setUp() {
    profilerService =
        new DatasetProfilerService(
            new ColumnTypeInferenceService(),
            new ColumnProfilerService(),
            new RowKeyEncoder(new ObjectMapper()));
    suggestionService = new SuggestionService(CleaningThresholds.defaults());
  }

  @Test
  void shouldSuggestMissingFillAndDuplicateRemoval() {
    DatasetProfile profile = profilerService.profile(TestFixtures.ageCityDataset());

    List<CleaningSuggestion> suggestions = suggestionService.generateSuggestions(profile);

    assertThat(suggestions).hasSize(2);

    CleaningSuggestion missing = suggestions.get(0);
    assertThat(missing.getColumn()).isEqualTo("age");
    assertThat(missing.getIssue()).isEqualTo(IssueType.MISSING);
    assertThat(missing.getDescription()).isEqualTo("1 missing values (33.33%)");
    assertThat(missing.getRecommendation()).isEqualTo("Fill with mean or median value");
    assertThat(missing.getAutoFix()).isTrue();

    CleaningSuggestion duplicate = suggestions.get(1);
    assertThat(duplicate.getColumn()).isEqualTo(CleaningSuggestion.MULTIPLE_COLUMNS);
    assertThat(duplicate.getIssue()).isEqualTo(IssueType.DUPLICATE);
    assertThat(duplicate.getDescription()).isEqualTo("1 duplicate rows (33.33%)");
    assertThat(duplicate.getRecommendation()).isEqualTo("Remove duplicate rows");
    assertThat(duplicate.getAutoFix()).isTrue();
  }

  @Test
  void shouldFlagOutlierWhenMaxExceedsThreeTimesMean() {
    DatasetProfile profile = profilerService.profile(TestFixtures.outlierDataset());

    List<CleaningSuggestion> suggestions = suggestionService.generateSuggestions(profile);

    assertThat(suggestions).hasSize(1);
    CleaningSuggestion outlier = suggestions.get(0);
    assertThat(outlier.getColumn()).isEqualTo("amount");
    assertThat(outlier.getIssue()).isEqualTo(IssueType.OUTLIER);
    assertThat(outlier.getDescription())
        .isEqualTo("Potential outliers detected (max value 1000 is far from mean 257.50)");
    assertThat(outlier.getRecommendation())
        .isEqualTo("Consider capping extreme values or removing outliers");
    assertThat(outlier.getAutoFix()).isTrue();
  }

  @Test
  void shouldEmitMissingThenDuplicateThenOutlier() {
    Dataset dataset =
        new Dataset(
            Arrays.asList("label", "amount"),
            Arrays.asList(
                row("label", "a", "amount", 1),
                row("label", "a", "amount", 1),
                row("label", null, "amount", 1),
                row("label", "b", "amount", 100)),
            "mixed.csv");

    List<CleaningSuggestion> suggestions =
        suggestionService.generateSuggestions(profilerService.profile(dataset));

    assertThat(suggestions)
        .extracting(CleaningSuggestion::getIssue)
        .containsExactly(IssueType.MISSING, IssueType.DUPLICATE, IssueType.OUTLIER);
    assertThat(suggestions.get(0).getRecommendation())
        .isEqualTo("Fill with most common value: \"a\"");
  }

  @Test
  void shouldRecommendPlaceholderForColumnsWithoutMode() {
    DatasetProfile profile = profilerService.profile(TestFixtures.employeeDataset());

    List<CleaningSuggestion> suggestions = suggestionService.generateSuggestions(profile);

    assertThat(suggestions)
        .extracting(CleaningSuggestion::getColumn)
        .containsExactly("name", "salary", "active", "hired");
    assertThat(suggestions.get(0).getRecommendation())
        .isEqualTo("Fill with most common value: \"Alice\"");
    assertThat(suggestions.get(2).getRecommendation())
        .isEqualTo("Fill with most common value: \"true\"");
    assertThat(suggestions.get(3).getRecommendation())
        .isEqualTo("Remove rows or fill with placeholder");
  }

  @Test
  void shouldNotFlagConstantNumericColumn() {
    Dataset dataset =
        Dataset.of(List.of("id", "v"), List.of(row("id", 1, "v", 5), row("id", 2, "v", 5)));

    assertThat(suggestionService.generateSuggestions(profilerService.profile(dataset))).isEmpty();
  }

  @Test
  void shouldUseConfiguredDetectionMultiplier() {
    DatasetProfile profile = profilerService.profile(TestFixtures.outlierDataset());
    SuggestionService strict =
        new SuggestionService(
            CleaningThresholds.builder().outlierDetectionMultiplier(4.0).build());

    assertThat(strict.generateSuggestions(profile)).isEmpty();
  }

  @Test
  void shouldNeverProduceInconsistentSuggestions() {
    for (Dataset dataset :
        List.of(
            TestFixtures.ageCityDataset(),
            TestFixtures.outlierDataset(),
            TestFixtures.employeeDataset())) {
      assertThat(suggestionService.generateSuggestions(profilerService.profile(dataset)))
          .extracting(CleaningSuggestion::getIssue)
          .doesNotContain(IssueType.INCONSISTENT);
    }
  }

  @Test
  void shouldReturnNoSuggestionsForCleanData() {
    Dataset dataset =
        Dataset.of(List.of("city"), List.of(row("city", "NY"), row("city", "LA")));

    assertThat(suggestionService.generateSuggestions(profilerService.profile(dataset))).isEmpty();
  }
}
