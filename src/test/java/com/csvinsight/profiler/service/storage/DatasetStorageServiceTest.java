package com.csvinsight.profiler.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.csvinsight.profiler.config.ApplicationProperties;
import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.dataset.DatasetSummary;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.exception.DatasetNotFoundException;
import com.csvinsight.profiler.fixtures.TestFixtures;
import com.csvinsight.profiler.service.profiling.ColumnProfilerService;
import com.csvinsight.profiler.service.profiling.ColumnTypeInferenceService;
import com.csvinsight.profiler.service.profiling.DatasetProfilerService;
import com.csvinsight.profiler.service.profiling.RowKeyEncoder;
import com.csvinsight.profiler.service.storage.DatasetStorageService.StoredDataset;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("Dataset storage")
class DatasetStorageServiceTest {

  private DatasetStorageService storageService;
  private Dataset dataset;
  private DatasetProfile profile;

  @BeforeEach
  void setUp() {
    storageService = new DatasetStorageService(new ApplicationProperties());
    dataset = TestFixtures.ageCityDataset();
    profile =
        new DatasetProfilerService(
                new ColumnTypeInferenceService(),
                new ColumnProfilerService(),
                new RowKeyEncoder(new ObjectMapper()))
            .profile(dataset);
  }

  @Test
  void shouldStoreAndRetrieveDataset() {
    StoredDataset stored = storageService.store(dataset, profile);

    StoredDataset retrieved = storageService.getDataset(stored.getDatasetId());
    assertThat(retrieved.getDataset()).isSameAs(dataset);
    assertThat(retrieved.getProfile()).isSameAs(profile);
    assertThat(retrieved.isCleaned()).isFalse();
    assertThat(retrieved.getStoredAt()).isNotNull();
  }

  @Test
  void shouldMarkCleaningResultWithParent() {
    StoredDataset parent = storageService.store(dataset, profile);
    StoredDataset child = storageService.store(dataset, profile, parent.getDatasetId());

    assertThat(child.isCleaned()).isTrue();
    assertThat(child.getDatasetId()).isNotEqualTo(parent.getDatasetId());

    DatasetSummary summary = child.toSummary();
    assertThat(summary.getParentDatasetId()).isEqualTo(parent.getDatasetId());
    assertThat(summary.getDisplayName()).isEqualTo("people.csv");
    assertThat(summary.getFields()).containsExactly("age", "city");
    assertThat(summary.getRowCount()).isEqualTo(3);
  }

  @Test
  void shouldThrowForUnknownDataset() {
    assertThatThrownBy(() -> storageService.getDataset("missing-id"))
        .isInstanceOf(DatasetNotFoundException.class)
        .hasMessage("Dataset not found: missing-id");
  }

  @Test
  void shouldDeleteDataset() {
    StoredDataset stored = storageService.store(dataset, profile);

    assertThat(storageService.deleteDataset(stored.getDatasetId())).isTrue();
    assertThat(storageService.deleteDataset(stored.getDatasetId())).isFalse();
    assertThat(storageService.getAllDatasets()).isEmpty();
  }

  @Test
  void shouldListAndClearDatasets() {
    storageService.store(dataset, profile);
    storageService.store(dataset, profile);

    assertThat(storageService.getAllDatasets()).hasSize(2);

    storageService.clearDatasets();
    assertThat(storageService.getAllDatasets()).isEmpty();
  }

  @Test
  void shouldEvictBeyondConfiguredCapacity() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getStorage().setMaxDatasets(1);
    DatasetStorageService bounded = new DatasetStorageService(properties);

    StoredDataset first = bounded.store(dataset, profile);
    StoredDataset second = bounded.store(dataset, profile);

    assertThat(bounded.getAllDatasets())
        .extracting(StoredDataset::getDatasetId)
        .containsExactly(second.getDatasetId())
        .doesNotContain(first.getDatasetId());
  }
}
