package com.csvinsight.profiler.service.storage;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.config.ApplicationProperties;
import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.dto.dataset.DatasetSummary;
import com.csvinsight.profiler.dto.profile.DatasetProfile;
import com.csvinsight.profiler.exception.DatasetNotFoundException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory store of uploaded and cleaned datasets. Entries are bounded in number and expire when
 * unused. Stored values are immutable, so they can be handed out to concurrent requests as is.
 */
@Slf4j
@Service
public class DatasetStorageService {

  private final Cache<String, StoredDataset> datasets;

  public DatasetStorageService(ApplicationProperties properties) {
    ApplicationProperties.Storage storage = properties.getStorage();
    this.datasets =
        CacheBuilder.newBuilder()
            .maximumSize(storage.getMaxDatasets())
            .expireAfterAccess(storage.getExpireAfterAccessMinutes(), TimeUnit.MINUTES)
            .build();
  }

  @Value
  @Builder
  public static class StoredDataset {
    String datasetId;
    String parentDatasetId;
    Dataset dataset;
    DatasetProfile profile;
    LocalDateTime storedAt;

    public boolean isCleaned() {
      return parentDatasetId != null;
    }

    public DatasetSummary toSummary() {
      return DatasetSummary.builder()
          .datasetId(datasetId)
          .parentDatasetId(parentDatasetId)
          .displayName(dataset.getDisplayName())
          .fields(dataset.getFields())
          .rowCount(dataset.getRowCount())
          .storedAt(storedAt)
          .build();
    }
  }

  public StoredDataset store(Dataset dataset, DatasetProfile profile) {
    return store(dataset, profile, null);
  }

  /** Stores a dataset with its profile. {@code parentDatasetId} marks a cleaning result. */
  public StoredDataset store(Dataset dataset, DatasetProfile profile, String parentDatasetId) {
    StoredDataset stored =
        StoredDataset.builder()
            .datasetId(UUID.randomUUID().toString())
            .parentDatasetId(parentDatasetId)
            .dataset(dataset)
            .profile(profile)
            .storedAt(LocalDateTime.now())
            .build();
    datasets.put(stored.getDatasetId(), stored);
    log.info("Stored dataset {} ({})", stored.getDatasetId(), dataset.getDisplayName());
    return stored;
  }

  /**
   * @throws DatasetNotFoundException if no dataset is stored under {@code datasetId}, or it has
   *     expired
   */
  public StoredDataset getDataset(String datasetId) {
    StoredDataset stored = datasets.getIfPresent(datasetId);
    if (stored == null) {
      throw new DatasetNotFoundException(datasetId);
    }
    return stored;
  }

  public List<StoredDataset> getAllDatasets() {
    return new ArrayList<>(datasets.asMap().values());
  }

  public boolean deleteDataset(String datasetId) {
    StoredDataset removed = datasets.asMap().remove(datasetId);
    if (removed != null) {
      log.info("Deleted dataset {} ({})", datasetId, removed.getDataset().getDisplayName());
      return true;
    }
    log.warn("Dataset not found for deletion: {}", datasetId);
    return false;
  }

  public void clearDatasets() {
    datasets.invalidateAll();
    log.info("Cleared all stored datasets");
  }
}
