package com.csvinsight.profiler.service.data_processing;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.dataset.Dataset;
import com.csvinsight.profiler.util.CellValues;
import com.opencsv.CSVWriter;

import lombok.extern.slf4j.Slf4j;

/** Writes a {@link Dataset} back to CSV: header row from the fields, then one line per row. */
@Slf4j
@Service
public class CsvExportService {

  private static final String CLEANED_PREFIX = "cleaned_";

  public String toCsv(Dataset dataset) {
    List<String> fields = dataset.getFields();
    StringWriter out = new StringWriter();

    try (CSVWriter writer = new CSVWriter(out)) {
      writer.writeNext(fields.toArray(new String[0]), false);

      for (Map<String, Object> row : dataset.getRows()) {
        String[] line = new String[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
          line[i] = CellValues.format(row.get(fields.get(i)));
        }
        writer.writeNext(line, false);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write CSV for " + dataset.getDisplayName(), e);
    }

    log.info("Exported {} rows from {}", dataset.getRowCount(), dataset.getDisplayName());
    return out.toString();
  }

  public String exportFileName(Dataset dataset, boolean cleaned) {
    String name = dataset.getDisplayName();
    if (name == null || name.isEmpty()) {
      name = "dataset.csv";
    }
    return cleaned ? CLEANED_PREFIX + name : name;
  }
}
