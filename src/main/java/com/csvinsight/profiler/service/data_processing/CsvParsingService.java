package com.csvinsight.profiler.service.data_processing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.csvinsight.profiler.dto.dataset.Dataset;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns uploaded CSV bytes into a {@link Dataset}. The first row is the header. Cells are
 * coerced: {@code true}/{@code TRUE} and {@code false}/{@code FALSE} become booleans, numeric
 * literals within double range become numbers, empty cells become {@code null} and anything else
 * stays text.
 */
@Slf4j
@Service
public class CsvParsingService {

  private static final Pattern NUMERIC_LITERAL =
      Pattern.compile("^\\s*-?(\\d+\\.?|\\.\\d+|\\d+\\.\\d+)([eE][-+]?\\d+)?\\s*$");

  public Dataset parseCsv(byte[] csvData, String fileName) {
    return parseCsv(new ByteArrayInputStream(csvData), fileName);
  }

  public Dataset parseCsv(InputStream csvStream, String fileName) {
    List<Map<String, Object>> data = new ArrayList<>();
    List<String> columns;

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {

      String[] headers = reader.readNext();
      if (headers == null || isBlankLine(headers)) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      columns = uniqueColumns(headers);

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (isBlankLine(row)) {
          continue;
        }
        if (row.length != headers.length) {
          log.debug(
              "Skipping row with incorrect column count: {} vs {}", row.length, headers.length);
          continue;
        }

        Map<String, Object> rowData = new LinkedHashMap<>();
        for (int i = 0; i < headers.length; i++) {
          rowData.put(headers[i], coerce(row[i]));
        }
        data.add(rowData);
      }
    } catch (IOException | CsvValidationException e) {
      throw new IllegalArgumentException("Unable to read CSV file: " + e.getMessage(), e);
    }

    log.info("Parsed {} rows with {} columns from {}", data.size(), columns.size(), fileName);
    return new Dataset(columns, data, fileName);
  }

  /** Typed value of a raw CSV cell. */
  static Object coerce(String raw) {
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    if ("true".equals(raw) || "TRUE".equals(raw)) {
      return Boolean.TRUE;
    }
    if ("false".equals(raw) || "FALSE".equals(raw)) {
      return Boolean.FALSE;
    }
    if (NUMERIC_LITERAL.matcher(raw).matches()) {
      Double number = Double.valueOf(raw.trim());
      // out-of-range literals such as 1e999 stay text rather than becoming Infinity
      return Double.isFinite(number) ? number : raw;
    }
    return raw;
  }

  private List<String> uniqueColumns(String[] headers) {
    Set<String> columns = new LinkedHashSet<>();
    for (String header : headers) {
      if (!columns.add(header)) {
        throw new IllegalArgumentException("CSV header contains duplicate column: " + header);
      }
    }
    return new ArrayList<>(Arrays.asList(headers));
  }

  private boolean isBlankLine(String[] row) {
    return row.length == 0 || (row.length == 1 && row[0].isEmpty());
  }
}
