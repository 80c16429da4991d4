package com.csvinsight.profiler.service.profiling;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Canonical row key used for duplicate detection. A row is serialized as a JSON object over the
 * dataset's fields in field order, absent keys written as {@code null}, so two rows share a key
 * exactly when every cell is equal.
 */
@Component
public class RowKeyEncoder {

  private final ObjectWriter keyWriter;

  public RowKeyEncoder(ObjectMapper objectMapper) {
    this.keyWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
  }

  public String encode(List<String> fields, Map<String, Object> row) {
    Map<String, Object> ordered = new LinkedHashMap<>();
    for (String field : fields) {
      ordered.put(field, row.get(field));
    }
    try {
      return keyWriter.writeValueAsString(ordered);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Row cannot be serialized: " + e.getOriginalMessage(), e);
    }
  }
}
