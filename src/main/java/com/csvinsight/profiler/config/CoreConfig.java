package com.csvinsight.profiler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.csvinsight.profiler.dto.cleaning.CleaningThresholds;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public CleaningThresholds cleaningThresholds(ApplicationProperties properties) {
    ApplicationProperties.Cleaning cleaning = properties.getCleaning();
    return CleaningThresholds.builder()
        .outlierDetectionMultiplier(cleaning.getOutlierDetectionMultiplier())
        .outlierCapMultiplier(cleaning.getOutlierCapMultiplier())
        .numericFillDefault(cleaning.getNumericFillDefault())
        .textFillDefault(cleaning.getTextFillDefault())
        .build();
  }
}
