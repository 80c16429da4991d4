package com.csvinsight.profiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "profiler")
public class ApplicationProperties {

  private Cleaning cleaning = new Cleaning();
  private Storage storage = new Storage();

  @Data
  public static class Cleaning {
    private double outlierDetectionMultiplier = 3.0;
    private double outlierCapMultiplier = 3.0;
    private double numericFillDefault = 0.0;
    private String textFillDefault = "Unknown";
  }

  @Data
  public static class Storage {
    private long maxDatasets = 100;
    private long expireAfterAccessMinutes = 60;
  }
}
