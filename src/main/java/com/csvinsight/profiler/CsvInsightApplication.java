package com.csvinsight.profiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CsvInsightApplication {

  public static void main(String[] args) {
    SpringApplication.run(CsvInsightApplication.class, args);
  }
}
