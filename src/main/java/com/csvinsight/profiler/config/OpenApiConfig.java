package com.csvinsight.profiler.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;

/** Metadata of the generated OpenAPI document served at {@code /v3/api-docs}. */
@Configuration
public class OpenApiConfig {

  static final String API_TITLE = "CSV Insight API";
  static final String API_SUMMARY =
      "Upload CSV datasets, inspect column profiles, review and apply cleaning suggestions,"
          + " export cleaned data and ask simple questions about a dataset.";

  @Value("${app.api.version:1.0.0}")
  private String apiVersion;

  @Value("${server.port:8080}")
  private int serverPort;

  @Bean
  public OpenAPI csvInsightOpenApi() {
    Info info =
        new Info()
            .title(API_TITLE)
            .version(apiVersion)
            .description(API_SUMMARY)
            .license(
                new License()
                    .name("Apache 2.0")
                    .url("https://www.apache.org/licenses/LICENSE-2.0"));

    Server local =
        new Server().url("http://localhost:" + serverPort).description("This instance");

    return new OpenAPI().info(info).servers(List.of(local));
  }
}
