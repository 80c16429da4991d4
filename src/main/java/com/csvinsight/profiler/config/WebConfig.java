package com.csvinsight.profiler.config;

import java.util.Arrays;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Browser access to the dataset API. The root path opens Swagger UI, and cross-origin calls to
 * {@code /api/**} are allowed from {@code cors.allowed-origins}, or from anywhere when that list
 * is empty. Exports expose {@code Content-Disposition} so a browser client can read the file name.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  static final String API_PATTERN = "/api/**";
  static final String DOCS_HOME = "/swagger-ui/index.html";

  private static final String ANY_ORIGIN = "*";
  private static final String[] API_METHODS = {"GET", "POST", "DELETE", "OPTIONS"};
  private static final String[] EXPORT_HEADERS = {"Content-Disposition", "X-Correlation-Id"};

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", DOCS_HOME);
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping(API_PATTERN)
        .allowedOriginPatterns(originPatterns())
        .allowedMethods(API_METHODS)
        .allowedHeaders("*")
        .exposedHeaders(EXPORT_HEADERS)
        .allowCredentials(true);
  }

  /** Configured origins without blanks; a pattern rather than a literal origin keeps credentials. */
  String[] originPatterns() {
    String[] origins =
        allowedOrigins == null
            ? new String[0]
            : Arrays.stream(allowedOrigins)
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toArray(String[]::new);
    return origins.length == 0 ? new String[] {ANY_ORIGIN} : origins;
  }
}
