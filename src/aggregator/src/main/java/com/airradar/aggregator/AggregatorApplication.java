package com.airradar.aggregator;

import com.airradar.aggregator.config.AggregatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the air quality aggregation service.
 *
 * <p>The application merges station feeds from several upstream sources and exposes radius,
 * bounding-box and single-point queries backed by a TTL cache and a call debouncer.
 */
@SpringBootApplication
@EnableConfigurationProperties(AggregatorProperties.class)
public class AggregatorApplication {
  /**
   * Starts the aggregation API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(AggregatorApplication.class, args);
  }
}
