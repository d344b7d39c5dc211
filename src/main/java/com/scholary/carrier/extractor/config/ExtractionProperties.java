package com.scholary.carrier.extractor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for extraction jobs.
 *
 * <p>Controls pacing, retries and how many jobs may run at once. Bound from the "extraction.*"
 * keys in application.yml.
 */
@ConfigurationProperties(prefix = "extraction")
@Validated
public record ExtractionProperties(
    @PositiveOrZero Integer requestsPerMinute,
    @PositiveOrZero Integer maxRetries,
    @NotNull Duration retryBaseDelay,
    @NotNull Duration requestTimeout,
    @Positive Integer maxConcurrentJobs,
    @PositiveOrZero Integer jobQueueSize,
    @Valid StoreProperties store) {

  public ExtractionProperties {
    if (requestsPerMinute == null) {
      requestsPerMinute = 10;
    }
    if (maxRetries == null) {
      maxRetries = 3;
    }
    if (retryBaseDelay == null) {
      retryBaseDelay = Duration.ofSeconds(2);
    }
    if (requestTimeout == null) {
      requestTimeout = Duration.ofSeconds(30);
    }
    if (maxConcurrentJobs == null) {
      maxConcurrentJobs = 2;
    }
    if (jobQueueSize == null) {
      jobQueueSize = 20;
    }
    if (store == null) {
      store = new StoreProperties(null, null, null);
    }
  }

  /**
   * Which store backs job state, and the eviction limits used by the in-memory variant.
   */
  public record StoreProperties(
      @NotBlank String type, @Positive Integer maxSize, @Positive Integer expireAfterMinutes) {

    public StoreProperties {
      if (type == null) {
        type = "jdbc";
      }
      if (maxSize == null) {
        maxSize = 10_000;
      }
      if (expireAfterMinutes == null) {
        expireAfterMinutes = 1440;
      }
    }
  }
}
