package com.scholary.carrier.extractor.config;

import com.scholary.carrier.extractor.retry.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for extraction-related beans.
 *
 * <p>Enables the ExtractionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {

  @Bean
  public Sleeper sleeper() {
    return Sleeper.THREAD;
  }
}
