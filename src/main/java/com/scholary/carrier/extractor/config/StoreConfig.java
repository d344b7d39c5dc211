package com.scholary.carrier.extractor.config;

import com.scholary.carrier.extractor.store.ExtractionStore;
import com.scholary.carrier.extractor.store.InMemoryExtractionStore;
import com.scholary.carrier.extractor.store.JdbcExtractionStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Configuration for job storage.
 *
 * <p>The relational store is the default. Setting {@code extraction.store.type=memory} switches to
 * the Caffeine-backed store, which loses everything on restart.
 */
@Configuration
public class StoreConfig {

  @Bean
  @ConditionalOnProperty(
      name = "extraction.store.type",
      havingValue = "jdbc",
      matchIfMissing = true)
  public ExtractionStore jdbcExtractionStore(JdbcTemplate jdbcTemplate) {
    return new JdbcExtractionStore(jdbcTemplate);
  }

  @Bean
  @ConditionalOnProperty(name = "extraction.store.type", havingValue = "memory")
  public ExtractionStore inMemoryExtractionStore(ExtractionProperties properties) {
    return new InMemoryExtractionStore(
        properties.store().maxSize(), properties.store().expireAfterMinutes());
  }
}
