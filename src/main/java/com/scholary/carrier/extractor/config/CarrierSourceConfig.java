package com.scholary.carrier.extractor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.carrier.extractor.source.CarrierDataSource;
import com.scholary.carrier.extractor.source.CarrierSourceProperties;
import com.scholary.carrier.extractor.source.HttpCarrierDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the carrier data source.
 *
 * <p>Wires the hosted-API client by default. Another {@link CarrierDataSource} bean replaces it.
 */
@Configuration
@EnableConfigurationProperties(CarrierSourceProperties.class)
public class CarrierSourceConfig {

  @Bean
  @ConditionalOnMissingBean(CarrierDataSource.class)
  public CarrierDataSource carrierDataSource(
      CarrierSourceProperties properties, ObjectMapper objectMapper) {
    return new HttpCarrierDataSource(properties, objectMapper);
  }
}
