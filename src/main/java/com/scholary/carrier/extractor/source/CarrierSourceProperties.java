package com.scholary.carrier.extractor.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the hosted carrier lookup API.
 *
 * <p>The API key may be left empty at startup; sessions then fail to open and jobs end as failed
 * with a clear error message instead of the application refusing to boot.
 */
@ConfigurationProperties(prefix = "carrier-source")
@Validated
public record CarrierSourceProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String actorId,
    @Positive int connectTimeout) {}
