package com.scholary.carrier.extractor.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the hosted carrier scraping API.
 *
 * <p>Each lookup runs the scraping actor synchronously and reads back its dataset items. The actor
 * emits slightly different field names depending on the page it scraped, so the mapping accepts
 * the known alternatives for each field.
 *
 * <p>Retries are not handled here; the orchestrator wraps every lookup in its retry policy.
 */
public class HttpCarrierDataSource implements CarrierDataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpCarrierDataSource.class);

  private final HttpClient httpClient;
  private final CarrierSourceProperties properties;
  private final ObjectMapper objectMapper;

  public HttpCarrierDataSource(CarrierSourceProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized carrier source client: baseUrl={}, actor={}",
        properties.baseUrl(),
        properties.actorId());
  }

  @Override
  public CarrierSession openSession() {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new CarrierLookupException("Carrier source API key is not configured");
    }
    return new Session();
  }

  /**
   * Map one dataset item from the actor into a raw record.
   *
   * <p>The requested identifier is used as the MC number; the actor does not echo it back
   * reliably.
   */
  RawCarrierRecord toRawRecord(JsonNode item, String mcNumber) {
    return new RawCarrierRecord(
        mcNumber,
        text(item, "dotNumber", "DOT"),
        text(item, "companyName", "name"),
        text(item, "authorityStatus", "status"),
        text(item, "authorityType"),
        text(item, "insuranceStatus"),
        text(item, "insuranceExpiry", "insuranceExpiration"),
        text(item, "safetyRating"),
        count(item, "violations12mo"),
        count(item, "accidents12mo"),
        text(item, "authorityDate", "establishedDate"),
        text(item, "email"),
        text(item, "phone", "phoneNumber"),
        state(item));
  }

  /** Parse a response body holding a JSON array of dataset items. */
  Optional<RawCarrierRecord> parseResponse(String body, String mcNumber) throws IOException {
    JsonNode root = objectMapper.readTree(body);
    if (root == null || !root.isArray()) {
      throw new CarrierLookupException("Unexpected response shape for MC " + mcNumber);
    }
    if (root.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toRawRecord(root.get(0), mcNumber));
  }

  private String text(JsonNode item, String... fields) {
    for (String field : fields) {
      JsonNode node = item.get(field);
      if (node != null && !node.isNull()) {
        String value = node.asText().trim();
        if (!value.isEmpty()) {
          return value;
        }
      }
    }
    return null;
  }

  private Integer count(JsonNode item, String field) {
    JsonNode node = item.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.asInt();
    }
    String digits = node.asText().replaceAll("\\D", "");
    return digits.isEmpty() ? null : Integer.valueOf(digits);
  }

  private String state(JsonNode item) {
    String state = text(item, "state");
    if (state != null) {
      return state;
    }
    JsonNode address = item.get("address");
    return address != null && address.isObject() ? text(address, "state") : null;
  }

  private class Session implements CarrierSession {

    @Override
    public Optional<RawCarrierRecord> lookup(String mcNumber, Duration timeout) {
      LOGGER.debug("Looking up MC {}", mcNumber);
      try {
        String payload = objectMapper.writeValueAsString(Map.of("mcNumber", mcNumber));

        HttpRequest request =
            HttpRequest.newBuilder()
                .uri(
                    URI.create(
                        properties.baseUrl()
                            + "/v2/acts/"
                            + properties.actorId()
                            + "/run-sync-get-dataset-items"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + properties.apiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();

        HttpResponse<String> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() == 404) {
          return Optional.empty();
        }
        if (response.statusCode() != 200 && response.statusCode() != 201) {
          throw new CarrierLookupException(
              String.format(
                  "Carrier source returned status %d for MC %s", response.statusCode(), mcNumber));
        }

        return parseResponse(response.body(), mcNumber);

      } catch (HttpTimeoutException e) {
        throw new CarrierLookupException("Timeout looking up MC " + mcNumber, e);
      } catch (IOException e) {
        throw new CarrierLookupException(
            "Lookup failed for MC " + mcNumber + ": " + e.getMessage(), e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CarrierLookupException("Lookup interrupted for MC " + mcNumber, e);
      }
    }

    @Override
    public void close() {
      // the shared HttpClient outlives individual sessions
    }
  }
}
