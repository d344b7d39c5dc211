package com.scholary.carrier.extractor.identifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cleans raw MC number input into a list of identifiers.
 *
 * <p>Input is free-form text: one or more lines, each holding comma-separated tokens. Each token
 * loses whitespace and the separators {@code - _ .}, then an optional leading "MC" label. What is
 * left must be 1 to 10 digits. Duplicates are dropped, keeping the first occurrence in place.
 */
@Component
public class IdentifierNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(IdentifierNormalizer.class);

  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-_.]");
  private static final Pattern TYPE_PREFIX = Pattern.compile("(?i)^MC");
  private static final Pattern DIGITS = Pattern.compile("[0-9]{1,10}");

  /**
   * Extract unique identifiers from free-form text.
   *
   * @param text raw input, e.g. an uploaded file or a pasted list
   * @return cleaned identifiers in first-seen order, never null
   */
  public List<String> normalize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    List<String> tokens = new ArrayList<>();
    for (String line : text.split("\\R")) {
      if (line.isBlank()) {
        continue;
      }
      for (String part : line.split(",")) {
        tokens.add(part);
      }
    }
    return normalizeAll(tokens);
  }

  /**
   * Clean an already-split list of tokens.
   *
   * @param tokens raw tokens, in input order
   * @return cleaned identifiers in first-seen order
   */
  public List<String> normalizeAll(Collection<String> tokens) {
    Set<String> unique = new LinkedHashSet<>();
    for (String token : tokens) {
      clean(token).ifPresent(unique::add);
    }
    LOGGER.info("Extracted {} unique MC numbers from input", unique.size());
    return List.copyOf(unique);
  }

  /**
   * Clean and validate a single token.
   *
   * @return the numeric identifier, or empty if the token is blank or not a valid MC number
   */
  public Optional<String> clean(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }

    String cleaned = SEPARATORS.matcher(token.strip()).replaceAll("");
    cleaned = TYPE_PREFIX.matcher(cleaned).replaceFirst("");

    if (DIGITS.matcher(cleaned).matches()) {
      return Optional.of(cleaned);
    }

    LOGGER.warn("Invalid MC number format: {}", token.strip());
    return Optional.empty();
  }
}
