package com.scholary.carrier.extractor.enrichment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class AuthorityStatusClassifierTest {

  @ParameterizedTest
  @CsvSource({
    "ACTIVE, Active",
    "Authorized For Property, Active",
    "INACTIVE, Inactive",
    "Revoked, Inactive",
    "out of service, Inactive",
    "Suspended pending review, Suspended",
    "Pending, Unknown",
    "Unknown, Unknown"
  })
  void classify_shouldMatchKeywords(String input, String expected) {
    assertThat(AuthorityStatusClassifier.classify(input)).isEqualTo(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {"AUTHORIZED FOR HIRE", "NOT AUTHORIZED", "Active", "Pending"})
  void normalize_presentStatus_shouldPassThroughUnchanged(String input) {
    assertThat(AuthorityStatusClassifier.normalize(input)).isEqualTo(input);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "Unknown"})
  void normalize_missingOrUnknown_shouldBeUnknown(String input) {
    assertThat(AuthorityStatusClassifier.normalize(input)).isEqualTo("Unknown");
  }
}
