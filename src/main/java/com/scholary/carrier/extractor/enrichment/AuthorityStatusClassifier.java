package com.scholary.carrier.extractor.enrichment;

import java.util.List;
import java.util.Locale;

/** Maps free-text operating authority descriptions onto a small set of labels. */
public final class AuthorityStatusClassifier {

  public static final String ACTIVE = "Active";
  public static final String INACTIVE = "Inactive";
  public static final String SUSPENDED = "Suspended";
  public static final String UNKNOWN = "Unknown";

  // "inactive" contains "active", so the negative terms are checked first
  private static final List<String> INACTIVE_TERMS =
      List.of("inactive", "revoked", "cancelled", "canceled", "out of service");
  private static final List<String> ACTIVE_TERMS =
      List.of("active", "authorized", "current", "valid");

  private AuthorityStatusClassifier() {}

  /**
   * Normalize an authority status.
   *
   * <p>Only a missing or {@code Unknown} status is classified. Any other value came from the data
   * source already and is returned unchanged.
   */
  public static String normalize(String status) {
    if (status == null || status.isBlank()) {
      return UNKNOWN;
    }
    if (UNKNOWN.equals(status)) {
      return classify(status);
    }
    return status;
  }

  static String classify(String status) {
    String lower = status.toLowerCase(Locale.ROOT);
    if (INACTIVE_TERMS.stream().anyMatch(lower::contains)) {
      return INACTIVE;
    }
    if (lower.contains("suspended")) {
      return SUSPENDED;
    }
    if (ACTIVE_TERMS.stream().anyMatch(lower::contains)) {
      return ACTIVE;
    }
    return UNKNOWN;
  }
}
