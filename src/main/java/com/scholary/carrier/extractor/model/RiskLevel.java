package com.scholary.carrier.extractor.model;

/** Three-tier risk classification derived from violation and accident counts. */
public enum RiskLevel {
  LOW("Low"),
  MEDIUM("Medium"),
  HIGH("High");

  private final String label;

  RiskLevel(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Resolve a stored label (case-insensitive) back to the enum.
   *
   * @throws IllegalArgumentException if the label is not a known risk level
   */
  public static RiskLevel fromLabel(String label) {
    for (RiskLevel level : values()) {
      if (level.label.equalsIgnoreCase(label)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown risk level: " + label);
  }
}
