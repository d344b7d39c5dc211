package com.scholary.carrier.extractor.job;

import java.util.Locale;

/** Lifecycle of an extraction job. Terminal states never change again. */
public enum JobStatus {
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  /** Lower-case value used in storage and API responses. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobStatus fromValue(String value) {
    return JobStatus.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
