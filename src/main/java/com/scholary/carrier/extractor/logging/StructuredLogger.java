package com.scholary.carrier.extractor.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into MDC for the duration of a single log call so log shippers can
 * index them, then clears them again. Job context ({@code jobId}) is set once per job run and
 * outlives individual events.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log item started event. */
  public void logItemStarted(String mcNumber, int index, int total) {
    try {
      MDC.put("event_type", "item_started");
      MDC.put("mcNumber", mcNumber);
      MDC.put("itemIndex", String.valueOf(index));

      logger.debug("Item started: mc={}, item={}/{}", mcNumber, index + 1, total);
    } finally {
      clearEventFields();
    }
  }

  /** Log item extracted event. */
  public void logItemExtracted(String mcNumber, int attempts, long elapsedMs) {
    try {
      MDC.put("event_type", "item_extracted");
      MDC.put("mcNumber", mcNumber);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Successfully extracted MC {}: attempts={}, elapsed={}ms", mcNumber, attempts, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log lookup retry event. */
  public void logLookupRetry(
      String mcNumber, int attempt, int maxRetries, long backoffMs, String message) {
    try {
      MDC.put("event_type", "lookup_retry");
      MDC.put("mcNumber", mcNumber);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));

      logger.warn(
          "Retry {}/{} for MC {} after {}ms: {}",
          attempt,
          maxRetries,
          mcNumber,
          backoffMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log lookup failure event. */
  public void logLookupFailed(String mcNumber, int maxRetries, String reason) {
    try {
      MDC.put("event_type", "lookup_failed");
      MDC.put("mcNumber", mcNumber);
      MDC.put("maxRetries", String.valueOf(maxRetries));

      logger.error("Failed to extract MC {}: {}", mcNumber, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int processed, int failed, int total) {
    try {
      int done = processed + failed;
      int percentComplete = total == 0 ? 100 : (done * 100) / total;
      MDC.put("event_type", "job_progress");
      MDC.put("processed", String.valueOf(processed));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Job progress: jobId={}, items={}/{}, failed={}, progress={}%",
          jobId,
          done,
          total,
          failed,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("mcNumber");
    MDC.remove("itemIndex");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("elapsedMs");
    MDC.remove("processed");
    MDC.remove("failed");
    MDC.remove("percentComplete");
  }
}
