package com.scholary.carrier.extractor.job;

import java.time.Instant;

/**
 * Snapshot of an extraction job as held by the store.
 *
 * <p>Counts only grow while the job is processing; {@code processedCount + failedCount} never
 * exceeds {@code total} and equals it once the job has completed.
 */
public record ExtractionJob(
    String id,
    JobStatus status,
    int total,
    int processedCount,
    int failedCount,
    Instant createdAt,
    Instant completedAt,
    String errorMessage) {

  public int remaining() {
    return total - processedCount - failedCount;
  }
}
