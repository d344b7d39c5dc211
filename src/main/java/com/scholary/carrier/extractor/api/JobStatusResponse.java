package com.scholary.carrier.extractor.api;

import com.scholary.carrier.extractor.job.ExtractionJob;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows stored progress of a job. {@code active} is true while the job still has a live task.
 */
public record JobStatusResponse(
    String jobId,
    String status,
    int totalMcNumbers,
    int processedCount,
    int failedCount,
    int progressPercent,
    Instant createdAt,
    Instant completedAt,
    String errorMessage,
    boolean active) {

  public static JobStatusResponse from(ExtractionJob job, boolean active) {
    int done = job.processedCount() + job.failedCount();
    int percent = job.total() == 0 ? 100 : (done * 100) / job.total();
    return new JobStatusResponse(
        job.id(),
        job.status().value(),
        job.total(),
        job.processedCount(),
        job.failedCount(),
        percent,
        job.createdAt(),
        job.completedAt(),
        job.errorMessage(),
        active);
  }
}
