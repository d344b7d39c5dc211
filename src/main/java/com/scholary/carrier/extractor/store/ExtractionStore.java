package com.scholary.carrier.extractor.store;

import com.scholary.carrier.extractor.job.ExtractionJob;
import com.scholary.carrier.extractor.job.JobStatus;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for job metadata, extracted records and failure records.
 *
 * <p>Each write is atomic on its own; no write spans more than one job. Once a job is in a
 * terminal status further {@link #updateJob} calls for it are ignored, and the completion time is
 * stamped by the store at the moment the terminal status is written.
 */
public interface ExtractionStore {

  /** Create a job in {@code processing} status with zero counts. */
  void createJob(String jobId, int total);

  /**
   * Update status and, where non-null, counts and error message.
   *
   * @return true if the job existed and was still processing
   */
  boolean updateJob(
      String jobId, JobStatus status, Integer processed, Integer failed, String errorMessage);

  /**
   * Move every job still in {@code processing} to {@code failed} with the given message.
   *
   * @return how many jobs were failed
   */
  int failProcessingJobs(String errorMessage);

  void saveRecord(CarrierRecord record);

  void saveFailure(String jobId, String mcNumber, String reason, int retryCount);

  Optional<ExtractionJob> getJob(String jobId);

  /** Records of a job in the order they were saved. */
  List<CarrierRecord> getRecords(String jobId);

  /** Failures of a job in the order they were saved. */
  List<FailedExtraction> getFailures(String jobId);

  /** Most recently created jobs first. */
  List<ExtractionJob> listJobs(int limit);
}
