package com.scholary.carrier.extractor.job;

/** Thrown when a job cannot be admitted because the job executor is saturated. */
public class JobRejectedException extends RuntimeException {

  public JobRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
