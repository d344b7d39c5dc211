package com.scholary.carrier.extractor.job;

import java.time.Instant;
import java.util.concurrent.Future;

/** Registry entry for a job that has been started and has not yet reached a terminal state. */
public class JobHandle {

  private final String jobId;
  private final CancellationToken token;
  private final Instant startedAt;
  private volatile Future<?> future;

  public JobHandle(String jobId, CancellationToken token) {
    this.jobId = jobId;
    this.token = token;
    this.startedAt = Instant.now();
  }

  public String getJobId() {
    return jobId;
  }

  public CancellationToken getToken() {
    return token;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Future<?> getFuture() {
    return future;
  }

  void attach(Future<?> future) {
    this.future = future;
  }
}
