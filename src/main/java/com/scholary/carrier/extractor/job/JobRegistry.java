package com.scholary.carrier.extractor.job;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory index of running jobs.
 *
 * <p>Liveness bookkeeping only: the store remains the source of truth for job status. Entries are
 * added when a job is started and removed when it reaches any terminal state.
 */
@Component
public class JobRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

  private final ConcurrentMap<String, JobHandle> jobs = new ConcurrentHashMap<>();

  /**
   * Register a started job.
   *
   * @throws IllegalStateException if a job with this id is already active
   */
  public void register(JobHandle handle) {
    JobHandle existing = jobs.putIfAbsent(handle.getJobId(), handle);
    if (existing != null) {
      throw new IllegalStateException("Job already active: " + handle.getJobId());
    }
  }

  public Optional<JobHandle> find(String jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  public boolean isActive(String jobId) {
    return jobs.containsKey(jobId);
  }

  public Set<String> activeJobIds() {
    return new TreeSet<>(jobs.keySet());
  }

  /** Remove a job only if the registered entry is this exact handle. */
  public void remove(JobHandle handle) {
    jobs.remove(handle.getJobId(), handle);
  }

  /**
   * Request cancellation of a running or queued job.
   *
   * @return true if the job was active and has been signalled
   */
  public boolean cancel(String jobId) {
    JobHandle handle = jobs.get(jobId);
    if (handle == null) {
      return false;
    }
    LOGGER.info("Cancellation requested for job {}", jobId);
    handle.getToken().cancel();
    return true;
  }
}
