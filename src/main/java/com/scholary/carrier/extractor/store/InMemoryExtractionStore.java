package com.scholary.carrier.extractor.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.carrier.extractor.job.ExtractionJob;
import com.scholary.carrier.extractor.job.JobStatus;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory store for development and tests.
 *
 * <p>Uses a Caffeine cache so that old jobs, with their records and failures, are evicted after
 * {@code expireAfterMinutes} or once {@code maxSize} jobs are held. Nothing survives a restart.
 */
public class InMemoryExtractionStore implements ExtractionStore {

  private final Cache<String, JobEntry> cache;
  private final Clock clock;

  public InMemoryExtractionStore(int maxSize, int expireAfterMinutes) {
    this(maxSize, expireAfterMinutes, Clock.systemUTC());
  }

  public InMemoryExtractionStore(int maxSize, int expireAfterMinutes, Clock clock) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(Duration.ofMinutes(expireAfterMinutes))
            .build();
    this.clock = clock;
  }

  @Override
  public void createJob(String jobId, int total) {
    ExtractionJob job =
        new ExtractionJob(jobId, JobStatus.PROCESSING, total, 0, 0, clock.instant(), null, null);
    JobEntry existing = cache.asMap().putIfAbsent(jobId, new JobEntry(job));
    if (existing != null) {
      throw new IllegalStateException("Job already exists: " + jobId);
    }
  }

  @Override
  public boolean updateJob(
      String jobId, JobStatus status, Integer processed, Integer failed, String errorMessage) {
    JobEntry entry = cache.getIfPresent(jobId);
    if (entry == null) {
      return false;
    }
    synchronized (entry) {
      ExtractionJob current = entry.job;
      if (current.status().isTerminal()) {
        return false;
      }
      entry.job =
          new ExtractionJob(
              current.id(),
              status,
              current.total(),
              processed != null ? processed : current.processedCount(),
              failed != null ? failed : current.failedCount(),
              current.createdAt(),
              status.isTerminal() ? clock.instant() : null,
              errorMessage != null ? errorMessage : current.errorMessage());
      return true;
    }
  }

  @Override
  public int failProcessingJobs(String errorMessage) {
    int failed = 0;
    for (String jobId : List.copyOf(cache.asMap().keySet())) {
      if (updateJob(jobId, JobStatus.FAILED, null, null, errorMessage)) {
        failed++;
      }
    }
    return failed;
  }

  @Override
  public void saveRecord(CarrierRecord record) {
    JobEntry entry = require(record.jobId());
    synchronized (entry) {
      entry.records.add(record);
    }
  }

  @Override
  public void saveFailure(String jobId, String mcNumber, String reason, int retryCount) {
    JobEntry entry = require(jobId);
    synchronized (entry) {
      entry.failures.add(
          new FailedExtraction(jobId, mcNumber, reason, retryCount, clock.instant()));
    }
  }

  @Override
  public Optional<ExtractionJob> getJob(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId)).map(entry -> entry.job);
  }

  @Override
  public List<CarrierRecord> getRecords(String jobId) {
    JobEntry entry = cache.getIfPresent(jobId);
    if (entry == null) {
      return List.of();
    }
    synchronized (entry) {
      return List.copyOf(entry.records);
    }
  }

  @Override
  public List<FailedExtraction> getFailures(String jobId) {
    JobEntry entry = cache.getIfPresent(jobId);
    if (entry == null) {
      return List.of();
    }
    synchronized (entry) {
      return List.copyOf(entry.failures);
    }
  }

  @Override
  public List<ExtractionJob> listJobs(int limit) {
    return cache.asMap().values().stream()
        .map(entry -> entry.job)
        .sorted(
            Comparator.comparing(ExtractionJob::createdAt)
                .thenComparing(ExtractionJob::id)
                .reversed())
        .limit(limit)
        .collect(Collectors.toList());
  }

  private JobEntry require(String jobId) {
    JobEntry entry = cache.getIfPresent(jobId);
    if (entry == null) {
      throw new IllegalStateException("Unknown job: " + jobId);
    }
    return entry;
  }

  private static final class JobEntry {
    private volatile ExtractionJob job;
    private final List<CarrierRecord> records = new ArrayList<>();
    private final List<FailedExtraction> failures = new ArrayList<>();

    private JobEntry(ExtractionJob job) {
      this.job = job;
    }
  }
}
