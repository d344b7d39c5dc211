package com.scholary.carrier.extractor.job;

import com.scholary.carrier.extractor.config.ExtractionProperties;
import com.scholary.carrier.extractor.enrichment.EnrichmentEngine;
import com.scholary.carrier.extractor.logging.StructuredLogger;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.ratelimit.RateLimiter;
import com.scholary.carrier.extractor.retry.RetryOutcome;
import com.scholary.carrier.extractor.retry.RetryPolicy;
import com.scholary.carrier.extractor.retry.Sleeper;
import com.scholary.carrier.extractor.source.CarrierDataSource;
import com.scholary.carrier.extractor.source.CarrierLookupException;
import com.scholary.carrier.extractor.source.CarrierSession;
import com.scholary.carrier.extractor.source.RawCarrierRecord;
import com.scholary.carrier.extractor.store.ExtractionStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Drives extraction jobs from start to a terminal status.
 *
 * <p>Each job runs as one task on the job executor and processes its identifiers strictly in
 * order: pace, then a retried lookup/validate/enrich/save, then a progress update. An identifier
 * that exhausts its retries is recorded as a failure and the job moves on. Only problems outside
 * the per-item loop (the data source failing to open, the store failing) fail the job.
 *
 * <p>The store is the source of truth for job status; the {@link JobRegistry} only tracks which
 * jobs are live so they can be cancelled.
 */
@Service
public class ExtractionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String CANCELLED_MESSAGE = "Cancelled by request";
  static final String QUEUE_FULL_MESSAGE = "Job queue is full";
  static final String SHUTDOWN_MESSAGE = "Service shutting down";
  static final String ABANDONED_MESSAGE = "Service restarted before the job finished";

  private final CarrierDataSource dataSource;
  private final ExtractionStore store;
  private final EnrichmentEngine enrichmentEngine;
  private final JobRegistry registry;
  private final ExtractionProperties properties;
  private final AsyncTaskExecutor jobExecutor;
  private final Sleeper sleeper;

  public ExtractionOrchestrator(
      CarrierDataSource dataSource,
      ExtractionStore store,
      EnrichmentEngine enrichmentEngine,
      JobRegistry registry,
      ExtractionProperties properties,
      @Qualifier("extractionJobExecutor") AsyncTaskExecutor jobExecutor,
      Sleeper sleeper) {

    this.dataSource = dataSource;
    this.store = store;
    this.enrichmentEngine = enrichmentEngine;
    this.registry = registry;
    this.properties = properties;
    this.jobExecutor = jobExecutor;
    this.sleeper = sleeper;
  }

  /**
   * Persist a new job and hand it to the job executor.
   *
   * <p>Returns as soon as the job is queued. Progress is observable only through the store.
   *
   * @param jobId the id of the new job
   * @param identifiers normalized, deduplicated MC numbers in processing order
   * @throws JobRejectedException if the executor has no room for another job
   */
  public void start(String jobId, List<String> identifiers) {
    List<String> items = List.copyOf(identifiers);
    store.createJob(jobId, items.size());

    CancellationToken token = new CancellationToken();
    JobHandle handle = new JobHandle(jobId, token);
    registry.register(handle);

    try {
      handle.attach(jobExecutor.submit(() -> runJob(jobId, items, token)));
      LOGGER.info("Queued extraction job {} with {} MC numbers", jobId, items.size());
    } catch (TaskRejectedException e) {
      LOGGER.warn("Rejected extraction job {}: {}", jobId, QUEUE_FULL_MESSAGE);
      store.updateJob(jobId, JobStatus.FAILED, 0, 0, QUEUE_FULL_MESSAGE);
      registry.remove(handle);
      throw new JobRejectedException(QUEUE_FULL_MESSAGE, e);
    }
  }

  /**
   * Request cancellation of a running or queued job.
   *
   * @return true if the job was live and has been signalled
   */
  public boolean cancel(String jobId) {
    return registry.cancel(jobId);
  }

  /**
   * Fail every live job before the job executor is torn down.
   *
   * <p>Queued jobs would otherwise be dropped by the executor without ever reaching a terminal
   * status. The failed status is written first, so whatever a running job writes afterwards is
   * ignored by the store.
   */
  @PreDestroy
  public void shutdown() {
    for (String jobId : registry.activeJobIds()) {
      registry
          .find(jobId)
          .ifPresent(
              handle -> {
                try {
                  store.updateJob(jobId, JobStatus.FAILED, null, null, SHUTDOWN_MESSAGE);
                } catch (RuntimeException e) {
                  LOGGER.error("Could not fail job {} on shutdown", jobId, e);
                }
                handle.getToken().cancel();
                Future<?> future = handle.getFuture();
                if (future != null) {
                  future.cancel(false);
                }
                registry.remove(handle);
                LOGGER.warn("Failed extraction job {}: {}", jobId, SHUTDOWN_MESSAGE);
              });
    }
  }

  /**
   * Fail jobs a previous run of the service left in {@code processing}.
   *
   * <p>Runs before the web server accepts requests, so no job of this run can be caught.
   */
  @PostConstruct
  public void failAbandonedJobs() {
    int abandoned = store.failProcessingJobs(ABANDONED_MESSAGE);
    if (abandoned > 0) {
      LOGGER.warn("Marked {} abandoned extraction job(s) as failed", abandoned);
    }
  }

  /**
   * Run one job to a terminal status on the calling thread.
   *
   * <p>The job must already exist in the store in {@code processing} status.
   */
  public void runJob(String jobId, List<String> identifiers, CancellationToken token) {
    StructuredLogger.setJobContext(jobId);
    Progress progress = new Progress();
    JobStatus finalStatus;
    String errorMessage = null;

    token.bind(Thread.currentThread());
    try {
      processAll(jobId, identifiers, token, progress);
      finalStatus = JobStatus.COMPLETED;
    } catch (InterruptedException e) {
      if (token.isCancelled()) {
        finalStatus = JobStatus.CANCELLED;
        errorMessage = CANCELLED_MESSAGE;
      } else {
        finalStatus = JobStatus.FAILED;
        errorMessage = "Interrupted";
      }
    } catch (Exception e) {
      LOGGER.error("Extraction job {} failed", jobId, e);
      finalStatus = JobStatus.FAILED;
      errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    } finally {
      token.unbind();
    }

    // The interrupt, if any, was the cancellation signal and has been handled above.
    Thread.interrupted();

    try {
      store.updateJob(
          jobId, finalStatus, progress.processed, progress.failed, errorMessage);
      LOGGER.info(
          "Extraction job {} finished: status={}, processed={}, failed={}, total={}",
          jobId,
          finalStatus.value(),
          progress.processed,
          progress.failed,
          identifiers.size());
    } catch (RuntimeException e) {
      LOGGER.error("Could not record final status {} for job {}", finalStatus.value(), jobId, e);
    } finally {
      registry.find(jobId).filter(h -> h.getToken() == token).ifPresent(registry::remove);
      StructuredLogger.clearJobContext();
    }
  }

  private void processAll(
      String jobId, List<String> identifiers, CancellationToken token, Progress progress)
      throws InterruptedException {

    if (token.isCancelled()) {
      throw new InterruptedException("Cancelled before start");
    }

    LOGGER.info("Starting extraction job {} with {} MC numbers", jobId, identifiers.size());

    RateLimiter rateLimiter =
        RateLimiter.forRequestsPerMinute(properties.requestsPerMinute(), sleeper);
    RetryPolicy retryPolicy =
        new RetryPolicy(properties.maxRetries(), properties.retryBaseDelay(), sleeper);
    int total = identifiers.size();

    try (CarrierSession session = dataSource.openSession()) {
      for (int i = 0; i < total; i++) {
        if (token.isCancelled()) {
          throw new InterruptedException("Cancelled at item " + i);
        }
        String mcNumber = identifiers.get(i);

        rateLimiter.pace();
        structuredLogger.logItemStarted(mcNumber, i, total);
        long startNanos = System.nanoTime();

        RetryOutcome<CarrierRecord> outcome =
            retryPolicy.execute(
                mcNumber, () -> extractOne(session, jobId, mcNumber), token::isCancelled);

        if (outcome.isSuccess()) {
          progress.processed++;
          structuredLogger.logItemExtracted(
              mcNumber, outcome.attempts(), (System.nanoTime() - startNanos) / 1_000_000);
        } else {
          store.saveFailure(jobId, mcNumber, outcome.failureReason(), outcome.retryCount());
          progress.failed++;
        }

        store.updateJob(jobId, JobStatus.PROCESSING, progress.processed, progress.failed, null);
        structuredLogger.logJobProgress(jobId, progress.processed, progress.failed, total);
      }
    }
  }

  private CarrierRecord extractOne(CarrierSession session, String jobId, String mcNumber) {
    RawCarrierRecord raw =
        session
            .lookup(mcNumber, properties.requestTimeout())
            .orElseThrow(() -> new CarrierLookupException("No data returned from data source"));

    if (!enrichmentEngine.validate(raw)) {
      throw new CarrierLookupException("Invalid carrier data returned");
    }

    CarrierRecord record = enrichmentEngine.enrich(raw, jobId);
    store.saveRecord(record);
    return record;
  }

  /** Counters of one run, written only by the job's thread. */
  private static final class Progress {
    private int processed;
    private int failed;
  }
}
