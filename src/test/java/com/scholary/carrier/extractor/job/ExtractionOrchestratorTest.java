package com.scholary.carrier.extractor.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.carrier.extractor.config.ExtractionProperties;
import com.scholary.carrier.extractor.enrichment.EnrichmentEngine;
import com.scholary.carrier.extractor.model.CarrierRecord;
import com.scholary.carrier.extractor.model.FailedExtraction;
import com.scholary.carrier.extractor.retry.RecordingSleeper;
import com.scholary.carrier.extractor.retry.Sleeper;
import com.scholary.carrier.extractor.source.CarrierDataSource;
import com.scholary.carrier.extractor.source.CarrierLookupException;
import com.scholary.carrier.extractor.source.CarrierSession;
import com.scholary.carrier.extractor.source.RawCarrierRecord;
import com.scholary.carrier.extractor.store.InMemoryExtractionStore;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Tests for ExtractionOrchestrator job lifecycle, failure accounting and cancellation. */
@ExtendWith(MockitoExtension.class)
class ExtractionOrchestratorTest {

  @Mock private CarrierDataSource dataSource;
  @Mock private CarrierSession session;

  private InMemoryExtractionStore store;
  private JobRegistry registry;
  private RecordingSleeper sleeper;

  @BeforeEach
  void setUp() {
    store = new InMemoryExtractionStore(100, 60);
    registry = new JobRegistry();
    sleeper = new RecordingSleeper();
  }

  @Test
  void start_secondItemFailsPermanently_shouldCompleteWithOneFailure() {
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(eq("111"), any())).thenReturn(Optional.of(raw("111")));
    when(session.lookup(eq("222"), any())).thenThrow(new CarrierLookupException("Timeout"));
    when(session.lookup(eq("333"), any())).thenReturn(Optional.of(raw("333")));

    orchestrator(properties(10), syncExecutor(), sleeper)
        .start("job-e", List.of("111", "222", "333"));

    ExtractionJob job = store.getJob("job-e").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.total()).isEqualTo(3);
    assertThat(job.processedCount()).isEqualTo(2);
    assertThat(job.failedCount()).isEqualTo(1);
    assertThat(job.completedAt()).isNotNull();
    assertThat(job.errorMessage()).isNull();

    assertThat(store.getRecords("job-e"))
        .extracting(CarrierRecord::mcNumber)
        .containsExactly("111", "333");
    List<FailedExtraction> failures = store.getFailures("job-e");
    assertThat(failures).hasSize(1);
    assertThat(failures.get(0).mcNumber()).isEqualTo("222");
    assertThat(failures.get(0).errorReason()).isEqualTo("Timeout (after 3 retries)");
    assertThat(failures.get(0).retryCount()).isEqualTo(3);

    assertThat(registry.isActive("job-e")).isFalse();
    verify(session).close();
  }

  @Test
  void start_shouldPaceItemsAndBackOffBetweenRetries() {
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(eq("111"), any())).thenReturn(Optional.of(raw("111")));
    when(session.lookup(eq("222"), any())).thenThrow(new CarrierLookupException("Timeout"));
    when(session.lookup(eq("333"), any())).thenReturn(Optional.of(raw("333")));

    orchestrator(properties(10), syncExecutor(), sleeper)
        .start("job-1", List.of("111", "222", "333"));

    assertThat(sleeper.sleeps())
        .containsExactly(
            Duration.ofSeconds(6),
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(6),
            Duration.ofSeconds(6));
  }

  @Test
  void runJob_noDataReturned_shouldRecordFailure() {
    store.createJob("job-1", 1);
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(anyString(), any())).thenReturn(Optional.empty());

    orchestrator(properties(10), syncExecutor(), sleeper)
        .runJob("job-1", List.of("111"), new CancellationToken());

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.failedCount()).isEqualTo(1);
    assertThat(store.getFailures("job-1").get(0).errorReason())
        .isEqualTo("No data returned from data source (after 3 retries)");
  }

  @Test
  void runJob_invalidRecord_shouldRecordFailure() {
    store.createJob("job-1", 1);
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(anyString(), any())).thenReturn(Optional.of(raw(" ")));

    orchestrator(properties(10), syncExecutor(), sleeper)
        .runJob("job-1", List.of("111"), new CancellationToken());

    assertThat(store.getRecords("job-1")).isEmpty();
    assertThat(store.getFailures("job-1").get(0).errorReason())
        .isEqualTo("Invalid carrier data returned (after 3 retries)");
  }

  @Test
  void runJob_sessionCannotOpen_shouldFailJob() {
    store.createJob("job-1", 2);
    when(dataSource.openSession()).thenThrow(new CarrierLookupException("API key missing"));

    orchestrator(properties(10), syncExecutor(), sleeper)
        .runJob("job-1", List.of("111", "222"), new CancellationToken());

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.errorMessage()).isEqualTo("API key missing");
    assertThat(job.processedCount()).isZero();
    assertThat(job.completedAt()).isNotNull();
    assertThat(store.getFailures("job-1")).isEmpty();
  }

  @Test
  void runJob_cancelledBeforeStart_shouldNotOpenSession() {
    store.createJob("job-1", 2);
    CancellationToken token = new CancellationToken();
    token.cancel();

    orchestrator(properties(10), syncExecutor(), sleeper)
        .runJob("job-1", List.of("111", "222"), token);

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.errorMessage()).isEqualTo("Cancelled by request");
    verify(dataSource, never()).openSession();
  }

  @Test
  void runJob_cancelledDuringItem_shouldStopBeforeNextItem() {
    store.createJob("job-1", 3);
    CancellationToken token = new CancellationToken();
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(eq("111"), any()))
        .thenAnswer(
            invocation -> {
              token.cancel();
              return Optional.of(raw("111"));
            });

    orchestrator(properties(10), syncExecutor(), sleeper)
        .runJob("job-1", List.of("111", "222", "333"), token);

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.processedCount()).isEqualTo(1);
    assertThat(job.processedCount() + job.failedCount()).isLessThan(job.total());
    assertThat(Thread.currentThread().isInterrupted()).isFalse();
    verify(session).close();
  }

  @Test
  void runJob_interruptedWithoutCancel_shouldFailJob() {
    store.createJob("job-1", 2);
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(eq("111"), any())).thenReturn(Optional.of(raw("111")));
    Sleeper interrupting =
        d -> {
          throw new InterruptedException("shutdown");
        };

    orchestrator(properties(10), syncExecutor(), interrupting)
        .runJob("job-1", List.of("111", "222"), new CancellationToken());

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.errorMessage()).isEqualTo("Interrupted");
    assertThat(job.processedCount()).isEqualTo(1);
  }

  @Test
  void start_queueFull_shouldRejectAndFailJob() {
    AsyncTaskExecutor executor = mock(AsyncTaskExecutor.class);
    when(executor.submit(any(Runnable.class))).thenThrow(new TaskRejectedException("full"));

    ExtractionOrchestrator orchestrator = orchestrator(properties(10), executor, sleeper);

    assertThatThrownBy(() -> orchestrator.start("job-1", List.of("111")))
        .isInstanceOf(JobRejectedException.class)
        .hasMessage("Job queue is full");

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.errorMessage()).isEqualTo("Job queue is full");
    assertThat(registry.isActive("job-1")).isFalse();
  }

  @Test
  void cancel_runningJob_shouldInterruptPacingAndEndCancelled() throws Exception {
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(anyString(), any())).thenReturn(Optional.of(raw("111")));

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.initialize();
    try {
      // one request per minute: the second item waits a full minute unless cancelled
      ExtractionOrchestrator orchestrator = orchestrator(properties(1), executor, Sleeper.THREAD);
      orchestrator.start("job-1", List.of("111", "222"));
      Future<?> future = registry.find("job-1").orElseThrow().getFuture();

      awaitProcessed("job-1", 1);
      assertThat(orchestrator.cancel("job-1")).isTrue();
      future.get(5, TimeUnit.SECONDS);

      ExtractionJob job = store.getJob("job-1").orElseThrow();
      assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
      assertThat(job.processedCount()).isEqualTo(1);
      assertThat(registry.isActive("job-1")).isFalse();
    } finally {
      executor.shutdown();
    }
  }

  @Test
  void shutdown_shouldFailRunningAndQueuedJobs() throws Exception {
    when(dataSource.openSession()).thenReturn(session);
    when(session.lookup(anyString(), any())).thenReturn(Optional.of(raw("111")));

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(5);
    executor.initialize();
    try {
      ExtractionOrchestrator orchestrator = orchestrator(properties(1), executor, Sleeper.THREAD);
      orchestrator.start("job-a", List.of("111", "222"));
      orchestrator.start("job-b", List.of("333"));
      awaitProcessed("job-a", 1);

      orchestrator.shutdown();
      executor.shutdown();
      assertThat(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS)).isTrue();

      ExtractionJob running = store.getJob("job-a").orElseThrow();
      assertThat(running.status()).isEqualTo(JobStatus.FAILED);
      assertThat(running.errorMessage()).isEqualTo("Service shutting down");
      assertThat(running.processedCount()).isEqualTo(1);
      assertThat(running.completedAt()).isNotNull();

      ExtractionJob queued = store.getJob("job-b").orElseThrow();
      assertThat(queued.status()).isEqualTo(JobStatus.FAILED);
      assertThat(queued.errorMessage()).isEqualTo("Service shutting down");
      assertThat(queued.processedCount()).isZero();
      assertThat(queued.completedAt()).isNotNull();

      assertThat(registry.activeJobIds()).isEmpty();
    } finally {
      executor.shutdown();
    }
  }

  @Test
  void failAbandonedJobs_shouldFailJobsLeftProcessing() {
    store.createJob("job-1", 3);
    store.updateJob("job-1", JobStatus.PROCESSING, 2, 0, null);

    orchestrator(properties(10), syncExecutor(), sleeper).failAbandonedJobs();

    ExtractionJob job = store.getJob("job-1").orElseThrow();
    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.errorMessage()).isEqualTo("Service restarted before the job finished");
    assertThat(job.processedCount()).isEqualTo(2);
    assertThat(job.completedAt()).isNotNull();
  }

  private void awaitProcessed(String jobId, int processed) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5_000;
    while (System.currentTimeMillis() < deadline) {
      if (store.getJob(jobId).orElseThrow().processedCount() >= processed) {
        return;
      }
      Thread.sleep(10);
    }
    throw new AssertionError("Job " + jobId + " did not reach " + processed + " processed items");
  }

  private ExtractionOrchestrator orchestrator(
      ExtractionProperties properties, AsyncTaskExecutor executor, Sleeper sleeper) {
    return new ExtractionOrchestrator(
        dataSource, store, new EnrichmentEngine(), registry, properties, executor, sleeper);
  }

  private static AsyncTaskExecutor syncExecutor() {
    return new TaskExecutorAdapter(Runnable::run);
  }

  private static ExtractionProperties properties(int requestsPerMinute) {
    return new ExtractionProperties(
        requestsPerMinute, 3, Duration.ofSeconds(2), Duration.ofSeconds(30), 2, 20, null);
  }

  private static RawCarrierRecord raw(String mc) {
    return new RawCarrierRecord(
        mc,
        "900" + mc,
        "Carrier " + mc,
        "ACTIVE",
        "Common",
        "Active",
        "2025-01-01",
        "Satisfactory",
        1,
        0,
        "2012-02-02",
        "ops@example.com",
        "555-0100",
        "OH");
  }
}
