package com.scholary.carrier.extractor.retry;

import com.scholary.carrier.extractor.logging.StructuredLogger;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with linear backoff.
 *
 * <p>An operation gets {@code maxRetries + 1} attempts. After failed attempt {@code n} (when
 * retries remain) the policy sleeps {@code n * baseDelay}, so a 2s base delay gives 2s, 4s, 6s.
 * Every call ends in exactly one of success or exhaustion, unless the thread is interrupted or
 * the caller cancels, which surfaces as {@link InterruptedException}.
 */
public class RetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int maxRetries;
  private final Duration baseDelay;
  private final Sleeper sleeper;

  public RetryPolicy(int maxRetries, Duration baseDelay, Sleeper sleeper) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = maxRetries;
    this.baseDelay = baseDelay;
    this.sleeper = sleeper;
  }

  /** A single attempt of the retried operation. */
  @FunctionalInterface
  public interface Attempt<T> {
    T call() throws Exception;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /** Delay before the attempt following failed attempt {@code attempt}. */
  public Duration backoff(int attempt) {
    return baseDelay.multipliedBy(attempt);
  }

  /**
   * Run an operation until it succeeds or the retries are used up.
   *
   * @param identifier the item being processed, for logging
   * @param attempt the operation
   * @param cancelled checked between attempts
   * @return success with the value, or exhaustion with the annotated last error
   * @throws InterruptedException if interrupted while backing off, or cancelled between attempts
   */
  public <T> RetryOutcome<T> execute(
      String identifier, Attempt<T> attempt, BooleanSupplier cancelled)
      throws InterruptedException {

    String lastError = null;

    for (int n = 1; n <= maxRetries + 1; n++) {
      if (cancelled.getAsBoolean()) {
        throw new InterruptedException("Cancelled while processing " + identifier);
      }
      try {
        return RetryOutcome.success(attempt.call(), n);
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        lastError = describe(e);
      }

      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Interrupted while processing " + identifier);
      }

      if (n <= maxRetries) {
        Duration wait = backoff(n);
        structuredLogger.logLookupRetry(identifier, n, maxRetries, wait.toMillis(), lastError);
        sleeper.sleep(wait);
      }
    }

    String reason = String.format("%s (after %d retries)", lastError, maxRetries);
    structuredLogger.logLookupFailed(identifier, maxRetries, reason);
    return RetryOutcome.exhausted(reason, maxRetries + 1, maxRetries);
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
