package com.scholary.carrier.extractor.retry;

/**
 * Terminal result of a retried operation: either a value or an exhausted failure.
 *
 * @param value the result on success, null when exhausted
 * @param attempts how many attempts were made
 * @param failureReason last error annotated with the retry count, null on success
 * @param retryCount retries spent before giving up, 0 on success
 */
public record RetryOutcome<T>(T value, int attempts, String failureReason, int retryCount) {

  public static <T> RetryOutcome<T> success(T value, int attempts) {
    return new RetryOutcome<>(value, attempts, null, 0);
  }

  public static <T> RetryOutcome<T> exhausted(String failureReason, int attempts, int retryCount) {
    return new RetryOutcome<>(null, attempts, failureReason, retryCount);
  }

  public boolean isSuccess() {
    return failureReason == null;
  }
}
