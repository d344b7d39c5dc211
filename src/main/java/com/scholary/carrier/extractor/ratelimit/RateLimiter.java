package com.scholary.carrier.extractor.ratelimit;

import com.scholary.carrier.extractor.retry.Sleeper;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed spacing between consecutive lookups of one job.
 *
 * <p>This is advisory pacing, not a token bucket: the full spacing is waited before every item
 * except the first, regardless of how long the previous lookup took. Throughput may be lower than
 * the configured rate but never higher. Not thread-safe; create one per job.
 */
public class RateLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

  private final Duration spacing;
  private final Sleeper sleeper;
  private boolean first = true;

  public RateLimiter(Duration spacing, Sleeper sleeper) {
    this.spacing = spacing;
    this.sleeper = sleeper;
  }

  /**
   * Create a limiter spacing items {@code 60 / requestsPerMinute} seconds apart.
   *
   * <p>A non-positive rate disables pacing.
   */
  public static RateLimiter forRequestsPerMinute(int requestsPerMinute, Sleeper sleeper) {
    if (requestsPerMinute <= 0) {
      return new RateLimiter(Duration.ZERO, sleeper);
    }
    return new RateLimiter(Duration.ofMillis(60_000L / requestsPerMinute), sleeper);
  }

  public Duration spacing() {
    return spacing;
  }

  /** Wait before the next item. Returns immediately for the first item. */
  public void pace() throws InterruptedException {
    if (first) {
      first = false;
      return;
    }
    if (!spacing.isZero()) {
      LOGGER.debug("Pacing next lookup by {}ms", spacing.toMillis());
      sleeper.sleep(spacing);
    }
  }
}
