package com.scholary.carrier.extractor.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.carrier.extractor.retry.RecordingSleeper;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

  @Test
  void pace_shouldSkipFirstItemAndSpaceTheRest() throws Exception {
    RecordingSleeper sleeper = new RecordingSleeper();
    RateLimiter limiter = RateLimiter.forRequestsPerMinute(10, sleeper);

    limiter.pace();
    limiter.pace();
    limiter.pace();

    assertThat(limiter.spacing()).isEqualTo(Duration.ofSeconds(6));
    assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(6), Duration.ofSeconds(6));
  }

  @Test
  void forRequestsPerMinute_nonPositiveRate_shouldDisablePacing() throws Exception {
    RecordingSleeper sleeper = new RecordingSleeper();
    RateLimiter limiter = RateLimiter.forRequestsPerMinute(0, sleeper);

    limiter.pace();
    limiter.pace();

    assertThat(limiter.spacing()).isEqualTo(Duration.ZERO);
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void forRequestsPerMinute_shouldRoundToMillis() {
    RateLimiter limiter = RateLimiter.forRequestsPerMinute(7, new RecordingSleeper());

    assertThat(limiter.spacing()).isEqualTo(Duration.ofMillis(8571));
  }
}
