package com.scholary.carrier.extractor.retry;

import java.time.Duration;

/** Blocking pause used for pacing and backoff. Replaced with a recorder in tests. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
