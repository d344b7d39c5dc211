package com.scholary.carrier.extractor.job;

/**
 * Cancellation signal for one job run.
 *
 * <p>The worker thread binds itself while it runs the job so that {@link #cancel()} can interrupt
 * a pacing or backoff sleep instead of waiting for it to end.
 */
public class CancellationToken {

  private boolean cancelled;
  private Thread runner;

  public synchronized void cancel() {
    cancelled = true;
    if (runner != null) {
      runner.interrupt();
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  synchronized void bind(Thread thread) {
    this.runner = thread;
  }

  synchronized void unbind() {
    this.runner = null;
  }
}
