package com.flamingo.ai.mindmap.service.generation;

import com.flamingo.ai.mindmap.exception.LlmServiceException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Enforces a minimum delay between successive calls to the text generation backend. The first call
 * is never delayed.
 */
@Slf4j
public class CallPacer {

  private final long minIntervalNanos;
  private long lastCallNanos;
  private boolean called;

  public CallPacer(Duration minInterval) {
    if (minInterval.isNegative()) {
      throw new IllegalArgumentException("Inter-call delay must not be negative: " + minInterval);
    }
    this.minIntervalNanos = minInterval.toNanos();
  }

  /** Blocks until the minimum interval since the previous call has elapsed, then records a call. */
  public synchronized void awaitTurn() {
    if (called && minIntervalNanos > 0) {
      long waitNanos = minIntervalNanos - (System.nanoTime() - lastCallNanos);
      if (waitNanos > 0) {
        sleep(waitNanos);
      }
    }
    called = true;
    lastCallNanos = System.nanoTime();
  }

  private void sleep(long nanos) {
    try {
      Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmServiceException("Interrupted while waiting to call the generation backend", e);
    }
  }
}
