package com.gentoro.kbgen.pipeline.progress;

/**
 * Time and delta based throttle for progress events of one stage.
 *
 * <p>An event passes when {@code minIntervalMs} elapsed since the last accepted one, or when the
 * completed counter moved by at least {@code minDelta}. The first event always passes.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;

  private boolean started;
  private long lastAcceptedAt;
  private long lastCompleted;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  public synchronized boolean tryAcquire(long nowMs, long completed) {
    boolean accept =
        !started
            || nowMs - lastAcceptedAt >= minIntervalMs
            || Math.abs(completed - lastCompleted) >= minDelta;
    if (accept) {
      started = true;
      lastAcceptedAt = nowMs;
      lastCompleted = completed;
    }
    return accept;
  }
}
