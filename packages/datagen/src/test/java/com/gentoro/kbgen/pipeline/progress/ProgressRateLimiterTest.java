package com.gentoro.kbgen.pipeline.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressRateLimiterTest {

  @Test
  void allowsFirstEventThenThrottlesByTimeOrDelta() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(1_000, 3);

    // first focal node always reports
    assertTrue(limiter.tryAcquire(0, 1));

    // too soon, too few completed
    assertFalse(limiter.tryAcquire(200, 2));
    assertFalse(limiter.tryAcquire(400, 3));

    // three more nodes since the last accepted event
    assertTrue(limiter.tryAcquire(450, 4));

    // interval elapsed since the event at t=450
    assertTrue(limiter.tryAcquire(1_450, 4));
  }

  @Test
  void zeroDeltaLetsEveryEventThrough() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(60_000, 0);
    assertTrue(limiter.tryAcquire(0, 0));
    assertTrue(limiter.tryAcquire(1, 0));
    assertTrue(limiter.tryAcquire(2, 1));
  }
}
