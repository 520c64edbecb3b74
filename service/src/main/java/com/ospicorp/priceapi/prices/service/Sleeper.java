package com.ospicorp.priceapi.prices.service;

import java.time.Duration;

/** Blocking pause between refresh attempts; swapped out in tests to record the delays. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return duration -> {
      if (!duration.isZero() && !duration.isNegative()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }
}
