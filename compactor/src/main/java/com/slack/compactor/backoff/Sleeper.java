package com.slack.compactor.backoff;

import java.time.Duration;

/** The wait between two attempts. Swapped out in tests so nothing actually sleeps. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD_SLEEPER =
      duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

  void sleep(Duration duration) throws InterruptedException;
}
