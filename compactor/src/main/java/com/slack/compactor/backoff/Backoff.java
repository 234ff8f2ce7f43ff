package com.slack.compactor.backoff;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;

/**
 * Backoff produces the sequence of delays for a single retry loop.
 *
 * <p>The first delay is always the initial backoff. Every following delay is picked uniformly at
 * random between the initial backoff and the previous delay multiplied by the base, and is capped
 * at the max backoff. Once the total time spent backing off would go past the configured deadline,
 * no further delay is returned.
 *
 * <p>This class is not thread safe, create one instance per retry loop.
 */
public class Backoff {
  private final long initBackoffNanos;
  private final long maxBackoffNanos;
  private final double base;
  private final long deadlineNanos;
  private final Random random;

  private long nextBackoffNanos;
  private long totalBackoffNanos = 0;

  public Backoff(BackoffConfig backoffConfig) {
    this(backoffConfig, new Random());
  }

  public Backoff(BackoffConfig backoffConfig, Random random) {
    this.initBackoffNanos = backoffConfig.getInitBackoff().toNanos();
    this.maxBackoffNanos = backoffConfig.getMaxBackoff().toNanos();
    this.base = backoffConfig.getBase();
    this.deadlineNanos = backoffConfig.getDeadline().map(Duration::toNanos).orElse(Long.MAX_VALUE);
    this.random = random;
    this.nextBackoffNanos = initBackoffNanos;
  }

  /** Returns the next delay, or empty if waiting for it would exceed the deadline. */
  public Optional<Duration> next() {
    long currentBackoffNanos = nextBackoffNanos;
    if (currentBackoffNanos > deadlineNanos - totalBackoffNanos) {
      return Optional.empty();
    }
    totalBackoffNanos += currentBackoffNanos;

    long upperBoundNanos = (long) Math.min(currentBackoffNanos * base, (double) Long.MAX_VALUE);
    long candidateNanos = initBackoffNanos;
    if (upperBoundNanos > initBackoffNanos) {
      candidateNanos += (long) (random.nextDouble() * (upperBoundNanos - initBackoffNanos));
    }
    nextBackoffNanos = Math.min(maxBackoffNanos, candidateNanos);

    return Optional.of(Duration.ofNanos(currentBackoffNanos));
  }

  public Duration getTotalBackoff() {
    return Duration.ofNanos(totalBackoffNanos);
  }
}
