package com.slack.compactor.backoff;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RetryingInvoker calls an operation until it succeeds, waiting between attempts according to a
 * {@link BackoffConfig}. It knows nothing about what the operation does.
 *
 * <p>With the default config there is no attempt cap and no deadline, so a call only returns once
 * the operation succeeds. The caller's thread is parked for the duration of every delay.
 * Interrupting that thread cancels the loop with a {@link RetryAbortedException}.
 */
public class RetryingInvoker {
  private static final Logger LOG = LoggerFactory.getLogger(RetryingInvoker.class);

  public static final String RETRY_FAILED_ATTEMPTS = "compactor_retry_failed_attempts";

  private final BackoffConfig backoffConfig;
  private final MeterRegistry meterRegistry;
  private final Sleeper sleeper;
  private final Random random;

  public RetryingInvoker(BackoffConfig backoffConfig, MeterRegistry meterRegistry) {
    this(backoffConfig, meterRegistry, Sleeper.THREAD_SLEEPER, new Random());
  }

  @VisibleForTesting
  public RetryingInvoker(
      BackoffConfig backoffConfig, MeterRegistry meterRegistry, Sleeper sleeper, Random random) {
    this.backoffConfig = backoffConfig;
    this.meterRegistry = meterRegistry;
    this.sleeper = sleeper;
    this.random = random;
  }

  public BackoffConfig getBackoffConfig() {
    return backoffConfig;
  }

  /** Retry the operation on every exception it throws. */
  public <T> T retryAllErrors(String taskName, Callable<T> operation) {
    return retryWithBackoff(taskName, operation, RetryClassifier.ALWAYS_RETRY);
  }

  /**
   * Retry the operation on exceptions the classifier marks as {@link RetryDecision#RETRY}. An
   * exception marked {@link RetryDecision#FAIL} ends the loop right away.
   */
  public <T> T retryWithBackoff(
      String taskName, Callable<T> operation, RetryClassifier classifier) {
    Backoff backoff = new Backoff(backoffConfig, random);
    Counter failedAttempts = meterRegistry.counter(RETRY_FAILED_ATTEMPTS, "task", taskName);
    OptionalInt maxAttempts = backoffConfig.getMaxAttempts();

    int attempts = 0;
    while (true) {
      attempts++;
      try {
        return operation.call();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RetryAbortedException(
            RetryAbortedException.Reason.INTERRUPTED, taskName, attempts, e);
      } catch (Exception e) {
        failedAttempts.increment();

        if (classifier.classify(e) == RetryDecision.FAIL) {
          throw new RetryAbortedException(
              RetryAbortedException.Reason.TERMINAL_ERROR, taskName, attempts, e);
        }
        if (maxAttempts.isPresent() && attempts >= maxAttempts.getAsInt()) {
          throw new RetryAbortedException(
              RetryAbortedException.Reason.ATTEMPTS_EXHAUSTED, taskName, attempts, e);
        }
        Optional<Duration> delay = backoff.next();
        if (delay.isEmpty()) {
          throw new RetryAbortedException(
              RetryAbortedException.Reason.DEADLINE_EXCEEDED, taskName, attempts, e);
        }

        LOG.warn(
            "Task {} encountered a non-fatal error on attempt {}, backing off for {} ms",
            taskName,
            attempts,
            delay.get().toMillis(),
            e);
        waitFor(delay.get(), taskName, attempts, e);
      }
    }
  }

  private void waitFor(Duration delay, String taskName, int attempts, Exception lastError) {
    try {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Interrupted before backing off");
      }
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      RetryAbortedException aborted =
          new RetryAbortedException(
              RetryAbortedException.Reason.INTERRUPTED, taskName, attempts, lastError);
      aborted.addSuppressed(e);
      throw aborted;
    }
  }
}
