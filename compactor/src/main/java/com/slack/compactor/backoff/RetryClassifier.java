package com.slack.compactor.backoff;

/** Decides whether a failed attempt is worth retrying. */
@FunctionalInterface
public interface RetryClassifier {
  RetryClassifier ALWAYS_RETRY = e -> RetryDecision.RETRY;

  RetryDecision classify(Exception e);
}
