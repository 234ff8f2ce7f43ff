package com.slack.compactor.backoff;

/** Outcome of classifying a failed attempt. */
public enum RetryDecision {
  RETRY,
  FAIL
}
