package com.slack.compactor.backoff;

/** Thrown when a retry loop gives up before the operation succeeded. */
public class RetryAbortedException extends RuntimeException {
  public enum Reason {
    TERMINAL_ERROR,
    DEADLINE_EXCEEDED,
    ATTEMPTS_EXHAUSTED,
    INTERRUPTED
  }

  private final Reason reason;
  private final String taskName;
  private final int attempts;

  public RetryAbortedException(Reason reason, String taskName, int attempts, Throwable cause) {
    super(
        String.format(
            "Retry of task %s aborted after %d attempts: %s", taskName, attempts, reason),
        cause);
    this.reason = reason;
    this.taskName = taskName;
    this.attempts = attempts;
  }

  public Reason getReason() {
    return reason;
  }

  public String getTaskName() {
    return taskName;
  }

  public int getAttempts() {
    return attempts;
  }
}
