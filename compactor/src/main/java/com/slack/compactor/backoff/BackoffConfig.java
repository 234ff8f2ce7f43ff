package com.slack.compactor.backoff;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.compactor.proto.config.CompactorConfigs;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * BackoffConfig describes how the delay grows between attempts of a retried operation. It is
 * immutable and shared by every retry loop in a process.
 *
 * <p>The optional deadline bounds the cumulative time spent backing off, and the optional max
 * attempts bounds the number of calls made. Both default to unbounded, in which case a retry loop
 * only ends when the operation succeeds.
 */
public class BackoffConfig {
  public static final Duration DEFAULT_INIT_BACKOFF = Duration.ofMillis(100);
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(500);
  public static final double DEFAULT_BASE = 3.0;

  private final Duration initBackoff;
  private final Duration maxBackoff;
  private final double base;
  private final Duration deadline;
  private final Integer maxAttempts;

  private BackoffConfig(
      Duration initBackoff,
      Duration maxBackoff,
      double base,
      Duration deadline,
      Integer maxAttempts) {
    checkArgument(
        initBackoff != null && !initBackoff.isNegative() && !initBackoff.isZero(),
        "initBackoff must be positive");
    checkArgument(
        maxBackoff != null && maxBackoff.compareTo(initBackoff) >= 0,
        "maxBackoff must be greater than or equal to initBackoff");
    checkArgument(base >= 1.0, "base must be greater than or equal to 1.0");
    checkArgument(
        deadline == null || (!deadline.isNegative() && !deadline.isZero()),
        "deadline must be positive when set");
    checkArgument(maxAttempts == null || maxAttempts > 0, "maxAttempts must be positive when set");

    this.initBackoff = initBackoff;
    this.maxBackoff = maxBackoff;
    this.base = base;
    this.deadline = deadline;
    this.maxAttempts = maxAttempts;
  }

  public static BackoffConfig defaultConfig() {
    return builder().build();
  }

  /** Zero valued fields of the proto fall back to the defaults, or to unbounded for limits. */
  public static BackoffConfig fromConfig(CompactorConfigs.BackoffConfig backoffConfig) {
    Builder builder = builder();
    if (backoffConfig.getInitBackoffMs() > 0) {
      builder.initBackoff(Duration.ofMillis(backoffConfig.getInitBackoffMs()));
    }
    if (backoffConfig.getMaxBackoffMs() > 0) {
      builder.maxBackoff(Duration.ofMillis(backoffConfig.getMaxBackoffMs()));
    }
    if (backoffConfig.getBase() > 0) {
      builder.base(backoffConfig.getBase());
    }
    if (backoffConfig.getDeadlineMs() > 0) {
      builder.deadline(Duration.ofMillis(backoffConfig.getDeadlineMs()));
    }
    if (backoffConfig.getMaxAttempts() > 0) {
      builder.maxAttempts(backoffConfig.getMaxAttempts());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration getInitBackoff() {
    return initBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public double getBase() {
    return base;
  }

  public Optional<Duration> getDeadline() {
    return Optional.ofNullable(deadline);
  }

  public OptionalInt getMaxAttempts() {
    return maxAttempts == null ? OptionalInt.empty() : OptionalInt.of(maxAttempts);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BackoffConfig that = (BackoffConfig) o;
    return Double.compare(that.base, base) == 0
        && initBackoff.equals(that.initBackoff)
        && maxBackoff.equals(that.maxBackoff)
        && Objects.equals(deadline, that.deadline)
        && Objects.equals(maxAttempts, that.maxAttempts);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initBackoff, maxBackoff, base, deadline, maxAttempts);
  }

  @Override
  public String toString() {
    return "BackoffConfig{"
        + "initBackoff="
        + initBackoff
        + ", maxBackoff="
        + maxBackoff
        + ", base="
        + base
        + ", deadline="
        + deadline
        + ", maxAttempts="
        + maxAttempts
        + '}';
  }

  public static class Builder {
    private Duration initBackoff = DEFAULT_INIT_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
    private double base = DEFAULT_BASE;
    private Duration deadline = null;
    private Integer maxAttempts = null;

    private Builder() {}

    public Builder initBackoff(Duration initBackoff) {
      this.initBackoff = initBackoff;
      return this;
    }

    public Builder maxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
      return this;
    }

    public Builder base(double base) {
      this.base = base;
      return this;
    }

    public Builder deadline(Duration deadline) {
      this.deadline = deadline;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public BackoffConfig build() {
      return new BackoffConfig(initBackoff, maxBackoff, base, deadline, maxAttempts);
    }
  }
}
