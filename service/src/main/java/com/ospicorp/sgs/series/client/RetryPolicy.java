package com.ospicorp.sgs.series.client;

import java.time.Duration;
import java.util.List;

/**
 * Fixed-table backoff: the delay after attempt {@code n} is {@code backoff[n - 1]}, clamped
 * to the last entry. No jitter.
 */
public class RetryPolicy {
  public static final List<Duration> DEFAULT_BACKOFF =
      List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5));
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  private final int maxAttempts;
  private final List<Duration> backoff;

  public RetryPolicy(int maxAttempts, List<Duration> backoff) {
    if (backoff.isEmpty()) {
      throw new IllegalArgumentException("backoff table must not be empty");
    }
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = List.copyOf(backoff);
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public boolean canRetry(RetryState state) {
    return state.lastError() != null
        && state.lastError().isRetryable()
        && state.attemptNumber() < maxAttempts;
  }

  public Duration delayAfter(int attempt) {
    int index = Math.min(Math.max(attempt, 1) - 1, backoff.size() - 1);
    return backoff.get(index);
  }
}
