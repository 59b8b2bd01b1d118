package com.ospicorp.sgs.series.client;

// Lives for a single fetch call; lastError is null until an attempt fails
public record RetryState(int attemptNumber, ErrorKind lastError) {

  public static RetryState initial() {
    return new RetryState(0, null);
  }

  public RetryState nextAttempt() {
    return new RetryState(attemptNumber + 1, lastError);
  }

  public RetryState failedWith(ErrorKind kind) {
    return new RetryState(attemptNumber, kind);
  }
}
