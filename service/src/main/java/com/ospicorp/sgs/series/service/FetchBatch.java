package com.ospicorp.sgs.series.service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * State shared by every fetch task started from one top-level call: the concurrency gate and
 * the first failure observed. Once a failure is recorded, tasks that have not started yet are
 * skipped.
 */
public final class FetchBatch {
  private final ConcurrencyGate gate;
  private final AtomicReference<Throwable> firstFailure = new AtomicReference<>();

  public FetchBatch(ConcurrencyGate gate) {
    this.gate = gate;
  }

  public ConcurrencyGate gate() {
    return gate;
  }

  public boolean isAborted() {
    return firstFailure.get() != null;
  }

  /** Records {@code failure} unless another one got there first; returns the winner. */
  Throwable recordFailure(Throwable failure) {
    firstFailure.compareAndSet(null, failure);
    return firstFailure.get();
  }

  Throwable firstFailure() {
    return firstFailure.get();
  }
}
