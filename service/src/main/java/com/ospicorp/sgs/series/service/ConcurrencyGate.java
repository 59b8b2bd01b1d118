package com.ospicorp.sgs.series.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Counting gate bounding simultaneous upstream requests. A slot is always released once the
 * guarded action returns or throws.
 */
public final class ConcurrencyGate {
  private final Semaphore permits;
  private final int capacity;

  public ConcurrencyGate(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
    }
    this.capacity = capacity;
    this.permits = new Semaphore(capacity, true);
  }

  public <T> T run(Supplier<T> action) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for an upstream slot");
    }
    try {
      return action.get();
    } finally {
      permits.release();
    }
  }

  public int capacity() {
    return capacity;
  }

  public int available() {
    return permits.availablePermits();
  }
}
