package com.ospicorp.sgs.series.exception;

/**
 * Retry budget exhausted on a retryable condition (throttling, server error or I/O timeout).
 */
public class UpstreamTimeoutException extends SgsException {
  private final long seriesId;
  private final int attempts;

  public UpstreamTimeoutException(long seriesId, int attempts) {
    super("Upstream did not answer for series " + seriesId + " after " + attempts + " attempts");
    this.seriesId = seriesId;
    this.attempts = attempts;
  }

  public UpstreamTimeoutException(long seriesId, int attempts, Throwable cause) {
    super("Upstream did not answer for series " + seriesId + " after " + attempts + " attempts",
        cause);
    this.seriesId = seriesId;
    this.attempts = attempts;
  }

  public long seriesId() {
    return seriesId;
  }

  public int attempts() {
    return attempts;
  }
}
