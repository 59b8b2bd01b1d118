package com.ospicorp.sgs.series.exception;

public class UpstreamException extends SgsException {
  private final int statusCode;

  public UpstreamException(int statusCode, String message) {
    super("Upstream error " + statusCode + ": " + message);
    this.statusCode = statusCode;
  }

  public UpstreamException(int statusCode, String message, Throwable cause) {
    super("Upstream error " + statusCode + ": " + message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
