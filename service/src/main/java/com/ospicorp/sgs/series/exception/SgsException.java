package com.ospicorp.sgs.series.exception;

/**
 * Base type for every failure surfaced by the series pipeline.
 */
public class SgsException extends RuntimeException {

  public SgsException(String message) {
    super(message);
  }

  public SgsException(String message, Throwable cause) {
    super(message, cause);
  }
}
