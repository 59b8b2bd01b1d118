package com.ospicorp.sgs.series.client;

import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Classification of a failed upstream attempt. Only the retryable kinds consume further
 * attempts; the rest surface immediately.
 */
public enum ErrorKind {
  NOT_FOUND(false),
  BAD_REQUEST(false),
  CLIENT_ERROR(false),
  INVALID_PAYLOAD(false),
  THROTTLED(true),
  SERVER_ERROR(true),
  TIMEOUT(true);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public static ErrorKind classify(RestClientException ex) {
    if (ex instanceof ResourceAccessException) {
      return TIMEOUT;
    }
    if (ex instanceof HttpStatusCodeException status) {
      int code = status.getStatusCode().value();
      if (code == 404) return NOT_FOUND;
      if (code == 400) return BAD_REQUEST;
      if (code == 429) return THROTTLED;
      if (code >= 500) return SERVER_ERROR;
      return CLIENT_ERROR;
    }
    return INVALID_PAYLOAD;
  }
}
