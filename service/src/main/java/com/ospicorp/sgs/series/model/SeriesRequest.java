package com.ospicorp.sgs.series.model;

import com.ospicorp.sgs.series.exception.InvalidParametersException;
import java.time.LocalDate;

/**
 * Requested window for a series. When {@code lastN} is set it takes precedence and the
 * dates are ignored; otherwise missing boundaries are filled in by the orchestrator.
 */
public record SeriesRequest(LocalDate start, LocalDate end, Integer lastN) {

  public SeriesRequest {
    if (lastN != null && lastN < 1) {
      throw new InvalidParametersException("lastN must be greater than zero, got " + lastN,
          InvalidParametersException.INVALID_LAST_N);
    }
    if (lastN == null && start != null && end != null && start.isAfter(end)) {
      throw new InvalidParametersException(
          "Start date (" + start + ") must not be after end date (" + end + ").",
          InvalidParametersException.INVERTED_RANGE);
    }
  }

  public static SeriesRequest between(LocalDate start, LocalDate end) {
    return new SeriesRequest(start, end, null);
  }

  public static SeriesRequest last(int n) {
    return new SeriesRequest(null, null, n);
  }

  public boolean isLastN() {
    return lastN != null;
  }
}
