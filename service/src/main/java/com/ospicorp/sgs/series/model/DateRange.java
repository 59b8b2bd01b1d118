package com.ospicorp.sgs.series.model;

import com.ospicorp.sgs.series.exception.InvalidParametersException;
import java.time.LocalDate;
import java.util.Objects;

public record DateRange(LocalDate start, LocalDate end) {

  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new InvalidParametersException(
          "Start date (" + start + ") must not be after end date (" + end + ").",
          InvalidParametersException.INVERTED_RANGE);
    }
  }
}
