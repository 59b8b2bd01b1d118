package com.ospicorp.sgs.series.service;

import com.ospicorp.sgs.series.exception.InvalidParametersException;
import com.ospicorp.sgs.series.model.DateRange;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class RangePartitioner {
  private RangePartitioner() {
  }

  /**
   * Splits {@code [start, end]} into contiguous chunks of at most {@code maxSpanYears}
   * calendar years. The last chunk always ends exactly on {@code end}.
   */
  public static List<DateRange> partition(LocalDate start, LocalDate end, int maxSpanYears) {
    if (maxSpanYears < 1) {
      throw new InvalidParametersException("maxSpanYears must be at least 1, got " + maxSpanYears,
          InvalidParametersException.INVALID_SPAN);
    }
    if (start.isAfter(end)) {
      throw new InvalidParametersException(
          "Start date (" + start + ") must not be after end date (" + end + ").",
          InvalidParametersException.INVERTED_RANGE);
    }

    List<DateRange> out = new ArrayList<>();
    LocalDate cursor = start;
    while (!cursor.isAfter(end)) {
      LocalDate candidateEnd = cursor.plusYears(maxSpanYears).minusDays(1);
      LocalDate chunkEnd = candidateEnd.isBefore(end) ? candidateEnd : end;
      out.add(new DateRange(cursor, chunkEnd));
      cursor = chunkEnd.plusDays(1);
    }
    return out;
  }
}
