package com.ospicorp.sgs.series.model;

/**
 * A single upstream request: either one bounded sub-range or the last {@code lastN} points.
 */
public record FetchTask(long seriesId, DateRange range, Integer lastN) {

  public static FetchTask forRange(long seriesId, DateRange range) {
    return new FetchTask(seriesId, range, null);
  }

  public static FetchTask forLast(long seriesId, int lastN) {
    return new FetchTask(seriesId, null, lastN);
  }

  public boolean isLastN() {
    return lastN != null;
  }

  @Override
  public String toString() {
    return isLastN()
        ? "series " + seriesId + " last " + lastN
        : "series " + seriesId + " " + range.start() + ".." + range.end();
  }
}
