package com.ospicorp.sgs.series.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Several series outer-joined on date. Rows are in ascending date order; a label missing
 * from {@link Row#values()} means that series has no observation on that date.
 */
public record SeriesTable(List<String> columns, List<Row> rows) {

  public record Row(LocalDate date, Map<String, Double> values) {}

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
