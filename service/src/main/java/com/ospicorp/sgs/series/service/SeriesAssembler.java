package com.ospicorp.sgs.series.service;

import com.ospicorp.sgs.series.exception.UpstreamException;
import com.ospicorp.sgs.series.model.RawPoint;
import com.ospicorp.sgs.series.model.SeriesPoint;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class SeriesAssembler {
  private SeriesAssembler() {
  }

  /**
   * Turns the concatenated chunk payloads of one series into an ordered series with one point
   * per date. When a date repeats, the occurrence that comes last in {@code raw} wins.
   *
   * @throws UpstreamException if a row carries a date that is not {@code dd/MM/yyyy}
   */
  public static List<SeriesPoint> assemble(List<RawPoint> raw) {
    if (raw.isEmpty()) return List.of();
    Map<LocalDate, Double> byDate = new TreeMap<>();
    for (RawPoint p : raw) {
      LocalDate date = parseDate(p.date());
      if (date == null) {
        throw new UpstreamException(200,
            "Unreadable date '" + p.date() + "' in upstream payload");
      }
      byDate.put(date, parseValue(p.value()));
    }
    List<SeriesPoint> out = new ArrayList<>(byDate.size());
    for (var e : byDate.entrySet()) {
      out.add(new SeriesPoint(e.getKey(), e.getValue()));
    }
    return out;
  }

  private static LocalDate parseDate(String text) {
    if (text == null) return null;
    try {
      return LocalDate.parse(text.trim(), DateNormalizer.UPSTREAM);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  static Double parseValue(String text) {
    if (text == null || text.isBlank()) return null;
    try {
      double v = Double.parseDouble(text.trim());
      return Double.isNaN(v) ? null : v;
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
