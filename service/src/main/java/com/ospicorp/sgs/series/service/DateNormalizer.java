package com.ospicorp.sgs.series.service;

import com.ospicorp.sgs.series.exception.InvalidParametersException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;

public final class DateNormalizer {
  public static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("uuuu-MM-dd")
      .withResolverStyle(ResolverStyle.STRICT);
  public static final DateTimeFormatter UPSTREAM = DateTimeFormatter.ofPattern("dd/MM/uuuu")
      .withResolverStyle(ResolverStyle.STRICT);

  private static final List<DateTimeFormatter> ACCEPTED = List.of(ISO, UPSTREAM);

  private DateNormalizer() {
  }

  /**
   * Converts a caller-supplied boundary to a calendar date. {@code null} yields {@code null}
   * so the caller can apply its own default.
   */
  public static LocalDate normalize(Object value) {
    if (value == null) return null;
    if (value instanceof LocalDate date) return date;
    if (value instanceof LocalDateTime dateTime) return dateTime.toLocalDate();
    if (value instanceof OffsetDateTime dateTime) return dateTime.toLocalDate();
    if (value instanceof ZonedDateTime dateTime) return dateTime.toLocalDate();
    if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    if (value instanceof String text) return parse(text);
    throw new InvalidParametersException(
        "Unsupported date type " + value.getClass().getSimpleName()
            + ". Use a date, a timestamp or a YYYY-MM-DD / DD/MM/YYYY string.",
        InvalidParametersException.INVALID_DATE);
  }

  public static String toUpstream(LocalDate date) {
    return UPSTREAM.format(date);
  }

  private static LocalDate parse(String text) {
    for (DateTimeFormatter formatter : ACCEPTED) {
      try {
        return LocalDate.parse(text, formatter);
      } catch (DateTimeParseException ignored) {
        // try the next accepted format
      }
    }
    throw new InvalidParametersException(
        "Invalid date format: '" + text + "'. Use YYYY-MM-DD or DD/MM/YYYY.",
        InvalidParametersException.INVALID_DATE);
  }
}
