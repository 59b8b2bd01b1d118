package com.ospicorp.sgs.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.sgs.series.exception.InvalidParametersException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DateNormalizerTest {

  @Test
  void nullMeansNoValue() {
    assertNull(DateNormalizer.normalize(null));
  }

  @Test
  void datesAndTimestampsKeepTheirCalendarDay() {
    LocalDate day = LocalDate.of(2024, 1, 15);
    assertSame(day, DateNormalizer.normalize(day));
    assertEquals(LocalDate.of(2024, 6, 20),
        DateNormalizer.normalize(LocalDateTime.of(2024, 6, 20, 10, 30)));
    assertEquals(LocalDate.of(2024, 6, 20),
        DateNormalizer.normalize(OffsetDateTime.of(2024, 6, 20, 23, 0, 0, 0, ZoneOffset.ofHours(-3))));
    assertEquals(LocalDate.of(2024, 6, 20),
        DateNormalizer.normalize(Instant.parse("2024-06-20T12:00:00Z")));
  }

  @Test
  void parsesIsoThenDayFirst() {
    assertEquals(LocalDate.of(2024, 3, 15), DateNormalizer.normalize("2024-03-15"));
    assertEquals(LocalDate.of(2024, 3, 15), DateNormalizer.normalize("15/03/2024"));
  }

  @Test
  void rejectsAnythingElse() {
    assertThrows(InvalidParametersException.class, () -> DateNormalizer.normalize("invalid-date"));
    assertThrows(InvalidParametersException.class, () -> DateNormalizer.normalize(""));
    assertThrows(InvalidParametersException.class, () -> DateNormalizer.normalize("2024/03/15"));
    assertThrows(InvalidParametersException.class, () -> DateNormalizer.normalize("31/02/2024"));
    var ex = assertThrows(InvalidParametersException.class, () -> DateNormalizer.normalize(20240315));
    assertThat(ex.errorCode()).isEqualTo(InvalidParametersException.INVALID_DATE);
    assertThat(ex.moreInfo()).endsWith("/1001");
  }

  @Test
  void upstreamFormatRoundTrips() {
    for (String text : new String[] {"02/01/2024", "29/02/2000", "31/12/1999"}) {
      assertEquals(text, DateNormalizer.toUpstream(DateNormalizer.normalize(text)));
    }
    assertEquals("01/03/2024", DateNormalizer.toUpstream(DateNormalizer.normalize("2024-03-01")));
  }
}
