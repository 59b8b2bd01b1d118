package com.ospicorp.sgs.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.sgs.series.exception.InvalidParametersException;
import com.ospicorp.sgs.series.model.DateRange;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RangePartitionerTest {

  @Test
  void shortRangeIsASingleChunk() {
    var start = LocalDate.of(2020, 1, 1);
    var end = LocalDate.of(2025, 12, 31);
    assertEquals(List.of(new DateRange(start, end)), RangePartitioner.partition(start, end, 10));
  }

  @Test
  void exactlyMaxSpanIsASingleChunk() {
    var chunks = RangePartitioner.partition(LocalDate.of(2015, 1, 1), LocalDate.of(2024, 12, 31), 10);
    assertEquals(1, chunks.size());
  }

  @Test
  void singleDayRangeIsOneChunk() {
    var day = LocalDate.of(2024, 5, 2);
    assertEquals(List.of(new DateRange(day, day)), RangePartitioner.partition(day, day, 10));
  }

  @Test
  void twentyFiveYearsSplitsIntoThreeChunks() {
    var chunks = RangePartitioner.partition(LocalDate.of(2000, 1, 1), LocalDate.of(2024, 12, 31), 10);

    assertEquals(3, chunks.size());
    assertEquals(new DateRange(LocalDate.of(2000, 1, 1), LocalDate.of(2009, 12, 31)), chunks.get(0));
    assertEquals(new DateRange(LocalDate.of(2010, 1, 1), LocalDate.of(2019, 12, 31)), chunks.get(1));
    assertEquals(new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2024, 12, 31)), chunks.get(2));
  }

  @Test
  void thirtyYearsSplitsIntoThreeChunks() {
    var chunks = RangePartitioner.partition(LocalDate.of(1995, 1, 1), LocalDate.of(2024, 12, 31), 10);
    assertEquals(3, chunks.size());
  }

  @Test
  void chunksAreContiguousAndBounded() {
    Random random = new Random(8675309L);
    LocalDate epoch = LocalDate.of(1980, 1, 1);
    for (int i = 0; i < 500; i++) {
      LocalDate start = epoch.plusDays(random.nextInt(15_000));
      LocalDate end = start.plusDays(random.nextInt(20_000));
      int span = 1 + random.nextInt(12);

      List<DateRange> chunks = RangePartitioner.partition(start, end, span);

      assertThat(chunks).isNotEmpty();
      assertEquals(start, chunks.get(0).start());
      assertEquals(end, chunks.get(chunks.size() - 1).end());
      for (int c = 0; c < chunks.size(); c++) {
        DateRange chunk = chunks.get(c);
        assertThat(chunk.end()).isBefore(chunk.start().plusYears(span));
        if (c > 0) {
          assertEquals(chunks.get(c - 1).end().plusDays(1), chunk.start());
        }
      }
    }
  }

  @Test
  void leapDayStartStaysContiguous() {
    var chunks = RangePartitioner.partition(LocalDate.of(2000, 2, 29), LocalDate.of(2012, 3, 1), 10);
    assertEquals(2, chunks.size());
    assertEquals(chunks.get(0).end().plusDays(1), chunks.get(1).start());
  }

  @Test
  void invertedRangeIsRejected() {
    var ex = assertThrows(InvalidParametersException.class,
        () -> RangePartitioner.partition(LocalDate.of(2025, 1, 1), LocalDate.of(2020, 1, 1), 10));
    assertEquals(InvalidParametersException.INVERTED_RANGE, ex.errorCode());
  }

  @Test
  void nonPositiveSpanIsRejected() {
    assertThrows(InvalidParametersException.class,
        () -> RangePartitioner.partition(LocalDate.of(2020, 1, 1), LocalDate.of(2021, 1, 1), 0));
  }
}
