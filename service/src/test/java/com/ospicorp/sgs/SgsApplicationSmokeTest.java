package com.ospicorp.sgs;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.sgs.series.cache.SeriesCache;
import com.ospicorp.sgs.series.model.SeriesRef;
import com.ospicorp.sgs.series.service.SgsSeriesService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class SgsApplicationSmokeTest {

  @Autowired
  SgsSeriesService service;

  @Autowired
  SeriesCache cache;

  @Test
  void contextLoads() {
    assertThat(service.listCatalog()).hasSizeGreaterThanOrEqualTo(14);
    assertThat(service.resolveCatalogEntry(SeriesRef.of("selic")).numericId()).isEqualTo(11L);
    assertThat(cache.isActive()).isFalse();
  }
}
