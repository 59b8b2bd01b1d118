package com.ospicorp.sgs.series.model.enums;

import java.time.Duration;

public enum Periodicity {
  DAILY(Duration.ofHours(1)),
  WEEKLY(Duration.ofHours(6)),
  MONTHLY(Duration.ofHours(24));

  private final Duration cacheTtl;

  Periodicity(Duration cacheTtl) {
    this.cacheTtl = cacheTtl;
  }

  public Duration cacheTtl() {
    return cacheTtl;
  }
}
