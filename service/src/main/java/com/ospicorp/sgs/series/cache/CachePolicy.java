package com.ospicorp.sgs.series.cache;

import com.ospicorp.sgs.series.model.enums.Periodicity;
import java.time.Duration;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Default time-to-live per series, driven by how often the series is published.
 */
public class CachePolicy {
  public static final Duration UNKNOWN_PERIODICITY_TTL = Duration.ofHours(1);

  private final LongFunction<Optional<Periodicity>> periodicityLookup;

  public CachePolicy(LongFunction<Optional<Periodicity>> periodicityLookup) {
    this.periodicityLookup = periodicityLookup;
  }

  public Duration ttlFor(long seriesId) {
    return periodicityLookup.apply(seriesId)
        .map(Periodicity::cacheTtl)
        .orElse(UNKNOWN_PERIODICITY_TTL);
  }
}
