package com.ospicorp.sgs.series.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.sgs.series.model.RawPoint;
import com.ospicorp.sgs.series.service.DateNormalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.h2.jdbcx.JdbcConnectionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Durable cache of raw upstream payloads, one row per exact {@code (series, start, end)}
 * request. Disabled until {@link #activate(Path)} is called; while disabled lookups miss and
 * stores are ignored.
 */
public class SeriesCache {
  private static final Logger log = LoggerFactory.getLogger(SeriesCache.class);
  private static final TypeReference<List<RawPoint>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;
  private final CachePolicy policy;
  private final Clock clock;

  private volatile Store store;

  public SeriesCache(ObjectMapper mapper, CachePolicy policy, Clock clock) {
    this.mapper = mapper;
    this.policy = policy;
    this.clock = clock;
  }

  public static Path defaultLocation() {
    return Path.of(System.getProperty("user.home"), ".sgs", "cache");
  }

  /**
   * Opens (creating if needed) the cache database at {@code location}, or at
   * {@link #defaultLocation()} when {@code null}. Re-activating switches to the new location.
   */
  public synchronized void activate(Path location) {
    Path target = (location != null ? location : defaultLocation()).toAbsolutePath();
    try {
      if (target.getParent() != null) {
        Files.createDirectories(target.getParent());
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create cache directory for " + target, e);
    }
    Store previous = store;
    JdbcConnectionPool pool = JdbcConnectionPool.create(jdbcUrl(target), "sa", "");
    JdbcTemplate jdbc = new JdbcTemplate(pool);
    jdbc.execute("""
        CREATE TABLE IF NOT EXISTS cache_series (
          cache_key VARCHAR(128) PRIMARY KEY,
          payload CLOB NOT NULL,
          stored_at BIGINT NOT NULL,
          ttl_seconds BIGINT NOT NULL
        )
        """);
    store = new Store(pool, jdbc);
    if (previous != null) {
      previous.pool().dispose();
    }
    log.info("Local cache activated at {}", target);
  }

  public synchronized void deactivate() {
    Store previous = store;
    store = null;
    if (previous != null) {
      previous.pool().dispose();
      log.info("Local cache deactivated");
    }
  }

  public boolean isActive() {
    return store != null;
  }

  public Optional<List<RawPoint>> lookup(long seriesId, LocalDate start, LocalDate end) {
    Store current = store;
    if (current == null) return Optional.empty();

    String key = key(seriesId, start, end);
    List<CachedRow> rows = current.jdbc().query(
        "SELECT payload, stored_at, ttl_seconds FROM cache_series WHERE cache_key = ?",
        (rs, i) -> new CachedRow(rs.getString(1), rs.getLong(2), rs.getLong(3)),
        key);
    if (rows.isEmpty()) return Optional.empty();

    CachedRow row = rows.get(0);
    long ageMillis = clock.millis() - row.storedAt();
    if (ageMillis > row.ttlSeconds() * 1000L) {
      // only the row that was read; a concurrent store may already have replaced it
      current.jdbc().update("DELETE FROM cache_series WHERE cache_key = ? AND stored_at = ?",
          key, row.storedAt());
      log.debug("Cache entry {} expired after {} ms", key, ageMillis);
      return Optional.empty();
    }
    try {
      List<RawPoint> points = mapper.readValue(row.payload(), PAYLOAD_TYPE);
      log.debug("Cache hit for {}", key);
      return Optional.of(points);
    } catch (JsonProcessingException e) {
      log.warn("Evicting unreadable cache entry {}: {}", key, e.getOriginalMessage());
      current.jdbc().update("DELETE FROM cache_series WHERE cache_key = ? AND stored_at = ?",
          key, row.storedAt());
      return Optional.empty();
    }
  }

  public void store(long seriesId, LocalDate start, LocalDate end, List<RawPoint> points) {
    store(seriesId, start, end, points, null);
  }

  /**
   * Replaces any entry for the same key. {@code ttlOverride} wins over the periodicity
   * default when non-null.
   */
  public void store(long seriesId, LocalDate start, LocalDate end, List<RawPoint> points,
      Duration ttlOverride) {
    Store current = store;
    if (current == null) return;

    String key = key(seriesId, start, end);
    Duration ttl = ttlOverride != null ? ttlOverride : policy.ttlFor(seriesId);
    current.jdbc().update("""
        MERGE INTO cache_series (cache_key, payload, stored_at, ttl_seconds)
        KEY (cache_key) VALUES (?, ?, ?, ?)
        """, key, writePayload(points), clock.millis(), ttl.toSeconds());
    log.debug("Cached {} points for {} (ttl {}s)", points.size(), key, ttl.toSeconds());
  }

  public void purgeAll() {
    Store current = store;
    if (current == null) return;
    int removed = current.jdbc().update("DELETE FROM cache_series");
    log.info("Cache cleared ({} entries)", removed);
  }

  public int purgeExpired() {
    Store current = store;
    if (current == null) return 0;
    int removed = current.jdbc().update(
        "DELETE FROM cache_series WHERE stored_at + ttl_seconds * 1000 < ?", clock.millis());
    if (removed > 0) {
      log.info("Cache: removed {} expired entries", removed);
    }
    return removed;
  }

  /**
   * File database URL for {@code location}. The first process to open the file serves it to
   * the others over a local TCP port, so several service instances can share one cache.
   */
  static String jdbcUrl(Path location) {
    return "jdbc:h2:file:" + location.toAbsolutePath() + ";AUTO_SERVER=TRUE";
  }

  static String key(long seriesId, LocalDate start, LocalDate end) {
    return seriesId + ":" + DateNormalizer.toUpstream(start) + ":" + DateNormalizer.toUpstream(end);
  }

  private String writePayload(List<RawPoint> points) {
    try {
      return mapper.writeValueAsString(points);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize cache payload", e);
    }
  }

  private record Store(JdbcConnectionPool pool, JdbcTemplate jdbc) {}

  private record CachedRow(String payload, long storedAt, long ttlSeconds) {}
}
