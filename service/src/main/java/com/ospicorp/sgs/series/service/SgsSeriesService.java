package com.ospicorp.sgs.series.service;

import com.ospicorp.sgs.series.cache.SeriesCache;
import com.ospicorp.sgs.series.catalog.SeriesCatalog;
import com.ospicorp.sgs.series.client.SgsClient;
import com.ospicorp.sgs.series.model.SeriesIdentity;
import com.ospicorp.sgs.series.model.SeriesMetadata;
import com.ospicorp.sgs.series.model.SeriesPoint;
import com.ospicorp.sgs.series.model.SeriesRef;
import com.ospicorp.sgs.series.model.SeriesRequest;
import com.ospicorp.sgs.series.model.SeriesTable;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for collaborators (request routing, catalog search, admin tooling).
 * References are resolved through the catalog once, here, before anything is fetched.
 */
@Service
public class SgsSeriesService {

  private final SeriesCatalog catalog;
  private final SeriesFetchOrchestrator orchestrator;
  private final MultiSeriesCoordinator coordinator;
  private final SeriesCache cache;
  private final SgsClient client;
  private final Executor executor;

  public SgsSeriesService(SeriesCatalog catalog, SeriesFetchOrchestrator orchestrator,
      MultiSeriesCoordinator coordinator, SeriesCache cache, SgsClient client,
      @Qualifier("sgsFetchExecutor") Executor executor) {
    this.catalog = catalog;
    this.orchestrator = orchestrator;
    this.coordinator = coordinator;
    this.cache = cache;
    this.client = client;
    this.executor = executor;
  }

  /**
   * @param start date, timestamp or {@code YYYY-MM-DD} / {@code DD/MM/YYYY} string, or null
   * @param end same accepted forms as {@code start}
   * @param lastN when non-null, fetch only the latest {@code lastN} points and ignore the dates
   */
  public List<SeriesPoint> fetchSeries(SeriesRef series, Object start, Object end, Integer lastN) {
    return fetchSeries(series, toRequest(start, end, lastN));
  }

  public List<SeriesPoint> fetchSeries(SeriesRef series, SeriesRequest request) {
    long id = catalog.resolve(series);
    return orchestrator.fetch(id, request);
  }

  /**
   * Same as {@link #fetchSeries(SeriesRef, Object, Object, Integer)} without blocking the
   * caller. Bad arguments and unknown names are rejected immediately; upstream failures
   * complete the future exceptionally.
   */
  public CompletableFuture<List<SeriesPoint>> fetchSeriesAsync(SeriesRef series, Object start,
      Object end, Integer lastN) {
    return fetchSeriesAsync(series, toRequest(start, end, lastN));
  }

  public CompletableFuture<List<SeriesPoint>> fetchSeriesAsync(SeriesRef series,
      SeriesRequest request) {
    long id = catalog.resolve(series);
    return orchestrator.fetchAsync(id, request, orchestrator.newBatch());
  }

  public SeriesTable fetchMultipleSeries(Map<String, SeriesRef> labelToSeries, Object start,
      Object end, Integer lastN) {
    return coordinator.fetchAll(labelToSeries, toRequest(start, end, lastN));
  }

  public CompletableFuture<SeriesTable> fetchMultipleSeriesAsync(
      Map<String, SeriesRef> labelToSeries, Object start, Object end, Integer lastN) {
    return coordinator.fetchAllAsync(labelToSeries, toRequest(start, end, lastN));
  }

  public SeriesIdentity resolveCatalogEntry(SeriesRef series) {
    return catalog.identity(series);
  }

  public List<SeriesIdentity> listCatalog() {
    return catalog.list();
  }

  /**
   * Upstream metadata, with blanks filled from the catalog entry when there is one.
   */
  public SeriesMetadata fetchMetadata(SeriesRef series) {
    return metadataFor(catalog.resolve(series));
  }

  public CompletableFuture<SeriesMetadata> fetchMetadataAsync(SeriesRef series) {
    long id = catalog.resolve(series);
    return CompletableFuture.supplyAsync(() -> metadataFor(id), executor);
  }

  private SeriesMetadata metadataFor(long id) {
    SeriesMetadata upstream = client.fetchMetadata(id);
    Optional<SeriesIdentity> known = catalog.find(id);
    if (known.isEmpty()) {
      return upstream;
    }
    SeriesIdentity entry = known.get();
    return new SeriesMetadata(id,
        upstream.name() != null ? upstream.name() : entry.canonicalName(),
        upstream.unit() != null ? upstream.unit() : entry.unit(),
        upstream.periodicity() != null ? upstream.periodicity() : entry.periodicity().name(),
        upstream.source(),
        upstream.start(),
        upstream.end());
  }

  public void activateCache(Path location) {
    cache.activate(location);
  }

  public void deactivateCache() {
    cache.deactivate();
  }

  public void purgeCache() {
    cache.purgeAll();
  }

  public int purgeExpiredCache() {
    return cache.purgeExpired();
  }

  private static SeriesRequest toRequest(Object start, Object end, Integer lastN) {
    if (lastN != null) {
      return SeriesRequest.last(lastN);
    }
    return SeriesRequest.between(DateNormalizer.normalize(start), DateNormalizer.normalize(end));
  }
}
