package com.ospicorp.sgs.series.service;

import com.ospicorp.sgs.series.catalog.SeriesCatalog;
import com.ospicorp.sgs.series.exception.InvalidParametersException;
import com.ospicorp.sgs.series.model.SeriesPoint;
import com.ospicorp.sgs.series.model.SeriesRef;
import com.ospicorp.sgs.series.model.SeriesRequest;
import com.ospicorp.sgs.series.model.SeriesTable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MultiSeriesCoordinator {
  private static final Logger log = LoggerFactory.getLogger(MultiSeriesCoordinator.class);

  private final SeriesFetchOrchestrator orchestrator;
  private final SeriesCatalog catalog;

  public MultiSeriesCoordinator(SeriesFetchOrchestrator orchestrator, SeriesCatalog catalog) {
    this.orchestrator = orchestrator;
    this.catalog = catalog;
  }

  /**
   * Fetches every series concurrently under one shared gate and outer-joins them on date.
   * The first series to fail aborts the whole call.
   */
  public SeriesTable fetchAll(Map<String, SeriesRef> labelToSeries, SeriesRequest request) {
    return SeriesFetchOrchestrator.await(fetchAllAsync(labelToSeries, request));
  }

  /**
   * Non-blocking form of {@link #fetchAll}. References are resolved before anything starts,
   * so an unknown name fails here rather than through the returned future.
   */
  public CompletableFuture<SeriesTable> fetchAllAsync(Map<String, SeriesRef> labelToSeries,
      SeriesRequest request) {
    if (labelToSeries.isEmpty()) {
      throw new InvalidParametersException("At least one series must be requested",
          InvalidParametersException.INVALID_REFERENCE);
    }
    Map<String, Long> ids = new LinkedHashMap<>();
    labelToSeries.forEach((label, ref) -> ids.put(label, catalog.resolve(ref)));

    FetchBatch batch = orchestrator.newBatch();
    CompletableFuture<SeriesTable> result = new CompletableFuture<>();
    Map<String, CompletableFuture<List<SeriesPoint>>> futures = new LinkedHashMap<>();
    for (Map.Entry<String, Long> e : ids.entrySet()) {
      CompletableFuture<List<SeriesPoint>> series =
          orchestrator.fetchAsync(e.getValue(), request, batch);
      series.whenComplete((points, ex) -> {
        if (ex != null) {
          log.warn("Series {} ({}) failed: {}", e.getKey(), e.getValue(), ex.getMessage());
          result.completeExceptionally(SeriesFetchOrchestrator.failureOf(batch, ex));
        }
      });
      futures.put(e.getKey(), series);
    }

    CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
        .whenComplete((ignored, ex) -> {
          if (ex != null) {
            result.completeExceptionally(SeriesFetchOrchestrator.failureOf(batch, ex));
            return;
          }
          Map<String, List<SeriesPoint>> bySeries = new LinkedHashMap<>();
          futures.forEach((label, f) -> bySeries.put(label, f.join()));
          result.complete(outerJoin(bySeries));
        });
    return result;
  }

  static SeriesTable outerJoin(Map<String, List<SeriesPoint>> bySeries) {
    Map<LocalDate, Map<String, Double>> byDate = new TreeMap<>();
    bySeries.forEach((label, points) -> {
      for (SeriesPoint p : points) {
        byDate.computeIfAbsent(p.date(), d -> new LinkedHashMap<>()).put(label, p.value());
      }
    });
    List<SeriesTable.Row> rows = new ArrayList<>(byDate.size());
    byDate.forEach((date, values) ->
        rows.add(new SeriesTable.Row(date, Collections.unmodifiableMap(values))));
    return new SeriesTable(List.copyOf(bySeries.keySet()), rows);
  }
}
