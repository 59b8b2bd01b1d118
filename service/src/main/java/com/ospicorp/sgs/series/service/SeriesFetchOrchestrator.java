package com.ospicorp.sgs.series.service;

import com.ospicorp.sgs.series.cache.SeriesCache;
import com.ospicorp.sgs.series.client.SgsClient;
import com.ospicorp.sgs.series.model.DateRange;
import com.ospicorp.sgs.series.model.FetchTask;
import com.ospicorp.sgs.series.model.RawPoint;
import com.ospicorp.sgs.series.model.SeriesPoint;
import com.ospicorp.sgs.series.model.SeriesRequest;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fetches one series: plans the sub-range tasks, serves what it can from the cache, sends the
 * rest upstream under the batch gate and assembles the result.
 */
@Service
public class SeriesFetchOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SeriesFetchOrchestrator.class);

  private final SgsClient client;
  private final SeriesCache cache;
  private final Executor executor;
  private final Clock clock;
  private final int maxSpanYears;
  private final int defaultLookbackYears;
  private final int maxConcurrentRequests;

  public SeriesFetchOrchestrator(SgsClient client, SeriesCache cache,
      @Qualifier("sgsFetchExecutor") Executor executor,
      Clock clock,
      @Value("${sgs.max-span-years:10}") int maxSpanYears,
      @Value("${sgs.default-lookback-years:10}") int defaultLookbackYears,
      @Value("${sgs.max-concurrent-requests:5}") int maxConcurrentRequests) {
    this.client = client;
    this.cache = cache;
    this.executor = executor;
    this.clock = clock;
    this.maxSpanYears = maxSpanYears;
    this.defaultLookbackYears = defaultLookbackYears;
    this.maxConcurrentRequests = maxConcurrentRequests;
  }

  public FetchBatch newBatch() {
    return new FetchBatch(new ConcurrencyGate(maxConcurrentRequests));
  }

  public List<SeriesPoint> fetch(long seriesId, SeriesRequest request) {
    return await(fetchAsync(seriesId, request, newBatch()));
  }

  /**
   * Completes with the assembled series, or exceptionally with the first failure recorded in
   * {@code batch}. Tasks already running when a failure happens are left to finish.
   */
  public CompletableFuture<List<SeriesPoint>> fetchAsync(long seriesId, SeriesRequest request,
      FetchBatch batch) {
    List<FetchTask> tasks = plan(seriesId, request);
    log.debug("Series {}: {} task(s) planned", seriesId, tasks.size());

    CompletableFuture<List<SeriesPoint>> result = new CompletableFuture<>();
    List<CompletableFuture<List<RawPoint>>> chunks = new ArrayList<>(tasks.size());
    for (FetchTask task : tasks) {
      CompletableFuture<List<RawPoint>> chunk =
          CompletableFuture.supplyAsync(() -> execute(task, batch), executor);
      chunk.whenComplete((points, ex) -> {
        if (ex != null) {
          result.completeExceptionally(failureOf(batch, ex));
        }
      });
      chunks.add(chunk);
    }

    CompletableFuture.allOf(chunks.toArray(new CompletableFuture<?>[0]))
        .whenComplete((ignored, ex) -> {
          if (ex != null) {
            result.completeExceptionally(failureOf(batch, ex));
            return;
          }
          // partition order, never completion order, so "last occurrence wins" is stable
          List<RawPoint> all = new ArrayList<>();
          for (CompletableFuture<List<RawPoint>> chunk : chunks) {
            all.addAll(chunk.join());
          }
          try {
            result.complete(SeriesAssembler.assemble(all));
          } catch (RuntimeException e) {
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  List<FetchTask> plan(long seriesId, SeriesRequest request) {
    if (request.isLastN()) {
      return List.of(FetchTask.forLast(seriesId, request.lastN()));
    }
    LocalDate end = request.end() != null ? request.end() : LocalDate.now(clock);
    LocalDate start = request.start() != null
        ? request.start()
        : end.minusYears(defaultLookbackYears - 1L);
    List<DateRange> ranges = RangePartitioner.partition(start, end, maxSpanYears);
    List<FetchTask> tasks = new ArrayList<>(ranges.size());
    for (DateRange range : ranges) {
      tasks.add(FetchTask.forRange(seriesId, range));
    }
    return tasks;
  }

  private List<RawPoint> execute(FetchTask task, FetchBatch batch) {
    if (batch.isAborted()) {
      throw new BatchAbortedException(task);
    }
    if (!task.isLastN()) {
      Optional<List<RawPoint>> cached =
          cache.lookup(task.seriesId(), task.range().start(), task.range().end());
      if (cached.isPresent()) {
        log.debug("{}: served from cache", task);
        return cached.get();
      }
    }

    List<RawPoint> points = batch.gate().run(() -> {
      if (batch.isAborted()) {
        throw new BatchAbortedException(task);
      }
      log.debug("{}: in flight", task);
      return task.isLastN()
          ? client.fetchLast(task.seriesId(), task.lastN())
          : client.fetchRange(task.seriesId(), task.range());
    });

    if (!task.isLastN()) {
      cache.store(task.seriesId(), task.range().start(), task.range().end(), points);
    }
    log.debug("{}: {} point(s) received", task, points.size());
    return points;
  }

  static Throwable failureOf(FetchBatch batch, Throwable ex) {
    Throwable cause = unwrap(ex);
    if (cause instanceof BatchAbortedException && batch.firstFailure() != null) {
      return batch.firstFailure();
    }
    return batch.recordFailure(cause);
  }

  static Throwable unwrap(Throwable ex) {
    Throwable current = ex;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Blocks for {@code future} and rethrows its failure as-is instead of wrapped in a
   * {@link CompletionException}.
   */
  static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = unwrap(e);
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  static final class BatchAbortedException extends CancellationException {
    BatchAbortedException(FetchTask task) {
      super("Skipped " + task + " because the batch already failed");
    }
  }
}
