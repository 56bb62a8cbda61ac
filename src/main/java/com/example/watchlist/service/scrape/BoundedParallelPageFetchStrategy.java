package com.example.watchlist.service.scrape;

import com.example.watchlist.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

@Slf4j
public class BoundedParallelPageFetchStrategy implements PageFetchStrategy {
  private final ExecutorService executor;

  public BoundedParallelPageFetchStrategy(int maxConcurrency) {
    int threads = Math.max(1, maxConcurrency);
    AtomicInteger counter = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(threads, runnable -> {
      Thread t = new Thread(runnable);
      t.setName("watchlist-page-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public <T> List<T> fetchPages(int firstPage, int lastPage, IntFunction<T> pageLoader) {
    List<Future<T>> tasks = new ArrayList<>();
    for (int page = firstPage; page <= lastPage; page++) {
      int current = page;
      tasks.add(executor.submit(() -> pageLoader.apply(current)));
    }
    List<T> pages = new ArrayList<>(tasks.size());
    try {
      for (Future<T> task : tasks) {
        pages.add(task.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      tasks.forEach(task -> task.cancel(true));
      throw new UpstreamUnavailableException("Interrupted while fetching watchlist pages", e);
    } catch (ExecutionException e) {
      tasks.forEach(task -> task.cancel(true));
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new UpstreamUnavailableException("Watchlist page fetch failed", e.getCause());
    }
    return pages;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    log.debug("Watchlist page executor stopped");
  }
}
