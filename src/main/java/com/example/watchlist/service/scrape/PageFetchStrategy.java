package com.example.watchlist.service.scrape;

import java.util.List;
import java.util.function.IntFunction;

/**
 * Fetches a contiguous range of watchlist pages. Implementations return the loaded
 * pages in page order regardless of the order they were fetched in, and rethrow the
 * first failure of the lowest failing page.
 */
public interface PageFetchStrategy extends AutoCloseable {

  <T> List<T> fetchPages(int firstPage, int lastPage, IntFunction<T> pageLoader);

  @Override
  default void close() {
  }
}
