package com.example.watchlist.service.scrape;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

// Default: one page at a time, to go easy on the origin site.
public class SequentialPageFetchStrategy implements PageFetchStrategy {
  @Override
  public <T> List<T> fetchPages(int firstPage, int lastPage, IntFunction<T> pageLoader) {
    List<T> pages = new ArrayList<>();
    for (int page = firstPage; page <= lastPage; page++) {
      pages.add(pageLoader.apply(page));
    }
    return pages;
  }
}
