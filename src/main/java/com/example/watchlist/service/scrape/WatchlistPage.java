package com.example.watchlist.service.scrape;

import com.example.watchlist.domain.MovieItem;

import java.util.List;

public record WatchlistPage(List<MovieItem> movies, int paginationMarkers) {
  public WatchlistPage {
    movies = List.copyOf(movies);
  }

  public int totalPages() {
    return Math.max(1, paginationMarkers);
  }
}
