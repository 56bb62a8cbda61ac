package com.example.watchlist.service.scrape;

public enum PaginationFailurePolicy {
  FAIL,
  PARTIAL
}
