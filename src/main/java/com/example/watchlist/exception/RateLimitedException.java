package com.example.watchlist.exception;

public class RateLimitedException extends RetrievalException {
  public RateLimitedException(String message) {
    super(message);
  }
}
