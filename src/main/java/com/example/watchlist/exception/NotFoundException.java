package com.example.watchlist.exception;

public class NotFoundException extends RetrievalException {
  public NotFoundException(String message) {
    super(message);
  }
}
