package com.example.watchlist.exception;

public abstract class RetrievalException extends RuntimeException {
  protected RetrievalException(String message) {
    super(message);
  }

  protected RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
