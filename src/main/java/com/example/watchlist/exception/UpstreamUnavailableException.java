package com.example.watchlist.exception;

public class UpstreamUnavailableException extends RetrievalException {
  public UpstreamUnavailableException(String message) {
    super(message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
