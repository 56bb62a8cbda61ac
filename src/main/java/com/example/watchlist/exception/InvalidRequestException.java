package com.example.watchlist.exception;

// Raised by the HTTP layer before a request reaches any retriever.
public class InvalidRequestException extends RuntimeException {
  public InvalidRequestException(String message) {
    super(message);
  }
}
