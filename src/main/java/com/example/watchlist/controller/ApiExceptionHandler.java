package com.example.watchlist.controller;

import com.example.watchlist.exception.InvalidRequestException;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.exception.RateLimitedException;
import com.example.watchlist.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
    log.info("Not found: {}", ex.getMessage());
    return build(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  public ResponseEntity<ApiError> handleUnavailable(UpstreamUnavailableException ex) {
    log.warn("Upstream unavailable: {}", ex.getMessage());
    return build(HttpStatus.FAILED_DEPENDENCY, ex.getMessage());
  }

  @ExceptionHandler(RateLimitedException.class)
  public ResponseEntity<ApiError> handleRateLimited(RateLimitedException ex) {
    log.warn("Rate limited: {}", ex.getMessage());
    return build(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
    return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex) {
    return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
  }

  private ResponseEntity<ApiError> build(HttpStatus status, String message) {
    ApiError body = new ApiError(status.value(), status.getReasonPhrase(), message, Instant.now().toString());
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }
}
