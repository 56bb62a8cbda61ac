package com.example.watchlist.service;

import com.example.watchlist.domain.Country;
import com.example.watchlist.domain.ShowSearchResult;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.exception.RateLimitedException;
import com.example.watchlist.exception.RetrievalException;
import com.example.watchlist.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class StreamingAvailabilityClient {
  private static final TypeReference<List<ShowSearchResult>> SEARCH_RESULTS = new TypeReference<>() {
  };

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;

  @Value("${motn.base-url:https://streaming-availability.p.rapidapi.com}")
  private String baseUrl;

  @Value("${motn.api-key:}")
  private String apiKey;

  @Value("${motn.api-key-header:X-RapidAPI-Key}")
  private String apiKeyHeader;

  public List<ShowSearchResult> searchByTitle(String title, Country country) {
    URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/shows/search/title")
        .queryParam("title", title)
        .queryParam("country", country.code())
        .encode()
        .build()
        .toUri();

    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    headers.set(apiKeyHeader, apiKey);

    log.debug("Query streaming availability for title='{}' country={}", title, country.code());
    String body;
    try {
      ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
      if (!response.getStatusCode().is2xxSuccessful()) {
        throw searchFailure(title, response.getStatusCode().value(), response.getBody());
      }
      body = response.getBody();
    } catch (HttpStatusCodeException ex) {
      throw searchFailure(title, ex.getStatusCode().value(), ex.getResponseBodyAsString());
    } catch (ResourceAccessException ex) {
      log.error("Could not reach streaming availability API for '{}': {}", title, ex.getMessage());
      throw new UpstreamUnavailableException("Could not reach streaming availability API", ex);
    }

    List<ShowSearchResult> results = parse(title, body);
    if (results.isEmpty()) {
      log.error("Streaming availability search returned no results for '{}'", title);
      throw new NotFoundException("No streaming availability results for " + title);
    }
    log.debug("Found {} results for '{}'", results.size(), title);
    return results;
  }

  private List<ShowSearchResult> parse(String title, String body) {
    if (body == null || body.isBlank()) {
      return List.of();
    }
    try {
      List<ShowSearchResult> results = objectMapper.readValue(body, SEARCH_RESULTS);
      return results == null ? List.of() : results;
    } catch (JsonProcessingException ex) {
      log.error("Unreadable streaming availability response for '{}': {}", title, ex.getOriginalMessage());
      throw new UpstreamUnavailableException("Unreadable streaming availability response", ex);
    }
  }

  private RetrievalException searchFailure(String title, int status, String body) {
    log.error("Streaming availability API returned {} for '{}': {}", status, title, body);
    return switch (status) {
      case 400, 403, 404 -> new NotFoundException("Could not find streaming availability for " + title);
      case 429 -> new RateLimitedException("Exceeded streaming availability API rate limit");
      default -> new UpstreamUnavailableException("Streaming availability API returned " + status);
    };
  }
}
