package com.example.watchlist.service;

import com.example.watchlist.cache.CacheKeys;
import com.example.watchlist.cache.CacheStore;
import com.example.watchlist.domain.MovieItem;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.exception.RateLimitedException;
import com.example.watchlist.exception.RetrievalException;
import com.example.watchlist.exception.UpstreamUnavailableException;
import com.example.watchlist.service.scrape.PageFetchStrategy;
import com.example.watchlist.service.scrape.PaginationFailurePolicy;
import com.example.watchlist.service.scrape.WatchlistPage;
import com.example.watchlist.service.scrape.WatchlistPageParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class WatchlistService {
  private static final TypeReference<List<MovieItem>> MOVIE_LIST = new TypeReference<>() {
  };

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final CacheStore cacheStore;
  private final WatchlistPageParser pageParser;
  private final PageFetchStrategy pageFetchStrategy;

  @Value("${letterboxd.base-url:https://letterboxd.com}")
  private String baseUrl;

  @Value("${cache.watchlist-ttl-seconds:3600}")
  private long watchlistTtlSeconds;

  @Value("${letterboxd.pagination-failure-policy:FAIL}")
  private PaginationFailurePolicy paginationFailurePolicy;

  public List<MovieItem> getWatchlist(String username) {
    if (username == null || username.isEmpty()) {
      return List.of();
    }

    String key = CacheKeys.watchlist(username);
    Optional<List<MovieItem>> cached = cacheStore.get(key).flatMap(json -> readCachedWatchlist(key, json));
    if (cached.isPresent()) {
      log.info("Cache hit for watchlist of {}", username);
      return cached.get();
    }

    String watchlistUrl = watchlistUrl(username);
    log.info("Get watchlist from {}", watchlistUrl);
    WatchlistPage firstPage = loadFirstPage(username, watchlistUrl);
    int totalPages = firstPage.totalPages();

    List<MovieItem> movies = new ArrayList<>(firstPage.movies());
    boolean complete = true;
    if (totalPages > 1) {
      log.debug("Watchlist of {} has {} pages", username, totalPages);
      List<Optional<WatchlistPage>> remaining = pageFetchStrategy.fetchPages(2, totalPages,
          page -> loadFollowingPage(watchlistUrl, page));
      for (Optional<WatchlistPage> page : remaining) {
        if (page.isPresent()) {
          movies.addAll(page.get().movies());
        } else {
          complete = false;
        }
      }
    }

    if (complete) {
      cacheStore.set(key, write(movies), Duration.ofSeconds(watchlistTtlSeconds));
    } else {
      log.warn("Watchlist of {} is incomplete ({} films), not caching it", username, movies.size());
    }
    log.info("Scraped {} films from {} page(s) for {}", movies.size(), totalPages, username);
    return movies;
  }

  String watchlistUrl(String username) {
    return baseUrl + "/" + username + "/watchlist/";
  }

  private WatchlistPage loadFirstPage(String username, String watchlistUrl) {
    String html;
    try {
      ResponseEntity<String> response = restTemplate.getForEntity(watchlistUrl, String.class);
      if (!response.getStatusCode().is2xxSuccessful()) {
        log.error("Watchlist of {} returned {}", username, response.getStatusCode());
        throw new NotFoundException("Watchlist not found for " + username);
      }
      html = response.getBody();
    } catch (HttpStatusCodeException ex) {
      log.error("Watchlist of {} returned {}", username, ex.getStatusCode());
      throw new NotFoundException("Watchlist not found for " + username);
    } catch (ResourceAccessException ex) {
      log.error("Could not reach Letterboxd for {}: {}", username, ex.getMessage());
      throw new UpstreamUnavailableException("Could not reach Letterboxd", ex);
    }
    return parseAndCache(html, watchlistUrl);
  }

  private Optional<WatchlistPage> loadFollowingPage(String watchlistUrl, int page) {
    String pageUrl = watchlistUrl + "page/" + page + "/";
    try {
      return Optional.of(parseAndCache(fetchFollowingPage(pageUrl), pageUrl));
    } catch (RetrievalException ex) {
      if (paginationFailurePolicy == PaginationFailurePolicy.PARTIAL) {
        log.warn("Skipping watchlist page {}: {}", pageUrl, ex.getMessage());
        return Optional.empty();
      }
      throw ex;
    }
  }

  private String fetchFollowingPage(String pageUrl) {
    try {
      ResponseEntity<String> response = restTemplate.getForEntity(pageUrl, String.class);
      if (!response.getStatusCode().is2xxSuccessful()) {
        throw pageFailure(pageUrl, response.getStatusCode().value());
      }
      return response.getBody();
    } catch (HttpStatusCodeException ex) {
      throw pageFailure(pageUrl, ex.getStatusCode().value());
    } catch (ResourceAccessException ex) {
      log.error("Could not reach {}: {}", pageUrl, ex.getMessage());
      throw new UpstreamUnavailableException("Could not reach Letterboxd", ex);
    }
  }

  private RetrievalException pageFailure(String pageUrl, int status) {
    log.error("Watchlist page {} returned {}", pageUrl, status);
    return switch (status) {
      case 403, 404 -> new NotFoundException("Watchlist page not found: " + pageUrl);
      case 429 -> new RateLimitedException("Letterboxd rate limited " + pageUrl);
      default -> new UpstreamUnavailableException("Letterboxd returned " + status + " for " + pageUrl);
    };
  }

  private WatchlistPage parseAndCache(String html, String pageUrl) {
    WatchlistPage page = pageParser.parse(html, pageUrl);
    for (MovieItem movie : page.movies()) {
      cacheStore.set(CacheKeys.movie(movie.id()), write(movie));
    }
    return page;
  }

  private Optional<List<MovieItem>> readCachedWatchlist(String key, String json) {
    try {
      return Optional.of(objectMapper.readValue(json, MOVIE_LIST));
    } catch (JsonProcessingException ex) {
      log.warn("Ignoring unreadable cache entry {}: {}", key, ex.getOriginalMessage());
      return Optional.empty();
    }
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), ex);
    }
  }
}
