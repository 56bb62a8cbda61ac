package com.example.watchlist.service;

import com.example.watchlist.cache.CacheKeys;
import com.example.watchlist.cache.CacheStore;
import com.example.watchlist.domain.MovieItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

// Reads the movie rows WatchlistService writes for every scraped film.
@Slf4j
@Component
@RequiredArgsConstructor
public class CachedMovieTitleLookup implements MovieTitleLookup {
  private final CacheStore cacheStore;
  private final ObjectMapper objectMapper;

  @Override
  public Optional<String> resolveTitle(String movieId) {
    String key = CacheKeys.movie(movieId);
    Optional<String> json = cacheStore.get(key);
    if (json.isEmpty()) {
      return Optional.empty();
    }
    try {
      MovieItem movie = objectMapper.readValue(json.get(), MovieItem.class);
      log.info("Cache hit for movie {} {}", movieId, movie.name());
      return Optional.ofNullable(movie.name()).filter(name -> !name.isBlank());
    } catch (JsonProcessingException ex) {
      log.warn("Unreadable cache entry {}: {}", key, ex.getOriginalMessage());
      return Optional.empty();
    }
  }
}
