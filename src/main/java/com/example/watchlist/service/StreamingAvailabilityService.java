package com.example.watchlist.service;

import com.example.watchlist.cache.CacheKeys;
import com.example.watchlist.cache.CacheStore;
import com.example.watchlist.domain.Country;
import com.example.watchlist.domain.ShowSearchResult;
import com.example.watchlist.domain.StreamingOption;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.util.TitleYear;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class StreamingAvailabilityService {
  private static final TypeReference<List<StreamingOption>> OPTION_LIST = new TypeReference<>() {
  };

  private final StreamingAvailabilityClient availabilityClient;
  private final MovieTitleLookup titleLookup;
  private final CacheStore cacheStore;
  private final ObjectMapper objectMapper;

  @Value("${cache.streaming-ttl-seconds:604800}")
  private long streamingTtlSeconds;

  public List<StreamingOption> getAvailability(String movieId, String countryCode) {
    log.debug("Get streaming options for {}", movieId);
    String key = CacheKeys.streamingOptions(movieId);
    Optional<List<StreamingOption>> cached = cacheStore.get(key).flatMap(json -> readCachedOptions(key, json));
    if (cached.isPresent()) {
      log.debug("Streaming options retrieved from cache for {}", movieId);
      return cached.get();
    }

    Optional<Country> country = Country.fromCode(countryCode);
    if (country.isEmpty()) {
      log.info("No streaming data for unsupported region '{}'", countryCode);
      return List.of();
    }

    String displayName = titleLookup.resolveTitle(movieId).orElseThrow(() -> {
      log.error("Movie {} unexpectedly not found in cache", movieId);
      return new NotFoundException("Unknown movie id " + movieId);
    });
    TitleYear titleYear = TitleYear.parse(displayName);
    List<ShowSearchResult> candidates = availabilityClient.searchByTitle(titleYear.title(), country.get());

    List<StreamingOption> options = selectCountrySlice(candidates, titleYear, country.get()).orElseThrow(() -> {
      log.warn("No search result for '{}' released in {} with options in {}",
          titleYear.title(), titleYear.year(), country.get().code());
      return new NotFoundException("Could not find streaming availability for " + displayName);
    });

    cacheStore.set(key, write(options), Duration.ofSeconds(streamingTtlSeconds));
    return options;
  }

  // First candidate, in relevance order, released in the wanted year that lists the country.
  static Optional<List<StreamingOption>> selectCountrySlice(List<ShowSearchResult> candidates,
                                                           TitleYear titleYear,
                                                           Country country) {
    if (!titleYear.hasYear()) {
      return Optional.empty();
    }
    return candidates.stream()
        .filter(candidate -> titleYear.matchesYear(candidate.releaseYear()))
        .map(candidate -> candidate.streamingOptionsFor(country))
        .flatMap(Optional::stream)
        .findFirst();
  }

  private Optional<List<StreamingOption>> readCachedOptions(String key, String json) {
    try {
      return Optional.of(objectMapper.readValue(json, OPTION_LIST));
    } catch (JsonProcessingException ex) {
      log.warn("Ignoring unreadable cache entry {}: {}", key, ex.getOriginalMessage());
      return Optional.empty();
    }
  }

  private String write(List<StreamingOption> options) {
    try {
      return objectMapper.writeValueAsString(options);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Could not serialize streaming options", ex);
    }
  }
}
