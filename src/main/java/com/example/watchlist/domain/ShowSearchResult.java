package com.example.watchlist.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ShowSearchResult(String id,
                               String title,
                               Integer releaseYear,
                               Map<String, List<StreamingOption>> streamingOptions) {
  public ShowSearchResult {
    streamingOptions = streamingOptions == null ? Map.of() : streamingOptions;
  }

  public Optional<List<StreamingOption>> streamingOptionsFor(Country country) {
    return Optional.ofNullable(streamingOptions.get(country.code()));
  }
}
