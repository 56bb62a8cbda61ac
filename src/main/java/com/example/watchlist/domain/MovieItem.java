package com.example.watchlist.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MovieItem(@JsonProperty("movie_id") String id,
                        @JsonProperty("movie_name") String name,
                        @JsonProperty("movie_slug") String slug,
                        @JsonProperty("streaming_options") List<StreamingOption> streamingOptions) {
  public static final String FILM_BASE_URL = "https://letterboxd.com/film/";

  @JsonCreator
  public MovieItem {
    streamingOptions = streamingOptions == null ? List.of() : List.copyOf(streamingOptions);
  }

  public MovieItem(String id, String name, String slug) {
    this(id, name, slug, List.of());
  }

  @JsonProperty("movie_url")
  public String url() {
    return FILM_BASE_URL + slug;
  }
}
