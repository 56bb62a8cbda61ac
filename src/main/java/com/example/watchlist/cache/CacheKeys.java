package com.example.watchlist.cache;

public final class CacheKeys {
  public static final String MOVIE_PREFIX = "movie:";
  public static final String WATCHLIST_PREFIX = "watchlist:";
  public static final String POSTER_PREFIX = "poster:";
  public static final String STREAMING_OPTIONS_PREFIX = "streaming_options:";

  private CacheKeys() {
  }

  public static String movie(String movieId) {
    return MOVIE_PREFIX + movieId;
  }

  public static String watchlist(String username) {
    return WATCHLIST_PREFIX + username;
  }

  public static String poster(String movieId) {
    return POSTER_PREFIX + movieId;
  }

  public static String streamingOptions(String movieId) {
    return STREAMING_OPTIONS_PREFIX + movieId;
  }
}
