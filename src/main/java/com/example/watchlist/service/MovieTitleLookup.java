package com.example.watchlist.service;

import java.util.Optional;

// Display name (title with trailing year) of a film seen in an earlier watchlist scrape.
public interface MovieTitleLookup {
  Optional<String> resolveTitle(String movieId);
}
