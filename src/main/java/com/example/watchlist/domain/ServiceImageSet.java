package com.example.watchlist.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceImageSet(String lightThemeImage,
                              String darkThemeImage,
                              String whiteImage) {
}
