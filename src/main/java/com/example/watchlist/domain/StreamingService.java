package com.example.watchlist.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// Also used for add-on channels, which share the service shape.
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamingService(String id,
                               String name,
                               String homePage,
                               String themeColorCode,
                               ServiceImageSet imageSet) {
}
