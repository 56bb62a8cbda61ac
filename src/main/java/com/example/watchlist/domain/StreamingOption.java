package com.example.watchlist.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

// Timestamps are epoch seconds.
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamingOption(StreamingService service,
                              String type,
                              StreamingService addon,
                              String link,
                              String videoLink,
                              String quality,
                              List<Audio> audios,
                              List<Subtitle> subtitles,
                              Price price,
                              boolean expiresSoon,
                              Long expiresOn,
                              long availableSince) {
  public StreamingOption {
    audios = audios == null ? List.of() : List.copyOf(audios);
    subtitles = subtitles == null ? List.of() : List.copyOf(subtitles);
  }
}
