package com.example.watchlist.controller;

import com.example.watchlist.domain.MovieItem;
import com.example.watchlist.domain.StreamingOption;
import com.example.watchlist.exception.InvalidRequestException;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.service.PosterService;
import com.example.watchlist.service.StreamingAvailabilityService;
import com.example.watchlist.service.WatchlistService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WatchlistController {
  private static final Pattern USERNAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{2,15}$");

  private final WatchlistService watchlistService;
  private final PosterService posterService;
  private final StreamingAvailabilityService availabilityService;

  @GetMapping("/watchlist")
  public List<MovieItem> getWatchlist(@RequestParam(name = "username", defaultValue = "") String username) {
    log.info("Get watchlist for {}", username);
    if (!USERNAME_PATTERN.matcher(username).matches()) {
      log.warn("Invalid username format: {}", username);
      throw new InvalidRequestException("Invalid username: expected 2-15 characters of letters, digits, '_' or '-'");
    }
    return watchlistService.getWatchlist(username.toLowerCase(Locale.ROOT));
  }

  // slugId is "<slug>-<id>", e.g. "the-godfather-51818"
  @GetMapping("/poster/{slugId}")
  public ResponseEntity<byte[]> getPoster(@PathVariable("slugId") String slugId) {
    int separator = slugId.lastIndexOf('-');
    if (separator <= 0 || separator == slugId.length() - 1) {
      throw new InvalidRequestException("Poster path must look like <slug>-<id>");
    }
    String slug = slugId.substring(0, separator);
    String movieId = slugId.substring(separator + 1);
    byte[] poster = posterService.getPoster(slug, movieId)
        .orElseThrow(() -> new NotFoundException("Poster not found"));
    return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(poster);
  }

  @GetMapping("/availability")
  public List<StreamingOption> getAvailability(@RequestParam("movie_id") String movieId,
                                               @RequestParam(name = "country", defaultValue = "de") String country) {
    log.info("Get availability for {} in {}", movieId, country);
    if (movieId.isBlank()) {
      throw new InvalidRequestException("movie_id must not be blank");
    }
    return availabilityService.getAvailability(movieId, country);
  }
}
