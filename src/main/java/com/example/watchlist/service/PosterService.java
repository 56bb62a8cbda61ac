package com.example.watchlist.service;

import com.example.watchlist.cache.CacheKeys;
import com.example.watchlist.cache.CacheStore;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.exception.RetrievalException;
import com.example.watchlist.exception.UpstreamUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PosterService {
  private final RestTemplate restTemplate;
  private final CacheStore cacheStore;

  @Value("${letterboxd.poster-base-url:https://a.ltrbxd.com/resized/film-poster}")
  private String posterBaseUrl;

  @Value("${cache.poster-ttl-seconds:31536000}")
  private long posterTtlSeconds;

  public Optional<byte[]> getPoster(String slug, String movieId) {
    log.debug("Get poster for id={} slug={}", movieId, slug);
    if (slug == null || movieId == null) {
      return Optional.empty();
    }

    String key = CacheKeys.poster(movieId);
    Optional<byte[]> cached = cacheStore.getBytes(key);
    if (cached.isPresent()) {
      log.debug("Cache hit for poster of {}", slug);
      return cached;
    }

    String url = posterUrl(slug, movieId);
    byte[] poster = fetchPoster(url, slug);
    log.debug("Set cache poster for {}", slug);
    cacheStore.setBytes(key, poster, Duration.ofSeconds(posterTtlSeconds));
    return Optional.of(poster);
  }

  // Letterboxd shards poster paths by every digit of the film id: 12345 -> 1/2/3/4/5/.
  String posterUrl(String slug, String movieId) {
    StringBuilder sb = new StringBuilder(posterBaseUrl);
    for (char digit : movieId.toCharArray()) {
      sb.append('/').append(digit);
    }
    return sb.append('/').append(movieId).append('-').append(slug).append("-0-460-0-690-crop.jpg").toString();
  }

  private byte[] fetchPoster(String url, String slug) {
    try {
      ResponseEntity<byte[]> response = restTemplate.getForEntity(url, byte[].class);
      if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
        throw posterFailure(slug, response.getStatusCode().value());
      }
      return response.getBody();
    } catch (HttpStatusCodeException ex) {
      throw posterFailure(slug, ex.getStatusCode().value());
    } catch (ResourceAccessException ex) {
      log.error("Could not reach poster host for {}: {}", slug, ex.getMessage());
      throw new UpstreamUnavailableException("Could not reach Letterboxd", ex);
    }
  }

  private RetrievalException posterFailure(String slug, int status) {
    log.error("Poster of {} returned {}", slug, status);
    if (status == 403 || status == 404) {
      return new NotFoundException("Could not find poster for " + slug);
    }
    return new UpstreamUnavailableException("Letterboxd returned " + status + " for poster of " + slug);
  }
}
