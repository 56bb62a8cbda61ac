package com.example.watchlist.service;

import com.example.watchlist.cache.CacheKeys;
import com.example.watchlist.cache.InMemoryCacheStore;
import com.example.watchlist.domain.MovieItem;
import com.example.watchlist.exception.NotFoundException;
import com.example.watchlist.exception.RateLimitedException;
import com.example.watchlist.exception.UpstreamUnavailableException;
import com.example.watchlist.service.scrape.PaginationFailurePolicy;
import com.example.watchlist.service.scrape.SequentialPageFetchStrategy;
import com.example.watchlist.service.scrape.WatchlistPageParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WatchlistServiceTest {
  private static final String BASE_URL = "https://letterboxd.com";
  private static final long WATCHLIST_TTL_SECONDS = 1800;

  private MockRestServiceServer server;
  private InMemoryCacheStore cacheStore;
  private ObjectMapper objectMapper;
  private WatchlistService service;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
    cacheStore = new InMemoryCacheStore();
    objectMapper = new ObjectMapper();
    service = new WatchlistService(restTemplate, objectMapper, cacheStore,
        new WatchlistPageParser(), new SequentialPageFetchStrategy());
    ReflectionTestUtils.setField(service, "baseUrl", BASE_URL);
    ReflectionTestUtils.setField(service, "watchlistTtlSeconds", WATCHLIST_TTL_SECONDS);
    ReflectionTestUtils.setField(service, "paginationFailurePolicy", PaginationFailurePolicy.FAIL);
  }

  @Test
  void getWatchlist_EmptyUsername_ReturnsEmptyListWithoutNetworkOrCache() {
    // When
    List<MovieItem> result = service.getWatchlist("");

    // Then
    assertTrue(result.isEmpty());
    assertEquals(0, cacheStore.size());
    server.verify();
  }

  @Test
  void getWatchlist_CachedWatchlist_ReturnsCachedContentWithoutNetwork() {
    // Given
    String cached = """
        [
          {"movie_id": "12345", "movie_name": "Cached Movie (2020)", "movie_slug": "cached-movie",
           "streaming_options": [], "movie_url": "https://letterboxd.com/film/cached-movie"},
          {"movie_id": "67890", "movie_name": "Another Cached Movie (2021)", "movie_slug": "another-cached-movie",
           "streaming_options": []}
        ]
        """;
    cacheStore.set(CacheKeys.watchlist("testuser"), cached, Duration.ofHours(1));

    // When
    List<MovieItem> result = service.getWatchlist("testuser");

    // Then
    assertEquals(List.of(
        new MovieItem("12345", "Cached Movie (2020)", "cached-movie"),
        new MovieItem("67890", "Another Cached Movie (2021)", "another-cached-movie")
    ), result);
    server.verify();
  }

  @Test
  void getWatchlist_SinglePage_ParsesFilmsAndCachesEachOne() throws IOException {
    // Given
    server.expect(requestTo(BASE_URL + "/testuser/watchlist/"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess(html("watchlist-two-films.html"), MediaType.TEXT_HTML));

    // When
    List<MovieItem> result = service.getWatchlist("testuser");

    // Then
    server.verify();
    assertEquals(2, result.size());
    assertEquals("12345", result.get(0).id());
    assertEquals("The Shawshank Redemption (1994)", result.get(0).name());
    assertEquals("the-shawshank-redemption", result.get(0).slug());
    assertTrue(result.get(0).streamingOptions().isEmpty());
    assertEquals("67890", result.get(1).id());
    assertEquals("The Godfather (1972)", result.get(1).name());

    JsonNode movieRow = objectMapper.readTree(cacheStore.get(CacheKeys.movie("12345")).orElseThrow());
    assertEquals("The Shawshank Redemption (1994)", movieRow.path("movie_name").asText());
    assertEquals("https://letterboxd.com/film/the-shawshank-redemption", movieRow.path("movie_url").asText());
    assertTrue(cacheStore.ttl(CacheKeys.movie("12345")).isEmpty());
    assertTrue(cacheStore.contains(CacheKeys.movie("67890")));

    JsonNode watchlistRow = objectMapper.readTree(cacheStore.get(CacheKeys.watchlist("testuser")).orElseThrow());
    assertEquals(2, watchlistRow.size());
  }

  @Test
  void getWatchlist_AfterScrape_WatchlistTtlIsPositiveAndBounded() throws IOException {
    // Given
    server.expect(requestTo(BASE_URL + "/testuser/watchlist/"))
        .andRespond(withSuccess(html("watchlist-two-films.html"), MediaType.TEXT_HTML));

    // When
    service.getWatchlist("testuser");

    // Then
    Duration ttl = cacheStore.ttl(CacheKeys.watchlist("testuser")).orElseThrow();
    assertTrue(ttl.getSeconds() > 0);
    assertTrue(ttl.getSeconds() <= WATCHLIST_TTL_SECONDS);
  }

  @Test
  void getWatchlist_SecondCall_IsServedFromCache() throws IOException {
    // Given
    server.expect(requestTo(BASE_URL + "/testuser/watchlist/"))
        .andRespond(withSuccess(html("watchlist-two-films.html"), MediaType.TEXT_HTML));
    List<MovieItem> first = service.getWatchlist("testuser");

    // When
    List<MovieItem> second = service.getWatchlist("testuser");

    // Then
    server.verify();
    assertEquals(first, second);
  }

  @Test
  void getWatchlist_ThreePaginationMarkers_FetchesEachPageOnceInOrder() throws IOException {
    // Given
    String url = BASE_URL + "/longlist/watchlist/";
    server.expect(requestTo(url)).andRespond(withSuccess(html("watchlist-page-1-of-3.html"), MediaType.TEXT_HTML));
    server.expect(requestTo(url + "page/2/")).andRespond(withSuccess(html("watchlist-page-2.html"), MediaType.TEXT_HTML));
    server.expect(requestTo(url + "page/3/")).andRespond(withSuccess(html("watchlist-page-3.html"), MediaType.TEXT_HTML));

    // When
    List<MovieItem> result = service.getWatchlist("longlist");

    // Then
    server.verify();
    assertEquals(List.of("11111", "11112", "22222", "33333"), result.stream().map(MovieItem::id).toList());
    assertTrue(cacheStore.contains(CacheKeys.movie("22222")));
    assertTrue(cacheStore.contains(CacheKeys.movie("33333")));
    assertTrue(cacheStore.contains(CacheKeys.watchlist("longlist")));
  }

  @Test
  void getWatchlist_FirstPageNotFound_ThrowsNotFound() {
    // Given
    server.expect(requestTo(BASE_URL + "/nonexistent/watchlist/")).andRespond(withStatus(HttpStatus.NOT_FOUND));

    // When / Then
    assertThrows(NotFoundException.class, () -> service.getWatchlist("nonexistent"));
    assertFalse(cacheStore.contains(CacheKeys.watchlist("nonexistent")));
  }

  @Test
  void getWatchlist_FirstPageServerError_ThrowsNotFound() {
    // Given
    server.expect(requestTo(BASE_URL + "/someone/watchlist/")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

    // When / Then
    assertThrows(NotFoundException.class, () -> service.getWatchlist("someone"));
  }

  @Test
  void getWatchlist_FollowingPageFailsUnderFailPolicy_ThrowsAndCachesNoAggregate() throws IOException {
    // Given
    String url = BASE_URL + "/longlist/watchlist/";
    server.expect(requestTo(url)).andRespond(withSuccess(html("watchlist-page-1-of-3.html"), MediaType.TEXT_HTML));
    server.expect(requestTo(url + "page/2/")).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

    // When / Then
    assertThrows(UpstreamUnavailableException.class, () -> service.getWatchlist("longlist"));
    server.verify();
    assertFalse(cacheStore.contains(CacheKeys.watchlist("longlist")));
    assertTrue(cacheStore.contains(CacheKeys.movie("11111")));
  }

  @Test
  void getWatchlist_FollowingPageRateLimited_ThrowsRateLimited() throws IOException {
    // Given
    String url = BASE_URL + "/longlist/watchlist/";
    server.expect(requestTo(url)).andRespond(withSuccess(html("watchlist-page-1-of-3.html"), MediaType.TEXT_HTML));
    server.expect(requestTo(url + "page/2/")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    // When / Then
    assertThrows(RateLimitedException.class, () -> service.getWatchlist("longlist"));
  }

  @Test
  void getWatchlist_FollowingPageFailsUnderPartialPolicy_ReturnsRemainingPagesUncached() throws IOException {
    // Given
    ReflectionTestUtils.setField(service, "paginationFailurePolicy", PaginationFailurePolicy.PARTIAL);
    String url = BASE_URL + "/longlist/watchlist/";
    server.expect(requestTo(url)).andRespond(withSuccess(html("watchlist-page-1-of-3.html"), MediaType.TEXT_HTML));
    server.expect(requestTo(url + "page/2/")).andRespond(withStatus(HttpStatus.NOT_FOUND));
    server.expect(requestTo(url + "page/3/")).andRespond(withSuccess(html("watchlist-page-3.html"), MediaType.TEXT_HTML));

    // When
    List<MovieItem> result = service.getWatchlist("longlist");

    // Then
    server.verify();
    assertEquals(List.of("11111", "11112", "33333"), result.stream().map(MovieItem::id).toList());
    assertFalse(cacheStore.contains(CacheKeys.watchlist("longlist")));
    assertTrue(cacheStore.contains(CacheKeys.movie("33333")));
  }

  private String html(String name) throws IOException {
    return StreamUtils.copyToString(new ClassPathResource("html/" + name).getInputStream(), StandardCharsets.UTF_8);
  }
}
