package com.example.watchlist.config;

import com.example.watchlist.service.scrape.BoundedParallelPageFetchStrategy;
import com.example.watchlist.service.scrape.PageFetchStrategy;
import com.example.watchlist.service.scrape.SequentialPageFetchStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class AppConfig {
  // Shared by every outbound call: watchlist pages, posters and the availability search.
  @Bean
  public RestTemplate restTemplate(
      RestTemplateBuilder builder,
      @Value("${http.client.connect-timeout-ms:5000}") int connectTimeoutMs,
      @Value("${http.client.read-timeout-ms:10000}") int readTimeoutMs,
      @Value("${http.client.user-agent:watchlist-availability}") String userAgent
  ) {
    return builder
        .setConnectTimeout(Duration.ofMillis(Math.max(1000, connectTimeoutMs)))
        .setReadTimeout(Duration.ofMillis(Math.max(1000, readTimeoutMs)))
        .defaultHeader("User-Agent", userAgent)
        .build();
  }

  @Bean(destroyMethod = "close")
  public PageFetchStrategy pageFetchStrategy(@Value("${letterboxd.page-fetch-concurrency:1}") int concurrency) {
    if (concurrency <= 1) {
      return new SequentialPageFetchStrategy();
    }
    log.info("Watchlist pages will be fetched with up to {} concurrent requests", concurrency);
    return new BoundedParallelPageFetchStrategy(concurrency);
  }
}
