package com.example.watchlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatchlistApplication {
  public static void main(String[] args) {
    SpringApplication.run(WatchlistApplication.class, args);
  }
}
