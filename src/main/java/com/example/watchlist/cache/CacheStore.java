package com.example.watchlist.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-key expiry shared by all retrievers.
 * <p>
 * Text values are stored as UTF-8, binary values as-is. A {@code null} ttl stores the
 * value without expiry. Implementations must be safe for concurrent use.
 */
public interface CacheStore {

  Optional<String> get(String key);

  Optional<byte[]> getBytes(String key);

  void set(String key, String value, Duration ttl);

  void setBytes(String key, byte[] value, Duration ttl);

  default void set(String key, String value) {
    set(key, value, null);
  }
}
