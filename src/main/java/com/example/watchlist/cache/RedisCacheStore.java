package com.example.watchlist.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {
  private final StringRedisTemplate stringRedisTemplate;
  private final RedisTemplate<String, byte[]> binaryRedisTemplate;

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(stringRedisTemplate.opsForValue().get(key));
  }

  @Override
  public Optional<byte[]> getBytes(String key) {
    return Optional.ofNullable(binaryRedisTemplate.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    if (hasExpiry(ttl)) {
      stringRedisTemplate.opsForValue().set(key, value, ttl);
    } else {
      stringRedisTemplate.opsForValue().set(key, value);
    }
    log.debug("Cached text value key='{}' ttl={}", key, ttl);
  }

  @Override
  public void setBytes(String key, byte[] value, Duration ttl) {
    if (hasExpiry(ttl)) {
      binaryRedisTemplate.opsForValue().set(key, value, ttl);
    } else {
      binaryRedisTemplate.opsForValue().set(key, value);
    }
    log.debug("Cached binary value key='{}' bytes={} ttl={}", key, value.length, ttl);
  }

  private boolean hasExpiry(Duration ttl) {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }
}
