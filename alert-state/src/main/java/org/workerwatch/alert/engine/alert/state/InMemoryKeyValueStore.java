package org.workerwatch.alert.engine.alert.state;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy.VarExpiration;
import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process local {@link KeyValueStore} backed by a Caffeine cache. Each entry expires after the ttl
 * it was written with, measured on the given clock.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Cache<String, String> cache;
  private final VarExpiration<String, String> expiration;

  public InMemoryKeyValueStore(Clock clock) {
    this.cache =
        Caffeine.newBuilder()
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.instant().toEpochMilli()))
            .executor(Runnable::run)
            .expireAfter(new WriteTtlExpiry())
            .build();
    this.expiration = cache.policy().expireVariably().orElseThrow();
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    Preconditions.checkArgument(
        ttl != null && !ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
    expiration.put(key, value, ttl);
  }

  @Override
  public void delete(String key) {
    cache.invalidate(key);
  }

  int size() {
    cache.cleanUp();
    return (int) cache.estimatedSize();
  }

  // entries only enter through VarExpiration.put, which sets their ttl
  private static class WriteTtlExpiry implements Expiry<String, String> {
    @Override
    public long expireAfterCreate(String key, String value, long currentTime) {
      return Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String key, String value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    @Override
    public long expireAfterRead(
        String key, String value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
