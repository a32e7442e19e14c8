/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics.micrometer;

import static com.macstab.oss.redis.resp.metrics.micrometer.MetricsConfiguration.TAG_CONNECTION_NAME;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache for Micrometer {@link Counter} and {@link Timer} instances.
 *
 * <p><strong>Problem:</strong> Registry lookup with tag matching costs ~100-200ns per call, and
 * recording happens once per command.
 *
 * <p><strong>Solution:</strong> Cache meters in {@link ConcurrentHashMap}s keyed by name and tags.
 * First access registers (~1-2μs), later accesses are a map lookup.
 *
 * <p><strong>Graceful Degradation:</strong> When the cache holds {@code maxCacheSize} entries,
 * meters are resolved through the registry directly (slower but works). High-cardinality command
 * names (arbitrary user input) end up here instead of growing the cache without bound.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tag order as given
 * by the caller, which is fixed per metric).
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final Map<String, Counter> counters;
  private final Map<String, Timer> timers;
  private final AtomicInteger cacheSize;

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(64);
    this.timers = new ConcurrentHashMap<>(64);
    this.cacheSize = new AtomicInteger(0);
  }

  /**
   * Gets or creates a counter.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return counter instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return createCounter(name, description, tagPairs);
          });
    }
    warnCacheFull(key);
    return createCounter(name, description, tagPairs);
  }

  /**
   * Gets or creates a timer.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return timer instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = timers.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return timers.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return createTimer(name, description, tagPairs);
          });
    }
    warnCacheFull(key);
    return createTimer(name, description, tagPairs);
  }

  /**
   * Evicts cached meters of one connection and removes every meter carrying its {@code
   * connection.name} tag from the registry (cached or not).
   *
   * @param connectionName connection to clean up
   * @return number of meters removed from the registry
   */
  int removeMetersForConnection(final String connectionName) {
    final var marker = ":" + TAG_CONNECTION_NAME + "=" + connectionName + ":";
    evict(counters, marker);
    evict(timers, marker);

    int removed = 0;
    for (final Meter meter : List.copyOf(registry.getMeters())) {
      final var id = meter.getId();
      if (id.getName().startsWith(MetricsConfiguration.PREFIX)
          && connectionName.equals(id.getTag(TAG_CONNECTION_NAME))) {
        registry.remove(meter);
        removed++;
      }
    }

    if (log.isDebugEnabled()) {
      log.debug("Removed {} meters for connection '{}'", removed, connectionName);
    }
    return removed;
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  // ==================== Private Methods ====================

  private <M extends Meter> void evict(final Map<String, M> cache, final String marker) {
    cache
        .keySet()
        .removeIf(
            key -> {
              if ((key + ":").contains(marker)) {
                cacheSize.decrementAndGet();
                return true;
              }
              return false;
            });
  }

  private String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + (tagPairs.length / 2 * 25));
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private Counter createCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private Timer createTimer(final String name, final String description, final String... tagPairs) {
    return Timer.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private void warnCacheFull(final String key) {
    log.warn("Metric cache full at {} entries. Direct registry used for: {}", maxCacheSize, key);
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }
}
