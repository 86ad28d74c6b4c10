/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.metrics.micrometer;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of Micrometer meters keyed by name and tags.
 *
 * <p><strong>Problem:</strong> registry lookups with tag matching are far more expensive than a
 * map hit, and the driver records on every request attempt.
 *
 * <p><strong>Solution:</strong> counters, timers and gauge holders are cached in {@code
 * ConcurrentHashMap}s under a key of the form {@code name:tag1=value1:tag2=value2}. The first
 * access registers the meter, later accesses reuse it.
 *
 * <p><strong>Graceful Degradation:</strong> once {@code maxCacheSize} entries are cached, new
 * meters are registered directly without caching. A warning is logged per overflowing key.
 *
 * <p><strong>Memory Management:</strong> hosts come and go, so the per-host meters of a session
 * are removed from cache and registry through {@link #removeByTag(String, String)} when the
 * session closes.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters;
  private final ConcurrentHashMap<String, Timer> timers;
  private final ConcurrentHashMap<String, CachedGauge> gauges;
  private final AtomicInteger cacheSize;

  /**
   * Creates a metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(128);
    this.timers = new ConcurrentHashMap<>(16);
    this.gauges = new ConcurrentHashMap<>(64);
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
    log.warn(
        "Metric cache full at {} entries. Direct registry used for counter: {}", maxCacheSize, key);
    return createCounter(name, description, tagPairs);
  }

  /**
   * Gets or creates a timer publishing the given percentiles.
   *
   * @param name metric name
   * @param description metric description
   * @param percentiles client-side percentiles, may be empty
   * @param tagPairs tag key-value pairs
   * @return timer instance (cached or direct)
   */
  Timer getOrCreateTimer(
      final String name,
      final String description,
      final double[] percentiles,
      final String... tagPairs) {

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
            return createTimer(name, description, percentiles, tagPairs);
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for timer: {}", maxCacheSize, key);
    return createTimer(name, description, percentiles, tagPairs);
  }

  /**
   * Gets or creates the value holder of a gauge.
   *
   * <p>Gauges hold a strong reference to their {@link AtomicInteger}; the holder stays in the cache
   * until {@link #removeByTag(String, String)} drops it.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs
   * @return value holder backing the gauge
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gauges.get(key);
    if (cached != null) {
      return cached.value();
    }

    if (cacheSize.get() < maxCacheSize) {
      return gauges
          .computeIfAbsent(
              key,
              k -> {
                cacheSize.incrementAndGet();
                return createGauge(name, description, tagPairs);
              })
          .value();
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for gauge: {}", maxCacheSize, key);
    return createGauge(name, description, tagPairs).value();
  }

  /**
   * Removes every cached meter carrying {@code tagKey=tagValue} from cache and registry.
   *
   * @param tagKey tag key
   * @param tagValue tag value
   * @return number of meters removed
   */
  int removeByTag(final String tagKey, final String tagValue) {
    final var token = ':' + tagKey + '=' + tagValue;
    int removed = 0;
    removed += removeMatching(counters, token);
    removed += removeMatching(timers, token);
    for (final var entry : gauges.entrySet()) {
      if (hasToken(entry.getKey(), token) && gauges.remove(entry.getKey(), entry.getValue())) {
        registry.remove(entry.getValue().gauge());
        cacheSize.decrementAndGet();
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Removed {} meters tagged {}={}", removed, tagKey, tagValue);
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

  private <M extends Meter> int removeMatching(final Map<String, M> meters, final String token) {
    int removed = 0;
    for (final var entry : meters.entrySet()) {
      if (hasToken(entry.getKey(), token) && meters.remove(entry.getKey(), entry.getValue())) {
        registry.remove(entry.getValue());
        cacheSize.decrementAndGet();
        removed++;
      }
    }
    return removed;
  }

  /** Matches whole tag tokens only: {@code :session.name=a} must not match {@code a2}. */
  private static boolean hasToken(final String key, final String token) {
    int from = 0;
    while (true) {
      final int index = key.indexOf(token, from);
      if (index < 0) {
        return false;
      }
      final int end = index + token.length();
      if (end == key.length() || key.charAt(end) == ':') {
        return true;
      }
      from = index + 1;
    }
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

  private Timer createTimer(
      final String name,
      final String description,
      final double[] percentiles,
      final String... tagPairs) {
    final var builder = Timer.builder(name).description(description).tags(tagPairs);
    if (percentiles.length > 0) {
      builder.publishPercentiles(percentiles);
    }
    return builder.register(registry);
  }

  private CachedGauge createGauge(
      final String name, final String description, final String... tagPairs) {
    final var value = new AtomicInteger(0);
    final var gauge =
        Gauge.builder(name, value, AtomicInteger::get)
            .description(description)
            .tags(tagPairs)
            .register(registry);
    return new CachedGauge(gauge, value);
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  private record CachedGauge(Gauge gauge, AtomicInteger value) {}
}
