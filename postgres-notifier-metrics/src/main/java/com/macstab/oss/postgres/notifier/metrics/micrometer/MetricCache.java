/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics.micrometer;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of Micrometer meters keyed by name and tags.
 *
 * <p><strong>Problem:</strong> registry lookup with tag matching costs far more than an increment,
 * and the relay path records a metric per notification.
 *
 * <p><strong>Solution:</strong> counters, distribution summaries and gauge values live in {@code
 * ConcurrentHashMap}s. The first access registers the meter, later accesses are a map lookup.
 *
 * <p><strong>Bounded:</strong> topic tags come from application code. Once {@code maxCacheSize}
 * entries exist, new meters go straight to the registry (slower but works) and a warning is
 * logged.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} (tags in call
 * order).
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>(64);
  private final ConcurrentHashMap<String, DistributionSummary> summaries =
      new ConcurrentHashMap<>(32);
  private final ConcurrentHashMap<String, GaugeEntry> gauges = new ConcurrentHashMap<>(32);
  private final AtomicInteger cacheSize = new AtomicInteger();

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }
    this.maxCacheSize = maxCacheSize;
  }

  Counter counter(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() >= maxCacheSize) {
      warnFull(key);
      return Counter.builder(name).description(description).tags(tagPairs).register(registry);
    }
    return counters.computeIfAbsent(
        key,
        k -> {
          cacheSize.incrementAndGet();
          return Counter.builder(name).description(description).tags(tagPairs).register(registry);
        });
  }

  DistributionSummary summary(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = summaries.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() >= maxCacheSize) {
      warnFull(key);
      return createSummary(name, description, tagPairs);
    }
    return summaries.computeIfAbsent(
        key,
        k -> {
          cacheSize.incrementAndGet();
          return createSummary(name, description, tagPairs);
        });
  }

  /**
   * Gets or registers a gauge backed by an {@link AtomicInteger}.
   *
   * <p>Gauges are always cached: {@link #removeGauges(String, String)} has to find them again.
   * They are few (a handful per notifier) so they do not count against {@code maxCacheSize}.
   */
  AtomicInteger gauge(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    return gauges
        .computeIfAbsent(
            buildKey(name, tagPairs),
            k -> {
              final var value = new AtomicInteger();
              final var gauge =
                  Gauge.builder(name, value, AtomicInteger::get)
                      .description(description)
                      .tags(tagPairs)
                      .register(registry);
              return new GaugeEntry(value, gauge.getId());
            })
        .value();
  }

  /**
   * Unregisters every gauge carrying the given tag value.
   *
   * @param tagKey tag key, e.g. {@code notifier.name}
   * @param tagValue tag value
   * @return number of removed gauges
   */
  int removeGauges(final String tagKey, final String tagValue) {
    final var marker = ":" + tagKey + "=" + tagValue;
    final var removed = new AtomicInteger();

    gauges
        .entrySet()
        .removeIf(
            entry -> {
              final var key = entry.getKey();
              if (!key.contains(marker + ":") && !key.endsWith(marker)) {
                return false;
              }
              registry.remove(entry.getValue().id());
              removed.incrementAndGet();
              log.debug("Removed gauge {}", key);
              return true;
            });
    return removed.get();
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getGaugeCount() {
    return gauges.size();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  private DistributionSummary createSummary(
      final String name, final String description, final String... tagPairs) {
    return DistributionSummary.builder(name)
        .description(description)
        .tags(tagPairs)
        .register(registry);
  }

  private void warnFull(final String key) {
    log.warn("Metric cache full at {} entries. Direct registry used for: {}", maxCacheSize, key);
  }

  private static String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length * 12);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private static void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  private record GaugeEntry(AtomicInteger value, Meter.Id id) {}
}
