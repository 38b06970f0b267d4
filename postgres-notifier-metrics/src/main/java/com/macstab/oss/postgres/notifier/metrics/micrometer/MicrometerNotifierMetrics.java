/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics.micrometer;

import static com.macstab.oss.postgres.notifier.metrics.micrometer.MetricsConfiguration.*;

import com.macstab.oss.postgres.notifier.metrics.NotifierMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link NotifierMetrics}.
 *
 * <p><strong>Dimensional Metrics:</strong> every meter carries {@code notifier.name}, so one
 * instance serves all notifiers of an application.
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code postgres.notifier.notifications.relayed}</td><td>Counter</td>
 *         <td>notifier.name, topic</td></tr>
 *     <tr><td>{@code postgres.notifier.notifications.recipients}</td><td>Summary</td>
 *         <td>notifier.name, topic</td></tr>
 *     <tr><td>{@code postgres.notifier.notifications.discarded}</td><td>Counter</td>
 *         <td>notifier.name</td></tr>
 *     <tr><td>{@code postgres.notifier.commands}</td><td>Counter</td>
 *         <td>notifier.name, command, outcome</td></tr>
 *     <tr><td>{@code postgres.notifier.payloads.published}</td><td>Counter</td>
 *         <td>notifier.name, topic</td></tr>
 *     <tr><td>{@code postgres.notifier.connected}</td><td>Gauge</td><td>notifier.name</td></tr>
 *     <tr><td>{@code postgres.notifier.connects}</td><td>Counter</td><td>notifier.name</td></tr>
 *     <tr><td>{@code postgres.notifier.registry.channels}</td><td>Gauge</td>
 *         <td>notifier.name</td></tr>
 *     <tr><td>{@code postgres.notifier.registry.listeners}</td><td>Gauge</td>
 *         <td>notifier.name</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Memory Management:</strong> gauges hold strong references in the {@code
 * MeterRegistry}. The notifier calls {@link #close(String)} when it stops, which unregisters its
 * gauges. Counters stay, they are cumulative.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerNotifierMetrics implements NotifierMetrics {

  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;

  /**
   * Creates Micrometer metrics.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerNotifierMetrics(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache = new MetricCache(registry, maxCacheSize);
    log.debug("Created MicrometerNotifierMetrics (maxCacheSize: {})", maxCacheSize);
  }

  public MicrometerNotifierMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordNotificationRelayed(
      final String notifierName, final String topic, final int listenerCount) {
    cache
        .counter(
            NOTIFICATIONS_RELAYED,
            "Notifications fanned out to listeners",
            TAG_NOTIFIER_NAME,
            notifierName,
            TAG_TOPIC,
            topic)
        .increment();
    cache
        .summary(
            NOTIFICATION_RECIPIENTS,
            "Listeners per relayed notification",
            TAG_NOTIFIER_NAME,
            notifierName,
            TAG_TOPIC,
            topic)
        .record(listenerCount);
  }

  @Override
  public void recordNotificationDiscarded(final String notifierName) {
    cache
        .counter(
            NOTIFICATIONS_DISCARDED,
            "Notifications for channels without listeners",
            TAG_NOTIFIER_NAME,
            notifierName)
        .increment();
  }

  @Override
  public void recordCommand(final String notifierName, final String command, final boolean success) {
    cache
        .counter(
            COMMANDS,
            "LISTEN, UNLISTEN and publish commands sent to PostgreSQL",
            TAG_NOTIFIER_NAME,
            notifierName,
            TAG_COMMAND,
            command,
            TAG_OUTCOME,
            success ? OUTCOME_SUCCESS : OUTCOME_FAILURE)
        .increment();
  }

  @Override
  public void recordPublished(final String notifierName, final String topic, final int payloadCount) {
    cache
        .counter(
            PAYLOADS_PUBLISHED,
            "Payloads handed to pg_notify",
            TAG_NOTIFIER_NAME,
            notifierName,
            TAG_TOPIC,
            topic)
        .increment(payloadCount);
  }

  @Override
  public void setConnected(final String notifierName, final boolean connected) {
    final var gauge =
        cache.gauge(CONNECTED, "1 while the notifier is connected", TAG_NOTIFIER_NAME, notifierName);
    final int previous = gauge.getAndSet(connected ? 1 : 0);

    if (connected && previous == 0) {
      cache
          .counter(CONNECTS, "Successful (re)connects", TAG_NOTIFIER_NAME, notifierName)
          .increment();
    }
  }

  @Override
  public void setRegistrySize(final String notifierName, final int channels, final int listeners) {
    cache
        .gauge(REGISTRY_CHANNELS, "Channels listened to", TAG_NOTIFIER_NAME, notifierName)
        .set(channels);
    cache
        .gauge(REGISTRY_LISTENERS, "Registered listeners", TAG_NOTIFIER_NAME, notifierName)
        .set(listeners);
  }

  @Override
  public void close(final String notifierName) {
    try {
      final int removed = cache.removeGauges(TAG_NOTIFIER_NAME, notifierName);
      if (removed > 0) {
        log.info("Removed {} gauge(s) of notifier '{}'", removed, notifierName);
      }
    } catch (final RuntimeException e) {
      // MUST NOT throw (called from the notifier's shutdown)
      log.error("Error during metrics cleanup for notifier '{}'", notifierName, e);
    }
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }
}
