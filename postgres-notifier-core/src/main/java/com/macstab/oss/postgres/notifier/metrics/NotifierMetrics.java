/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics;

/**
 * Metrics hooks of the notifier.
 *
 * <p>Core stays free of any metrics library: every method is a no-op by default and {@link #NOOP}
 * is used when nothing else is configured. The {@code postgres-notifier-metrics} module provides
 * the Micrometer implementation.
 *
 * <p><strong>Dimensions:</strong> every call carries the notifier name ({@code notifier.name} tag)
 * so several notifiers can share one registry. Topic tags are bounded by the application's topic
 * set.
 *
 * <p><strong>Threading:</strong> relay, command, registry and connection-state hooks run on the
 * notifier thread. Publish hooks run on whichever thread completes the publish command, usually
 * the connection I/O thread.
 * Implementations MUST be thread-safe and MUST NOT throw.
 */
public interface NotifierMetrics extends AutoCloseable {

  /** No-op singleton. */
  NotifierMetrics NOOP = new NotifierMetrics() {};

  /**
   * A notification was fanned out.
   *
   * <p><strong>Metric Type:</strong> Counter {@code postgres.notifier.notifications.relayed}
   * (tags: notifier.name, topic) plus a distribution of recipients per notification.
   *
   * @param notifierName notifier name
   * @param topic topic of the notification
   * @param listenerCount number of listeners it was delivered to (&gt;= 1)
   */
  default void recordNotificationRelayed(String notifierName, String topic, int listenerCount) {
    // No-op by default
  }

  /**
   * A notification arrived for a channel nobody listens to anymore (unsubscribe race).
   *
   * @param notifierName notifier name
   */
  default void recordNotificationDiscarded(String notifierName) {
    // No-op by default
  }

  /**
   * A LISTEN, UNLISTEN or publish command finished.
   *
   * <p><strong>Metric Type:</strong> Counter {@code postgres.notifier.commands} (tags:
   * notifier.name, command, outcome).
   *
   * @param notifierName notifier name
   * @param command {@code listen}, {@code unlisten} or {@code publish}
   * @param success whether the database accepted it
   */
  default void recordCommand(String notifierName, String command, boolean success) {
    // No-op by default
  }

  /**
   * Payloads handed to the database by one publish call.
   *
   * @param notifierName notifier name
   * @param topic target topic
   * @param payloadCount batch size
   */
  default void recordPublished(String notifierName, String topic, int payloadCount) {
    // No-op by default
  }

  /**
   * The notifier saw its connection come up or go down.
   *
   * <p><strong>Metric Type:</strong> Gauge {@code postgres.notifier.connected} (1/0) plus counter
   * {@code postgres.notifier.connects}.
   *
   * @param notifierName notifier name
   * @param connected new state
   */
  default void setConnected(String notifierName, boolean connected) {
    // No-op by default
  }

  /**
   * Registry size after a mutation.
   *
   * @param notifierName notifier name
   * @param channels registered channels
   * @param listeners registered listeners
   */
  default void setRegistrySize(String notifierName, int channels, int listeners) {
    // No-op by default
  }

  /**
   * Removes gauges held for a notifier. Idempotent, never throws.
   *
   * @param notifierName notifier name
   */
  default void close(String notifierName) {
    // No-op by default
  }

  /** Closes metrics of the default notifier. */
  @Override
  default void close() {
    close("default");
  }
}
