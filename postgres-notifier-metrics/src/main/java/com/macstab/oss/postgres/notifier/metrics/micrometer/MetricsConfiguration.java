/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys of the notifier.
 *
 * <p><strong>Naming Convention:</strong> {@code postgres.notifier.*}. Prometheus output replaces
 * dots with underscores:
 *
 * <pre>
 * postgres.notifier.notifications.relayed → postgres_notifier_notifications_relayed_total
 * postgres.notifier.connected             → postgres_notifier_connected
 * </pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "postgres.notifier";

  /** Counter. Tags: notifier.name, topic. */
  public static final String NOTIFICATIONS_RELAYED = PREFIX + ".notifications.relayed";

  /** Distribution summary of listeners per relayed notification. Tags: notifier.name, topic. */
  public static final String NOTIFICATION_RECIPIENTS = PREFIX + ".notifications.recipients";

  /** Counter of notifications for channels nobody listened to anymore. Tags: notifier.name. */
  public static final String NOTIFICATIONS_DISCARDED = PREFIX + ".notifications.discarded";

  /**
   * Counter of database commands.
   *
   * <p><strong>Tags:</strong>
   *
   * <ul>
   *   <li>{@code notifier.name}
   *   <li>{@code command} - listen, unlisten, publish
   *   <li>{@code outcome} - success, failure
   * </ul>
   */
  public static final String COMMANDS = PREFIX + ".commands";

  /** Counter of published payloads. Tags: notifier.name, topic. */
  public static final String PAYLOADS_PUBLISHED = PREFIX + ".payloads.published";

  /** Gauge, 1 while connected. Tags: notifier.name. */
  public static final String CONNECTED = PREFIX + ".connected";

  /** Counter of successful (re)connects. Tags: notifier.name. */
  public static final String CONNECTS = PREFIX + ".connects";

  /** Gauge of channels currently listened to. Tags: notifier.name. */
  public static final String REGISTRY_CHANNELS = PREFIX + ".registry.channels";

  /** Gauge of registered listeners. Tags: notifier.name. */
  public static final String REGISTRY_LISTENERS = PREFIX + ".registry.listeners";

  // Tag keys
  public static final String TAG_NOTIFIER_NAME = "notifier.name";
  public static final String TAG_TOPIC = "topic";
  public static final String TAG_COMMAND = "command";
  public static final String TAG_OUTCOME = "outcome";

  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";
}
