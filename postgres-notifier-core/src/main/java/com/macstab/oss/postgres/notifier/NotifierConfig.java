/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable notifier configuration.
 *
 * <p>{@code prefix} namespaces every channel ({@code "<prefix>.oban_<topic>"}), so two
 * applications sharing one database only hear each other when they share a prefix. The whole
 * config object is handed to listeners as the {@link Notification#source()} of every relayed
 * notification.
 *
 * <pre>{@code
 * NotifierConfig config = NotifierConfig.builder()
 *     .name("jobs")
 *     .prefix("private")
 *     .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class NotifierConfig {

  public static final String DEFAULT_NAME = "default";
  public static final String DEFAULT_PREFIX = "public";
  public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);

  /** Notifier name (thread names, log lines, metric tags). */
  @NonNull @Builder.Default String name = DEFAULT_NAME;

  /** Channel namespace prefix. */
  @NonNull @Builder.Default String prefix = DEFAULT_PREFIX;

  /** How long blocking subscribe/unsubscribe calls wait for the notifier to reply. */
  @NonNull @Builder.Default Duration callTimeout = DEFAULT_CALL_TIMEOUT;

  /** Config with default name, prefix and call timeout. */
  public static NotifierConfig defaults() {
    return builder().build();
  }
}
