/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Settings of {@link PgJdbcNotificationConnection}.
 *
 * <p>Defaults follow the usual PostgreSQL client behaviour: reconnect automatically, back off
 * between 1 s and 30 s.
 *
 * <pre>{@code
 * PgConnectionSettings settings = PgConnectionSettings.builder()
 *     .url("jdbc:postgresql://localhost:5432/app")
 *     .username("app")
 *     .password("secret")
 *     .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class PgConnectionSettings {

  public static final String DEFAULT_APPLICATION_NAME = "postgres-notifier";

  /** JDBC URL, e.g. {@code jdbc:postgresql://localhost:5432/app}. */
  @NonNull String url;

  String username;

  @ToString.Exclude String password;

  /** Reported in {@code pg_stat_activity.application_name}. */
  @NonNull @Builder.Default String applicationName = DEFAULT_APPLICATION_NAME;

  /** Reconnect after a lost or failed connection. */
  @Builder.Default boolean autoReconnect = true;

  /** First reconnect delay. */
  @NonNull @Builder.Default Duration reconnectDelayMin = Duration.ofSeconds(1);

  /** Upper bound of the reconnect delay. */
  @NonNull @Builder.Default Duration reconnectDelayMax = Duration.ofSeconds(30);

  /** Longest wait between two notification polls while no command is queued. */
  @NonNull @Builder.Default Duration pollInterval = Duration.ofMillis(50);

  /** How often an idle connection is checked with {@code Connection.isValid}. */
  @NonNull @Builder.Default Duration healthCheckInterval = Duration.ofSeconds(15);

  /** TCP connect timeout (whole seconds, at least 1). */
  @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(10);

  /**
   * Checks ranges.
   *
   * @throws IllegalArgumentException if a duration is not positive, the poll interval is below 1 ms
   *     or min exceeds max
   */
  public PgConnectionSettings validate() {
    requirePositive("reconnectDelayMin", reconnectDelayMin);
    requirePositive("reconnectDelayMax", reconnectDelayMax);
    if (pollInterval.toMillis() < 1) {
      throw new IllegalArgumentException("pollInterval must be >= 1ms, got: " + pollInterval);
    }
    requirePositive("healthCheckInterval", healthCheckInterval);
    requirePositive("connectTimeout", connectTimeout);
    if (reconnectDelayMin.compareTo(reconnectDelayMax) > 0) {
      throw new IllegalArgumentException(
          "reconnectDelayMin ("
              + reconnectDelayMin
              + ") must not exceed reconnectDelayMax ("
              + reconnectDelayMax
              + ")");
    }
    return this;
  }

  private static void requirePositive(final String name, final Duration value) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
  }
}
