/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.spring3;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.postgres.notifier.NotifierConfig;
import com.macstab.oss.postgres.notifier.connection.PgConnectionSettings;

import lombok.Data;
import lombok.ToString;

/**
 * Configuration properties for the auto-configured {@code PostgresNotifier}.
 *
 * <pre>{@code
 * macstab:
 *   postgres:
 *     notifier:
 *       name: orders
 *       prefix: public
 *       url: jdbc:postgresql://db:5432/app   # defaults to spring.datasource.url
 *       reconnect-delay-max: 30s
 * }</pre>
 *
 * <p>{@code url}, {@code username} and {@code password} fall back to {@code spring.datasource.*}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = PostgresNotifierProperties.PREFIX)
public class PostgresNotifierProperties {

  public static final String PREFIX = "macstab.postgres.notifier";

  /** Create the notifier bean. */
  private boolean enabled = true;

  /** Notifier name, used in thread names and as the {@code notifier.name} metric tag. */
  private String name = NotifierConfig.DEFAULT_NAME;

  /** Channel namespace prefix. */
  private String prefix = NotifierConfig.DEFAULT_PREFIX;

  /** How long blocking subscribe/unsubscribe calls wait. */
  private Duration callTimeout = NotifierConfig.DEFAULT_CALL_TIMEOUT;

  /** JDBC URL of the LISTEN connection. */
  private String url;

  private String username;

  @ToString.Exclude private String password;

  private String applicationName = PgConnectionSettings.DEFAULT_APPLICATION_NAME;

  private boolean autoReconnect = true;

  private Duration reconnectDelayMin = Duration.ofSeconds(1);

  private Duration reconnectDelayMax = Duration.ofSeconds(30);

  /** Longest wait between two notification polls. */
  private Duration pollInterval = Duration.ofMillis(50);

  private Duration healthCheckInterval = Duration.ofSeconds(15);

  private Duration connectTimeout = Duration.ofSeconds(10);

  NotifierConfig toNotifierConfig() {
    return NotifierConfig.builder().name(name).prefix(prefix).callTimeout(callTimeout).build();
  }
}
