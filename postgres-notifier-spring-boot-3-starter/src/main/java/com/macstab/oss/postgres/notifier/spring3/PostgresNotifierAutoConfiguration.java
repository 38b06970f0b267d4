/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.spring3;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.macstab.oss.postgres.notifier.PostgresNotifier;
import com.macstab.oss.postgres.notifier.connection.JdbcConnector;
import com.macstab.oss.postgres.notifier.connection.PgConnectionSettings;
import com.macstab.oss.postgres.notifier.connection.PgJdbcNotificationConnection;
import com.macstab.oss.postgres.notifier.liveness.TerminationLivenessMonitor;
import com.macstab.oss.postgres.notifier.metrics.NotifierMetrics;
import com.macstab.oss.postgres.notifier.metrics.autoconfigure.NotifierMetricsAutoConfiguration;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for a {@link PostgresNotifier} bean.
 *
 * <p>Active unless {@code macstab.postgres.notifier.enabled=false}. The notifier is started on
 * creation (connecting happens in the background) and closed with the context.
 *
 * <p><strong>Optional beans:</strong>
 *
 * <ul>
 *   <li>{@link NotifierMetrics} - from {@link NotifierMetricsAutoConfiguration}, or NOOP
 *   <li>{@link ObjectMapper} - for {@code publishJson}, a plain mapper otherwise
 *   <li>{@link JdbcConnector} - replaces {@code DriverManager} for the LISTEN connection
 * </ul>
 *
 * @see PostgresNotifierProperties
 */
@Slf4j
@AutoConfiguration(
    after = NotifierMetricsAutoConfiguration.class,
    afterName = {
      "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
      "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration"
    })
@ConditionalOnClass(PostgresNotifier.class)
@ConditionalOnProperty(
    prefix = PostgresNotifierProperties.PREFIX,
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(PostgresNotifierProperties.class)
public class PostgresNotifierAutoConfiguration {

  static final String DATASOURCE_PREFIX = "spring.datasource.";

  /**
   * Connection settings, falling back to {@code spring.datasource.*} for url and credentials.
   *
   * @throws IllegalStateException if neither url is set
   */
  @Bean
  @ConditionalOnMissingBean
  public PgConnectionSettings postgresNotifierConnectionSettings(
      final PostgresNotifierProperties properties, final Environment environment) {

    final var url = firstText(properties.getUrl(), environment.getProperty(DATASOURCE_PREFIX + "url"));
    if (url == null) {
      throw new IllegalStateException(
          PostgresNotifierProperties.PREFIX
              + ".url or "
              + DATASOURCE_PREFIX
              + "url must be set for the PostgreSQL notifier");
    }

    return PgConnectionSettings.builder()
        .url(url)
        .username(
            firstText(properties.getUsername(), environment.getProperty(DATASOURCE_PREFIX + "username")))
        .password(
            firstText(properties.getPassword(), environment.getProperty(DATASOURCE_PREFIX + "password")))
        .applicationName(properties.getApplicationName())
        .autoReconnect(properties.isAutoReconnect())
        .reconnectDelayMin(properties.getReconnectDelayMin())
        .reconnectDelayMax(properties.getReconnectDelayMax())
        .pollInterval(properties.getPollInterval())
        .healthCheckInterval(properties.getHealthCheckInterval())
        .connectTimeout(properties.getConnectTimeout())
        .build()
        .validate();
  }

  /**
   * Creates and starts the notifier.
   *
   * @param properties notifier properties
   * @param settings connection settings
   * @param metricsProvider metrics (optional)
   * @param objectMapperProvider JSON mapper (optional)
   * @param connectorProvider JDBC connector (optional)
   * @return started notifier
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public PostgresNotifier postgresNotifier(
      final PostgresNotifierProperties properties,
      final PgConnectionSettings settings,
      final ObjectProvider<NotifierMetrics> metricsProvider,
      final ObjectProvider<ObjectMapper> objectMapperProvider,
      final ObjectProvider<JdbcConnector> connectorProvider) {

    final var config = properties.toNotifierConfig();
    final var connector =
        connectorProvider.getIfAvailable(() -> JdbcConnector.driverManager(settings));
    final var metrics = metricsProvider.getIfAvailable(() -> NotifierMetrics.NOOP);

    final var notifier =
        new PostgresNotifier(
            config,
            new PgJdbcNotificationConnection(config.getName(), settings, connector),
            metrics,
            TerminationLivenessMonitor.INSTANCE,
            objectMapperProvider.getIfAvailable(ObjectMapper::new));
    notifier.start();

    if (log.isInfoEnabled()) {
      log.info(
          "PostgreSQL notifier '{}' started: prefix={}, url={}, metrics={}",
          config.getName(),
          config.getPrefix(),
          settings.getUrl(),
          metrics == NotifierMetrics.NOOP ? "disabled" : "enabled");
    }
    return notifier;
  }

  private static String firstText(final String preferred, final String fallback) {
    if (StringUtils.hasText(preferred)) {
      return preferred;
    }
    return StringUtils.hasText(fallback) ? fallback : null;
  }
}
