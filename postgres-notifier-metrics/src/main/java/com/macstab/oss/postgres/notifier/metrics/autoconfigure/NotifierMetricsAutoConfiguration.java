/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.postgres.notifier.metrics.NotifierMetrics;
import com.macstab.oss.postgres.notifier.metrics.micrometer.MicrometerNotifierMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for notifier metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath
 *   <li>{@code MeterRegistry} bean exists
 *   <li>{@code management.metrics.postgres-notifier.enabled=true} (default)
 * </ol>
 *
 * <p>Otherwise {@link NotifierMetrics#NOOP} is registered. A user-defined {@link NotifierMetrics}
 * bean always wins.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(NotifierMetricsProperties.class)
public class NotifierMetricsAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = NotifierMetricsProperties.PREFIX,
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(NotifierMetrics.class)
  public NotifierMetrics micrometerNotifierMetrics(
      final MeterRegistry registry, final NotifierMetricsProperties properties) {

    log.info(
        "Activating PostgreSQL notifier metrics (Micrometer) - maxCacheSize: {}",
        properties.getMaxCacheSize());
    return new MicrometerNotifierMetrics(registry, properties.getMaxCacheSize());
  }

  /** Explicit no-op when disabled or no registry exists. */
  @Bean
  @ConditionalOnMissingBean(NotifierMetrics.class)
  public NotifierMetrics noOpNotifierMetrics() {
    log.debug("PostgreSQL notifier metrics disabled - using NOOP singleton");
    return NotifierMetrics.NOOP;
  }
}
