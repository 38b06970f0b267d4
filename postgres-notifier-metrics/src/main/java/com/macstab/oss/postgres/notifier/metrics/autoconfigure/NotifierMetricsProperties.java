/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for notifier metrics.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     postgres-notifier:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = NotifierMetricsProperties.PREFIX)
public class NotifierMetricsProperties {

  public static final String PREFIX = "management.metrics.postgres-notifier";

  /** Enable Micrometer metrics. When disabled the notifier reports to a no-op. */
  private boolean enabled = true;

  /**
   * Maximum cached meter instances.
   *
   * <p>Topic tags come from application code. Past this limit meters are still recorded, only
   * uncached.
   */
  private int maxCacheSize = 1000;
}
