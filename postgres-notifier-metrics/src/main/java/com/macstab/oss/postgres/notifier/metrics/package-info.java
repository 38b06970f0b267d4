/* (C)2026 Macstab GmbH */

/**
 * Micrometer metrics for the PostgreSQL notifier.
 *
 * <h2>Quick Start</h2>
 *
 * <p>With Spring Boot and a {@code MeterRegistry} bean, adding this module is enough: {@link
 * com.macstab.oss.postgres.notifier.metrics.autoconfigure.NotifierMetricsAutoConfiguration}
 * registers a {@link com.macstab.oss.postgres.notifier.metrics.micrometer.MicrometerNotifierMetrics}
 * bean that the starter hands to every notifier.
 *
 * <p>Without Spring:
 *
 * <pre>{@code
 * NotifierMetrics metrics = new MicrometerNotifierMetrics(meterRegistry);
 * PostgresNotifier notifier = new PostgresNotifier(config, connection, metrics);
 * }</pre>
 *
 * <h2>Metrics</h2>
 *
 * <p>See {@link com.macstab.oss.postgres.notifier.metrics.micrometer.MetricsConfiguration} for
 * names and tags. Disable with {@code management.metrics.postgres-notifier.enabled=false}.
 */
package com.macstab.oss.postgres.notifier.metrics;
