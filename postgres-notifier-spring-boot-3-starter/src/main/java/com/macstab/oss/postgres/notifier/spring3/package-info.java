/* (C)2026 Macstab GmbH */

/**
 * Spring Boot 3.x auto-configuration for the PostgreSQL notifier.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Configure (application.yml):</strong>
 *
 * <pre>{@code
 * spring:
 *   datasource:
 *     url: jdbc:postgresql://db:5432/app
 *     username: app
 *     password: secret
 * macstab:
 *   postgres:
 *     notifier:
 *       prefix: public
 * }</pre>
 *
 * <p><strong>2. Use:</strong>
 *
 * <pre>{@code
 * @Service
 * public class OrderEvents {
 *     private final PostgresNotifier notifier;
 *
 *     public void onStart() {
 *         notifier.subscribe(notification -> handle(notification.payload()), "orders");
 *     }
 *
 *     public void orderPlaced(String id) {
 *         notifier.publish("orders", id);
 *     }
 * }
 * }</pre>
 *
 * <h2>Connection</h2>
 *
 * <p>The notifier never borrows from the application's {@code DataSource}: LISTEN state belongs
 * to one session, so it opens its own connection with the same url and credentials.
 */
package com.macstab.oss.postgres.notifier.spring3;
