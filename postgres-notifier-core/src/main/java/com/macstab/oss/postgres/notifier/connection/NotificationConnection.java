/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Single database connection able to LISTEN and deliver notifications.
 *
 * <p>Owns connecting and reconnecting. Users only react to {@link ConnectionHandler} events and
 * submit commands.
 *
 * <p><strong>Ordering:</strong> commands run one at a time in submission order. A command's future
 * completes before the next command starts.
 */
public interface NotificationConnection extends AutoCloseable {

  /**
   * Starts connecting in the background. Must be called once.
   *
   * @param handler receiver of connect/disconnect/notification events
   */
  void start(ConnectionHandler handler);

  /**
   * Queues a parameterized command.
   *
   * @param sql statement with {@code ?} placeholders
   * @param parameters bound in order, as strings
   * @return completes when the database acknowledged the command; fails with {@link
   *     com.macstab.oss.postgres.notifier.NotifierException} when it was rejected or the
   *     connection dropped
   */
  CompletableFuture<Void> execute(String sql, List<String> parameters);

  /** Queues a command without parameters. */
  default CompletableFuture<Void> execute(final String sql) {
    return execute(sql, List.of());
  }

  boolean isConnected();

  /** Closes the connection and stops reconnecting. Idempotent. */
  @Override
  void close();
}
