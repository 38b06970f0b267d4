/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

/**
 * Receives events from a {@link NotificationConnection}.
 *
 * <p>All callbacks come from the connection's I/O thread, in the order the events happened. A
 * command whose connection dropped is failed before {@link #onDisconnect()} is signalled.
 */
public interface ConnectionHandler {

  /** Connection (re)established. Previous LISTEN state is gone. */
  void onConnect();

  /** Connection lost or closed. */
  void onDisconnect();

  /**
   * Notification received on a channel this connection listens to.
   *
   * @param channel full channel name
   * @param payload payload string (empty when none was sent)
   */
  void onNotification(String channel, String payload);
}
