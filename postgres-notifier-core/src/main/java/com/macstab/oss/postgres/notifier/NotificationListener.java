/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Subscriber registered with a {@link PostgresNotifier}.
 *
 * <p><strong>Identity:</strong> listeners are registry keys, compared with {@code equals}/{@code
 * hashCode}. Keep the defaults (object identity) unless two instances really are the same
 * subscriber.
 *
 * <p><strong>Threading:</strong> {@link #onNotification(Notification)} runs on the notifier thread.
 * Block there and every other listener of the notifier waits. Hand work off (see {@link
 * MailboxListener}).
 *
 * <p><strong>Liveness:</strong> {@link #termination()} completes when the subscriber is gone. The
 * notifier watches it and drops all of the listener's topics, unsubscribing at the database when
 * no other listener needs them. Listeners that never terminate must unsubscribe explicitly.
 */
@FunctionalInterface
public interface NotificationListener {

  /** Shared stage that never completes (default for listeners without a lifecycle). */
  CompletionStage<Void> NEVER_TERMINATES = new CompletableFuture<Void>().minimalCompletionStage();

  /**
   * Receives one notification for a topic this listener subscribed to.
   *
   * @param notification source config, topic and payload
   */
  void onNotification(Notification notification);

  /**
   * Completes (normally or exceptionally) when this listener terminates.
   *
   * @return termination stage; never completes by default
   */
  default CompletionStage<Void> termination() {
    return NEVER_TERMINATES;
  }
}
