/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.postgres.notifier.liveness.LivenessHandle;

/**
 * Mailbox messages of the {@link PostgresNotifier} thread.
 *
 * <p>Deferrable messages mutate the registry or issue commands. They wait in the stash while a
 * database command is in flight. Everything else is handled on arrival.
 */
sealed interface NotifierMessage {

  /** Whether the message waits while a command is in flight. */
  default boolean deferrable() {
    return false;
  }

  /** Caller waiting for this message, if any. */
  default CompletableFuture<Void> replyOrNull() {
    return null;
  }

  record Subscribe(
      NotificationListener listener, Set<String> channels, CompletableFuture<Void> reply)
      implements NotifierMessage {

    @Override
    public boolean deferrable() {
      return true;
    }

    @Override
    public CompletableFuture<Void> replyOrNull() {
      return reply;
    }
  }

  record Unsubscribe(
      NotificationListener listener, Set<String> channels, CompletableFuture<Void> reply)
      implements NotifierMessage {

    @Override
    public boolean deferrable() {
      return true;
    }

    @Override
    public CompletableFuture<Void> replyOrNull() {
      return reply;
    }
  }

  /** Handle is resolved when handled; the callback may fire before {@code watch} returned. */
  record ListenerDown(NotificationListener listener, AtomicReference<LivenessHandle> handle)
      implements NotifierMessage {

    @Override
    public boolean deferrable() {
      return true;
    }
  }

  record Connected() implements NotifierMessage {

    @Override
    public boolean deferrable() {
      return true;
    }
  }

  record Disconnected() implements NotifierMessage {}

  record Inbound(String channel, String payload) implements NotifierMessage {}

  /** Result of the command with the given id; {@code error} is null on success. */
  record CommandCompleted(long commandId, Throwable error) implements NotifierMessage {}

  record Stop() implements NotifierMessage {}
}
