/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.postgres.notifier.connection.ConnectionHandler;
import com.macstab.oss.postgres.notifier.connection.NotificationConnection;

/**
 * In-memory {@link NotificationConnection} recording every command.
 *
 * <p>Tests drive the connection events ({@link #connect()}, {@link #disconnect()}, {@link
 * #deliver}) and decide when commands complete. With {@code autoComplete} every accepted command
 * succeeds right away.
 */
final class RecordingConnection implements NotificationConnection {

  record Command(String sql, List<String> parameters, CompletableFuture<Void> future) {}

  private final List<Command> commands = new ArrayList<>();
  private volatile boolean autoComplete;
  private volatile boolean connected;
  private volatile boolean closed;
  private volatile ConnectionHandler handler;

  RecordingConnection(final boolean autoComplete) {
    this.autoComplete = autoComplete;
  }

  void setAutoComplete(final boolean autoComplete) {
    this.autoComplete = autoComplete;
  }

  @Override
  public void start(final ConnectionHandler handler) {
    this.handler = handler;
  }

  @Override
  public CompletableFuture<Void> execute(final String sql, final List<String> parameters) {
    if (closed) {
      return CompletableFuture.failedFuture(new IllegalStateException("closed"));
    }
    if (!connected) {
      return CompletableFuture.failedFuture(new ConnectionLostException("not connected"));
    }
    final var command = new Command(sql, List.copyOf(parameters), new CompletableFuture<>());
    synchronized (commands) {
      commands.add(command);
    }
    if (autoComplete) {
      command.future().complete(null);
    }
    return command.future();
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public void close() {
    closed = true;
    connected = false;
  }

  boolean isClosed() {
    return closed;
  }

  void connect() {
    connected = true;
    handler.onConnect();
  }

  /** Fails uncompleted commands, then signals the disconnect. */
  void disconnect() {
    connected = false;
    for (final var command : commands()) {
      command.future().completeExceptionally(new ConnectionLostException("connection lost"));
    }
    handler.onDisconnect();
  }

  /** Signals the disconnect but leaves running commands to the test. */
  void signalDisconnect() {
    connected = false;
    handler.onDisconnect();
  }

  void deliver(final String channel, final String payload) {
    handler.onNotification(channel, payload);
  }

  List<Command> commands() {
    synchronized (commands) {
      return List.copyOf(commands);
    }
  }

  List<String> sqls() {
    return commands().stream().map(Command::sql).toList();
  }

  int commandCount() {
    return commands().size();
  }

  Command lastCommand() {
    final var all = commands();
    return all.get(all.size() - 1);
  }

  /** Completes the oldest command that is still running. */
  void completeNext() {
    pending().future().complete(null);
  }

  void failNext(final Throwable error) {
    pending().future().completeExceptionally(error);
  }

  private Command pending() {
    return commands().stream()
        .filter(command -> !command.future().isDone())
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("no running command"));
  }
}
