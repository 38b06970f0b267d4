/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static lombok.AccessLevel.PRIVATE;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import com.macstab.oss.postgres.notifier.ConnectionLostException;
import com.macstab.oss.postgres.notifier.NotifierException;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link NotificationConnection} on a single pgjdbc connection.
 *
 * <p><strong>Why one dedicated connection:</strong> PostgreSQL keeps LISTEN registrations per
 * session. A pooled connection would hand notifications to whichever borrower happens to hold it
 * (and transaction-mode poolers such as PgBouncer drop them entirely). The I/O thread owns the
 * connection for its whole life.
 *
 * <p><strong>I/O loop:</strong>
 *
 * <pre>
 * connect ─→ onConnect ─→ ┌─ run queued commands (FIFO, one at a time)
 *                         ├─ PGConnection.getNotifications() ─→ onNotification
 *                         ├─ isValid() every healthCheckInterval
 *                         └─ wait ≤ pollInterval for the next command
 *          SQLException ─→ close, fail queued commands, onDisconnect ─→ backoff ─→ connect
 * </pre>
 *
 * <p>pgjdbc buffers notifications that arrive while a command runs, so none are lost between
 * polls. Notification latency is bounded by {@code pollInterval}.
 *
 * <p><strong>Failure policy:</strong> any {@code SQLException} or driver {@code RuntimeException},
 * including a rejected command, ends the session. A rejected command fails with {@link
 * NotifierException}, everything still queued fails with {@link ConnectionLostException}, and the
 * connection reconnects (when {@code autoReconnect}). Listeners relying on LISTEN state are
 * re-subscribed by the {@link ConnectionHandler#onConnect()} reaction.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class PgJdbcNotificationConnection implements NotificationConnection {

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  String name;
  PgConnectionSettings settings;
  JdbcConnector connector;
  ReconnectBackoff backoff;
  BlockingQueue<PendingCommand> commands = new LinkedBlockingQueue<>();
  AtomicBoolean started = new AtomicBoolean();
  AtomicBoolean closed = new AtomicBoolean();

  @NonFinal volatile boolean connected;
  @NonFinal volatile Thread ioThread;

  public PgJdbcNotificationConnection(
      @NonNull final String name, @NonNull final PgConnectionSettings settings) {
    this(name, settings, JdbcConnector.driverManager(settings));
  }

  public PgJdbcNotificationConnection(
      @NonNull final String name,
      @NonNull final PgConnectionSettings settings,
      @NonNull final JdbcConnector connector) {
    this.name = name;
    this.settings = settings.validate();
    this.connector = connector;
    this.backoff = new ReconnectBackoff(settings.getReconnectDelayMin(), settings.getReconnectDelayMax());
  }

  @Override
  public void start(@NonNull final ConnectionHandler handler) {
    if (closed.get()) {
      throw new IllegalStateException("Connection '" + name + "' has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Connection '" + name + "' already started");
    }

    final var thread = new Thread(() -> runLoop(handler), "postgres-notifier-io-" + name);
    thread.setDaemon(true);
    ioThread = thread;
    thread.start();

    if (log.isInfoEnabled()) {
      log.info("Started notification connection '{}' to {}", name, settings.getUrl());
    }
  }

  @Override
  public CompletableFuture<Void> execute(
      @NonNull final String sql, @NonNull final List<String> parameters) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Connection '" + name + "' has been closed"));
    }
    if (!connected) {
      return CompletableFuture.failedFuture(notConnected());
    }

    final var command = new PendingCommand(sql, List.copyOf(parameters), new CompletableFuture<>());
    commands.add(command);

    // the session may have ended (and drained the queue) between the checks above and add()
    if (closed.get()) {
      failPending(new NotifierException("Connection '" + name + "' has been closed"));
    } else if (!connected) {
      failPending(notConnected());
    }
    return command.future();
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    final var thread = ioThread;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
      try {
        thread.join(CLOSE_TIMEOUT.toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (thread.isAlive()) {
        log.warn("I/O thread of connection '{}' did not stop within {}", name, CLOSE_TIMEOUT);
      }
    }

    failPending(new NotifierException("Connection '" + name + "' has been closed"));

    if (log.isInfoEnabled()) {
      log.info("Closed notification connection '{}'", name);
    }
  }

  // ==================== I/O thread ====================

  private void runLoop(final ConnectionHandler handler) {
    int failures = 0;

    while (!closed.get()) {
      final Connection connection;
      try {
        connection = connector.connect();
        connection.setAutoCommit(true);
      } catch (final SQLException | RuntimeException e) {
        log.warn(
            "Connection '{}' failed to connect to {} (attempt {}): {}",
            name,
            settings.getUrl(),
            failures + 1,
            e.getMessage());
        if (!settings.isAutoReconnect()) {
          log.error("Connection '{}' gives up, auto-reconnect is disabled", name);
          break;
        }
        if (!pause(backoff.delay(failures++))) {
          break;
        }
        continue;
      }

      failures = 0;
      runSession(connection, handler);

      if (closed.get()) {
        break;
      }
      if (!settings.isAutoReconnect()) {
        log.warn("Connection '{}' lost and auto-reconnect is disabled, not reconnecting", name);
        break;
      }
      if (!pause(backoff.delay(0))) {
        break;
      }
    }

    failPending(new ConnectionLostException("Connection '" + name + "' stopped"));
  }

  private void runSession(final Connection connection, final ConnectionHandler handler) {
    connected = true;
    if (log.isInfoEnabled()) {
      log.info("Connection '{}' connected to {}", name, settings.getUrl());
    }

    try {
      handler.onConnect();
      serve(connection, handler);
    } catch (final SQLException e) {
      if (!closed.get()) {
        log.warn("Connection '{}' lost: {}", name, e.getMessage());
      }
    } catch (final RuntimeException e) {
      if (!closed.get()) {
        log.warn("Connection '{}' lost on driver failure", name, e);
      }
    } catch (final InterruptedException e) {
      if (!closed.get()) {
        log.warn("I/O thread of connection '{}' interrupted", name);
      }
      Thread.currentThread().interrupt();
    } finally {
      connected = false;
      closeQuietly(connection);
      failPending(new ConnectionLostException("Connection '" + name + "' to PostgreSQL lost"));
      handler.onDisconnect();
    }
  }

  private void serve(final Connection connection, final ConnectionHandler handler)
      throws SQLException, InterruptedException {

    final var pgConnection = connection.unwrap(PGConnection.class);
    final long pollMillis = settings.getPollInterval().toMillis();
    final long healthCheckNanos = settings.getHealthCheckInterval().toNanos();
    final int validationTimeoutSeconds = (int) Math.max(1, settings.getConnectTimeout().toSeconds());
    long nextHealthCheck = System.nanoTime() + healthCheckNanos;

    while (!closed.get()) {
      var command = commands.poll(pollMillis, MILLISECONDS);
      while (command != null) {
        runCommand(connection, command);
        command = commands.poll();
      }

      deliver(pgConnection.getNotifications(), handler);

      if (System.nanoTime() - nextHealthCheck >= 0) {
        if (!connection.isValid(validationTimeoutSeconds)) {
          throw new SQLException("Connection failed validation");
        }
        nextHealthCheck = System.nanoTime() + healthCheckNanos;
      }
    }
  }

  private void runCommand(final Connection connection, final PendingCommand command)
      throws SQLException {
    try {
      if (command.parameters().isEmpty()) {
        try (var statement = connection.createStatement()) {
          statement.execute(command.sql());
        }
      } else {
        try (var statement = connection.prepareStatement(command.sql())) {
          for (int i = 0; i < command.parameters().size(); i++) {
            statement.setString(i + 1, command.parameters().get(i));
          }
          statement.execute();
        }
      }
    } catch (final SQLException e) {
      log.warn("Connection '{}' command rejected, reconnecting: {}", name, e.getMessage());
      command
          .future()
          .completeExceptionally(
              new NotifierException("Command rejected by PostgreSQL: " + e.getMessage(), e));
      throw e;
    } catch (final RuntimeException e) {
      command
          .future()
          .completeExceptionally(
              new ConnectionLostException("Driver failed running command: " + e.getMessage(), e));
      throw e;
    }

    if (log.isDebugEnabled()) {
      log.debug("Connection '{}' executed: {}", name, command.sql());
    }
    command.future().complete(null);
  }

  private void deliver(final PGNotification[] notifications, final ConnectionHandler handler) {
    if (notifications == null) {
      return;
    }
    for (final var notification : notifications) {
      final var payload = notification.getParameter();
      handler.onNotification(notification.getName(), payload == null ? "" : payload);
    }
  }

  private void failPending(final NotifierException cause) {
    final List<PendingCommand> pending = new ArrayList<>();
    commands.drainTo(pending);
    pending.forEach(command -> command.future().completeExceptionally(cause));

    if (!pending.isEmpty() && log.isDebugEnabled()) {
      log.debug("Connection '{}' failed {} queued command(s)", name, pending.size());
    }
  }

  private ConnectionLostException notConnected() {
    return new ConnectionLostException("Connection '" + name + "' is not connected to PostgreSQL");
  }

  private boolean pause(final Duration delay) {
    if (log.isDebugEnabled()) {
      log.debug("Connection '{}' reconnecting in {} ms", name, delay.toMillis());
    }
    try {
      Thread.sleep(delay.toMillis());
      return !closed.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void closeQuietly(final Connection connection) {
    try {
      connection.close();
    } catch (final SQLException e) {
      log.debug("Connection '{}' close failed: {}", name, e.getMessage());
    }
  }

  private record PendingCommand(String sql, List<String> parameters, CompletableFuture<Void> future) {}
}
