/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.macstab.oss.postgres.notifier.NotifierMessage.CommandCompleted;
import com.macstab.oss.postgres.notifier.NotifierMessage.Connected;
import com.macstab.oss.postgres.notifier.NotifierMessage.Disconnected;
import com.macstab.oss.postgres.notifier.NotifierMessage.Inbound;
import com.macstab.oss.postgres.notifier.NotifierMessage.ListenerDown;
import com.macstab.oss.postgres.notifier.NotifierMessage.Stop;
import com.macstab.oss.postgres.notifier.NotifierMessage.Subscribe;
import com.macstab.oss.postgres.notifier.NotifierMessage.Unsubscribe;
import com.macstab.oss.postgres.notifier.connection.ConnectionHandler;
import com.macstab.oss.postgres.notifier.connection.NotificationConnection;
import com.macstab.oss.postgres.notifier.connection.PgConnectionSettings;
import com.macstab.oss.postgres.notifier.connection.PgJdbcNotificationConnection;
import com.macstab.oss.postgres.notifier.liveness.LivenessHandle;
import com.macstab.oss.postgres.notifier.liveness.LivenessMonitor;
import com.macstab.oss.postgres.notifier.liveness.TerminationLivenessMonitor;
import com.macstab.oss.postgres.notifier.metrics.NotifierMetrics;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Pub/sub relay on PostgreSQL {@code LISTEN}/{@code NOTIFY}.
 *
 * <p>Many in-process {@link NotificationListener}s subscribe to topics. Their interest is
 * multiplexed onto one database connection, and inbound notifications are fanned out to exactly
 * the listeners of the notification's topic.
 *
 * <p><strong>Architecture:</strong>
 *
 * <pre>
 * callers ──subscribe/unsubscribe──┐
 * liveness ──listener down─────────┤
 * I/O thread ──connect/notify──────┼──→ mailbox ──→ notifier thread ──→ registry, commands, fan-out
 * command futures ──completed──────┘
 * callers ──publish──────────────────────────────────────────────────→ connection (direct)
 * </pre>
 *
 * <p>All registry state is confined to the notifier thread ({@code postgres-notifier-<name>}), so
 * the three sources of change (application calls, listener termination, connection loss) are
 * serialized without locks.
 *
 * <p><strong>Round trips:</strong> only channels whose subscriber count moves from or to zero
 * reach the database, batched into one {@code DO} block per request. A successful {@link
 * #subscribe} returns after PostgreSQL acknowledged the LISTEN, so anything published afterwards
 * is delivered.
 *
 * <p><strong>One command in flight:</strong> while a LISTEN/UNLISTEN issued by the notifier runs,
 * subscribe, unsubscribe, listener-down and connect messages are stashed and replayed in arrival
 * order. Notifications and disconnects are handled on arrival. Publishing bypasses the mailbox.
 *
 * <p><strong>Reconnect:</strong> the registry survives connection loss. On every connect the
 * notifier issues one LISTEN for all registered channels. Notifications sent while disconnected
 * are lost.
 *
 * <p><strong>Usage:</strong>
 *
 * <pre>{@code
 * try (var notifier = PostgresNotifier.create(NotifierConfig.defaults(), settings);
 *     var inbox = new MailboxListener()) {
 *   notifier.start();
 *   notifier.subscribe(inbox, "job_insert");
 *   notifier.publish("job_insert", "{\"queue\":\"default\"}");
 *   Notification n = inbox.poll(Duration.ofSeconds(1));
 * }
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class PostgresNotifier implements AutoCloseable {

  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

  NotifierConfig config;
  String name;
  ChannelNames channelNames;
  NotificationConnection connection;
  LivenessMonitor livenessMonitor;
  NotifierMetrics metrics;
  ObjectMapper objectMapper;

  BlockingQueue<NotifierMessage> mailbox = new LinkedBlockingQueue<>();
  CompletableFuture<Void> termination = new CompletableFuture<>();
  AtomicBoolean terminated = new AtomicBoolean();
  Object lifecycleLock = new Object();

  // notifier-thread state
  ListenerRegistry registry;
  Deque<NotifierMessage> stash = new ArrayDeque<>();
  @NonFinal InFlightCommand inFlight;
  @NonFinal NotifierMessage handling;
  @NonFinal long lastCommandId;

  @NonFinal volatile boolean connected;
  @NonFinal volatile boolean stopRequested;
  @NonFinal volatile Thread notifierThread;

  public PostgresNotifier(
      @NonNull final NotifierConfig config, @NonNull final NotificationConnection connection) {
    this(config, connection, NotifierMetrics.NOOP);
  }

  public PostgresNotifier(
      @NonNull final NotifierConfig config,
      @NonNull final NotificationConnection connection,
      @NonNull final NotifierMetrics metrics) {
    this(config, connection, metrics, TerminationLivenessMonitor.INSTANCE, new ObjectMapper());
  }

  public PostgresNotifier(
      @NonNull final NotifierConfig config,
      @NonNull final NotificationConnection connection,
      @NonNull final NotifierMetrics metrics,
      @NonNull final LivenessMonitor livenessMonitor,
      @NonNull final ObjectMapper objectMapper) {
    this.config = config;
    this.name = config.getName();
    this.channelNames = new ChannelNames(config.getPrefix());
    this.connection = connection;
    this.metrics = metrics;
    this.livenessMonitor = livenessMonitor;
    this.objectMapper = objectMapper;
    this.registry = new ListenerRegistry(this::watch);
  }

  /**
   * Creates a notifier on a dedicated pgjdbc connection.
   *
   * @param config notifier config
   * @param settings connection settings
   * @return notifier, not yet started
   */
  public static PostgresNotifier create(
      @NonNull final NotifierConfig config, @NonNull final PgConnectionSettings settings) {
    return new PostgresNotifier(config, new PgJdbcNotificationConnection(config.getName(), settings));
  }

  // ==================== Lifecycle ====================

  /**
   * Starts the notifier thread, then the connection. Connecting happens in the background.
   *
   * @throws IllegalStateException if already started or closed
   */
  public void start() {
    synchronized (lifecycleLock) {
      checkNotClosed();
      if (notifierThread != null) {
        throw new IllegalStateException("Notifier '" + name + "' already started");
      }
      final var thread = new Thread(this::runLoop, "postgres-notifier-" + name);
      thread.setDaemon(true);
      notifierThread = thread;
      thread.start();
    }

    connection.start(new MailboxConnectionHandler());

    if (log.isInfoEnabled()) {
      log.info("Started notifier '{}' (prefix '{}')", name, config.getPrefix());
    }
  }

  /**
   * Stops the notifier. Waiting and stashed callers fail with {@link NotifierException}, every
   * liveness handle is released and the connection is closed. Idempotent.
   */
  @Override
  public void close() {
    final Thread thread;
    synchronized (lifecycleLock) {
      if (stopRequested) {
        return;
      }
      stopRequested = true;
      thread = notifierThread;
    }

    if (thread == null) {
      shutdown(null);
      return;
    }

    mailbox.add(new Stop());
    if (thread != Thread.currentThread()) {
      try {
        thread.join(STOP_TIMEOUT.toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (thread.isAlive()) {
        log.warn("Notifier '{}' did not stop within {}", name, STOP_TIMEOUT);
      }
    }
  }

  /** Completes normally on {@link #close()}, exceptionally when the notifier failed. */
  public CompletableFuture<Void> terminationFuture() {
    return termination.copy();
  }

  public boolean isRunning() {
    return notifierThread != null && !terminated.get();
  }

  /** Connection state as last seen by the notifier thread. */
  public boolean isConnected() {
    return connected;
  }

  public String getName() {
    return name;
  }

  public NotifierConfig getConfig() {
    return config;
  }

  // ==================== Subscribe / unsubscribe ====================

  /**
   * Subscribes a listener to topics and waits until PostgreSQL listens on every new channel.
   *
   * <p>Idempotent per listener and topic. When disconnected the subscription is recorded and the
   * LISTEN is issued on the next connect. The same holds when the connection drops while the
   * LISTEN runs: the call returns normally and the reconnect listens on the recorded channels.
   *
   * @throws IllegalArgumentException if a topic is malformed (before anything changes)
   * @throws NotifierException if the LISTEN was rejected, the call timed out or the notifier
   *     terminated
   */
  public void subscribe(
      @NonNull final NotificationListener listener, @NonNull final Collection<String> topics) {
    await(subscribeAsync(listener, topics), "subscribe");
  }

  public void subscribe(@NonNull final NotificationListener listener, final String... topics) {
    subscribe(listener, Arrays.asList(topics));
  }

  /** Non-blocking {@link #subscribe}; the future completes when the notifier replies. */
  public CompletableFuture<Void> subscribeAsync(
      @NonNull final NotificationListener listener, @NonNull final Collection<String> topics) {
    checkNotClosed();
    final var channels = channelNames.toChannels(topics);
    final var reply = new CompletableFuture<Void>();
    return request(new Subscribe(listener, channels, reply), reply);
  }

  /**
   * Withdraws a listener's interest in topics and waits for the UNLISTEN of channels nobody else
   * needs. Unknown listeners and topics are ignored.
   */
  public void unsubscribe(
      @NonNull final NotificationListener listener, @NonNull final Collection<String> topics) {
    await(unsubscribeAsync(listener, topics), "unsubscribe");
  }

  public void unsubscribe(@NonNull final NotificationListener listener, final String... topics) {
    unsubscribe(listener, Arrays.asList(topics));
  }

  /** Non-blocking {@link #unsubscribe}. */
  public CompletableFuture<Void> unsubscribeAsync(
      @NonNull final NotificationListener listener, @NonNull final Collection<String> topics) {
    checkNotClosed();
    final var channels = channelNames.toChannels(topics);
    final var reply = new CompletableFuture<Void>();
    return request(new Unsubscribe(listener, channels, reply), reply);
  }

  // ==================== Publish ====================

  /**
   * Sends each payload as one notification on the topic's channel, in one query.
   *
   * <p>Does not wait for the notifier thread. PostgreSQL delivers notifications on commit and
   * folds identical payloads sent within one transaction.
   *
   * @param topic target topic
   * @param payloads pre-serialized payloads, sent in order
   * @return completes when the query ran; ignoring it is fine
   * @throws IllegalArgumentException if the topic is malformed
   */
  public CompletableFuture<Void> publish(
      @NonNull final String topic, @NonNull final Collection<String> payloads) {
    checkNotClosed();
    final var channel = channelNames.toChannel(topic);
    if (payloads.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }

    final String batch;
    try {
      batch = objectMapper.writeValueAsString(List.copyOf(payloads));
    } catch (final JsonProcessingException e) {
      throw new NotifierException("Cannot encode payload batch for topic '" + topic + "'", e);
    }

    final int count = payloads.size();
    return connection
        .execute(ListenCommands.PUBLISH_SQL, List.of(channel, batch))
        .whenComplete(
            (ignored, error) -> {
              metrics.recordCommand(name, "publish", error == null);
              if (error == null) {
                metrics.recordPublished(name, topic, count);
              } else {
                log.warn("Notifier '{}' publish to '{}' failed: {}", name, topic, error.getMessage());
              }
            });
  }

  public CompletableFuture<Void> publish(@NonNull final String topic, final String... payloads) {
    return publish(topic, Arrays.asList(payloads));
  }

  /**
   * Encodes each message as JSON with the notifier's {@link ObjectMapper} and publishes the
   * results.
   */
  public CompletableFuture<Void> publishJson(
      @NonNull final String topic, @NonNull final Collection<?> messages) {
    final List<String> payloads = new ArrayList<>(messages.size());
    for (final var message : messages) {
      try {
        payloads.add(objectMapper.writeValueAsString(message));
      } catch (final JsonProcessingException e) {
        throw new NotifierException("Cannot encode message for topic '" + topic + "'", e);
      }
    }
    return publish(topic, payloads);
  }

  // ==================== Caller side ====================

  private CompletableFuture<Void> request(
      final NotifierMessage message, final CompletableFuture<Void> reply) {
    mailbox.add(message);
    // shutdown sets the flag before draining the mailbox, so this or the drain fails the reply
    if (terminated.get()) {
      reply.completeExceptionally(closedException());
    }
    return reply;
  }

  private void await(final CompletableFuture<Void> reply, final String operation) {
    final var timeout = config.getCallTimeout();
    try {
      reply.get(timeout.toMillis(), MILLISECONDS);
    } catch (final TimeoutException e) {
      throw new NotifierException(
          "Notifier '" + name + "' " + operation + " timed out after " + timeout, e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotifierException("Interrupted during " + operation, e);
    } catch (final ExecutionException e) {
      final var cause = e.getCause();
      throw new NotifierException(
          "Notifier '" + name + "' " + operation + " failed: " + cause.getMessage(), cause);
    }
  }

  private void checkNotClosed() {
    if (stopRequested || terminated.get()) {
      throw new IllegalStateException("Notifier '" + name + "' is closed");
    }
  }

  private NotifierException closedException() {
    return new NotifierException("Notifier '" + name + "' is closed");
  }

  // ==================== Notifier thread ====================

  private void runLoop() {
    Throwable failure = null;
    boolean stopped = false;
    try {
      while (true) {
        final var message = mailbox.take();
        if (message instanceof Stop) {
          stopped = true;
          break;
        }
        handle(message);
        handling = null;
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      failure = new NotifierException("Notifier thread interrupted", e);
    } catch (final RuntimeException e) {
      failure = e;
    } finally {
      if (!stopped && failure == null) {
        failure = new NotifierException("Notifier thread died unexpectedly");
      }
      shutdown(failure);
    }
  }

  private void handle(final NotifierMessage message) {
    if (inFlight != null && message.deferrable()) {
      stash.addLast(message);
      return;
    }

    handling = message;
    if (message instanceof Subscribe subscribe) {
      onSubscribe(subscribe);
    } else if (message instanceof Unsubscribe unsubscribe) {
      onUnsubscribe(unsubscribe);
    } else if (message instanceof ListenerDown down) {
      onListenerDown(down);
    } else if (message instanceof Connected) {
      onConnected();
    } else if (message instanceof Disconnected) {
      onDisconnected();
    } else if (message instanceof Inbound inbound) {
      relay(inbound.channel(), inbound.payload());
    } else if (message instanceof CommandCompleted completed) {
      onCommandCompleted(completed);
    }
  }

  private void onSubscribe(final Subscribe message) {
    final var added = registry.addListener(message.listener(), message.channels());
    publishRegistrySize();

    if (log.isDebugEnabled()) {
      log.debug(
          "Notifier '{}' subscribed {} to {} (new channels: {})",
          name,
          message.listener(),
          message.channels(),
          added);
    }

    if (!connected || added.isEmpty()) {
      message.reply().complete(null);
      return;
    }
    issue(CommandKind.LISTEN, ListenCommands.listen(added), message.reply());
  }

  private void onUnsubscribe(final Unsubscribe message) {
    final var removed = registry.removeListenerChannels(message.listener(), message.channels());
    publishRegistrySize();

    if (log.isDebugEnabled()) {
      log.debug(
          "Notifier '{}' unsubscribed {} from {} (released channels: {})",
          name,
          message.listener(),
          message.channels(),
          removed);
    }

    if (!connected || removed.isEmpty()) {
      message.reply().complete(null);
      return;
    }
    issue(CommandKind.UNLISTEN, ListenCommands.unlisten(removed), message.reply());
  }

  private void onListenerDown(final ListenerDown message) {
    final var current = registry.handleOf(message.listener());
    if (current.isEmpty() || current.get() != message.handle().get()) {
      return; // stale: listener already unsubscribed everything
    }

    final var removed = registry.removeListener(message.listener());
    publishRegistrySize();

    if (log.isDebugEnabled()) {
      log.debug(
          "Notifier '{}' removed terminated listener {} (released channels: {})",
          name,
          message.listener(),
          removed);
    }

    if (connected && !removed.isEmpty()) {
      issue(CommandKind.UNLISTEN, ListenCommands.unlisten(removed), null);
    }
  }

  private void onConnected() {
    connected = true;
    metrics.setConnected(name, true);

    if (log.isInfoEnabled()) {
      log.info("Notifier '{}' connected, listening on {} channel(s)", name, registry.channelCount());
    }

    if (!registry.isEmpty()) {
      issue(CommandKind.LISTEN, ListenCommands.listen(registry.channels()), null);
    }
  }

  private void onDisconnected() {
    connected = false;
    metrics.setConnected(name, false);
    // a connect stashed before this disconnect is stale
    stash.removeIf(Connected.class::isInstance);
    log.warn("Notifier '{}' disconnected, {} channel(s) kept", name, registry.channelCount());
  }

  private void relay(final String channel, final String payload) {
    final var subscribers = registry.subscribersOf(channel);
    if (subscribers.isEmpty()) {
      metrics.recordNotificationDiscarded(name);
      if (log.isDebugEnabled()) {
        log.debug("Notifier '{}' discarded notification on unwatched channel {}", name, channel);
      }
      return;
    }

    final var topic = channelNames.toTopic(channel);
    final var notification = new Notification(config, topic, payload);
    for (final var listener : subscribers) {
      try {
        listener.onNotification(notification);
      } catch (final RuntimeException e) {
        log.warn("Listener {} failed on topic '{}' of notifier '{}'", listener, topic, name, e);
      }
    }
    metrics.recordNotificationRelayed(name, topic, subscribers.size());
  }

  private void issue(
      final CommandKind kind, final String sql, final CompletableFuture<Void> replyOrNull) {
    final long id = ++lastCommandId;
    inFlight = new InFlightCommand(id, kind, replyOrNull);

    if (log.isDebugEnabled()) {
      log.debug("Notifier '{}' issuing command #{}: {}", name, id, sql);
    }

    CompletableFuture<Void> result;
    try {
      result = connection.execute(sql);
    } catch (final RuntimeException e) {
      result = CompletableFuture.failedFuture(e);
    }
    result.whenComplete((ignored, error) -> mailbox.add(new CommandCompleted(id, error)));
  }

  private void onCommandCompleted(final CommandCompleted message) {
    final var command = inFlight;
    if (command == null || command.id() != message.commandId()) {
      return;
    }
    inFlight = null;

    final var error = unwrap(message.error());
    metrics.recordCommand(name, command.kind().metricName(), error == null);

    if (error == null || error instanceof ConnectionLostException) {
      // a lost session is rebuilt from the registry on reconnect, the caller's request stands
      if (error != null && log.isDebugEnabled()) {
        log.debug(
            "Notifier '{}' {} cut off by disconnect: {}", name, command.kind(), error.getMessage());
      }
      if (command.reply() != null) {
        command.reply().complete(null);
      }
    } else {
      log.warn("Notifier '{}' {} failed: {}", name, command.kind(), error.getMessage());
      if (command.reply() != null) {
        command
            .reply()
            .completeExceptionally(
                error instanceof NotifierException
                    ? error
                    : new NotifierException(command.kind() + " failed", error));
      }
    }

    while (inFlight == null && !stash.isEmpty()) {
      handle(stash.pollFirst());
    }
  }

  private LivenessHandle watch(final NotificationListener listener) {
    final var handle = new AtomicReference<LivenessHandle>();
    handle.set(
        livenessMonitor.watch(listener, gone -> mailbox.add(new ListenerDown(gone, handle))));
    return handle.get();
  }

  private void publishRegistrySize() {
    metrics.setRegistrySize(name, registry.channelCount(), registry.listenerCount());
  }

  private void shutdown(final Throwable cause) {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    stopRequested = true;

    final var error =
        cause == null
            ? closedException()
            : new NotifierException("Notifier '" + name + "' terminated: " + cause.getMessage(), cause);

    if (inFlight != null && inFlight.reply() != null) {
      inFlight.reply().completeExceptionally(error);
    }
    inFlight = null;

    // message whose handling failed
    if (handling != null && handling.replyOrNull() != null) {
      handling.replyOrNull().completeExceptionally(error);
    }
    handling = null;

    final List<NotifierMessage> abandoned = new ArrayList<>(stash);
    stash.clear();
    mailbox.drainTo(abandoned);
    for (final var message : abandoned) {
      final var reply = message.replyOrNull();
      if (reply != null) {
        reply.completeExceptionally(error);
      }
    }

    registry.clear();
    connected = false;

    try {
      connection.close();
    } catch (final RuntimeException e) {
      log.warn("Notifier '{}' failed to close its connection", name, e);
    }
    metrics.setConnected(name, false);
    metrics.close(name);

    if (cause == null) {
      if (log.isInfoEnabled()) {
        log.info("Stopped notifier '{}'", name);
      }
      termination.complete(null);
    } else {
      log.error("Notifier '{}' terminated", name, cause);
      termination.completeExceptionally(cause);
    }
  }

  private static Throwable unwrap(final Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  /** Translates connection events into mailbox messages. Runs on the connection I/O thread. */
  private final class MailboxConnectionHandler implements ConnectionHandler {

    @Override
    public void onConnect() {
      mailbox.add(new Connected());
    }

    @Override
    public void onDisconnect() {
      mailbox.add(new Disconnected());
    }

    @Override
    public void onNotification(final String channel, final String payload) {
      mailbox.add(new Inbound(channel, payload));
    }
  }

  private enum CommandKind {
    LISTEN,
    UNLISTEN;

    String metricName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** {@code reply} is null for commands nobody waits on (reconnect, liveness cleanup). */
  private record InFlightCommand(long id, CommandKind kind, CompletableFuture<Void> reply) {}
}
