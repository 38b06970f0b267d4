/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import lombok.experimental.FieldDefaults;

/**
 * Listener that queues notifications for a consumer thread.
 *
 * <p>The notifier thread only enqueues, so a slow consumer never stalls other listeners. Closing
 * the mailbox completes {@link #termination()}, after which the notifier removes every
 * subscription of this mailbox on its own.
 *
 * <pre>{@code
 * try (MailboxListener mailbox = new MailboxListener()) {
 *   notifier.subscribe(mailbox, "job_insert");
 *   Notification next = mailbox.poll(Duration.ofSeconds(1));
 * }
 * }</pre>
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class MailboxListener implements NotificationListener, AutoCloseable {

  BlockingQueue<Notification> queue = new LinkedBlockingQueue<>();
  CompletableFuture<Void> terminated = new CompletableFuture<>();
  CompletionStage<Void> terminationView = terminated.minimalCompletionStage();

  @Override
  public void onNotification(final Notification notification) {
    if (!terminated.isDone()) {
      queue.offer(notification);
    }
  }

  @Override
  public CompletionStage<Void> termination() {
    return terminationView;
  }

  /**
   * Waits for the next notification.
   *
   * @param timeout maximum wait
   * @return next notification, or {@code null} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public Notification poll(final Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** Removes and returns everything queued so far. */
  public List<Notification> drain() {
    final List<Notification> drained = new ArrayList<>();
    queue.drainTo(drained);
    return drained;
  }

  public int size() {
    return queue.size();
  }

  public boolean isClosed() {
    return terminated.isDone();
  }

  /** Terminates the mailbox. Queued notifications stay readable. Idempotent. */
  @Override
  public void close() {
    terminated.complete(null);
  }
}
