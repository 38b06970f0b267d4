/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.liveness;

import java.util.function.Consumer;

import com.macstab.oss.postgres.notifier.NotificationListener;

/**
 * Detects listener termination without polling.
 *
 * <p>The notifier creates one handle per distinct listener, on its first subscription, and
 * releases it when the listener holds no more topics.
 *
 * <p><strong>Threading contract:</strong> {@code onTerminated} may run on any thread, including the
 * caller of {@link #watch} if the listener is already gone. Implementations must not start it
 * once {@link LivenessHandle#release()} has run; a callback racing with release can still arrive,
 * and the notifier drops callbacks for handles it no longer holds.
 */
public interface LivenessMonitor {

  /**
   * Starts watching a listener.
   *
   * @param listener listener to watch
   * @param onTerminated callback receiving the listener once it terminated
   * @return handle that stops watching when released
   */
  LivenessHandle watch(NotificationListener listener, Consumer<NotificationListener> onTerminated);
}
