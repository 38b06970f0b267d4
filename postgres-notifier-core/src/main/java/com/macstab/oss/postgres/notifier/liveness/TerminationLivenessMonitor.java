/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.liveness;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.macstab.oss.postgres.notifier.NotificationListener;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LivenessMonitor} driven by {@link NotificationListener#termination()}.
 *
 * <p>Listeners returning {@link NotificationListener#NEVER_TERMINATES} get {@link
 * LivenessHandle#NONE}: nothing is attached to a stage that cannot complete.
 */
@Slf4j
public final class TerminationLivenessMonitor implements LivenessMonitor {

  public static final TerminationLivenessMonitor INSTANCE = new TerminationLivenessMonitor();

  @Override
  public LivenessHandle watch(
      @NonNull final NotificationListener listener,
      @NonNull final Consumer<NotificationListener> onTerminated) {

    final var termination = listener.termination();
    if (termination == null || termination == NotificationListener.NEVER_TERMINATES) {
      return LivenessHandle.NONE;
    }

    final var handle = new WatchHandle();
    termination.whenComplete(
        (ignored, error) -> {
          if (handle.fire()) {
            if (log.isDebugEnabled()) {
              log.debug("Listener {} terminated", listener, error);
            }
            onTerminated.accept(listener);
          }
        });
    return handle;
  }

  /** Released and fired share one flag, so the callback runs at most once and never after release. */
  private static final class WatchHandle implements LivenessHandle {

    private final AtomicBoolean done = new AtomicBoolean();

    boolean fire() {
      return done.compareAndSet(false, true);
    }

    @Override
    public void release() {
      done.set(true);
    }
  }
}
