/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.macstab.oss.postgres.notifier.liveness.LivenessHandle;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Two-sided map between channels and listeners.
 *
 * <ul>
 *   <li>{@code channels}: channel name → listeners interested in it (relay fan-out order)
 *   <li>{@code listeners}: listener → liveness handle + channel set
 * </ul>
 *
 * <p><strong>Invariants (hold after every public call):</strong>
 *
 * <ol>
 *   <li>A channel is a key of {@code channels} iff at least one listener lists it. No empty lists.
 *   <li>A listener has exactly one handle while it holds at least one channel. The handle is
 *       created on the first subscription and released exactly once, when the set becomes empty.
 * </ol>
 *
 * <p>Mutators return the <em>delta</em>: channels whose subscriber count moved from or to zero.
 * Only those need a LISTEN/UNLISTEN at the database.
 *
 * <p><strong>Not thread-safe.</strong> Confined to the notifier thread.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ListenerRegistry {

  Map<String, List<NotificationListener>> channels = new LinkedHashMap<>();
  Map<NotificationListener, Registration> listeners = new LinkedHashMap<>();
  Function<NotificationListener, LivenessHandle> handleFactory;

  /**
   * Creates an empty registry.
   *
   * @param handleFactory creates the liveness handle for a listener's first subscription
   */
  public ListenerRegistry(
      @NonNull final Function<NotificationListener, LivenessHandle> handleFactory) {
    this.handleFactory = handleFactory;
  }

  /**
   * Registers interest of a listener in channels.
   *
   * @return channels that had no subscriber before (LISTEN delta), in argument order
   */
  public Set<String> addListener(
      @NonNull final NotificationListener listener, @NonNull final Collection<String> channelNames) {

    if (channelNames.isEmpty()) {
      return Set.of();
    }

    final var registration =
        listeners.computeIfAbsent(listener, l -> new Registration(handleFactory.apply(l)));

    final Set<String> added = new LinkedHashSet<>();
    for (final var channel : channelNames) {
      if (!registration.channels.add(channel)) {
        continue; // already subscribed
      }

      final var subscribers = channels.computeIfAbsent(channel, c -> new ArrayList<>(2));
      if (subscribers.isEmpty()) {
        added.add(channel);
      }
      subscribers.add(listener);
    }
    return added;
  }

  /**
   * Withdraws interest of a listener in channels. Unknown listeners and channels are ignored.
   *
   * @return channels left without subscribers (UNLISTEN delta), in argument order
   */
  public Set<String> removeListenerChannels(
      @NonNull final NotificationListener listener, @NonNull final Collection<String> channelNames) {

    final var registration = listeners.get(listener);
    if (registration == null) {
      return Set.of();
    }

    final Set<String> removed = new LinkedHashSet<>();
    for (final var channel : channelNames) {
      if (!registration.channels.remove(channel)) {
        continue;
      }

      final var subscribers = channels.get(channel);
      subscribers.remove(listener);
      if (subscribers.isEmpty()) {
        channels.remove(channel);
        removed.add(channel);
      }
    }

    if (registration.channels.isEmpty()) {
      listeners.remove(listener);
      registration.handle.release();
    }
    return removed;
  }

  /**
   * Removes a listener entirely (termination path).
   *
   * @return channels left without subscribers
   */
  public Set<String> removeListener(@NonNull final NotificationListener listener) {
    final var registration = listeners.get(listener);
    if (registration == null) {
      return Set.of();
    }
    return removeListenerChannels(listener, List.copyOf(registration.channels));
  }

  /** Snapshot of a channel's subscribers; empty when nobody listens. */
  public List<NotificationListener> subscribersOf(final String channel) {
    final var subscribers = channels.get(channel);
    return subscribers == null ? List.of() : List.copyOf(subscribers);
  }

  /** Snapshot of all registered channels, in registration order. */
  public Set<String> channels() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(channels.keySet()));
  }

  /** Snapshot of a listener's channels; empty for unknown listeners. */
  public Set<String> channelsOf(final NotificationListener listener) {
    final var registration = listeners.get(listener);
    return registration == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(registration.channels));
  }

  /** Liveness handle currently held for a listener. */
  public Optional<LivenessHandle> handleOf(final NotificationListener listener) {
    return Optional.ofNullable(listeners.get(listener)).map(registration -> registration.handle);
  }

  public boolean isEmpty() {
    return channels.isEmpty();
  }

  public int channelCount() {
    return channels.size();
  }

  public int listenerCount() {
    return listeners.size();
  }

  /** Releases every handle and forgets all state. */
  public void clear() {
    listeners.values().forEach(registration -> registration.handle.release());
    listeners.clear();
    channels.clear();
  }

  @FieldDefaults(level = PRIVATE, makeFinal = true)
  private static final class Registration {

    LivenessHandle handle;
    Set<String> channels = new LinkedHashSet<>();

    Registration(final LivenessHandle handle) {
      this.handle = handle;
    }
  }
}
