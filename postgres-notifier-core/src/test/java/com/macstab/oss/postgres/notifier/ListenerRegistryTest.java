/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ListenerRegistry}.
 *
 * <p>Both invariants are checked after every mutation: no channel without subscribers, and
 * exactly one handle per listener holding channels.
 */
@DisplayName("ListenerRegistry")
class ListenerRegistryTest {

  private final NotificationListener l1 = notification -> {};
  private final NotificationListener l2 = notification -> {};

  private AtomicInteger created;
  private AtomicInteger released;
  private ListenerRegistry registry;

  @BeforeEach
  void setUp() {
    created = new AtomicInteger();
    released = new AtomicInteger();
    registry =
        new ListenerRegistry(
            listener -> {
              created.incrementAndGet();
              return released::incrementAndGet;
            });
  }

  private void assertInvariants() {
    for (final var channel : registry.channels()) {
      assertThat(registry.subscribersOf(channel)).as("subscribers of %s", channel).isNotEmpty();
    }
    assertThat(created.get() - released.get()).isEqualTo(registry.listenerCount());
  }

  @Nested
  @DisplayName("addListener")
  class AddListener {

    @Test
    @DisplayName("returns only channels that had no subscriber")
    void addListener_ReturnsDelta() {
      // Act
      final var first = registry.addListener(l1, List.of("a", "b"));
      final var second = registry.addListener(l2, List.of("b", "c"));

      // Assert
      assertThat(first).containsExactly("a", "b");
      assertThat(second).containsExactly("c");
      assertThat(registry.subscribersOf("b")).containsExactly(l1, l2);
      assertInvariants();
    }

    @Test
    @DisplayName("re-adding held channels changes nothing")
    void addListener_Idempotent() {
      // Arrange
      registry.addListener(l1, List.of("a"));

      // Act
      final var delta = registry.addListener(l1, List.of("a"));

      // Assert
      assertThat(delta).isEmpty();
      assertThat(registry.subscribersOf("a")).containsExactly(l1);
      assertThat(created.get()).isEqualTo(1);
      assertInvariants();
    }

    @Test
    @DisplayName("handle is created once per listener")
    void addListener_OneHandlePerListener() {
      // Act
      registry.addListener(l1, List.of("a"));
      registry.addListener(l1, List.of("b"));

      // Assert
      assertThat(created.get()).isEqualTo(1);
      assertThat(registry.handleOf(l1)).isPresent();
      assertThat(registry.channelsOf(l1)).containsExactly("a", "b");
    }

    @Test
    @DisplayName("empty channel list registers nothing")
    void addListener_Empty() {
      assertThat(registry.addListener(l1, List.of())).isEmpty();
      assertThat(registry.listenerCount()).isZero();
      assertThat(created.get()).isZero();
    }
  }

  @Nested
  @DisplayName("removeListenerChannels")
  class RemoveListenerChannels {

    @Test
    @DisplayName("returns only channels left without subscribers")
    void remove_ReturnsDelta() {
      // Arrange
      registry.addListener(l1, List.of("a", "b"));
      registry.addListener(l2, List.of("b"));

      // Act
      final var delta = registry.removeListenerChannels(l1, List.of("a", "b"));

      // Assert
      assertThat(delta).containsExactly("a");
      assertThat(registry.channels()).containsExactly("b");
      assertThat(registry.subscribersOf("b")).containsExactly(l2);
      assertInvariants();
    }

    @Test
    @DisplayName("releases the handle exactly once when the last channel goes")
    void remove_ReleasesHandleOnce() {
      // Arrange
      registry.addListener(l1, List.of("a", "b"));

      // Act
      registry.removeListenerChannels(l1, List.of("a"));
      assertThat(released.get()).isZero();
      registry.removeListenerChannels(l1, List.of("b"));
      registry.removeListenerChannels(l1, List.of("b"));

      // Assert
      assertThat(released.get()).isEqualTo(1);
      assertThat(registry.handleOf(l1)).isEmpty();
      assertThat(registry.isEmpty()).isTrue();
      assertInvariants();
    }

    @Test
    @DisplayName("unknown listener and channels are ignored")
    void remove_Unknown() {
      // Arrange
      registry.addListener(l1, List.of("a"));

      // Act & Assert
      assertThat(registry.removeListenerChannels(l2, List.of("a"))).isEmpty();
      assertThat(registry.removeListenerChannels(l1, List.of("zzz"))).isEmpty();
      assertThat(registry.subscribersOf("a")).containsExactly(l1);
      assertInvariants();
    }
  }

  @Test
  @DisplayName("removeListener drops every channel of the listener")
  void removeListener_All() {
    // Arrange
    registry.addListener(l1, List.of("a", "b"));
    registry.addListener(l2, List.of("b"));

    // Act
    final var delta = registry.removeListener(l1);

    // Assert
    assertThat(delta).containsExactly("a");
    assertThat(registry.listenerCount()).isEqualTo(1);
    assertThat(registry.channelCount()).isEqualTo(1);
    assertInvariants();
  }

  @Test
  @DisplayName("clear releases every handle")
  void clear_ReleasesAll() {
    // Arrange
    registry.addListener(l1, List.of("a"));
    registry.addListener(l2, List.of("b"));

    // Act
    registry.clear();

    // Assert
    assertThat(released.get()).isEqualTo(2);
    assertThat(registry.isEmpty()).isTrue();
    assertThat(registry.listenerCount()).isZero();
  }

  @Test
  @DisplayName("snapshots are detached from later mutations")
  void snapshots_Detached() {
    // Arrange
    registry.addListener(l1, List.of("a"));
    final var subscribers = registry.subscribersOf("a");
    final var channels = registry.channels();

    // Act
    registry.addListener(l2, List.of("a", "b"));

    // Assert
    assertThat(subscribers).containsExactly(l1);
    assertThat(channels).containsExactly("a");
    assertThat(registry.subscribersOf("missing")).isEmpty();
    assertThat(registry.handleOf(l2)).isPresent();
  }
}
