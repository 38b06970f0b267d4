/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.metrics.micrometer;

import static com.macstab.oss.postgres.notifier.metrics.micrometer.MetricsConfiguration.*;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MicrometerNotifierMetrics}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("MicrometerNotifierMetrics")
class MicrometerNotifierMetricsTest {

  private SimpleMeterRegistry registry;
  private MicrometerNotifierMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerNotifierMetrics(registry);
  }

  @Nested
  @DisplayName("Relay")
  class Relay {

    @Test
    @DisplayName("should count relayed notifications and record recipients per topic")
    void shouldCountRelayedNotifications() {
      // Act
      metrics.recordNotificationRelayed("main", "orders", 3);
      metrics.recordNotificationRelayed("main", "orders", 1);

      // Assert
      assertThat(
              registry
                  .get(NOTIFICATIONS_RELAYED)
                  .tag(TAG_NOTIFIER_NAME, "main")
                  .tag(TAG_TOPIC, "orders")
                  .counter()
                  .count())
          .isEqualTo(2.0);
      final var recipients =
          registry.get(NOTIFICATION_RECIPIENTS).tag(TAG_TOPIC, "orders").summary();
      assertThat(recipients.count()).isEqualTo(2);
      assertThat(recipients.totalAmount()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("should count discarded notifications")
    void shouldCountDiscardedNotifications() {
      // Act
      metrics.recordNotificationDiscarded("main");

      // Assert
      assertThat(registry.get(NOTIFICATIONS_DISCARDED).tag(TAG_NOTIFIER_NAME, "main").counter().count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Commands")
  class Commands {

    @Test
    @DisplayName("should tag commands with their outcome")
    void shouldTagCommandsWithOutcome() {
      // Act
      metrics.recordCommand("main", "listen", true);
      metrics.recordCommand("main", "listen", false);
      metrics.recordCommand("main", "listen", true);

      // Assert
      assertThat(
              registry
                  .get(COMMANDS)
                  .tag(TAG_COMMAND, "listen")
                  .tag(TAG_OUTCOME, OUTCOME_SUCCESS)
                  .counter()
                  .count())
          .isEqualTo(2.0);
      assertThat(
              registry
                  .get(COMMANDS)
                  .tag(TAG_COMMAND, "listen")
                  .tag(TAG_OUTCOME, OUTCOME_FAILURE)
                  .counter()
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should add the payload count to published payloads")
    void shouldCountPublishedPayloads() {
      // Act
      metrics.recordPublished("main", "orders", 5);

      // Assert
      assertThat(registry.get(PAYLOADS_PUBLISHED).tag(TAG_TOPIC, "orders").counter().count())
          .isEqualTo(5.0);
    }
  }

  @Nested
  @DisplayName("Gauges")
  class Gauges {

    @Test
    @DisplayName("should count a connect only on the transition to connected")
    void shouldCountConnectOnTransition() {
      // Act
      metrics.setConnected("main", true);
      metrics.setConnected("main", true);
      metrics.setConnected("main", false);
      metrics.setConnected("main", true);

      // Assert
      assertThat(registry.get(CONNECTED).tag(TAG_NOTIFIER_NAME, "main").gauge().value())
          .isEqualTo(1.0);
      assertThat(registry.get(CONNECTS).tag(TAG_NOTIFIER_NAME, "main").counter().count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should report registry size")
    void shouldReportRegistrySize() {
      // Act
      metrics.setRegistrySize("main", 4, 2);

      // Assert
      assertThat(registry.get(REGISTRY_CHANNELS).gauge().value()).isEqualTo(4.0);
      assertThat(registry.get(REGISTRY_LISTENERS).gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should remove gauges of a closed notifier and keep the others")
    void shouldRemoveGaugesOfClosedNotifier() {
      // Arrange
      metrics.setConnected("main", true);
      metrics.setRegistrySize("main", 1, 1);
      metrics.setConnected("audit", true);

      // Act
      metrics.close("main");

      // Assert
      assertThat(registry.find(CONNECTED).tag(TAG_NOTIFIER_NAME, "main").gauge()).isNull();
      assertThat(registry.find(REGISTRY_CHANNELS).gauge()).isNull();
      assertThat(registry.get(CONNECTED).tag(TAG_NOTIFIER_NAME, "audit").gauge().value())
          .isEqualTo(1.0);
      assertThat(registry.get(CONNECTS).tag(TAG_NOTIFIER_NAME, "main").counter().count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should tolerate closing an unknown notifier")
    void shouldTolerateClosingUnknownNotifier() {
      // Act + Assert
      assertThatCode(() -> metrics.close("unknown")).doesNotThrowAnyException();
    }
  }
}
