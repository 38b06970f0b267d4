/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReconnectBackoff")
class ReconnectBackoffTest {

  @Test
  @DisplayName("doubles per failed attempt without jitter")
  void delay_Exponential() {
    // Arrange
    final var backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 0);

    // Act & Assert
    assertThat(backoff.delay(0)).isEqualTo(Duration.ofSeconds(1));
    assertThat(backoff.delay(1)).isEqualTo(Duration.ofSeconds(2));
    assertThat(backoff.delay(3)).isEqualTo(Duration.ofSeconds(8));
    assertThat(backoff.delay(10)).isEqualTo(Duration.ofSeconds(30));
    assertThat(backoff.delay(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  @DisplayName("jittered delays stay within bounds")
  void delay_JitterWithinBounds() {
    // Arrange
    final var backoff = new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30));

    // Act & Assert
    for (int attempt = 0; attempt < 12; attempt++) {
      for (int i = 0; i < 50; i++) {
        assertThat(backoff.delay(attempt))
            .isBetween(Duration.ofSeconds(1), Duration.ofSeconds(30));
      }
    }
  }

  @Test
  @DisplayName("rejects inverted bounds and bad jitter")
  void constructor_Invalid() {
    assertThatThrownBy(() -> new ReconnectBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(2), 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
