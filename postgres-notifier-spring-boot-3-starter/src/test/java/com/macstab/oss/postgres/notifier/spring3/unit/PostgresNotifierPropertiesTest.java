/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.spring3.unit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.postgres.notifier.NotifierConfig;
import com.macstab.oss.postgres.notifier.connection.PgConnectionSettings;
import com.macstab.oss.postgres.notifier.spring3.PostgresNotifierProperties;

/**
 * Unit tests for {@link PostgresNotifierProperties}.
 *
 * <p>No Spring context (pure unit test). Defaults must match the core builders.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("PostgresNotifierProperties")
class PostgresNotifierPropertiesTest {

  @Nested
  @DisplayName("Default Values")
  class DefaultValuesTest {

    @Test
    @DisplayName("should match NotifierConfig defaults")
    void shouldMatchNotifierConfigDefaults() {
      // Arrange & Act
      final var properties = new PostgresNotifierProperties();
      final var defaults = NotifierConfig.defaults();

      // Assert
      assertThat(properties.isEnabled()).isTrue();
      assertThat(properties.getName()).isEqualTo(defaults.getName());
      assertThat(properties.getPrefix()).isEqualTo(defaults.getPrefix());
      assertThat(properties.getCallTimeout()).isEqualTo(defaults.getCallTimeout());
    }

    @Test
    @DisplayName("should match PgConnectionSettings defaults")
    void shouldMatchConnectionSettingsDefaults() {
      // Arrange & Act
      final var properties = new PostgresNotifierProperties();
      final var defaults = PgConnectionSettings.builder().url("jdbc:postgresql://x/y").build();

      // Assert
      assertThat(properties.getUrl()).isNull();
      assertThat(properties.getApplicationName()).isEqualTo(defaults.getApplicationName());
      assertThat(properties.isAutoReconnect()).isEqualTo(defaults.isAutoReconnect());
      assertThat(properties.getReconnectDelayMin()).isEqualTo(defaults.getReconnectDelayMin());
      assertThat(properties.getReconnectDelayMax()).isEqualTo(defaults.getReconnectDelayMax());
      assertThat(properties.getPollInterval()).isEqualTo(defaults.getPollInterval());
      assertThat(properties.getHealthCheckInterval()).isEqualTo(defaults.getHealthCheckInterval());
      assertThat(properties.getConnectTimeout()).isEqualTo(defaults.getConnectTimeout());
    }
  }

  @Nested
  @DisplayName("toString")
  class ToStringTest {

    @Test
    @DisplayName("should not expose the password")
    void shouldNotExposePassword() {
      // Arrange
      final var properties = new PostgresNotifierProperties();
      properties.setPassword("s3cr3t");
      properties.setCallTimeout(Duration.ofSeconds(1));

      // Act
      final var text = properties.toString();

      // Assert
      assertThat(text).doesNotContain("s3cr3t");
    }
  }
}
