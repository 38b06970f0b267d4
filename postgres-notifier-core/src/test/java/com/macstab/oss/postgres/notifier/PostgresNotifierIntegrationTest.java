/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.macstab.oss.postgres.notifier.connection.PgConnectionSettings;

/**
 * Integration tests with real PostgreSQL (Testcontainers).
 *
 * <p><strong>What We Test:</strong>
 *
 * <ul>
 *   <li>Real LISTEN/NOTIFY round trip through the pgjdbc connection
 *   <li>Server-side payload expansion of the publish query
 *   <li>Prefix isolation between notifiers
 *   <li>Re-subscription after the backend was terminated
 * </ul>
 *
 * <p><strong>Requirements:</strong> Docker. Skipped without it.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgresNotifier Integration Tests (Real PostgreSQL)")
class PostgresNotifierIntegrationTest {

  private static final Duration WAIT = Duration.ofSeconds(10);

  @Container
  private static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
          .withStartupTimeout(Duration.ofSeconds(60));

  private PostgresNotifier notifier;

  private static PgConnectionSettings settings() {
    return PgConnectionSettings.builder()
        .url(POSTGRES.getJdbcUrl())
        .username(POSTGRES.getUsername())
        .password(POSTGRES.getPassword())
        .reconnectDelayMin(Duration.ofMillis(100))
        .reconnectDelayMax(Duration.ofSeconds(1))
        .healthCheckInterval(Duration.ofSeconds(1))
        .build();
  }

  private static PostgresNotifier startNotifier(final NotifierConfig config) {
    final var notifier = PostgresNotifier.create(config, settings());
    notifier.start();
    await().atMost(WAIT).until(notifier::isConnected);
    return notifier;
  }

  @BeforeEach
  void setUp() {
    notifier = startNotifier(NotifierConfig.defaults());
  }

  @AfterEach
  void tearDown() {
    notifier.close();
  }

  @Nested
  @DisplayName("Round trip")
  class RoundTrip {

    @Test
    @DisplayName("published payloads reach every subscriber in order")
    void publish_DeliveredToSubscribers() throws InterruptedException {
      // Arrange
      final var first = new MailboxListener();
      final var second = new MailboxListener();
      notifier.subscribe(first, "insert");
      notifier.subscribe(second, "insert");

      // Act
      notifier.publish("insert", "x", "y").join();

      // Assert
      for (final var mailbox : List.of(first, second)) {
        final var one = mailbox.poll(WAIT);
        final var two = mailbox.poll(WAIT);
        assertThat(one.topic()).isEqualTo("insert");
        assertThat(List.of(one.payload(), two.payload())).containsExactly("x", "y");
      }
    }

    @Test
    @DisplayName("NOTIFY from another session is relayed")
    void externalNotify_Relayed() throws Exception {
      // Arrange
      final var mailbox = new MailboxListener();
      notifier.subscribe(mailbox, "signal");

      // Act
      try (var other =
              DriverManager.getConnection(
                  POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
          var statement = other.createStatement()) {
        statement.execute("NOTIFY \"public.oban_signal\", 'from-sql'");
      }

      // Assert
      final var received = mailbox.poll(WAIT);
      assertThat(received).isNotNull();
      assertThat(received.payload()).isEqualTo("from-sql");
    }

    @Test
    @DisplayName("after unsubscribe nothing is delivered")
    void unsubscribe_StopsDelivery() throws InterruptedException {
      // Arrange
      final var mailbox = new MailboxListener();
      notifier.subscribe(mailbox, "gone");
      notifier.unsubscribe(mailbox, "gone");

      // Act
      notifier.publish("gone", "x").join();

      // Assert
      assertThat(mailbox.poll(Duration.ofMillis(500))).isNull();
    }
  }

  @Test
  @DisplayName("notifiers with different prefixes do not hear each other")
  void prefixes_Isolated() throws InterruptedException {
    // Arrange
    final var privateNotifier =
        startNotifier(NotifierConfig.builder().name("private").prefix("private").build());
    try {
      final var publicBox = new MailboxListener();
      final var privateBox = new MailboxListener();
      notifier.subscribe(publicBox, "insert");
      privateNotifier.subscribe(privateBox, "insert");

      // Act
      privateNotifier.publish("insert", "secret").join();

      // Assert
      final var received = privateBox.poll(WAIT);
      assertThat(received.source().getPrefix()).isEqualTo("private");
      assertThat(publicBox.poll(Duration.ofMillis(500))).isNull();
    } finally {
      privateNotifier.close();
    }
  }

  @Test
  @DisplayName("subscriptions survive a terminated backend")
  void reconnect_Resubscribes() throws SQLException, InterruptedException {
    // Arrange
    final var mailbox = new MailboxListener();
    notifier.subscribe(mailbox, "durable");

    // Act
    try (var admin =
            DriverManager.getConnection(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        var statement = admin.createStatement()) {
      statement.execute(
          "SELECT pg_terminate_backend(pid) FROM pg_stat_activity"
              + " WHERE application_name = 'postgres-notifier'");
    }

    // Assert
    await()
        .atMost(Duration.ofSeconds(30))
        .ignoreExceptions()
        .untilAsserted(
            () -> {
              notifier.publish("durable", "again").join();
              assertThat(mailbox.poll(Duration.ofMillis(500))).isNotNull();
            });
  }
}
