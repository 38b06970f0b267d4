/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** Opens a fresh JDBC connection to PostgreSQL. */
@FunctionalInterface
public interface JdbcConnector {

  Connection connect() throws SQLException;

  /**
   * {@link DriverManager}-based connector for the given settings.
   *
   * <p>Sets the pgjdbc properties {@code user}, {@code password}, {@code ApplicationName}, {@code
   * connectTimeout} (seconds) and {@code tcpKeepAlive}.
   */
  static JdbcConnector driverManager(final PgConnectionSettings settings) {
    return () -> {
      final var properties = new Properties();
      if (settings.getUsername() != null) {
        properties.setProperty("user", settings.getUsername());
      }
      if (settings.getPassword() != null) {
        properties.setProperty("password", settings.getPassword());
      }
      properties.setProperty("ApplicationName", settings.getApplicationName());
      properties.setProperty(
          "connectTimeout", String.valueOf(Math.max(1, settings.getConnectTimeout().toSeconds())));
      properties.setProperty("tcpKeepAlive", "true");
      return DriverManager.getConnection(settings.getUrl(), properties);
    };
  }
}
