/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import java.util.Collection;
import java.util.stream.Collectors;

import lombok.experimental.UtilityClass;

/**
 * SQL issued by the notifier.
 *
 * <p>LISTEN/UNLISTEN for several channels go out as one anonymous {@code DO} block, one statement
 * per channel, so the database sees a single round trip:
 *
 * <pre>
 * DO $$BEGIN LISTEN "public.oban_insert";
 * LISTEN "public.oban_signal"; END$$
 * </pre>
 *
 * <p>Publishing expands a JSON array server side, one {@code pg_notify} per element. Notifications
 * are delivered after commit and identical payloads within one transaction are folded into one.
 */
@UtilityClass
public class ListenCommands {

  /** Parameters: full channel name, JSON array of payload strings. */
  public static final String PUBLISH_SQL =
      "SELECT pg_notify(?, payload) FROM json_array_elements_text(?::json) AS payload";

  public static String listen(final Collection<String> channels) {
    return block("LISTEN", channels);
  }

  public static String unlisten(final Collection<String> channels) {
    return block("UNLISTEN", channels);
  }

  static String quoteIdentifier(final String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  private static String block(final String statement, final Collection<String> channels) {
    if (channels.isEmpty()) {
      throw new IllegalArgumentException(statement + " needs at least one channel");
    }

    return channels.stream()
        .map(channel -> statement + " " + quoteIdentifier(channel) + ";")
        .collect(Collectors.joining("\n", "DO $$BEGIN ", " END$$"));
  }
}
