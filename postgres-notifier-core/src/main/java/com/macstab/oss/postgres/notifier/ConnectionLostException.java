/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

/**
 * Command that never reached PostgreSQL or lost its session while running.
 *
 * <p>Distinct from a rejection: the database did not refuse the statement. LISTEN state tied to
 * the lost session is gone with it, and the notifier rebuilds it from its registry on the next
 * connect.
 */
public class ConnectionLostException extends NotifierException {

  private static final long serialVersionUID = 1L;

  public ConnectionLostException(final String message) {
    super(message);
  }

  public ConnectionLostException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
