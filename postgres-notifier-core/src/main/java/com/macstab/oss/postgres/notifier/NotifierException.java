/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

/**
 * Failure of a notifier operation.
 *
 * <p>Raised for rejected LISTEN/UNLISTEN/NOTIFY commands, call timeouts, interrupted calls and
 * calls cut off because the notifier terminated.
 */
public class NotifierException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public NotifierException(final String message) {
    super(message);
  }

  public NotifierException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
