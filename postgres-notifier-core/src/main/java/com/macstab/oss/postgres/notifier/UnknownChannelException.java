/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import lombok.Getter;

/**
 * Channel name that does not follow {@code "<prefix>.oban_<topic>"}.
 *
 * <p>Seen on the inbound path this means the connection is listening on a channel the notifier
 * never subscribed to. The notifier treats it as fatal.
 */
@Getter
public class UnknownChannelException extends NotifierException {

  private static final long serialVersionUID = 1L;

  private final String channel;

  public UnknownChannelException(final String channel, final String prefix) {
    super("Channel '" + channel + "' does not match '" + prefix + ".oban_<topic>'");
    this.channel = channel;
  }
}
