/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import static lombok.AccessLevel.PRIVATE;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Maps logical topics to database channel names and back.
 *
 * <p><strong>Format:</strong> {@code "<prefix>.oban_<topic>"}, e.g. prefix {@code public} and topic
 * {@code job_insert} give {@code public.oban_job_insert}.
 *
 * <p><strong>Limits enforced up front:</strong>
 *
 * <ul>
 *   <li>Topics: {@code [A-Za-z0-9_.:-]+}
 *   <li>Prefix: non-blank, no {@code "}, {@code $} or NUL (it ends up inside a double-quoted
 *       identifier within a dollar-quoted {@code DO} block)
 *   <li>Channel: at most {@value #MAX_CHANNEL_BYTES} bytes UTF-8. PostgreSQL truncates longer
 *       identifiers ({@code NAMEDATALEN - 1}), and a truncated name no longer reverse-maps.
 * </ul>
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ChannelNames {

  public static final int MAX_CHANNEL_BYTES = 63;

  private static final String TOPIC_MARKER = ".oban_";
  private static final Pattern TOPIC_PATTERN = Pattern.compile("[A-Za-z0-9_.:-]+");

  @Getter String prefix;
  String channelPrefix;

  public ChannelNames(@NonNull final String prefix) {
    if (prefix.isBlank()) {
      throw new IllegalArgumentException("prefix must not be blank");
    }
    if (prefix.indexOf('"') >= 0 || prefix.indexOf('$') >= 0 || prefix.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("prefix must not contain '\"', '$' or NUL: " + prefix);
    }
    this.prefix = prefix;
    this.channelPrefix = prefix + TOPIC_MARKER;
  }

  /**
   * Full channel name for a topic.
   *
   * @throws IllegalArgumentException if the topic is malformed or the channel too long
   */
  public String toChannel(@NonNull final String topic) {
    if (!TOPIC_PATTERN.matcher(topic).matches()) {
      throw new IllegalArgumentException(
          "topic must match " + TOPIC_PATTERN.pattern() + ", got: '" + topic + "'");
    }

    final var channel = channelPrefix + topic;
    final var length = channel.getBytes(StandardCharsets.UTF_8).length;
    if (length > MAX_CHANNEL_BYTES) {
      throw new IllegalArgumentException(
          "channel '"
              + channel
              + "' is "
              + length
              + " bytes, PostgreSQL identifiers are limited to "
              + MAX_CHANNEL_BYTES);
    }
    return channel;
  }

  /** Translates a batch of topics, dropping duplicates and keeping first-seen order. */
  public Set<String> toChannels(@NonNull final Collection<String> topics) {
    final Set<String> channels = new LinkedHashSet<>();
    for (final var topic : topics) {
      channels.add(toChannel(topic));
    }
    return channels;
  }

  /**
   * Topic for a channel name.
   *
   * @throws UnknownChannelException if the channel is not {@code "<prefix>.oban_<topic>"}
   */
  public String toTopic(@NonNull final String channel) {
    if (!matches(channel)) {
      throw new UnknownChannelException(channel, prefix);
    }
    return channel.substring(channelPrefix.length());
  }

  /** Whether {@link #toTopic(String)} would succeed. */
  public boolean matches(final String channel) {
    return channel != null
        && channel.length() > channelPrefix.length()
        && channel.startsWith(channelPrefix);
  }
}
