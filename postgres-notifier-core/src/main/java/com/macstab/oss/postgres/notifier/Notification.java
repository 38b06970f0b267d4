/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier;

import lombok.NonNull;

/**
 * A notification relayed to a listener.
 *
 * @param source config of the notifier that received it
 * @param topic logical topic (channel name with prefix stripped)
 * @param payload raw payload string as sent to {@code pg_notify}
 */
public record Notification(
    @NonNull NotifierConfig source, @NonNull String topic, @NonNull String payload) {}
