/* (C)2026 Macstab GmbH */

/**
 * PostgreSQL {@code LISTEN}/{@code NOTIFY} pub/sub relay (no Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Many in-process listeners subscribe to logical topics. Their interest is multiplexed onto one
 * dedicated database connection, and every notification is fanned out to exactly the listeners of
 * its topic.
 *
 * <h2>Channel naming</h2>
 *
 * <p>Topic {@code job_insert} under prefix {@code public} becomes channel {@code
 * public.oban_job_insert} ({@link com.macstab.oss.postgres.notifier.ChannelNames}). Processes
 * sharing a database only hear each other when they share a prefix.
 *
 * <h2>Consistency</h2>
 *
 * <p>Application calls, listener termination and connection loss all funnel into the mailbox of
 * one notifier thread ({@link com.macstab.oss.postgres.notifier.PostgresNotifier}). The thread
 * owns the {@link com.macstab.oss.postgres.notifier.ListenerRegistry} and allows one database
 * command in flight at a time. LISTEN/UNLISTEN only go out for channels whose subscriber count
 * crosses zero.
 *
 * <h2>Delivery</h2>
 *
 * <p>At most once. Notifications sent while the connection is down are lost; the registry is
 * re-established with one LISTEN on every reconnect.
 *
 * <h2>Packages</h2>
 *
 * <ul>
 *   <li>{@code connection}: connection SPI and the pgjdbc implementation
 *   <li>{@code liveness}: listener termination detection
 *   <li>{@code metrics}: metrics SPI (no-op default, Micrometer in a separate module)
 * </ul>
 */
package com.macstab.oss.postgres.notifier;
