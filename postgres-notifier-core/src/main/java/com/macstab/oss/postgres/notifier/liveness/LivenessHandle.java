/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.liveness;

/**
 * Token for one watched listener.
 *
 * <p>Owned by the registry entry of its listener. After {@link #release()} the termination
 * callback never fires.
 */
public interface LivenessHandle {

  /** Handle that watches nothing. */
  LivenessHandle NONE = () -> {};

  /** Stops watching. Idempotent. */
  void release();
}
