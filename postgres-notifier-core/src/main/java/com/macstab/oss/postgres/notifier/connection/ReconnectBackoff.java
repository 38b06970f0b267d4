/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.postgres.notifier.connection;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Exponential reconnect backoff with jitter.
 *
 * <p>{@code delay(n) = clamp(min * 2^n ± jitter, min, max)} with {@code n} the number of failed
 * attempts so far. Jitter spreads reconnect storms when many application instances lose the
 * database at once.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ReconnectBackoff {

  static final double DEFAULT_JITTER_RATIO = 0.2;

  long minMillis;
  long maxMillis;
  double jitterRatio;

  public ReconnectBackoff(@NonNull final Duration min, @NonNull final Duration max) {
    this(min, max, DEFAULT_JITTER_RATIO);
  }

  public ReconnectBackoff(
      @NonNull final Duration min, @NonNull final Duration max, final double jitterRatio) {
    if (min.isNegative() || min.compareTo(max) > 0) {
      throw new IllegalArgumentException("Invalid backoff bounds: min=" + min + ", max=" + max);
    }
    if (jitterRatio < 0 || jitterRatio >= 1) {
      throw new IllegalArgumentException("jitterRatio must be in [0, 1), got: " + jitterRatio);
    }
    this.minMillis = min.toMillis();
    this.maxMillis = max.toMillis();
    this.jitterRatio = jitterRatio;
  }

  /**
   * Delay before the next attempt.
   *
   * @param failedAttempts consecutive failures so far (0 for the first retry)
   */
  public Duration delay(final int failedAttempts) {
    final double ideal = minMillis * Math.pow(2.0, Math.min(Math.max(0, failedAttempts), 30));

    double jittered = ideal;
    if (jitterRatio > 0) {
      jittered += ThreadLocalRandom.current().nextDouble(-jitterRatio, jitterRatio) * ideal;
    }

    final long millis = (long) Math.max(minMillis, Math.min(jittered, maxMillis));
    return Duration.ofMillis(millis);
  }
}
