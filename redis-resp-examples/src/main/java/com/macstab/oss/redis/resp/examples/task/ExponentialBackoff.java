/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import java.time.Duration;

import lombok.NonNull;

/**
 * Doubling reconnect delay: initial, 2×initial, 4×initial, ..., capped at max. Reset after a
 * successful command.
 *
 * <p>Not thread-safe (one per loop).
 */
final class ExponentialBackoff {

  private final Duration initial;
  private final Duration max;
  private Duration next;

  ExponentialBackoff(@NonNull final Duration initial, @NonNull final Duration max) {
    if (initial.isNegative() || max.compareTo(initial) < 0) {
      throw new IllegalArgumentException(
          "Backoff requires 0 <= initial <= max, got initial=" + initial + ", max=" + max);
    }
    this.initial = initial;
    this.max = max;
    this.next = initial;
  }

  /** Returns the current delay and doubles it for the following call. */
  Duration next() {
    final var current = next;
    final var doubled = current.multipliedBy(2);
    next = doubled.compareTo(max) > 0 ? max : doubled;
    return current;
  }

  void reset() {
    next = initial;
  }
}
