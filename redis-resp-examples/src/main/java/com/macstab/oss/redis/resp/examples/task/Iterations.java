/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import java.time.Duration;

import lombok.experimental.UtilityClass;

@UtilityClass
class Iterations {

  /** {@code max} of 0 means unbounded. */
  boolean more(final long done, final long max) {
    return max <= 0 || done < max;
  }

  void pause(final Duration interval) throws InterruptedException {
    if (!interval.isZero() && !interval.isNegative()) {
      Thread.sleep(interval.toMillis());
    }
  }
}
