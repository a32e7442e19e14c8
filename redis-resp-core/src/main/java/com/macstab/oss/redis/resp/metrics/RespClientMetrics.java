/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics;

import java.time.Duration;

import com.macstab.oss.redis.resp.exception.ErrorKind;
import com.macstab.oss.redis.resp.reply.RespReply;

/**
 * Framework-agnostic metrics interface for the RESP client.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only what they need; the client calls every method unconditionally (no null checks).
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - zero-overhead singleton (uses default methods)
 *   <li>{@code MicrometerRespClientMetrics} - Micrometer integration ({@code redis-resp-metrics})
 * </ul>
 *
 * <p><strong>Lifecycle:</strong> handed to {@code RespClient} through {@code RespClientOptions};
 * {@link #register(String)} is called once when a client connects, {@link #close(String)} once
 * when it is closed. Several clients may share a connection name; implementations keep
 * per-name state until the last of them is closed.
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. One instance is usually
 * shared by several clients (one per consumer thread).
 *
 * <p><strong>Exception Handling:</strong> Implementations MUST NOT throw. Recording runs inside the
 * client's request path; a failing metrics backend must not fail a Redis command.
 */
public interface RespClientMetrics {

  /** No-op singleton instance. */
  RespClientMetrics NOOP = new RespClientMetrics() {};

  /**
   * Records one completed {@code execute()} call.
   *
   * <p><strong>Metric Type:</strong> Counter + Timer
   *
   * <p><strong>Expected Tags:</strong> {@code connection.name}, {@code command} (upper-case
   * command name), {@code outcome} ({@code success} / {@code failure})
   *
   * @param connectionName connection name (e.g., "counter", "default")
   * @param command upper-case command name (e.g., "INCR")
   * @param duration time from send to fully decoded reply
   * @param success {@code false} if the call ended with any {@code RespException}
   */
  default void recordCommand(
      String connectionName, String command, Duration duration, boolean success) {
    // No-op by default
  }

  /**
   * Records one frame delivered by {@code readFrame()}.
   *
   * <p><strong>Metric Type:</strong> Counter
   *
   * @param connectionName connection name
   * @param frameKind reply kind of the frame
   */
  default void recordFrame(String connectionName, RespReply.Kind frameKind) {
    // No-op by default
  }

  /**
   * Records a failure by category.
   *
   * <p><strong>Metric Type:</strong> Counter, tags {@code connection.name}, {@code error.kind}
   *
   * @param connectionName connection name
   * @param kind failure category
   */
  default void recordError(String connectionName, ErrorKind kind) {
    // No-op by default
  }

  /**
   * Announces a newly connected client using {@code connectionName}.
   *
   * @param connectionName connection name
   */
  default void register(String connectionName) {
    // No-op by default
  }

  /**
   * Releases one registration of a connection name. Called once per client, on {@code close()},
   * also when a fatal failure closed the client earlier.
   *
   * @param connectionName connection name to clean up
   */
  default void close(String connectionName) {
    // No-op by default
  }
}
