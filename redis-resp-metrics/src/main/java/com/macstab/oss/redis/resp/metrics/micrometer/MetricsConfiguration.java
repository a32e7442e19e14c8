/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys for the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code redis.resp.client.*}
 *
 * <p><strong>Prometheus Output:</strong> Micrometer's {@code PrometheusNamingConvention} converts
 * dots to underscores:
 *
 * <pre>
 * redis.resp.client.commands        → redis_resp_client_commands_total
 * redis.resp.client.command.latency → redis_resp_client_command_latency_seconds
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "redis.resp.client";

  /**
   * Executed commands.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code command}, {@code outcome}
   * (success/failure)
   */
  public static final String COMMANDS = PREFIX + ".commands";

  /**
   * Round-trip time from send to fully decoded reply.
   *
   * <p><strong>Type:</strong> Timer
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code command}
   */
  public static final String COMMAND_LATENCY = PREFIX + ".command.latency";

  /**
   * Frames received via {@code readFrame()} (pub/sub pushes).
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code frame.kind}
   */
  public static final String FRAMES = PREFIX + ".frames";

  /**
   * Failures by error kind (CONNECTION, IO, PROTOCOL, SERVER, ENCODE).
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code connection.name}, {@code error.kind}
   */
  public static final String ERRORS = PREFIX + ".errors";

  // Tag keys
  public static final String TAG_CONNECTION_NAME = "connection.name";
  public static final String TAG_COMMAND = "command";
  public static final String TAG_OUTCOME = "outcome";
  public static final String TAG_FRAME_KIND = "frame.kind";
  public static final String TAG_ERROR_KIND = "error.kind";

  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";
}
