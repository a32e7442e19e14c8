/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics.micrometer;

import static com.macstab.oss.redis.resp.metrics.micrometer.MetricsConfiguration.*;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.macstab.oss.redis.resp.exception.ErrorKind;
import com.macstab.oss.redis.resp.metrics.RespClientMetrics;
import com.macstab.oss.redis.resp.reply.RespReply;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link RespClientMetrics} with dimensional tags.
 *
 * <p><strong>Dimensional Metrics:</strong> every meter carries the {@code connection.name} tag,
 * so one instance can serve several clients (counter loop, stream consumer, subscriber).
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr>
 *       <td>{@code redis.resp.client.commands}</td>
 *       <td>Counter</td>
 *       <td>connection.name, command, outcome</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.resp.client.command.latency}</td>
 *       <td>Timer</td>
 *       <td>connection.name, command</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.resp.client.frames}</td>
 *       <td>Counter</td>
 *       <td>connection.name, frame.kind</td>
 *     </tr>
 *     <tr>
 *       <td>{@code redis.resp.client.errors}</td>
 *       <td>Counter</td>
 *       <td>connection.name, error.kind</td>
 *     </tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Lifecycle:</strong> meters outlive failures. Clients sharing a connection name are
 * counted through {@link #register(String)}; {@link #close(String)} removes the name's meters only
 * when the last registered client is closed. A client reconnecting under the same name registers
 * them again on first use.
 *
 * <p><strong>Thread Safety:</strong> all methods are thread-safe.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerRespClientMetrics implements RespClientMetrics {

  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;
  private final Map<String, Integer> registrations = new ConcurrentHashMap<>();

  public MicrometerRespClientMetrics(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.cache = new MetricCache(registry, maxCacheSize);

    log.debug("Created MicrometerRespClientMetrics (maxCacheSize: {})", maxCacheSize);
  }

  public MicrometerRespClientMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordCommand(
      final String connectionName,
      final String command,
      final Duration duration,
      final boolean success) {
    cache
        .getOrCreateCounter(
            COMMANDS,
            "Executed RESP commands",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_COMMAND,
            command,
            TAG_OUTCOME,
            success ? OUTCOME_SUCCESS : OUTCOME_FAILURE)
        .increment();

    cache
        .getOrCreateTimer(
            COMMAND_LATENCY,
            "Round-trip time from send to decoded reply",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_COMMAND,
            command)
        .record(duration);
  }

  @Override
  public void recordFrame(final String connectionName, final RespReply.Kind frameKind) {
    cache
        .getOrCreateCounter(
            FRAMES,
            "Frames received via readFrame (pub/sub pushes)",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_FRAME_KIND,
            frameKind.name())
        .increment();
  }

  @Override
  public void recordError(final String connectionName, final ErrorKind kind) {
    cache
        .getOrCreateCounter(
            ERRORS,
            "RESP client failures by error kind",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_ERROR_KIND,
            kind.name())
        .increment();
  }

  @Override
  public void register(final String connectionName) {
    registrations.merge(connectionName, 1, Integer::sum);
  }

  @Override
  public void close(final String connectionName) {
    final var remaining =
        registrations.computeIfPresent(
            connectionName, (name, count) -> count > 1 ? count - 1 : null);
    if (remaining != null) {
      log.debug(
          "Keeping meters for connection '{}', {} client(s) still open", connectionName, remaining);
      return;
    }
    try {
      final int removed = cache.removeMetersForConnection(connectionName);
      if (removed > 0) {
        log.info("Removed {} RESP client meters for connection '{}'", removed, connectionName);
      }
    } catch (final RuntimeException e) {
      // Called from RespClient.close(), must not throw
      log.error("Error during metrics cleanup for connection '{}'", connectionName, e);
    }
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }

  int getRegistrations(final String connectionName) {
    return registrations.getOrDefault(connectionName, 0);
  }
}
