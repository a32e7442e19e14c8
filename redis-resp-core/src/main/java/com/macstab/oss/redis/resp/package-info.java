/* (C)2026 Macstab GmbH */

/**
 * Blocking RESP2 client core library (NO Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Talks to a Redis-compatible server over one TCP connection using the RESP wire protocol:
 * encodes commands as arrays of bulk strings, decodes every reply type, and exposes push-style
 * reads (blocking stream polls, pub/sub subscriptions) with a typed error taxonomy.
 *
 * <h2>Core Constraint: Positional Reply Matching</h2>
 *
 * <p>RESP has NO request IDs. The n-th reply on a socket answers the n-th request:
 *
 * <pre>{@code
 * Client sends:               Server answers (same order):
 * → INCR counter              ← :1
 * → XREAD BLOCK 5000 ...      ← *-1            (after 5s without data)
 * → SUBSCRIBE notify          ← [subscribe, notify, 1]
 *                             ← [message, notify, hello]   (unsolicited)
 * }</pre>
 *
 * <p>{@link com.macstab.oss.redis.resp.RespClient} therefore keeps exactly one request in flight
 * and tracks a small state machine ({@link com.macstab.oss.redis.resp.ClientState}). After {@code
 * SUBSCRIBE} the connection only carries pushed frames, read with {@code readFrame()}.
 *
 * <h2>Packages</h2>
 *
 * <ul>
 *   <li>{@code codec}: {@code RespEncoder} (request frames), {@code RespDecoder} (one value per
 *       call, incremental, never over-reads)
 *   <li>{@code connection}: {@code RespConnection}, buffered blocking socket with timeout handling
 *   <li>{@code reply}: sealed {@code RespReply} value model, null bulk/array distinct from empty
 *   <li>{@code exception}: {@code RespException} hierarchy keyed by {@code ErrorKind}
 *   <li>{@code result}: {@code RespResult}, value-returning alternative to exceptions
 *   <li>{@code stream}, {@code pubsub}: typed views over XREAD replies and pushed messages
 *   <li>{@code metrics}: {@code RespClientMetrics} SPI (NOOP default, Micrometer in the metrics
 *       module)
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (var client = RespClient.connect("localhost", 6379)) {
 *   long hits = client.execute("INCR", "hits").asLong();
 *
 *   var reply = client.execute("XREAD", "BLOCK", "5000", "STREAMS", "events", "$");
 *   for (var entry : StreamReadReply.parse(reply)) {   // empty on timeout
 *     log.info("{} {}", entry.id(), entry.fields());
 *   }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A client is owned by one thread. {@code close()} may be called from any thread and cancels a
 * blocked read.
 */
package com.macstab.oss.redis.resp;
