/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

import java.util.List;

import com.macstab.oss.redis.resp.exception.RespProtocolException;

/**
 * One decoded RESP value.
 *
 * <p><strong>Variants (closed set):</strong>
 *
 * <table>
 *   <caption>Reply variants</caption>
 *   <thead>
 *     <tr><th>Wire prefix</th><th>Variant</th><th>{@link Kind}</th><th>Null form</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code :}</td><td>{@link IntegerReply}</td><td>INTEGER</td><td>-</td></tr>
 *     <tr><td>{@code +}</td><td>{@link SimpleStringReply}</td><td>SIMPLE_STRING</td><td>-</td></tr>
 *     <tr><td>{@code $}</td><td>{@link BulkStringReply}</td><td>BULK_STRING</td>
 *         <td>{@code $-1} → {@link BulkStringReply#NULL}</td></tr>
 *     <tr><td>{@code *}</td><td>{@link ArrayReply}</td><td>ARRAY</td>
 *         <td>{@code *-1} → {@link ArrayReply#NULL}</td></tr>
 *     <tr><td>{@code -}</td><td>{@link ErrorReply}</td><td>ERROR</td><td>-</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Exhaustive matching:</strong> switch on {@link #kind()}. A {@code switch} over the
 * enum without {@code default} lets the compiler flag a forgotten case:
 *
 * <pre>{@code
 * switch (reply.kind()) {
 *   case INTEGER -> log.info("(integer) {}", reply.asLong());
 *   case SIMPLE_STRING, BULK_STRING -> log.info("{}", reply.asText());
 *   case ARRAY -> reply.asList().forEach(this::print);
 *   case ERROR -> log.warn("(error) {}", reply.asText());
 * }
 * }</pre>
 *
 * <p><strong>Null is data, not failure:</strong> a bounded {@code XREAD BLOCK} that times out
 * answers {@code *-1}. That decodes to {@link ArrayReply#NULL} and is returned like any other
 * value. Check {@link #isNull()} before using the typed accessors.
 *
 * <p><strong>Immutability:</strong> all variants are immutable once decoded (bulk payloads are
 * copied in and out, array element lists are unmodifiable). Safe to hand to other threads.
 */
public sealed interface RespReply
    permits IntegerReply, SimpleStringReply, BulkStringReply, ArrayReply, ErrorReply {

  /** Variant tag, one constant per permitted implementation. */
  enum Kind {
    INTEGER,
    SIMPLE_STRING,
    BULK_STRING,
    ARRAY,
    ERROR
  }

  Kind kind();

  /**
   * Whether this is the null form of a bulk string ({@code $-1}) or array ({@code *-1}).
   *
   * @return {@code false} for all other values
   */
  default boolean isNull() {
    return false;
  }

  /**
   * Integer value.
   *
   * @throws RespProtocolException if this is not an {@link IntegerReply}
   */
  default long asLong() {
    throw mismatch(Kind.INTEGER, this);
  }

  /**
   * Text value: simple string, bulk string decoded as UTF-8, or error message.
   *
   * @return text, or {@code null} for {@link BulkStringReply#NULL}
   * @throws RespProtocolException for integers and arrays
   */
  default String asText() {
    throw mismatch(Kind.BULK_STRING, this);
  }

  /**
   * Raw bytes of a string value (copy).
   *
   * @return bytes, or {@code null} for {@link BulkStringReply#NULL}
   * @throws RespProtocolException for integers, arrays and errors
   */
  default byte[] asBytes() {
    throw mismatch(Kind.BULK_STRING, this);
  }

  /**
   * Array elements (unmodifiable).
   *
   * @return elements, or {@code null} for {@link ArrayReply#NULL}
   * @throws RespProtocolException if this is not an {@link ArrayReply}
   */
  default List<RespReply> asList() {
    throw mismatch(Kind.ARRAY, this);
  }

  private static RespProtocolException mismatch(final Kind expected, final RespReply actual) {
    return new RespProtocolException(
        "Expected " + expected + " reply but was " + actual.kind() + ": " + actual);
  }
}
