/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.redis.resp.exception.RespIoException;
import com.macstab.oss.redis.resp.exception.RespProtocolException;
import com.macstab.oss.redis.resp.reply.ArrayReply;
import com.macstab.oss.redis.resp.reply.BulkStringReply;
import com.macstab.oss.redis.resp.reply.ErrorReply;
import com.macstab.oss.redis.resp.reply.IntegerReply;
import com.macstab.oss.redis.resp.reply.RespReply;
import com.macstab.oss.redis.resp.reply.SimpleStringReply;

import lombok.extern.slf4j.Slf4j;

/**
 * Decodes exactly one RESP value from a blocking byte source.
 *
 * <p><strong>Incremental reads:</strong> the frame length is not known up front. The decoder
 * pulls the type byte, then a CRLF-terminated header line, then exactly as many payload bytes as
 * the header declares. Nothing beyond the end of the current frame is consumed, so the next call
 * starts cleanly at the next frame (request/reply pairing on one socket depends on this).
 *
 * <p><strong>Dispatch:</strong>
 *
 * <pre>
 * '+' → SimpleStringReply      '-' → ErrorReply       ':' → IntegerReply
 * '$' → BulkStringReply ($-1 → NULL)                   '_' → BulkStringReply.NULL
 * '*' → ArrayReply (*-1 → NULL, elements decoded recursively)
 * </pre>
 *
 * <p><strong>Failure mapping:</strong>
 *
 * <ul>
 *   <li>Unknown type byte, missing CRLF, bad number, length outside {@code [-1,
 *       MAX_BULK_LENGTH]}, nesting deeper than {@link #MAX_NESTING_DEPTH}, stream ending inside a
 *       frame → {@link RespProtocolException}
 *   <li>Stream ending exactly at a frame boundary (peer closed the connection between frames) or
 *       any {@link IOException} → {@link RespIoException}
 * </ul>
 *
 * <p>Expects a buffered stream: single-byte reads on a raw socket stream would be one syscall
 * each. Stateless and thread-safe (state lives in the stream).
 */
@Slf4j
public final class RespDecoder {

  /** Same default as the server's {@code proto-max-bulk-len} (512 MiB). */
  public static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;

  public static final int MAX_NESTING_DEPTH = 512;

  /** Upper bound for simple-string, error and header lines. */
  public static final int MAX_LINE_LENGTH = 64 * 1024;

  /**
   * Decodes one value from the stream, blocking until it is complete.
   *
   * @param input buffered source positioned at a frame boundary
   * @return decoded value, never {@code null}
   * @throws RespProtocolException on malformed or truncated data
   * @throws RespIoException on transport failure or when the peer closed between frames
   */
  public RespReply decode(final InputStream input) {
    try {
      final int prefix = input.read();
      if (prefix == -1) {
        throw new RespIoException(
            "Connection closed by peer", new EOFException("End of stream at frame boundary"));
      }
      return decodeValue(input, prefix, 0);
    } catch (final IOException e) {
      throw new RespIoException("Failed to read reply: " + e.getMessage(), e);
    }
  }

  /**
   * Decodes the first value of a byte fixture. Trailing bytes are ignored.
   *
   * @param frame encoded value
   * @return decoded value
   */
  public RespReply decode(final byte[] frame) {
    return decode(new ByteArrayInputStream(frame));
  }

  private RespReply decodeValue(final InputStream input, final int prefix, final int depth)
      throws IOException {
    final var type = RespType.fromPrefix(prefix);
    if (type == null) {
      throw new RespProtocolException(
          "Unknown RESP type byte 0x" + Integer.toHexString(prefix & 0xFF) + describe(prefix));
    }
    return switch (type) {
      case SIMPLE_STRING -> new SimpleStringReply(readLine(input));
      case ERROR -> new ErrorReply(readLine(input));
      case INTEGER -> new IntegerReply(parseLong(readLine(input), "integer"));
      case BULK_STRING -> readBulkString(input);
      case ARRAY -> readArray(input, depth);
      case NULL -> readNull(input);
    };
  }

  private BulkStringReply readBulkString(final InputStream input) throws IOException {
    final long length = parseLong(readLine(input), "bulk string length");
    if (length == -1) {
      return BulkStringReply.NULL;
    }
    if (length < 0 || length > MAX_BULK_LENGTH) {
      throw new RespProtocolException("Invalid bulk string length: " + length);
    }
    final var payload = input.readNBytes((int) length);
    if (payload.length < length) {
      throw new RespProtocolException(
          "Stream ended after "
              + payload.length
              + " of "
              + length
              + " declared bulk string bytes");
    }
    expectCrlf(input);
    return new BulkStringReply(payload);
  }

  private ArrayReply readArray(final InputStream input, final int depth) throws IOException {
    final long count = parseLong(readLine(input), "array count");
    if (count == -1) {
      return ArrayReply.NULL;
    }
    if (count < 0 || count > Integer.MAX_VALUE) {
      throw new RespProtocolException("Invalid array count: " + count);
    }
    if (depth >= MAX_NESTING_DEPTH) {
      throw new RespProtocolException("Array nesting exceeds " + MAX_NESTING_DEPTH + " levels");
    }
    // Do not trust the header for pre-sizing, a corrupt count would allocate gigabytes.
    final List<RespReply> elements = new ArrayList<>((int) Math.min(count, 1024));
    for (long i = 0; i < count; i++) {
      final int prefix = input.read();
      if (prefix == -1) {
        throw new RespProtocolException(
            "Stream ended after " + i + " of " + count + " declared array elements");
      }
      elements.add(decodeValue(input, prefix, depth + 1));
    }
    return new ArrayReply(elements);
  }

  private BulkStringReply readNull(final InputStream input) throws IOException {
    final var rest = readLine(input);
    if (!rest.isEmpty()) {
      throw new RespProtocolException("Unexpected payload after null marker: " + rest);
    }
    return BulkStringReply.NULL;
  }

  private String readLine(final InputStream input) throws IOException {
    final var line = new ByteArrayOutputStream(32);
    while (true) {
      final int b = input.read();
      if (b == -1) {
        throw new RespProtocolException("Stream ended before CRLF line terminator");
      }
      if (b == '\r') {
        final int next = input.read();
        if (next != '\n') {
          throw new RespProtocolException("Expected LF after CR but got" + describe(next));
        }
        return line.toString(StandardCharsets.UTF_8);
      }
      if (line.size() >= MAX_LINE_LENGTH) {
        throw new RespProtocolException("Line exceeds " + MAX_LINE_LENGTH + " bytes");
      }
      line.write(b);
    }
  }

  private void expectCrlf(final InputStream input) throws IOException {
    final int cr = input.read();
    final int lf = input.read();
    if (cr != '\r' || lf != '\n') {
      throw new RespProtocolException("Bulk string payload not terminated by CRLF");
    }
  }

  private long parseLong(final String text, final String what) {
    try {
      return Long.parseLong(text);
    } catch (final NumberFormatException e) {
      if (log.isDebugEnabled()) {
        log.debug("Unparseable {} '{}'", what, text);
      }
      throw new RespProtocolException("Invalid " + what + ": '" + text + "'", e);
    }
  }

  private static String describe(final int b) {
    if (b == -1) {
      return " (end of stream)";
    }
    return b >= 0x20 && b < 0x7F ? " ('" + (char) b + "')" : "";
  }
}
