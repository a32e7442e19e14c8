/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.codec;

import java.io.ByteArrayOutputStream;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.macstab.oss.redis.resp.exception.RespEncodeException;

/**
 * Encodes commands as RESP request frames.
 *
 * <p><strong>Frame layout</strong> (array of bulk strings, the only request form Redis expects
 * from clients):
 *
 * <pre>{@code
 * INCR counter  →  *2\r\n$4\r\nINCR\r\n$7\r\ncounter\r\n
 * }</pre>
 *
 * <p>Bulk lengths count UTF-8 <em>bytes</em>, not chars ({@code "é"} is {@code $2}). Text that
 * has no UTF-8 form (unpaired surrogate) is rejected instead of silently replaced with {@code ?},
 * which would send a different key than the caller asked for.
 *
 * <p>Stateless and thread-safe.
 */
public final class RespEncoder {

  private static final byte[] CRLF = {'\r', '\n'};

  /**
   * Encodes text arguments (command name first).
   *
   * @param args command name followed by its arguments, must not be empty
   * @return complete request frame
   * @throws RespEncodeException if the list is empty, contains {@code null}, or an argument is not
   *     representable in UTF-8
   */
  public byte[] encodeCommand(final List<String> args) {
    if (args == null || args.isEmpty()) {
      throw new RespEncodeException("Command must have at least one argument (the command name)");
    }
    final List<byte[]> raw = new ArrayList<>(args.size());
    for (int i = 0; i < args.size(); i++) {
      raw.add(toUtf8(args.get(i), i));
    }
    return encodeRaw(raw);
  }

  public byte[] encodeCommand(final String... args) {
    return encodeCommand(args == null ? null : Arrays.asList(args));
  }

  /**
   * Encodes binary arguments as-is.
   *
   * @param args raw argument bytes, must not be empty or contain {@code null}
   * @return complete request frame
   */
  public byte[] encodeRaw(final List<byte[]> args) {
    if (args == null || args.isEmpty()) {
      throw new RespEncodeException("Command must have at least one argument (the command name)");
    }
    final var out = new ByteArrayOutputStream(estimateSize(args));
    writeHeader(out, RespType.ARRAY, args.size());
    for (int i = 0; i < args.size(); i++) {
      final var arg = args.get(i);
      if (arg == null) {
        throw new RespEncodeException("Argument " + i + " is null");
      }
      writeHeader(out, RespType.BULK_STRING, arg.length);
      out.writeBytes(arg);
      out.writeBytes(CRLF);
    }
    return out.toByteArray();
  }

  private static void writeHeader(
      final ByteArrayOutputStream out, final RespType type, final long length) {
    out.write(type.getPrefix());
    out.writeBytes(Long.toString(length).getBytes(StandardCharsets.US_ASCII));
    out.writeBytes(CRLF);
  }

  private static byte[] toUtf8(final String arg, final int index) {
    if (arg == null) {
      throw new RespEncodeException("Argument " + index + " is null");
    }
    final var encoder =
        StandardCharsets.UTF_8
            .newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      final var buffer = encoder.encode(CharBuffer.wrap(arg));
      final var bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      return bytes;
    } catch (final CharacterCodingException e) {
      throw new RespEncodeException("Argument " + index + " is not representable as UTF-8", e);
    }
  }

  // *N\r\n + per arg: $len\r\n + payload + \r\n (~16 bytes framing each)
  private static int estimateSize(final List<byte[]> args) {
    int size = 16;
    for (final var arg : args) {
      size += 16 + (arg == null ? 0 : arg.length);
    }
    return size;
  }
}
