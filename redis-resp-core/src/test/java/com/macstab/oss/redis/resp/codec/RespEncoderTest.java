/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.resp.exception.RespEncodeException;

/**
 * Tests for {@link RespEncoder}: request framing and argument validation.
 */
@DisplayName("RespEncoder")
class RespEncoderTest {

  private final RespEncoder encoder = new RespEncoder();

  private static String ascii(final byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("encodes a command as an array of bulk strings")
  void encodesArrayOfBulkStrings() {
    // Act
    final var frame = encoder.encodeCommand("INCR", "counter");

    // Assert
    assertThat(ascii(frame)).isEqualTo("*2\r\n$4\r\nINCR\r\n$7\r\ncounter\r\n");
  }

  @Test
  @DisplayName("XREAD with BLOCK and STREAMS arguments")
  void encodesXread() {
    // Act
    final var frame = encoder.encodeCommand(List.of("XREAD", "BLOCK", "5000", "STREAMS", "s", "$"));

    // Assert
    assertThat(ascii(frame))
        .isEqualTo(
            "*6\r\n$5\r\nXREAD\r\n$5\r\nBLOCK\r\n$4\r\n5000\r\n"
                + "$7\r\nSTREAMS\r\n$1\r\ns\r\n$1\r\n$\r\n");
  }

  @Test
  @DisplayName("bulk length is the UTF-8 byte count, not the char count")
  void utf8ByteLength() {
    // Act
    final var frame = encoder.encodeCommand("SET", "k", "ü€");

    // Assert (ü = 2 bytes, € = 3 bytes)
    assertThat(ascii(frame)).endsWith("$5\r\nü€\r\n");
  }

  @Test
  @DisplayName("empty argument is encoded as $0")
  void emptyArgument() {
    assertThat(ascii(encoder.encodeCommand("SET", "k", "")))
        .isEqualTo("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$0\r\n\r\n");
  }

  @Test
  @DisplayName("arguments containing CRLF are length-prefixed, not escaped")
  void crlfInArgument() {
    assertThat(ascii(encoder.encodeCommand("ECHO", "a\r\nb")))
        .isEqualTo("*2\r\n$4\r\nECHO\r\n$4\r\na\r\nb\r\n");
  }

  @Test
  @DisplayName("raw byte arguments are written verbatim")
  void rawArguments() {
    // Arrange
    final byte[] payload = {0, (byte) 0xff, '\r'};

    // Act
    final var frame = encoder.encodeRaw(List.of("SET".getBytes(StandardCharsets.US_ASCII), payload));

    // Assert
    final var header = "*2\r\n$3\r\nSET\r\n$3\r\n".getBytes(StandardCharsets.US_ASCII);
    assertThat(Arrays.copyOfRange(frame, 0, header.length)).isEqualTo(header);
    assertThat(Arrays.copyOfRange(frame, header.length, header.length + 3)).isEqualTo(payload);
  }

  @Test
  @DisplayName("unpaired surrogate is rejected before anything is sent")
  void unpairedSurrogate() {
    assertThatThrownBy(() -> encoder.encodeCommand("SET", "k", "\uD800"))
        .isInstanceOf(RespEncodeException.class)
        .hasMessageContaining("Argument 2");
  }

  @Test
  @DisplayName("empty command and null arguments are rejected")
  void invalidCommandLine() {
    assertThatThrownBy(() -> encoder.encodeCommand(List.of()))
        .isInstanceOf(RespEncodeException.class);
    assertThatThrownBy(() -> encoder.encodeCommand((String[]) null))
        .isInstanceOf(RespEncodeException.class);
    assertThatThrownBy(() -> encoder.encodeCommand("SET", null, "v"))
        .isInstanceOf(RespEncodeException.class)
        .hasMessageContaining("Argument 1 is null");
  }
}
