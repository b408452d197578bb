// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.github.simbo1905.textlog.TextFormat.LOGGER;

/// Bounded writer over the region `[position, limit)` of a caller-owned buffer. A fragment is written whole
/// or not at all, and one byte is always kept free so the text can be zero-terminated.
public final class TextCursor {
  private final ByteBuffer buffer;
  private final int start;
  private final int capacity;

  /// Starts a cursor at the current position with the remaining bytes as capacity
  public TextCursor(ByteBuffer buffer) {
    this(Objects.requireNonNull(buffer), buffer.position(), buffer.remaining());
  }

  TextCursor(ByteBuffer buffer, int start, int capacity) {
    this.buffer = buffer;
    this.start = start;
    this.capacity = capacity;
  }

  ByteBuffer buffer() {
    return buffer;
  }

  /// Bytes written so far, excluding the terminator
  public int length() {
    return buffer.position() - start;
  }

  public int capacity() {
    return capacity;
  }

  /// Writes the UTF-8 bytes of `text` if they fit together with a terminator
  /// @return false, leaving the buffer untouched, if they do not
  public boolean writeFragment(String text) {
    final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    if (length() + bytes.length + 1 > capacity) {
      LOGGER.finer(() -> "Fragment of " + bytes.length + " bytes does not fit at offset " + length() + " of " + capacity);
      return false;
    }
    buffer.put(bytes);
    terminate();
    return true;
  }

  public boolean writeSeparator() {
    return writeFragment(" ");
  }

  /// @return a position to come back to with [#reset]
  public int mark() {
    return length();
  }

  /// Discards everything written after `mark`
  public void reset(int mark) {
    if (mark < 0 || mark > length()) {
      throw new IllegalArgumentException("Mark " + mark + " is outside the written text of length " + length());
    }
    buffer.position(start + mark);
    terminate();
  }

  /// Puts the zero byte at the current position, pulling the position back onto the last byte of the
  /// region if a writer ran past the space reserved for it. Nothing is written when the capacity is zero.
  public void terminate() {
    if (capacity == 0) {
      return;
    }
    if (length() >= capacity) {
      buffer.position(start + capacity - 1);
    }
    buffer.put(buffer.position(), (byte) 0);
  }

  /// Terminates and returns the length written
  public int finish() {
    terminate();
    return length();
  }

  /// Terminates at the last safe position and returns [TextFormat#OVERFLOW]
  public int overflow() {
    terminate();
    return TextFormat.OVERFLOW;
  }
}
