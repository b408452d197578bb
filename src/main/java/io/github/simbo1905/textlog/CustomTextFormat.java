// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.nio.ByteBuffer;
import java.util.Objects;

/// Wraps a hand-written [TextWriter] so it can stand wherever a generated format can. The wrapper renders
/// `null` itself, normalises any negative result to [#OVERFLOW], re-establishes the terminator, and rejects
/// a writer whose reported length disagrees with what it wrote.
final class CustomTextFormat<T> implements TextFormat<T> {
  final TextHandler<T> handler;

  CustomTextFormat(TextHandler<T> handler) {
    this.handler = Objects.requireNonNull(handler);
  }

  @Override
  public int toText(ByteBuffer buffer, T record, String namePrefix) {
    Objects.requireNonNull(buffer);
    final int start = buffer.position();
    final int capacity = buffer.remaining();
    final var cursor = new TextCursor(buffer, start, capacity);
    if (record == null) {
      return cursor.finish();
    }
    final int written = handler.writer().write(buffer, record, namePrefix);
    if (written < 0) {
      return cursor.overflow();
    }
    if (cursor.length() != written || (capacity > 0 && written >= capacity) || (capacity == 0 && written > 0)) {
      throw new IllegalStateException("Custom writer for " + handler.type().getName() + " reported " + written +
          " bytes but advanced the buffer by " + cursor.length() + " with capacity " + capacity);
    }
    return cursor.finish();
  }

  @Override
  public Class<T> userType() {
    return handler.type();
  }

  @Override
  public String toString() {
    return "CustomTextFormat{userType=" + handler.type().getSimpleName() + "}";
  }
}
