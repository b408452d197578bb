// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import io.github.simbo1905.textlog.TextFormat;
import io.github.simbo1905.textlog.TextLimits;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.textlog.logging.StructuredLogger.LOGGER;

/// Renders a details record through its [TextFormat] into a single pair. Text that does not fit the
/// capacity is kept up to the last whole field and marked with `...(truncated)`.
public record TextFormatParser<T>(String key, TextFormat<T> format, int capacity) implements EventParser<T> {
  static final String TRUNCATED = "...(truncated)";

  public TextFormatParser {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(format, "format must not be null");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
  }

  /// Parser for a record type rendered with its generated format and [TextLimits#renderCapacity]
  public static <T> TextFormatParser<T> forClass(Class<T> type, String key) {
    return new TextFormatParser<>(key, TextFormat.forClass(type), TextLimits.current().renderCapacity());
  }

  @Override
  public List<KeyValue> parse(T details) {
    final ByteBuffer buffer = ByteBuffer.allocate(capacity);
    final int written = format.toText(buffer, details, "");
    if (written < 0) {
      LOGGER.fine(() -> "Details of " + format.userType().getSimpleName() + " truncated at " + buffer.position() + " bytes");
      return List.of(new KeyValue(key, TextFormat.decode(buffer, 0, buffer.position()) + TRUNCATED));
    }
    return List.of(new KeyValue(key, TextFormat.decode(buffer, 0, written)));
  }
}
