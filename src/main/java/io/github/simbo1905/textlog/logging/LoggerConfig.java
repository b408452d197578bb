// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import io.github.simbo1905.textlog.TextLimits;

import java.util.Objects;

/// The strategies a [StructuredLogger] is built with
/// @param formatter       combines message and pairs into a line
/// @param sink            receives each line
/// @param messageCapacity characters of the user message kept before it is cut
public record LoggerConfig(LogFormatter formatter, LogSink sink, int messageCapacity) {
  public LoggerConfig {
    Objects.requireNonNull(formatter, "formatter must not be null");
    Objects.requireNonNull(sink, "sink must not be null");
    if (messageCapacity < StructuredLogger.TRUNCATION_INDICATOR.length()) {
      throw new IllegalArgumentException("messageCapacity must be at least " +
          StructuredLogger.TRUNCATION_INDICATOR.length() + ", got " + messageCapacity);
    }
  }

  /// logfmt lines to stderr with the configured [TextLimits#messageCapacity]
  public static LoggerConfig defaults() {
    return new LoggerConfig(new LogfmtFormatter(), PrintStreamSink.stderr(), TextLimits.current().messageCapacity());
  }

  public LoggerConfig withSink(LogSink sink) {
    return new LoggerConfig(formatter, sink, messageCapacity);
  }

  public LoggerConfig withFormatter(LogFormatter formatter) {
    return new LoggerConfig(formatter, sink, messageCapacity);
  }
}
