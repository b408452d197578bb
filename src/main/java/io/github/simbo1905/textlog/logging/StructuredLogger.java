// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logs a printf style message together with the structured details of an event:
///
/// ```java
/// final var log = new StructuredLogger(LoggerConfig.defaults(), ParserRegistry.builder()
///     .register(FileError.class, TextFormatParser.forClass(FileError.class, "error"))
///     .build());
/// log.log(error, "open failed after %d attempts", 3);
/// ```
///
/// writes `open failed after 3 attempts error="path=/tmp/x errno=2"`. Failures inside a parser or the
/// formatter are reported through `java.util.logging` and never reach the caller.
public final class StructuredLogger {
  static final Logger LOGGER = Logger.getLogger(StructuredLogger.class.getName());

  static final String TRUNCATION_INDICATOR = "...(msg_truncated)";
  static final String LOGGING_ERROR_KEY = "logging_error";

  private final LoggerConfig config;
  private final ParserRegistry parsers;

  public StructuredLogger(LoggerConfig config, ParserRegistry parsers) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.parsers = Objects.requireNonNull(parsers, "parsers must not be null");
  }

  public StructuredLogger(LoggerConfig config) {
    this(config, ParserRegistry.empty());
  }

  /// @param details the event details, may be null
  /// @param format  a `java.util.Formatter` pattern for the message
  /// @param args    the pattern arguments
  public void log(Object details, String format, Object... args) {
    Objects.requireNonNull(format, "format must not be null");
    final List<KeyValue> pairs = parseDetails(details);
    final String message = formatMessage(format, args);
    config.sink().accept(formatLine(message, pairs));
  }

  /// A message with no details, the same as `log(null, format, args)`
  public void message(String format, Object... args) {
    log(null, format, args);
  }

  List<KeyValue> parseDetails(Object details) {
    if (details == null) {
      return List.of();
    }
    try {
      return parsers.parse(details);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, e, () -> "Parser failed for details of type " + details.getClass().getName());
      return List.of(new KeyValue(LOGGING_ERROR_KEY, "parser failed for " + details.getClass().getSimpleName() + ": " + e));
    }
  }

  String formatMessage(String format, Object... args) {
    String message;
    try {
      message = String.format(Locale.ROOT, format, args);
    } catch (IllegalFormatException e) {
      LOGGER.log(Level.WARNING, e, () -> "Invalid log message format: " + format);
      message = "format failed for user message. Original fmt: " + format;
    }
    final int capacity = config.messageCapacity();
    if (message.length() > capacity) {
      message = message.substring(0, capacity - TRUNCATION_INDICATOR.length()) + TRUNCATION_INDICATOR;
    }
    return message;
  }

  String formatLine(String message, List<KeyValue> pairs) {
    String line;
    try {
      line = config.formatter().format(message, pairs);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, e, () -> "Formatter " + config.formatter().getClass().getName() + " failed");
      line = null;
    }
    if (line == null) {
      return "[structured-log warning] Formatter failed. Raw user message: " + message;
    }
    return line;
  }
}
