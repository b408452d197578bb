// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Hands each line to a `java.util.logging` logger so it picks up the application's handlers
public record JulSink(Logger logger, Level level) implements LogSink {
  public JulSink {
    Objects.requireNonNull(logger, "logger must not be null");
    Objects.requireNonNull(level, "level must not be null");
  }

  public static JulSink severe(String loggerName) {
    return new JulSink(Logger.getLogger(loggerName), Level.SEVERE);
  }

  @Override
  public void accept(String line) {
    logger.log(level, line);
  }
}
