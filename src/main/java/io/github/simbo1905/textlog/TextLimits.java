// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

/// Buffer sizes used where the library allocates on the caller's behalf. Set via system properties:
/// - `textlog.render.capacity` bytes allocated by [TextFormat#render] (default 1024)
/// - `textlog.message.capacity` characters kept of a formatted log message (default 1024)
public record TextLimits(int renderCapacity, int messageCapacity) {

  public static final String RENDER_CAPACITY = "textlog.render.capacity";
  public static final String MESSAGE_CAPACITY = "textlog.message.capacity";
  static final int DEFAULT_CAPACITY = 1024;

  public TextLimits {
    if (renderCapacity <= 0 || messageCapacity <= 0) {
      throw new IllegalArgumentException("Capacities must be positive, got render=" + renderCapacity +
          " message=" + messageCapacity);
    }
  }

  public static TextLimits current() {
    return new TextLimits(
        positive(RENDER_CAPACITY),
        positive(MESSAGE_CAPACITY));
  }

  private static int positive(String property) {
    final String value = System.getProperty(property, Integer.toString(DEFAULT_CAPACITY)).trim();
    final int parsed;
    try {
      parsed = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + property + ": " + value + ". Must be a positive integer", e);
    }
    if (parsed <= 0) {
      throw new IllegalArgumentException("Invalid value for " + property + ": " + value + ". Must be a positive integer");
    }
    return parsed;
  }
}
