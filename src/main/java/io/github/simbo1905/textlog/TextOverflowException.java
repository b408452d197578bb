// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

/// Thrown by [TextFormat#render] when the rendered text does not fit the configured capacity
public class TextOverflowException extends RuntimeException {
  private final transient Class<?> type;
  private final int capacity;
  private final String partialText;

  public TextOverflowException(Class<?> type, int capacity, String partialText) {
    super("Text of " + type.getName() + " does not fit in " + capacity + " bytes");
    this.type = type;
    this.capacity = capacity;
    this.partialText = partialText;
  }

  public Class<?> type() {
    return type;
  }

  public int capacity() {
    return capacity;
  }

  /// The null-terminated text that was written before the overflow
  public String partialText() {
    return partialText;
  }
}
