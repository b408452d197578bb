// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.util.Objects;

/// Replaces the generated format of `type` with a hand-written [TextWriter] wherever that type appears,
/// at the root or nested in another record.
public record TextHandler<T>(Class<T> type, TextWriter<T> writer) {
  public TextHandler {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(writer, "writer must not be null");
    if (type.isPrimitive() || type.isArray()) {
      throw new IllegalArgumentException("Custom handlers cannot target primitive or array types: " + type);
    }
  }
}
