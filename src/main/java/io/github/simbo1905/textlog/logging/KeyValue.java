// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.util.Objects;

/// One structured detail of a log event
public record KeyValue(String key, String value) {
  public KeyValue {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(value, "value must not be null");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
  }
}
