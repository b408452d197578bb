// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.util.Objects;

/// Dotted path composition for nested field names
public final class NamePrefix {

  private NamePrefix() {
  }

  /// @param prefix the parent path, `null` or empty at the top level
  /// @param name   the field name
  /// @return `prefix.name`, or just `name` when there is no prefix
  public static String qualify(String prefix, String name) {
    Objects.requireNonNull(name, "name must not be null");
    if (prefix == null || prefix.isEmpty()) {
      return name;
    }
    return prefix + "." + name;
  }
}
