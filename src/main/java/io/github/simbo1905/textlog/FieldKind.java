// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

/// How a field is turned into text
public enum FieldKind {
  /// Formatted directly as `name=value`
  PRIMITIVE,
  /// A nested record rendered by its own [TextFormat] under a dotted prefix
  STRUCT
}
