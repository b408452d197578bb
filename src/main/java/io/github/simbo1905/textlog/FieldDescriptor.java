// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.util.Objects;

/// Metadata for one field of a record type. Exactly one of `nestedType` and `formatSpec` is meaningful,
/// selected by `kind`.
///
/// @param storageType the declared Java type of the field
/// @param name        the field name as it appears in the output
/// @param kind        whether the field is formatted directly or delegated to a nested format
/// @param nestedType  the nested record type for STRUCT fields, otherwise [#NOT_APPLICABLE]
/// @param formatSpec  a `java.util.Formatter` pattern for PRIMITIVE fields, `null` for the default text
/// @param quoted      whether a PRIMITIVE value is wrapped in escaped double quotes
public record FieldDescriptor(
    Class<?> storageType,
    String name,
    FieldKind kind,
    Class<?> nestedType,
    String formatSpec,
    boolean quoted
) {

  /// Marker for the nested type of a PRIMITIVE field
  public static final Class<?> NOT_APPLICABLE = Void.class;

  public FieldDescriptor {
    Objects.requireNonNull(storageType, "storageType must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(nestedType, "nestedType must not be null, use NOT_APPLICABLE");
    if (name.isBlank() || name.indexOf('.') >= 0 || name.indexOf(' ') >= 0 || name.indexOf('=') >= 0) {
      throw new IllegalArgumentException("Field name must be non-blank without '.', ' ' or '=': '" + name + "'");
    }
    switch (kind) {
      case STRUCT -> {
        if (nestedType == NOT_APPLICABLE) {
          throw new IllegalArgumentException("STRUCT field " + name + " must name its nested type");
        }
        if (formatSpec != null || quoted) {
          throw new IllegalArgumentException("STRUCT field " + name + " cannot carry a format spec or quoting");
        }
      }
      case PRIMITIVE -> {
        if (nestedType != NOT_APPLICABLE) {
          throw new IllegalArgumentException("PRIMITIVE field " + name + " cannot name a nested type: " + nestedType);
        }
        if (formatSpec != null && formatSpec.isEmpty()) {
          throw new IllegalArgumentException("PRIMITIVE field " + name + " has an empty format spec, use null for the default");
        }
      }
    }
  }

  static FieldDescriptor primitive(Class<?> storageType, String name, String formatSpec, boolean quoted) {
    return new FieldDescriptor(storageType, name, FieldKind.PRIMITIVE, NOT_APPLICABLE, formatSpec, quoted);
  }

  static FieldDescriptor struct(Class<?> nestedType, String name) {
    return new FieldDescriptor(nestedType, name, FieldKind.STRUCT, nestedType, null, false);
  }
}
