// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/// Type classification shared by definition derivation and the builder
final class Companion {

  private Companion() {
  }

  static final Set<Class<?>> BOXED_PRIMITIVES = Set.of(
      Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class, Character.class, Boolean.class
  );

  static final Set<Class<?>> VALUE_REFERENCE_TYPES = Set.of(
      String.class, UUID.class, LocalDate.class, LocalDateTime.class
  );

  /// Types formatted directly as a single value
  static boolean isValueType(Class<?> type) {
    return type.isPrimitive() || BOXED_PRIMITIVES.contains(type) || VALUE_REFERENCE_TYPES.contains(type) || type.isEnum();
  }

  /// Container kinds that have no text form
  static boolean isContainerType(Class<?> type) {
    return type.isArray() || Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)
        || Optional.class.equals(type);
  }

  /// A representative value of a value type, used to check format specs. Null only for an enum without
  /// constants, whose fields can only ever hold null.
  static Object sampleValue(Class<?> type) {
    if (type == int.class || type == Integer.class) return 0;
    if (type == long.class || type == Long.class) return 0L;
    if (type == short.class || type == Short.class) return (short) 0;
    if (type == byte.class || type == Byte.class) return (byte) 0;
    if (type == double.class || type == Double.class) return 0.0d;
    if (type == float.class || type == Float.class) return 0.0f;
    if (type == boolean.class || type == Boolean.class) return false;
    if (type == char.class || type == Character.class) return 'a';
    if (type == String.class) return "";
    if (type == UUID.class) return new UUID(0L, 0L);
    if (type == LocalDate.class) return LocalDate.EPOCH;
    if (type == LocalDateTime.class) return LocalDateTime.of(LocalDate.EPOCH, LocalTime.MIDNIGHT);
    if (type.isEnum()) {
      final Object[] constants = type.getEnumConstants();
      return constants.length == 0 ? null : constants[0];
    }
    throw new IllegalArgumentException("No sample value for " + type.getName());
  }
}
