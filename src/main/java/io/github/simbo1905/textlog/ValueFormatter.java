// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.util.IllegalFormatException;
import java.util.Locale;

/// Renders primitive field values. Output depends only on the value and the descriptor: every pattern is
/// applied with `Locale.ROOT`.
public final class ValueFormatter {

  private ValueFormatter() {
  }

  /// Text for a PRIMITIVE field value, formatted and optionally quoted as the descriptor declares.
  /// A null value is `null` whatever the pattern.
  public static String format(FieldDescriptor descriptor, Object value) {
    final String text = descriptor.formatSpec() == null || value == null
        ? defaultText(value)
        : String.format(Locale.ROOT, descriptor.formatSpec(), value);
    return descriptor.quoted() ? quote(text) : text;
  }

  /// Enums by constant name, everything else by `String.valueOf`
  public static String defaultText(Object value) {
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    return String.valueOf(value);
  }

  /// Wraps in double quotes escaping `"` and `\`
  public static String quote(String text) {
    final var quoted = new StringBuilder(text.length() + 2);
    quoted.append('"');
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '"' || c == '\\') {
        quoted.append('\\');
      }
      quoted.append(c);
    }
    return quoted.append('"').toString();
  }

  /// Fails fast on a pattern that cannot format the field's type, by formatting a sample value
  static void validate(FieldDescriptor descriptor) {
    if (descriptor.formatSpec() == null) {
      return;
    }
    final Object sample = Companion.sampleValue(descriptor.storageType());
    if (sample == null) {
      return;
    }
    try {
      String.format(Locale.ROOT, descriptor.formatSpec(), sample);
    } catch (IllegalFormatException e) {
      throw new IllegalArgumentException("Format spec '" + descriptor.formatSpec() + "' of field " + descriptor.name() +
          " cannot format " + descriptor.storageType().getSimpleName(), e);
    }
  }
}
