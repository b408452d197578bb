// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import io.github.simbo1905.textlog.ValueFormatter;

import java.util.List;

/// logfmt style: `message key1="value1" key2="value2"` with `"` and `\` escaped in values
public final class LogfmtFormatter implements LogFormatter {

  @Override
  public String format(String message, List<KeyValue> pairs) {
    final var line = new StringBuilder(message == null ? "" : message);
    for (KeyValue pair : pairs) {
      if (line.length() > 0 && line.charAt(line.length() - 1) != ' ') {
        line.append(' ');
      }
      line.append(pair.key()).append('=').append(ValueFormatter.quote(pair.value()));
    }
    return line.toString();
  }
}
