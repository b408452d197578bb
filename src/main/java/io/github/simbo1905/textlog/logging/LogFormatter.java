// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.util.List;

/// Combines the user message and the parsed pairs into one line
@FunctionalInterface
public interface LogFormatter {
  String format(String message, List<KeyValue> pairs);
}
