// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.util.List;

/// Turns the details object of a log event into key/value pairs
@FunctionalInterface
public interface EventParser<T> {
  List<KeyValue> parse(T details);
}
