// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

/// Destination of formatted log lines
@FunctionalInterface
public interface LogSink {
  void accept(String line);
}
