// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.io.PrintStream;
import java.util.Objects;

/// Writes each line followed by a newline and flushes, so error lines are not lost on exit
public record PrintStreamSink(PrintStream out) implements LogSink {
  public PrintStreamSink {
    Objects.requireNonNull(out, "out must not be null");
  }

  public static PrintStreamSink stderr() {
    return new PrintStreamSink(System.err);
  }

  @Override
  public void accept(String line) {
    out.println(line);
    out.flush();
  }
}
