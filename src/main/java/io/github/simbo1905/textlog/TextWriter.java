// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.nio.ByteBuffer;

/// A hand-written renderer for one type. Implementations honour the same contract as a generated
/// [TextFormat]: write from the buffer position, advance the position by the returned byte count,
/// leave a zero byte at the final position, prefix every field name with [NamePrefix#qualify], and return
/// [TextFormat#OVERFLOW] when the remaining space cannot hold the whole output plus the terminator.
/// [TextCursor] does the bookkeeping.
///
/// Writers registered through a [TextHandler] are never handed a `null` value.
@FunctionalInterface
public interface TextWriter<T> {
  int write(ByteBuffer buffer, T value, String namePrefix);
}
