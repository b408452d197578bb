// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Renders instances of a record type as bounded `name=value` text, recursing into nested records with
/// dotted names: `Line(start=Point(10,20), end=Point(30,40), label="MainLine")` under the prefix `myline`
/// becomes
///
/// ```
/// myline.start.x=10 myline.start.y=20 myline.end.x=30 myline.end.y=40 myline.label=MainLine
/// ```
///
/// Formats are resolved once per type by the factory methods; nested fields are bound to the nested type's
/// format at that point, whether generated or supplied by a [TextHandler].
public sealed interface TextFormat<T> permits RecordTextFormat, CustomTextFormat {

  Logger LOGGER = Logger.getLogger(TextFormat.class.getName());

  /// Returned when the output does not fit in the buffer
  int OVERFLOW = -1;

  /// Write the text of `record` starting at the buffer's position. The usable capacity is
  /// `buffer.remaining()` and one byte of it is kept for a zero terminator which is written but not counted.
  /// On success the position is advanced past the text. On overflow the position is left after the last
  /// field that fitted whole, the terminator is written there, and [#OVERFLOW] is returned.
  /// @param buffer     the destination
  /// @param record     the instance, `null` renders as the empty string
  /// @param namePrefix the dotted path of this record, `null` or empty at the top level
  /// @return the number of bytes written, or [#OVERFLOW]
  int toText(ByteBuffer buffer, T record, String namePrefix);

  /// [#toText(ByteBuffer, Object, String)] with no prefix
  default int toText(ByteBuffer buffer, T record) {
    return toText(buffer, record, "");
  }

  /// The type this format renders
  Class<T> userType();

  /// Render into a fresh buffer of [TextLimits#renderCapacity] bytes
  /// @throws TextOverflowException if the text does not fit
  default String render(T record) {
    return render(record, "");
  }

  /// Render into a fresh buffer of [TextLimits#renderCapacity] bytes
  /// @throws TextOverflowException if the text does not fit
  default String render(T record, String namePrefix) {
    final ByteBuffer buffer = ByteBuffer.allocate(TextLimits.current().renderCapacity());
    final int written = toText(buffer, record, namePrefix);
    if (written < 0) {
      throw new TextOverflowException(userType(), buffer.capacity(), decode(buffer, 0, buffer.position()));
    }
    return decode(buffer, 0, written);
  }

  /// Reads `length` bytes of UTF-8 text at `start` without moving the buffer's position
  static String decode(ByteBuffer buffer, int start, int length) {
    final byte[] bytes = new byte[length];
    buffer.get(start, bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  /// Format for a record type whose nested fields are all records
  static <T> TextFormat<T> forClass(@NotNull Class<T> type) {
    return forClass(type, List.of(), List.of());
  }

  /// Format for a type using hand-written writers for the handled types
  static <T> TextFormat<T> forClass(@NotNull Class<T> type, @NotNull List<TextHandler<?>> handlers) {
    return forClass(type, handlers, List.of());
  }

  /// Format for a type using hand-written writers for the handled types and explicit field lists for the
  /// defined types. Every other reachable type must be a record.
  /// @throws IllegalArgumentException for unsupported field types, cyclic nesting, or duplicate registrations
  static <T> TextFormat<T> forClass(@NotNull Class<T> type,
                                    @NotNull List<TextHandler<?>> handlers,
                                    @NotNull List<RecordDefinition<?>> definitions) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(handlers, "handlers must not be null");
    Objects.requireNonNull(definitions, "definitions must not be null");
    final var format = new FormatResolver(handlers, definitions).resolve(type);
    LOGGER.fine(() -> "Resolved " + format + " for " + type.getName());
    return format;
  }

  /// Format for an explicitly declared field list
  static <T> TextFormat<T> forDefinition(@NotNull RecordDefinition<T> definition) {
    return forDefinition(definition, List.of());
  }

  /// Format for an explicitly declared field list with hand-written writers for the handled types
  static <T> TextFormat<T> forDefinition(@NotNull RecordDefinition<T> definition, @NotNull List<TextHandler<?>> handlers) {
    Objects.requireNonNull(definition, "definition must not be null");
    return forClass(definition.type(), handlers, List.of(definition));
  }
}
