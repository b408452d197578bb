// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Generated format: renders the fields of a [RecordDefinition] in declaration order separated by single
/// spaces. Each field is bound to a writer when the format is built.
final class RecordTextFormat<T> implements TextFormat<T> {
  final RecordDefinition<T> definition;
  final List<FieldWriter<T>> writers;

  RecordTextFormat(RecordDefinition<T> definition, List<FieldWriter<T>> writers) {
    this.definition = Objects.requireNonNull(definition);
    this.writers = List.copyOf(writers);
    assert definition.fields().size() == writers.size() : "One writer per field of " + definition.type();
  }

  @Override
  public int toText(ByteBuffer buffer, T record, String namePrefix) {
    Objects.requireNonNull(buffer);
    final var cursor = new TextCursor(buffer);
    if (record == null) {
      return cursor.finish();
    }
    boolean firstField = true;
    for (FieldWriter<T> writer : writers) {
      if (!firstField && !cursor.writeSeparator()) {
        return cursor.overflow();
      }
      firstField = false;
      if (!writer.write(cursor, record, namePrefix)) {
        LOGGER.finer(() -> "[" + definition.type().getSimpleName() + ".toText] overflow at " +
            NamePrefix.qualify(namePrefix, writer.name()) + " after " + cursor.length() + " of " + cursor.capacity() + " bytes");
        return cursor.overflow();
      }
    }
    return cursor.finish();
  }

  @Override
  public Class<T> userType() {
    return definition.type();
  }

  @Override
  public String toString() {
    return "RecordTextFormat{userType=" + definition.type().getSimpleName() + ", fields=" +
        writers.stream().map(FieldWriter::name).collect(Collectors.joining(",")) + "}";
  }

  /// Writes one field at the cursor
  sealed interface FieldWriter<T> permits PrimitiveFieldWriter, StructFieldWriter {
    String name();

    /// @return false if the field did not fit, in which case nothing of it remains in the buffer
    boolean write(TextCursor cursor, T record, String namePrefix);
  }

  /// `name=value` in one atomic fragment
  record PrimitiveFieldWriter<T>(FieldDescriptor descriptor, Function<? super T, ?> accessor) implements FieldWriter<T> {
    @Override
    public String name() {
      return descriptor.name();
    }

    @Override
    public boolean write(TextCursor cursor, T record, String namePrefix) {
      final String value = ValueFormatter.format(descriptor, accessor.apply(record));
      return cursor.writeFragment(NamePrefix.qualify(namePrefix, descriptor.name()) + "=" + value);
    }
  }

  /// Delegates to the nested type's format under the extended prefix
  record StructFieldWriter<T, N>(FieldDescriptor descriptor, Function<? super T, ? extends N> accessor,
                                 TextFormat<N> nested) implements FieldWriter<T> {
    @Override
    public String name() {
      return descriptor.name();
    }

    @Override
    public boolean write(TextCursor cursor, T record, String namePrefix) {
      final int mark = cursor.mark();
      final int written = nested.toText(cursor.buffer(), accessor.apply(record), NamePrefix.qualify(namePrefix, descriptor.name()));
      if (written < 0) {
        cursor.reset(mark);
        return false;
      }
      return true;
    }
  }
}
