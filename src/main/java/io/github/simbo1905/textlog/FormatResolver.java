// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.simbo1905.textlog.TextFormat.LOGGER;

/// Builds the formats reachable from a root type depth first, so every nested format exists before the
/// format that delegates to it. The types on the current path are tracked to reject cyclic nesting.
final class FormatResolver {
  private final Map<Class<?>, TextHandler<?>> handlers = new HashMap<>();
  private final Map<Class<?>, RecordDefinition<?>> definitions = new HashMap<>();
  private final Set<Class<?>> structTypes = new HashSet<>();
  private final Map<Class<?>, TextFormat<?>> resolved = new HashMap<>();
  private final Deque<Class<?>> path = new ArrayDeque<>();

  FormatResolver(List<TextHandler<?>> handlers, List<RecordDefinition<?>> definitions) {
    for (TextHandler<?> handler : handlers) {
      if (this.handlers.put(handler.type(), handler) != null) {
        throw new IllegalArgumentException("Duplicate custom handler for " + handler.type().getName());
      }
    }
    for (RecordDefinition<?> definition : definitions) {
      if (this.handlers.containsKey(definition.type())) {
        throw new IllegalArgumentException("Type " + definition.type().getName() + " has both a custom handler and a definition");
      }
      if (this.definitions.put(definition.type(), definition) != null) {
        throw new IllegalArgumentException("Duplicate definition for " + definition.type().getName());
      }
    }
    structTypes.addAll(this.handlers.keySet());
    structTypes.addAll(this.definitions.keySet());
  }

  <T> TextFormat<T> resolve(Class<T> type) {
    @SuppressWarnings("unchecked") final var existing = (TextFormat<T>) resolved.get(type);
    if (existing != null) {
      return existing;
    }
    if (path.contains(type)) {
      final List<String> cycle = new ArrayList<>();
      for (Iterator<Class<?>> it = path.descendingIterator(); it.hasNext(); ) {
        cycle.add(it.next().getSimpleName());
      }
      cycle.add(type.getSimpleName());
      throw new IllegalArgumentException("Records cannot nest themselves: " + String.join(" -> ", cycle));
    }

    final TextFormat<T> format;
    @SuppressWarnings("unchecked") final var handler = (TextHandler<T>) handlers.get(type);
    if (handler != null) {
      LOGGER.fine(() -> "Using custom handler for " + type.getName());
      format = new CustomTextFormat<>(handler);
    } else {
      path.push(type);
      try {
        final RecordDefinition<T> definition = definitionFor(type);
        final List<RecordTextFormat.FieldWriter<T>> writers = definition.fields().stream()
            .map(this::writerFor)
            .collect(Collectors.toList());
        format = new RecordTextFormat<>(definition, writers);
      } finally {
        path.pop();
      }
    }
    resolved.put(type, format);
    return format;
  }

  private <T> RecordDefinition<T> definitionFor(Class<T> type) {
    @SuppressWarnings("unchecked") final var declared = (RecordDefinition<T>) definitions.get(type);
    if (declared != null) {
      return declared;
    }
    if (!type.isRecord()) {
      throw new IllegalArgumentException("No custom handler or definition for " + type.getName() +
          " and it is not a record");
    }
    return RecordDefinition.of(type, structTypes);
  }

  private <T> RecordTextFormat.FieldWriter<T> writerFor(RecordDefinition.Field<T> field) {
    final FieldDescriptor descriptor = field.descriptor();
    return switch (descriptor.kind()) {
      case PRIMITIVE -> new RecordTextFormat.PrimitiveFieldWriter<>(descriptor, field.accessor());
      case STRUCT -> structWriter(descriptor, field.accessor());
    };
  }

  private <T> RecordTextFormat.FieldWriter<T> structWriter(FieldDescriptor descriptor, Function<? super T, ?> accessor) {
    @SuppressWarnings("unchecked") final var nested = (TextFormat<Object>) resolve(descriptor.nestedType());
    LOGGER.finer(() -> "Field " + descriptor.name() + " delegates to " + nested);
    return new RecordTextFormat.StructFieldWriter<T, Object>(descriptor, accessor, nested);
  }
}
