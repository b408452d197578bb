// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.simbo1905.textlog.TextFormat.LOGGER;

/// The ordered field list of a record type together with how to read each field from an instance.
///
/// A Java `record` already declares its storage layout, so [#of] derives the list from the record
/// components once, turning each accessor into a [MethodHandle]. Any other class can declare the same list
/// explicitly with [#builder] and plain accessor lambdas.
public final class RecordDefinition<T> {

  /// A field descriptor paired with the function that reads it
  public record Field<T>(FieldDescriptor descriptor, Function<? super T, ?> accessor) {
    public Field {
      Objects.requireNonNull(descriptor, "descriptor must not be null");
      Objects.requireNonNull(accessor, "accessor must not be null");
    }
  }

  private final Class<T> type;
  private final List<Field<T>> fields;

  private RecordDefinition(Class<T> type, List<Field<T>> fields) {
    this.type = type;
    this.fields = List.copyOf(fields);
    final Set<String> names = new HashSet<>();
    this.fields.stream()
        .map(field -> field.descriptor().name())
        .filter(name -> !names.add(name))
        .findAny()
        .ifPresent(name -> {
          throw new IllegalArgumentException("Duplicate field name " + name + " in " + type.getName());
        });
  }

  public Class<T> type() {
    return type;
  }

  public List<Field<T>> fields() {
    return fields;
  }

  /// The descriptors in declaration order
  public List<FieldDescriptor> descriptors() {
    return fields.stream().map(Field::descriptor).toList();
  }

  /// Derives the definition of a record whose nested fields are all records
  public static <T> RecordDefinition<T> of(@NotNull Class<T> recordClass) {
    return of(recordClass, Set.of());
  }

  /// Derives the definition of a record from its components in declaration order
  /// @param recordClass the record type
  /// @param structTypes non-record types that are rendered as nested structs, because they have a
  ///                    [TextHandler] or an explicit definition
  public static <T> RecordDefinition<T> of(@NotNull Class<T> recordClass, @NotNull Set<Class<?>> structTypes) {
    Objects.requireNonNull(recordClass, "recordClass must not be null");
    Objects.requireNonNull(structTypes, "structTypes must not be null");
    if (!recordClass.isRecord()) {
      throw new IllegalArgumentException("Class must be a record, use RecordDefinition.builder for " + recordClass);
    }
    final RecordComponent[] components = recordClass.getRecordComponents();
    final List<Field<T>> fields = Arrays.stream(components)
        .map(component -> RecordDefinition.<T>deriveField(recordClass, component, structTypes))
        .collect(Collectors.toList());
    LOGGER.fine(() -> "Derived definition for " + recordClass.getSimpleName() + ": " +
        fields.stream().map(f -> f.descriptor().name() + ":" + f.descriptor().kind()).collect(Collectors.joining(", ")));
    return new RecordDefinition<>(recordClass, fields);
  }

  private static <T> Field<T> deriveField(Class<T> recordClass, RecordComponent component, Set<Class<?>> structTypes) {
    final Class<?> componentType = component.getType();
    final String name = component.getName();
    LOGGER.finer(() -> "Analyzing component " + name + " with type " + component.getGenericType());
    final FieldDescriptor descriptor;
    if (structTypes.contains(componentType) || componentType.isRecord()) {
      if (component.isAnnotationPresent(TextField.class)) {
        throw new IllegalArgumentException("@TextField only applies to primitive fields, not " + name + " of " + recordClass.getName());
      }
      descriptor = FieldDescriptor.struct(componentType, name);
    } else if (Companion.isValueType(componentType)) {
      final TextField annotation = component.getAnnotation(TextField.class);
      final String formatSpec = annotation == null || annotation.format().isEmpty() ? null : annotation.format();
      final boolean quoted = annotation != null && annotation.quoted();
      descriptor = FieldDescriptor.primitive(componentType, name, formatSpec, quoted);
      ValueFormatter.validate(descriptor);
    } else if (Companion.isContainerType(componentType)) {
      throw new IllegalArgumentException("Arrays and collections cannot be rendered as text: " + name + " of " +
          recordClass.getName() + " has type " + component.getGenericType());
    } else {
      throw new IllegalArgumentException("Unsupported type " + componentType.getName() + " for " + name + " of " +
          recordClass.getName() + ", register a TextHandler or a definition for it");
    }
    return new Field<>(descriptor, accessorFor(recordClass, component));
  }

  private static <T> Function<T, Object> accessorFor(Class<T> recordClass, RecordComponent component) {
    final MethodHandle handle;
    try {
      final var method = component.getAccessor();
      method.setAccessible(true);
      handle = MethodHandles.lookup().unreflect(method);
    } catch (Exception e) {
      throw new IllegalArgumentException("Failed to create accessor for " + component.getName() + " of " + recordClass.getName(), e);
    }
    return record -> {
      try {
        return handle.invoke(record);
      } catch (Throwable t) {
        throw new IllegalStateException("Failed to read " + component.getName() + " of " + recordClass.getName(), t);
      }
    };
  }

  /// Starts an explicit field list for `type`
  public static <T> Builder<T> builder(@NotNull Class<T> type) {
    return new Builder<>(Objects.requireNonNull(type, "type must not be null"));
  }

  @Override
  public String toString() {
    return "RecordDefinition{type=" + type.getName() + ", fields=" + descriptors() + "}";
  }

  /// Declares a field list in order. Nothing is reflected: every field is read through the given accessor.
  public static final class Builder<T> {
    private final Class<T> type;
    private final List<Field<T>> fields = new ArrayList<>();

    private Builder(Class<T> type) {
      this.type = type;
    }

    public Builder<T> primitive(String name, Class<?> valueType, Function<? super T, ?> accessor) {
      return primitive(name, valueType, accessor, null, false);
    }

    public Builder<T> primitive(String name, Class<?> valueType, Function<? super T, ?> accessor, String formatSpec) {
      return primitive(name, valueType, accessor, formatSpec, false);
    }

    /// A primitive field rendered in escaped double quotes
    public Builder<T> quoted(String name, Class<?> valueType, Function<? super T, ?> accessor) {
      return primitive(name, valueType, accessor, null, true);
    }

    private Builder<T> primitive(String name, Class<?> valueType, Function<? super T, ?> accessor,
                                 String formatSpec, boolean quoted) {
      Objects.requireNonNull(valueType, "valueType must not be null");
      if (!Companion.isValueType(valueType)) {
        throw new IllegalArgumentException("Field " + name + " of " + type.getName() + " is not a primitive value type: " + valueType);
      }
      final var descriptor = FieldDescriptor.primitive(valueType, name, formatSpec, quoted);
      ValueFormatter.validate(descriptor);
      fields.add(new Field<>(descriptor, accessor));
      return this;
    }

    /// A nested field rendered by the format of `nestedType`
    public <N> Builder<T> struct(String name, Class<N> nestedType, Function<? super T, ? extends N> accessor) {
      Objects.requireNonNull(nestedType, "nestedType must not be null");
      if (Companion.isContainerType(nestedType) || nestedType.isPrimitive()) {
        throw new IllegalArgumentException("Field " + name + " of " + type.getName() + " cannot nest " + nestedType);
      }
      if (nestedType.equals(type)) {
        throw new IllegalArgumentException("Field " + name + " of " + type.getName() + " cannot nest its own type");
      }
      fields.add(new Field<>(FieldDescriptor.struct(nestedType, name), accessor));
      return this;
    }

    public RecordDefinition<T> build() {
      return new RecordDefinition<>(type, fields);
    }
  }
}
