// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Chooses the parser for a details object by its runtime type: the exact class first, then the nearest
/// superclass, then interfaces breadth first. Unregistered types go to the fallback parser.
public final class ParserRegistry {
  static final String UNKNOWN_TYPE_KEY = "unknown_error_type";

  private final Map<Class<?>, EventParser<?>> parsers;
  private final EventParser<Object> fallback;

  private ParserRegistry(Map<Class<?>, EventParser<?>> parsers, EventParser<Object> fallback) {
    this.parsers = Map.copyOf(parsers);
    this.fallback = fallback;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// A registry that renders every details object with the fallback parser
  public static ParserRegistry empty() {
    return builder().build();
  }

  /// @return the pairs for `details`, empty for `null`
  public List<KeyValue> parse(Object details) {
    if (details == null) {
      return List.of();
    }
    return parserFor(details.getClass()).parse(details);
  }

  @SuppressWarnings("unchecked")
  EventParser<Object> parserFor(Class<?> type) {
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      final var parser = parsers.get(c);
      if (parser != null) {
        return (EventParser<Object>) parser;
      }
    }
    final Deque<Class<?>> pending = new ArrayDeque<>();
    final Set<Class<?>> seen = new HashSet<>();
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      pending.addAll(List.of(c.getInterfaces()));
    }
    while (!pending.isEmpty()) {
      final Class<?> candidate = pending.removeFirst();
      if (!seen.add(candidate)) {
        continue;
      }
      final var parser = parsers.get(candidate);
      if (parser != null) {
        return (EventParser<Object>) parser;
      }
      pending.addAll(List.of(candidate.getInterfaces()));
    }
    return fallback;
  }

  /// One pair naming the unhandled type and the instance identity
  public static List<KeyValue> unknownType(Object details) {
    return List.of(new KeyValue(UNKNOWN_TYPE_KEY, "unhandled_type_" + details.getClass().getSimpleName() + "@" +
        Integer.toHexString(System.identityHashCode(details))));
  }

  public static final class Builder {
    private final Map<Class<?>, EventParser<?>> parsers = new LinkedHashMap<>();
    private EventParser<Object> fallback = ParserRegistry::unknownType;

    private Builder() {
    }

    public <T> Builder register(Class<T> type, EventParser<? super T> parser) {
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(parser, "parser must not be null");
      if (parsers.putIfAbsent(type, parser) != null) {
        throw new IllegalArgumentException("Duplicate parser for " + type.getName());
      }
      return this;
    }

    public Builder fallback(EventParser<Object> fallback) {
      this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
      return this;
    }

    public ParserRegistry build() {
      return new ParserRegistry(parsers, fallback);
    }
  }
}
