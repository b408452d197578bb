// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParserRegistryTest {

  interface Coded {
    int code();
  }

  public record FileError(String path, int code) implements Coded {
  }

  public record NetworkError(String host, int code) implements Coded {
  }

  static class BaseFailure {
  }

  static class DiskFull extends BaseFailure {
  }

  final ParserRegistry registry = ParserRegistry.builder()
      .register(FileError.class, error -> List.of(new KeyValue("path", error.path())))
      .register(Coded.class, coded -> List.of(new KeyValue("code", Integer.toString(coded.code()))))
      .register(BaseFailure.class, failure -> List.of(new KeyValue("failure", failure.getClass().getSimpleName())))
      .build();

  @Test
  void testExactClassWins() {
    assertThat(registry.parse(new FileError("/tmp/x", 2))).containsExactly(new KeyValue("path", "/tmp/x"));
  }

  @Test
  void testInterfaceMatch() {
    assertThat(registry.parse(new NetworkError("db", 7))).containsExactly(new KeyValue("code", "7"));
  }

  @Test
  void testSuperclassMatch() {
    assertThat(registry.parse(new DiskFull())).containsExactly(new KeyValue("failure", "DiskFull"));
  }

  @Test
  void testUnknownTypeFallback() {
    final Object details = "not registered";
    final var pairs = registry.parse(details);
    assertThat(pairs).hasSize(1);
    assertThat(pairs.get(0).key()).isEqualTo("unknown_error_type");
    assertThat(pairs.get(0).value())
        .isEqualTo("unhandled_type_String@" + Integer.toHexString(System.identityHashCode(details)));
  }

  @Test
  void testCustomFallbackAndNull() {
    final var custom = ParserRegistry.builder().fallback(details -> List.of(new KeyValue("raw", details.toString()))).build();
    assertThat(custom.parse(42)).containsExactly(new KeyValue("raw", "42"));
    assertThat(custom.parse(null)).isEmpty();
  }

  @Test
  void testDuplicateRegistrationRejected() {
    assertThatThrownBy(() -> ParserRegistry.builder()
        .register(FileError.class, error -> List.of())
        .register(FileError.class, error -> List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("FileError");
  }
}
