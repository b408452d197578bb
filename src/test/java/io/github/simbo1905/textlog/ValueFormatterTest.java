// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

public class ValueFormatterTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private final Locale originalLocale = Locale.getDefault();

  @AfterEach
  void restoreLocale() {
    Locale.setDefault(originalLocale);
  }

  public enum Severity {LOW, HIGH}

  public record Everything(
      boolean flag,
      byte b,
      short s,
      char c,
      long l,
      float f,
      double d,
      Integer boxed,
      Severity severity,
      UUID id,
      LocalDate day,
      LocalDateTime at
  ) {
  }

  public record Measured(
      @TextField(format = "%.3f") double celsius,
      @TextField(format = "%08X") int mask,
      @TextField(format = "[%-5s]") String tag,
      @TextField(quoted = true) String comment,
      @TextField(format = "%s!", quoted = true) String shout
  ) {
  }

  public record NullBoxed(
      @TextField(format = "%08X") Integer mask,
      @TextField(format = "%.2f") Double ratio,
      @TextField(format = "%tF", quoted = true) LocalDate day
  ) {
  }

  @Test
  void testNullIgnoresFormatSpec() {
    assertThat(TextFormat.forClass(NullBoxed.class).render(new NullBoxed(null, null, null)))
        .isEqualTo("mask=null ratio=null day=\"null\"");
    assertThat(TextFormat.forClass(NullBoxed.class).render(new NullBoxed(255, 0.5, LocalDate.of(2024, 1, 2))))
        .isEqualTo("mask=000000FF ratio=0.50 day=\"2024-01-02\"");
  }

  @Test
  void testDefaultTextForEachValueType() {
    final var id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    final var value = new Everything(true, (byte) -1, (short) 300, 'z', 1L << 40, 1.5f, -0.25d, null,
        Severity.HIGH, id, LocalDate.of(2024, 1, 15), LocalDateTime.of(2024, 1, 15, 10, 30));
    assertThat(TextFormat.forClass(Everything.class).render(value)).isEqualTo(
        "flag=true b=-1 s=300 c=z l=1099511627776 f=1.5 d=-0.25 boxed=null severity=HIGH " +
            "id=123e4567-e89b-12d3-a456-426614174000 day=2024-01-15 at=2024-01-15T10:30");
  }

  @Test
  void testFormatSpecsIgnoreDefaultLocale() {
    Locale.setDefault(Locale.GERMANY);
    final var value = new Measured(21.5, 255, "ab", "say \"hi\" \\o/", "go");
    assertThat(TextFormat.forClass(Measured.class).render(value, "m")).isEqualTo(
        "m.celsius=21.500 m.mask=000000FF m.tag=[ab   ] m.comment=\"say \\\"hi\\\" \\\\o/\" m.shout=\"go!\"");
  }

  @Test
  void testQuoteEscapesOnlyQuotesAndBackslashes() {
    assertThat(ValueFormatter.quote("")).isEqualTo("\"\"");
    assertThat(ValueFormatter.quote("a b=c")).isEqualTo("\"a b=c\"");
    assertThat(ValueFormatter.quote("\\\"")).isEqualTo("\"\\\\\\\"\"");
  }

  @Test
  void testGeneratedPathDoesNotEscapeByDefault() {
    final var format = TextFormat.forClass(TextFormatTest.Line.class);
    final var point = new TextFormatTest.Point(0, 0);
    assertThat(format.render(new TextFormatTest.Line(point, point, "a \"b\""))).endsWith("label=a \"b\"");
  }
}
