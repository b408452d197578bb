// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.textlog.TextFormatTest.Line;
import io.github.simbo1905.textlog.TextFormatTest.Point;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TruncationTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @AfterEach
  void clearProperties() {
    System.clearProperty(TextLimits.RENDER_CAPACITY);
  }

  static final TextFormat<Point> POINT_FORMAT = TextFormat.forClass(Point.class);
  static final TextFormat<Line> LINE_FORMAT = TextFormat.forClass(Line.class);

  @Test
  void testExactFitNeedsRoomForTerminator() {
    // "x=10 y=20" is nine bytes
    final var buffer = ByteBuffer.allocate(10);
    assertThat(POINT_FORMAT.toText(buffer, new Point(10, 20))).isEqualTo(9);
    assertThat(buffer.get(9)).isZero();
  }

  @Test
  void testOneByteShortDropsTheWholeLastField() {
    final var buffer = ByteBuffer.allocate(9);
    assertThat(POINT_FORMAT.toText(buffer, new Point(10, 20))).isEqualTo(TextFormat.OVERFLOW);
    assertThat(buffer.position()).isEqualTo(5);
    assertThat(buffer.get(5)).isZero();
    assertThat(TextFormat.decode(buffer, 0, 5)).isEqualTo("x=10 ");
  }

  @Test
  void testNoRoomForSeparator() {
    // "x=10" plus terminator fills five bytes, the separator needs a sixth
    final var buffer = ByteBuffer.allocate(5);
    assertThat(POINT_FORMAT.toText(buffer, new Point(10, 20))).isEqualTo(TextFormat.OVERFLOW);
    assertThat(buffer.position()).isEqualTo(4);
    assertThat(buffer.get(4)).isZero();
    assertThat(TextFormat.decode(buffer, 0, 4)).isEqualTo("x=10");
  }

  @Test
  void testFirstFieldTooLarge() {
    final var buffer = ByteBuffer.allocate(3);
    buffer.put(0, (byte) 'q');
    assertThat(POINT_FORMAT.toText(buffer, new Point(10, 20))).isEqualTo(TextFormat.OVERFLOW);
    assertThat(buffer.position()).isZero();
    assertThat(buffer.get(0)).isZero();
  }

  @Test
  void testZeroCapacityWritesNothing() {
    final var buffer = ByteBuffer.allocate(4);
    buffer.put(2, (byte) 'q');
    buffer.position(2).limit(2);
    assertThat(POINT_FORMAT.toText(buffer, new Point(1, 2))).isEqualTo(TextFormat.OVERFLOW);
    assertThat(POINT_FORMAT.toText(buffer, null)).isZero();
    assertThat(buffer.position()).isEqualTo(2);
    assertThat(buffer.array()[2]).isEqualTo((byte) 'q');
  }

  @Test
  void testNestedOverflowRewindsToTheParentField() {
    // start.x=10 start.y=20 end.x=30 end.y=40 label=MainLine
    // the end point fails on end.y so nothing of end may remain
    final var buffer = ByteBuffer.allocate(39);
    final int result = LINE_FORMAT.toText(buffer, new Line(new Point(10, 20), new Point(30, 40), "MainLine"));
    assertThat(result).isEqualTo(TextFormat.OVERFLOW);
    assertThat(buffer.position()).isEqualTo(22);
    assertThat(buffer.get(22)).isZero();
    assertThat(TextFormat.decode(buffer, 0, 22)).isEqualTo("start.x=10 start.y=20 ");
  }

  @Test
  void testOverflowOnLastPrimitiveAfterNested() {
    final var line = new Line(new Point(10, 20), new Point(30, 40), "MainLine");
    final String full = "start.x=10 start.y=20 end.x=30 end.y=40 label=MainLine";
    final var buffer = ByteBuffer.allocate(full.length());
    assertThat(LINE_FORMAT.toText(buffer, line)).isEqualTo(TextFormat.OVERFLOW);
    assertThat(TextFormat.decode(buffer, 0, buffer.position())).isEqualTo("start.x=10 start.y=20 end.x=30 end.y=40 ");

    final var roomy = ByteBuffer.allocate(full.length() + 1);
    assertThat(LINE_FORMAT.toText(roomy, line)).isEqualTo(full.length());
  }

  @Test
  void testRenderThrowsWithPartialText() {
    System.setProperty(TextLimits.RENDER_CAPACITY, "12");
    assertThatThrownBy(() -> POINT_FORMAT.render(new Point(100, 200), "p"))
        .isInstanceOf(TextOverflowException.class)
        .satisfies(e -> {
          final var overflow = (TextOverflowException) e;
          assertThat(overflow.capacity()).isEqualTo(12);
          assertThat(overflow.type()).isEqualTo(Point.class);
          assertThat(overflow.partialText()).isEqualTo("p.x=100 ");
        });
  }
}
