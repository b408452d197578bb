// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog.logging;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class LogfmtFormatterTest {

  final LogfmtFormatter formatter = new LogfmtFormatter();

  @Test
  void testMessageThenQuotedPairs() {
    assertThat(formatter.format("open failed", List.of(new KeyValue("path", "/tmp/x"), new KeyValue("errno", "2"))))
        .isEqualTo("open failed path=\"/tmp/x\" errno=\"2\"");
  }

  @Test
  void testValuesAreEscaped() {
    assertThat(formatter.format("m", List.of(new KeyValue("v", "a \"b\" c\\d"))))
        .isEqualTo("m v=\"a \\\"b\\\" c\\\\d\"");
  }

  @Test
  void testNoDoubleSpaceOrLeadingSpace() {
    assertThat(formatter.format("trailing ", List.of(new KeyValue("k", "v")))).isEqualTo("trailing k=\"v\"");
    assertThat(formatter.format("", List.of(new KeyValue("k", "v")))).isEqualTo("k=\"v\"");
    assertThat(formatter.format(null, List.of())).isEmpty();
    assertThat(formatter.format("only", List.of())).isEqualTo("only");
  }
}
