// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.textlog;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Optional formatting metadata for a primitive record component.
///
/// ```java
/// record Reading(@TextField(format = "%.2f") double celsius,
///                @TextField(quoted = true) String sensor) {}
/// ```
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface TextField {

  /// A `java.util.Formatter` pattern applied with `Locale.ROOT`. Empty means the type's default text.
  String format() default "";

  /// Wrap the value in double quotes escaping `"` and `\`
  boolean quoted() default false;
}
