// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/// How a combined value is rendered as text. Set the default via system property
/// `no.framework.Bitmask.FormatStyle`. The default is GENERAL.
public enum FormatStyle {
  /// Names when the value is declared or an exact union of flags, else decimal. Specifier `G`.
  GENERAL("G"),
  /// Decimal digits of the value. Specifier `D`.
  DECIMAL("D"),
  /// Upper case hex of the bit pattern padded to the width. Specifier `X`.
  HEX("X"),
  /// As GENERAL but decomposes into flags even when the type is not flag-shaped. Specifier `F`.
  FLAGS("F");

  public static final String PROPERTY = "no.framework.Bitmask.FormatStyle";

  private final String specifier;

  FormatStyle(String specifier) {
    this.specifier = specifier;
  }

  public String specifier() {
    return specifier;
  }

  public static FormatStyle fromSpecifier(@NotNull String specifier) {
    Objects.requireNonNull(specifier, "specifier must not be null");
    return Arrays.stream(values())
        .filter(s -> s.specifier.equalsIgnoreCase(specifier.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Invalid format specifier: '" + specifier +
            "'. Must be one of: G, D, X, F"));
  }

  public static FormatStyle current() {
    final String style = System.getProperty(PROPERTY, GENERAL.name()).toUpperCase(Locale.ROOT);
    try {
      return FormatStyle.valueOf(style);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid format style: " + style + ". Must be one of: " + Arrays.toString(FormatStyle.values()), e);
    }
  }
}
