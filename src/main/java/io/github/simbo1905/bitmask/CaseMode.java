// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.util.Arrays;
import java.util.Locale;

/// How member names are matched when parsing. Set the default via system property
/// `no.framework.Bitmask.CaseMode`. The default is INSENSITIVE.
public enum CaseMode {
  /// `left, RIGHT` matches `Left` and `Right`
  INSENSITIVE,
  /// tokens must match declared names exactly
  SENSITIVE;

  public static final String PROPERTY = "no.framework.Bitmask.CaseMode";

  public static CaseMode current() {
    final String mode = System.getProperty(PROPERTY, INSENSITIVE.name()).toUpperCase(Locale.ROOT);
    try {
      return CaseMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid case mode: " + mode + ". Must be one of: " + Arrays.toString(CaseMode.values()), e);
    }
  }
}
