// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Implemented by enums that carry an integral value per constant. Constants that do not override
/// `integralValue()` are numbered by ordinal, so an enum declared as `A, B, C` has the values 0, 1, 2.
public interface Symbolic {

  /// The integral value of this constant. For `UINT64` types return the bit pattern.
  default long integralValue() {
    return ((Enum<?>) this).ordinal();
  }

  /// The underlying integral type of a `Symbolic` enum. Enums without it are `INT32`.
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.TYPE)
  @interface Width {
    IntegralWidth value();
  }
}
