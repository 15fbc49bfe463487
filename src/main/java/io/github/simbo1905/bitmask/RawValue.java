// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.math.BigInteger;
import java.util.Objects;

/// A value of a symbolic type as produced by reinterpreting an integral. It has no identity beyond its bits and
/// carries no guarantee that any declared member or combination of members has this value.
public record RawValue(String typeId, IntegralWidth width, BigInteger value) {
  public RawValue {
    Objects.requireNonNull(typeId, "typeId must not be null");
    Objects.requireNonNull(width, "width must not be null");
    Objects.requireNonNull(value, "value must not be null");
    assert width.fits(value) : "RawValue " + value + " must fit " + width;
  }

  /// @return the value as a Java long. `UINT64` values above `Long.MAX_VALUE` come back as their bit pattern.
  public long longValue() {
    return value.longValue();
  }

  /// @return the value boxed in the Java type that preserves its width
  public Number boxed() {
    return width.box(value);
  }
}
