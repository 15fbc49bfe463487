// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/// The underlying integral type of a symbolic type. Values are carried as `BigInteger` which is wide enough to
/// hold every width without loss. The widest value we accept anywhere is a 128-bit signed integer.
public enum IntegralWidth {
  INT8(8, true),
  UINT8(8, false),
  INT16(16, true),
  UINT16(16, false),
  INT32(32, true),
  UINT32(32, false),
  INT64(64, true),
  UINT64(64, false);

  /// Bits of the widest internal representation.
  public static final int WIDEST_BITS = 128;
  static final BigInteger WIDEST_MIN = BigInteger.ONE.shiftLeft(WIDEST_BITS - 1).negate();
  static final BigInteger WIDEST_MAX = BigInteger.ONE.shiftLeft(WIDEST_BITS - 1).subtract(BigInteger.ONE);

  private final int bits;
  private final boolean signed;
  private final BigInteger min;
  private final BigInteger max;
  private final BigInteger modulus;
  private final BigInteger mask;

  IntegralWidth(int bits, boolean signed) {
    this.bits = bits;
    this.signed = signed;
    this.modulus = BigInteger.ONE.shiftLeft(bits);
    this.mask = modulus.subtract(BigInteger.ONE);
    if (signed) {
      this.min = BigInteger.ONE.shiftLeft(bits - 1).negate();
      this.max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
    } else {
      this.min = BigInteger.ZERO;
      this.max = mask;
    }
  }

  public int bits() {
    return bits;
  }

  public boolean signed() {
    return signed;
  }

  public BigInteger min() {
    return min;
  }

  public BigInteger max() {
    return max;
  }

  /// @return true if the value is representable in this width without truncation
  public boolean fits(@NotNull BigInteger value) {
    Objects.requireNonNull(value, "value must not be null");
    return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
  }

  /// Reinterpret the low `bits()` bits of the value as this width. This is an unchecked cast: it never fails and
  /// silently drops the high bits of a value that does not fit.
  public BigInteger wrap(@NotNull BigInteger value) {
    Objects.requireNonNull(value, "value must not be null");
    final BigInteger low = value.and(mask);
    if (signed && low.testBit(bits - 1)) {
      return low.subtract(modulus);
    }
    return low;
  }

  /// The unsigned bit pattern of a value. Negative values map to their two's complement in this width. Values that
  /// do not fit keep their excess bits so that nothing is lost.
  public BigInteger toBitPattern(@NotNull BigInteger value) {
    Objects.requireNonNull(value, "value must not be null");
    if (value.signum() < 0 && value.compareTo(min()) >= 0) {
      return value.add(modulus);
    }
    return value;
  }

  /// Read a Java `long`. For `UINT64` the bits are taken as unsigned, all other widths take the signed value.
  public BigInteger fromLongBits(long bits) {
    if (this == UINT64 && bits < 0) {
      return BigInteger.valueOf(bits).add(modulus);
    }
    return BigInteger.valueOf(bits);
  }

  /// Number of hexadecimal digits needed to print every bit of this width.
  public int hexDigits() {
    return bits / 4;
  }

  /// Box a value into the narrowest Java type that holds every value of this width. Java has no unsigned boxes
  /// so the unsigned widths move up one size, and `UINT64` stays a `BigInteger`.
  public Number box(@NotNull BigInteger value) {
    if (!fits(value)) {
      throw new IntegralOverflowException(value, this);
    }
    return switch (this) {
      case INT8 -> value.byteValueExact();
      case INT16, UINT8 -> value.shortValueExact();
      case INT32, UINT16 -> value.intValueExact();
      case INT64, UINT32 -> value.longValueExact();
      case UINT64 -> value;
    };
  }

  public static IntegralWidth of(int bits, boolean signed) {
    return Arrays.stream(values())
        .filter(w -> w.bits == bits && w.signed == signed)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported integral width: " + bits + " bits " +
            (signed ? "signed" : "unsigned") + ". Must be one of: " + Arrays.toString(values())));
  }

  /// @return true if the value is inside the 128-bit signed range used as the widest internal representation
  static boolean fitsWidest(BigInteger value) {
    return value.compareTo(WIDEST_MIN) >= 0 && value.compareTo(WIDEST_MAX) <= 0;
  }
}
