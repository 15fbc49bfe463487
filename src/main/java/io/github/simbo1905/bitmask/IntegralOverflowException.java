// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.math.BigInteger;

/// The target width cannot hold the value. Recoverable: the caller decides the fallback.
public final class IntegralOverflowException extends BitmaskException {
  private final BigInteger value;
  private final IntegralWidth width;

  IntegralOverflowException(BigInteger value, IntegralWidth width) {
    super("Value " + value + " does not fit " + width + " [" + width.min() + ", " + width.max() + "]");
    this.value = value;
    this.width = width;
  }

  public BigInteger value() {
    return value;
  }

  public IntegralWidth width() {
    return width;
  }
}
