// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.math.BigInteger;

/// Raised only by the strict conversion when a value is neither declared nor an exact union of declared flags.
public final class UndefinedValueException extends BitmaskException {
  private final String typeId;
  private final BigInteger value;

  UndefinedValueException(String typeId, BigInteger value) {
    super("Value " + value + " is not defined by " + typeId);
    this.typeId = typeId;
    this.value = value;
  }

  public String typeId() {
    return typeId;
  }

  public BigInteger value() {
    return value;
  }
}
