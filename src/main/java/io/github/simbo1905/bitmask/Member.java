// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.math.BigInteger;
import java.util.Objects;

/// A declared member of a symbolic type: its name and its integral value
public record Member(String name, BigInteger value) {
  public Member {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(value, "value must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Member name must not be blank");
    }
  }

  public Member(String name, long value) {
    this(name, BigInteger.valueOf(value));
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
