// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/// Result of splitting a combined value into declared single-bit members.
/// @param raw the value that was decomposed
/// @param width the width the bits were read in
/// @param members matched atomic members in declaration order
/// @param unrecognizedBits bits of `raw` that match no atomic member, as an unsigned bit pattern
public record Decomposition(BigInteger raw, IntegralWidth width, List<Member> members, BigInteger unrecognizedBits) {
  public Decomposition {
    Objects.requireNonNull(raw, "raw must not be null");
    Objects.requireNonNull(width, "width must not be null");
    members = List.copyOf(members);
    Objects.requireNonNull(unrecognizedBits, "unrecognizedBits must not be null");
  }

  /// @return true if no bits were left over
  public boolean isExactUnion() {
    return unrecognizedBits.signum() == 0;
  }

  public List<String> names() {
    return members.stream().map(Member::name).toList();
  }

  /// OR the matched members back together with the unrecognized bits. Always equals `raw`.
  public BigInteger reconstruct() {
    final BigInteger pattern = members.stream()
        .map(m -> width.toBitPattern(m.value()))
        .reduce(unrecognizedBits, BigInteger::or);
    if (raw.signum() < 0 && width.fits(raw)) {
      return pattern.subtract(BigInteger.ONE.shiftLeft(width.bits()));
    }
    return pattern;
  }
}
