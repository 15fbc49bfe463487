// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.bitmask.Bitmask.LOGGER;

/// Splits combined values into the declared single-bit ("atomic") members that compose them.
///
/// Members are visited in declaration order, not bit order, so output reads the way the type was written. Only
/// atomic members are emitted: composite members such as `Weekend = Saturday | Sunday` are a presentation concern
/// and never appear in a decomposition. Bits that match no atomic member are reported, never dropped. Nothing here
/// throws for a non-null input.
///
/// All bit arithmetic is done on the unsigned bit pattern of the descriptor's width, so a flag in the sign bit of
/// a signed type is atomic like any other.
public final class FlagDecomposer {

  private FlagDecomposer() {
  }

  /// @return members whose value is a single set bit, in declaration order
  public static List<Member> atomicMembers(@NotNull EnumDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    final IntegralWidth width = descriptor.width();
    return descriptor.members().stream()
        .filter(m -> isAtomic(width.toBitPattern(m.value())))
        .toList();
  }

  /// Decompose a combined value.
  ///
  /// 1. take the atomic members in declaration order
  /// 2. emit each whose bits are all still set in a working copy of `raw`, then clear them, so an alias of an
  ///    already emitted bit is not emitted twice
  /// 3. report whatever is left in the working copy as unrecognized bits
  public static Decomposition decompose(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(raw, "raw must not be null");
    final IntegralWidth width = descriptor.width();
    BigInteger working = width.toBitPattern(raw);
    final var matched = new ArrayList<Member>();
    for (Member member : atomicMembers(descriptor)) {
      final BigInteger bit = width.toBitPattern(member.value());
      if (working.and(bit).equals(bit)) {
        matched.add(member);
        working = working.andNot(bit);
      }
    }
    final BigInteger unrecognized = working;
    LOGGER.finer(() -> "FlagDecomposer " + descriptor.typeId() + " decomposed " + raw + " into " + matched +
        " unrecognized 0x" + unrecognized.toString(16));
    return new Decomposition(raw, width, matched, unrecognized);
  }

  public static Decomposition decompose(@NotNull EnumDescriptor descriptor, long raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    return decompose(descriptor, descriptor.width().fromLongBits(raw));
  }

  /// @return true if `raw` is a union of declared atomic members with no bits left over
  public static boolean isExactUnion(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw) {
    return decompose(descriptor, raw).isExactUnion();
  }

  /// Count set bits by repeatedly clearing the lowest one. Negative values are read as 128-bit two's complement.
  /// @throws IllegalArgumentException if the value is outside the 128-bit signed range
  public static int countSetAtomicBits(@NotNull BigInteger raw) {
    Objects.requireNonNull(raw, "raw must not be null");
    if (!IntegralWidth.fitsWidest(raw)) {
      throw new IllegalArgumentException("Value " + raw + " is outside the " + IntegralWidth.WIDEST_BITS + "-bit range");
    }
    BigInteger value = raw.signum() < 0 ? raw.add(BigInteger.ONE.shiftLeft(IntegralWidth.WIDEST_BITS)) : raw;
    int count = 0;
    while (value.signum() != 0) {
      value = value.and(value.subtract(BigInteger.ONE));
      count++;
    }
    return count;
  }

  /// Count the bits of `raw` that belong to declared atomic members. For a type declaring `Left=1, Right=2, Top=4,
  /// Bottom=8` the value 255 counts 4.
  public static int countSetAtomicBits(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(raw, "raw must not be null");
    return countSetAtomicBits(descriptor.width().toBitPattern(raw).and(atomicMask(descriptor)));
  }

  /// Count set bits of a long read as 64 unsigned bits.
  public static int countSetAtomicBits(long raw) {
    int count = 0;
    while (raw != 0) {
      raw &= raw - 1;
      count++;
    }
    return count;
  }

  /// @return true if every bit of `flag` is set in `raw`. A zero flag is always set.
  public static boolean hasFlag(@NotNull BigInteger raw, @NotNull BigInteger flag) {
    Objects.requireNonNull(raw, "raw must not be null");
    Objects.requireNonNull(flag, "flag must not be null");
    return raw.and(flag).equals(flag);
  }

  /// @return the union of all atomic member bits as an unsigned bit pattern
  public static BigInteger atomicMask(@NotNull EnumDescriptor descriptor) {
    final IntegralWidth width = descriptor.width();
    return atomicMembers(descriptor).stream()
        .map(m -> width.toBitPattern(m.value()))
        .reduce(BigInteger.ZERO, BigInteger::or);
  }

  /// True if every member is zero or a single bit and no two distinct non-zero values share a bit. Aliases that
  /// repeat the same value are tolerated. Computed on each call: a plain sequential type fails this test.
  public static boolean isFlagSet(@NotNull EnumDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    final IntegralWidth width = descriptor.width();
    final var seen = new HashSet<BigInteger>();
    BigInteger used = BigInteger.ZERO;
    for (Member member : descriptor.members()) {
      final BigInteger bits = width.toBitPattern(member.value());
      if (bits.signum() == 0 || !seen.add(bits)) {
        continue;
      }
      if (!isAtomic(bits) || used.and(bits).signum() != 0) {
        return false;
      }
      used = used.or(bits);
    }
    return true;
  }

  /// @return true if the host declared the type as flags or its members form a flag set
  public static boolean isFlagShaped(@NotNull EnumDescriptor descriptor) {
    return descriptor.declaredFlags() || isFlagSet(descriptor);
  }

  static boolean isAtomic(BigInteger bits) {
    return bits.signum() > 0 && bits.and(bits.subtract(BigInteger.ONE)).signum() == 0;
  }
}
