// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.bitmask.Bitmask.LOGGER;

/// Conversions between symbolic values and their integral representation. All conversions are exact. Overflow
/// is reported, never rounded or truncated, except by `fromIntegral` which is a deliberate unchecked cast.
public final class IntegralBridge {

  private IntegralBridge() {
  }

  /// Widen a member value of the descriptor's type to the widest integral.
  /// @throws IntegralOverflowException if the value does not fit the descriptor's declared width
  public static BigInteger toIntegral(@NotNull EnumDescriptor descriptor, @NotNull BigInteger memberValue) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(memberValue, "memberValue must not be null");
    if (!descriptor.width().fits(memberValue)) {
      LOGGER.finer(() -> "IntegralBridge " + descriptor.typeId() + " overflow of " + memberValue + " in " + descriptor.width());
      throw new IntegralOverflowException(memberValue, descriptor.width());
    }
    return memberValue;
  }

  public static BigInteger toIntegral(@NotNull EnumDescriptor descriptor, long memberValue) {
    return toIntegral(descriptor, BigInteger.valueOf(memberValue));
  }

  /// As `toIntegral` but returns empty on overflow.
  public static Optional<BigInteger> tryToIntegral(@NotNull EnumDescriptor descriptor, @NotNull BigInteger memberValue) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(memberValue, "memberValue must not be null");
    return descriptor.width().fits(memberValue) ? Optional.of(memberValue) : Optional.empty();
  }

  /// Reinterpret an integral as a value of the descriptor's type. Never fails and never checks membership: the
  /// low bits of `raw` are read in the declared width exactly as an unchecked cast would. Use
  /// `fromIntegralChecked` to validate.
  public static RawValue fromIntegral(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(raw, "raw must not be null");
    final BigInteger wrapped = descriptor.width().wrap(raw);
    if (!wrapped.equals(raw)) {
      LOGGER.finer(() -> "IntegralBridge " + descriptor.typeId() + " reinterpreted " + raw + " as " + wrapped);
    }
    return new RawValue(descriptor.typeId(), descriptor.width(), wrapped);
  }

  public static RawValue fromIntegral(@NotNull EnumDescriptor descriptor, long raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    return fromIntegral(descriptor, descriptor.width().fromLongBits(raw));
  }

  /// Strict variant of `fromIntegral`.
  /// @throws IntegralOverflowException if `raw` does not fit the declared width
  /// @throws UndefinedValueException if `raw` is not a declared value, nor an exact union of declared flags when the
  /// descriptor is flag-shaped
  public static RawValue fromIntegralChecked(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(raw, "raw must not be null");
    if (!descriptor.width().fits(raw)) {
      throw new IntegralOverflowException(raw, descriptor.width());
    }
    final boolean defined = descriptor.isDefined(raw) ||
        (FlagDecomposer.isFlagShaped(descriptor) && FlagDecomposer.isExactUnion(descriptor, raw));
    if (!defined) {
      throw new UndefinedValueException(descriptor.typeId(), raw);
    }
    return new RawValue(descriptor.typeId(), descriptor.width(), raw);
  }

  /// Convert exactly between widths, as when a member of a byte-backed type is read into a long.
  /// @throws IntegralOverflowException if the target width cannot hold the value
  public static BigInteger convert(@NotNull BigInteger value, @NotNull IntegralWidth target) {
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(target, "target must not be null");
    if (!target.fits(value)) {
      throw new IntegralOverflowException(value, target);
    }
    return value;
  }

  /// @return the member value boxed in the Java type that preserves the descriptor's width
  public static Number boxedIntegral(@NotNull EnumDescriptor descriptor, @NotNull BigInteger memberValue) {
    return descriptor.width().box(toIntegral(descriptor, memberValue));
  }
}
