// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.*;

import static io.github.simbo1905.bitmask.Bitmask.LOGGER;

/// Bitmask view of a `Symbolic` enum backed by its cached descriptor
final class EnumBitmask<E extends Enum<E> & Symbolic> implements Bitmask<E> {
  final Class<E> enumType;
  final EnumDescriptor descriptor;
  final List<E> constants;
  final Map<String, E> constantsByName;
  final Map<BigInteger, E> constantsByValue;

  EnumBitmask(@NotNull Class<E> enumType, @NotNull EnumDescriptor descriptor) {
    assert enumType.isEnum() : "User type must be an enum: " + enumType;
    assert enumType.getName().equals(descriptor.typeId()) : "Descriptor " + descriptor.typeId() + " is not for " + enumType;

    this.enumType = enumType;
    this.descriptor = descriptor;
    this.constants = List.of(enumType.getEnumConstants());
    final var byName = new HashMap<String, E>();
    final var byValue = new HashMap<BigInteger, E>();
    for (E constant : constants) {
      byName.put(constant.name(), constant);
      byValue.putIfAbsent(valueOf(constant), constant);
    }
    this.constantsByName = Collections.unmodifiableMap(byName);
    this.constantsByValue = Collections.unmodifiableMap(byValue);

    LOGGER.fine(() -> "EnumBitmask " + enumType.getName() + " construction complete with " + constants.size() +
        " constants width " + descriptor.width());
  }

  @Override
  public EnumDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public List<E> constants() {
    return constants;
  }

  @Override
  public long toIntegral(E constant) {
    return IntegralBridge.toIntegral(descriptor, valueOf(constant)).longValue();
  }

  @Override
  public Number boxedIntegral(E constant) {
    return IntegralBridge.boxedIntegral(descriptor, valueOf(constant));
  }

  @Override
  public RawValue fromIntegral(long raw) {
    return IntegralBridge.fromIntegral(descriptor, raw);
  }

  @Override
  public Optional<E> constantOf(long raw) {
    return Optional.ofNullable(constantsByValue.get(widen(raw)));
  }

  @SafeVarargs
  @Override
  public final long combine(E... flags) {
    Objects.requireNonNull(flags, "flags must not be null");
    BigInteger result = BigInteger.ZERO;
    for (E flag : flags) {
      result = result.or(valueOf(flag));
    }
    return result.longValue();
  }

  @Override
  public List<E> decompose(long raw) {
    return decomposition(raw).members().stream()
        .map(m -> constantsByName.get(m.name()))
        .toList();
  }

  @Override
  public Decomposition decomposition(long raw) {
    return FlagDecomposer.decompose(descriptor, raw);
  }

  @Override
  public Set<E> flagsOf(long raw) {
    final EnumSet<E> flags = EnumSet.noneOf(enumType);
    flags.addAll(decompose(raw));
    return flags;
  }

  @Override
  public boolean hasFlag(long raw, E flag) {
    Objects.requireNonNull(flag, "flag must not be null");
    final IntegralWidth width = descriptor.width();
    return FlagDecomposer.hasFlag(width.toBitPattern(widen(raw)), width.toBitPattern(valueOf(flag)));
  }

  @Override
  public boolean isDefined(long raw) {
    return descriptor.isDefined(widen(raw));
  }

  @Override
  public boolean isExactUnion(long raw) {
    return FlagDecomposer.isExactUnion(descriptor, widen(raw));
  }

  @Override
  public int countSetFlags(long raw) {
    final IntegralWidth width = descriptor.width();
    return FlagDecomposer.countSetAtomicBits(width.toBitPattern(width.wrap(widen(raw))));
  }

  @Override
  public String format(long raw) {
    return SymbolicTextCodec.format(descriptor, widen(raw));
  }

  @Override
  public String format(long raw, FormatStyle style) {
    return SymbolicTextCodec.format(descriptor, widen(raw), style);
  }

  @Override
  public String format(Set<E> flags) {
    Objects.requireNonNull(flags, "flags must not be null");
    BigInteger result = BigInteger.ZERO;
    for (E flag : flags) {
      result = result.or(valueOf(flag));
    }
    return SymbolicTextCodec.format(descriptor, result);
  }

  @Override
  public long parse(String text) {
    return SymbolicTextCodec.parse(descriptor, text).longValue();
  }

  @Override
  public long parse(String text, CaseMode caseMode) {
    return SymbolicTextCodec.parse(descriptor, text, caseMode).longValue();
  }

  @Override
  public Optional<Long> tryParse(String text) {
    return SymbolicTextCodec.tryParse(descriptor, text).map(BigInteger::longValue);
  }

  @Override
  public List<Map.Entry<Long, String>> options() {
    return descriptor.members().stream()
        .map(m -> Map.entry(m.value().longValue(), m.name()))
        .toList();
  }

  BigInteger valueOf(E constant) {
    Objects.requireNonNull(constant, "constant must not be null");
    return descriptor.width().fromLongBits(constant.integralValue());
  }

  BigInteger widen(long raw) {
    return descriptor.width().fromLongBits(raw);
  }

  @Override
  public String toString() {
    return "EnumBitmask{enumType=" + enumType + ", signature=0x" + Long.toHexString(descriptor.signature()) + "}";
  }
}
