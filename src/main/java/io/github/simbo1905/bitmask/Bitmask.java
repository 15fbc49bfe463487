// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Main interface of the No Framework Bitmask library.
/// Gives any `Symbolic` enum width-safe integral conversion, flag decomposition, and name formatting and parsing.
/// Raw values are Java longs; for `UINT64` types they hold the unsigned bit pattern.
public sealed interface Bitmask<E extends Enum<E> & Symbolic> permits EnumBitmask {

  Logger LOGGER = Logger.getLogger(Bitmask.class.getName());

  /// Factory method for the typed view of an enum. The descriptor is built once and cached in the registry.
  /// @param enumType the enum class
  /// @param registry the registry that owns the descriptor
  /// @return a bitmask view of the enum
  static <E extends Enum<E> & Symbolic> Bitmask<E> forEnum(@NotNull Class<E> enumType, @NotNull DescriptorRegistry registry) {
    Objects.requireNonNull(enumType, "enumType must not be null");
    Objects.requireNonNull(registry, "registry must not be null");
    return new EnumBitmask<>(enumType, registry.forEnum(enumType));
  }

  EnumDescriptor descriptor();

  /// @return the constants in declaration order
  List<E> constants();

  /// @return the integral value of the constant in its declared width
  long toIntegral(E constant);

  /// @return the integral value boxed in the Java type that preserves its width
  Number boxedIntegral(E constant);

  /// Unchecked cast of an integral to this type. Never fails and never validates.
  RawValue fromIntegral(long raw);

  /// @return the first constant declared with exactly this value
  Optional<E> constantOf(long raw);

  /// OR the constants' values together
  @SuppressWarnings("unchecked")
  long combine(E... flags);

  /// @return single-bit constants set in `raw`, in declaration order
  List<E> decompose(long raw);

  /// @return the full decomposition including any unrecognized bits
  Decomposition decomposition(long raw);

  /// @return single-bit constants set in `raw` as an enum set
  Set<E> flagsOf(long raw);

  boolean hasFlag(long raw, E flag);

  /// @return true if some constant is declared with exactly this value
  boolean isDefined(long raw);

  boolean isExactUnion(long raw);

  /// @return the number of bits set in `raw` within the declared width
  int countSetFlags(long raw);

  String format(long raw);

  String format(long raw, FormatStyle style);

  String format(Set<E> flags);

  /// @throws SymbolParseException if the text is empty or names an unknown member
  long parse(String text);

  long parse(String text, CaseMode caseMode);

  Optional<Long> tryParse(String text);

  /// @return (value, name) pairs in declaration order, as needed to populate a selection list
  List<Map.Entry<Long, String>> options();
}
