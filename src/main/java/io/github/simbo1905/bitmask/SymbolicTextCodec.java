// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.bitmask.Bitmask.LOGGER;

/// Converts combined values to comma separated member names and back.
public final class SymbolicTextCodec {
  public static final String SEPARATOR = ", ";

  private SymbolicTextCodec() {
  }

  /// Format using the configured default style, see `FormatStyle.current()`.
  public static String format(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw) {
    return format(descriptor, raw, FormatStyle.current());
  }

  /// Format a combined value. Never fails: a value with no symbolic form comes back as decimal digits.
  ///
  /// GENERAL applies these rules in order:
  /// 1. zero is the name of the first member declared as zero, or "0"
  /// 2. a flag-shaped type with an exact union joins the atomic names in declaration order
  /// 3. any other type returns the first member declared with exactly that value, else joins the atomic names of
  ///    an exact union
  /// 4. otherwise decimal
  public static String format(@NotNull EnumDescriptor descriptor, @NotNull BigInteger raw, @NotNull FormatStyle style) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(raw, "raw must not be null");
    Objects.requireNonNull(style, "style must not be null");
    return switch (style) {
      case DECIMAL -> raw.toString();
      case HEX -> hex(descriptor.width(), raw);
      case GENERAL -> symbolic(descriptor, raw, FlagDecomposer.isFlagShaped(descriptor));
      case FLAGS -> symbolic(descriptor, raw, true);
    };
  }

  public static String format(@NotNull EnumDescriptor descriptor, long raw) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    return format(descriptor, descriptor.width().fromLongBits(raw));
  }

  static String symbolic(EnumDescriptor descriptor, BigInteger raw, boolean asFlags) {
    if (raw.signum() == 0) {
      return descriptor.memberForValue(BigInteger.ZERO).map(Member::name).orElse("0");
    }
    if (asFlags) {
      final Decomposition decomposition = FlagDecomposer.decompose(descriptor, raw);
      if (decomposition.isExactUnion()) {
        return String.join(SEPARATOR, decomposition.names());
      }
    } else {
      final Optional<Member> exact = descriptor.memberForValue(raw);
      if (exact.isPresent()) {
        return exact.get().name();
      }
      final Decomposition decomposition = FlagDecomposer.decompose(descriptor, raw);
      if (decomposition.isExactUnion()) {
        return String.join(SEPARATOR, decomposition.names());
      }
    }
    LOGGER.finer(() -> "SymbolicTextCodec " + descriptor.typeId() + " has no symbolic form for " + raw + ", using decimal");
    return raw.toString();
  }

  static String hex(IntegralWidth width, BigInteger raw) {
    final String digits = width.toBitPattern(raw).toString(16).toUpperCase(Locale.ROOT);
    if (digits.length() >= width.hexDigits()) {
      return digits;
    }
    return "0".repeat(width.hexDigits() - digits.length()) + digits;
  }

  /// Parse with the configured default case mode, see `CaseMode.current()`.
  public static BigInteger parse(@NotNull EnumDescriptor descriptor, String text) {
    return parse(descriptor, text, CaseMode.current());
  }

  /// Parse comma separated member names and OR their values together. Whitespace around each name is ignored.
  /// @throws SymbolParseException with `EMPTY_INPUT` for null or blank text, or `UNKNOWN_MEMBER` naming the first
  /// token that is not a declared member. An empty token between commas is an unknown member.
  public static BigInteger parse(@NotNull EnumDescriptor descriptor, String text, @NotNull CaseMode caseMode) {
    final Parsed parsed = parseTokens(descriptor, text, caseMode);
    if (parsed.value() != null) {
      return parsed.value();
    }
    if (parsed.unknownToken() == null) {
      throw SymbolParseException.emptyInput(descriptor.typeId());
    }
    throw SymbolParseException.unknownMember(descriptor.typeId(), parsed.unknownToken());
  }

  /// As `parse` but returns empty rather than throwing.
  public static Optional<BigInteger> tryParse(@NotNull EnumDescriptor descriptor, String text, @NotNull CaseMode caseMode) {
    return Optional.ofNullable(parseTokens(descriptor, text, caseMode).value());
  }

  public static Optional<BigInteger> tryParse(@NotNull EnumDescriptor descriptor, String text) {
    return tryParse(descriptor, text, CaseMode.current());
  }

  /// Either a value, or the unknown token that stopped parsing, or neither for empty input.
  private record Parsed(BigInteger value, String unknownToken) {
  }

  private static Parsed parseTokens(EnumDescriptor descriptor, String text, CaseMode caseMode) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    Objects.requireNonNull(caseMode, "caseMode must not be null");
    if (text == null || text.isBlank()) {
      return new Parsed(null, null);
    }
    BigInteger result = BigInteger.ZERO;
    for (String part : text.split(",", -1)) {
      final String token = part.trim();
      final Optional<Member> member = caseMode == CaseMode.SENSITIVE
          ? descriptor.member(token)
          : descriptor.memberIgnoreCase(token);
      if (member.isEmpty()) {
        LOGGER.finer(() -> "SymbolicTextCodec " + descriptor.typeId() + " unknown token '" + token + "' in '" + text + "'");
        return new Parsed(null, token);
      }
      result = result.or(member.get().value());
    }
    return new Parsed(result, null);
  }

}
