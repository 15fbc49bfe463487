// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.github.simbo1905.bitmask.Bitmask.LOGGER;

/// Static metadata for one symbolic type: its members in declaration order and the width of its underlying
/// integral type. Immutable once built, so a single instance is shared by every thread that uses the type.
///
/// Two indices are built at construction so that lookups by name and by value are O(1):
/// - name to member (plus a lower-cased copy for case-insensitive lookups)
/// - value to the first member declared with that value, so aliases resolve to the earliest name
public final class EnumDescriptor {
  static final String SHA_256 = "SHA-256";
  /// Mask that treats a byte of the digest as unsigned before shifting it into the signature.
  static final long FFL = 0xFFL;

  private final String typeId;
  private final IntegralWidth width;
  private final boolean declaredFlags;
  private final List<Member> members;
  private final Map<String, Member> byName;
  private final Map<String, Member> byLowerName;
  private final Map<BigInteger, Member> byValue;
  private final long signature;

  private EnumDescriptor(String typeId, IntegralWidth width, boolean declaredFlags, List<Member> members) {
    this.typeId = typeId;
    this.width = width;
    this.declaredFlags = declaredFlags;
    this.members = List.copyOf(members);

    final var names = new HashMap<String, Member>(members.size() * 2);
    final var lowerNames = new HashMap<String, Member>(members.size() * 2);
    final var values = new HashMap<BigInteger, Member>(members.size() * 2);
    for (Member member : this.members) {
      if (names.putIfAbsent(member.name(), member) != null) {
        throw new DescriptorBuildException(DescriptorBuildException.Kind.DUPLICATE_NAME, typeId,
            "Duplicate member name '" + member.name() + "'");
      }
      lowerNames.putIfAbsent(member.name().toLowerCase(Locale.ROOT), member);
      values.putIfAbsent(member.value(), member);
    }
    this.byName = Collections.unmodifiableMap(names);
    this.byLowerName = Collections.unmodifiableMap(lowerNames);
    this.byValue = Collections.unmodifiableMap(values);
    this.signature = hashSignature(typeId + "!" + width + "!" + this.members.stream()
        .map(Member::toString)
        .collect(Collectors.joining("!")));
  }

  /// Build a descriptor from an ordered list of declared members.
  /// @param typeId opaque identifier of the symbolic type, usually its class name
  /// @param rawMembers members in declaration order, which is preserved exactly
  /// @param width the underlying integral type
  /// @throws DescriptorBuildException if the list is empty, a name repeats or cannot be parsed back, or a value
  /// does not fit the width
  public static EnumDescriptor build(@NotNull String typeId, @NotNull List<Member> rawMembers, @NotNull IntegralWidth width) {
    return build(typeId, rawMembers, width, false);
  }

  /// Build a descriptor, marking whether the host declared it as a set of combinable flags.
  public static EnumDescriptor build(@NotNull String typeId, @NotNull List<Member> rawMembers,
                                     @NotNull IntegralWidth width, boolean declaredFlags) {
    Objects.requireNonNull(typeId, "typeId must not be null");
    Objects.requireNonNull(rawMembers, "members must not be null");
    Objects.requireNonNull(width, "width must not be null");
    if (rawMembers.isEmpty()) {
      throw new DescriptorBuildException(DescriptorBuildException.Kind.EMPTY_MEMBERS, typeId,
          "A symbolic type must declare at least one member");
    }
    rawMembers.stream()
        .filter(m -> m.name().indexOf(',') >= 0 || !m.name().equals(m.name().trim()))
        .findFirst()
        .ifPresent(m -> {
          throw new DescriptorBuildException(DescriptorBuildException.Kind.INVALID_NAME, typeId,
              "Member name '" + m.name() + "' must not contain ',' or leading or trailing whitespace");
        });
    rawMembers.stream()
        .filter(m -> !width.fits(m.value()))
        .findFirst()
        .ifPresent(m -> {
          throw new DescriptorBuildException(DescriptorBuildException.Kind.VALUE_OUT_OF_RANGE, typeId,
              "Member " + m.name() + " value " + m.value() + " does not fit " + width +
                  " [" + width.min() + ", " + width.max() + "]");
        });
    final var descriptor = new EnumDescriptor(typeId, width, declaredFlags, rawMembers);
    LOGGER.fine(() -> "EnumDescriptor " + typeId + " construction complete with " + descriptor.members.size() +
        " members width " + width + " signature 0x" + Long.toHexString(descriptor.signature));
    return descriptor;
  }

  public static Builder builder(@NotNull String typeId, @NotNull IntegralWidth width) {
    return new Builder(typeId, width);
  }

  public String typeId() {
    return typeId;
  }

  public IntegralWidth width() {
    return width;
  }

  public boolean signed() {
    return width.signed();
  }

  /// @return true if the host declared the type as combinable flags
  public boolean declaredFlags() {
    return declaredFlags;
  }

  /// @return members in declaration order
  public List<Member> members() {
    return members;
  }

  public List<String> names() {
    return members.stream().map(Member::name).toList();
  }

  public List<BigInteger> values() {
    return members.stream().map(Member::value).toList();
  }

  public Optional<Member> member(@NotNull String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(byName.get(name));
  }

  /// Case-insensitive lookup. If two names differ only by case the first declared wins.
  public Optional<Member> memberIgnoreCase(@NotNull String name) {
    Objects.requireNonNull(name, "name must not be null");
    return Optional.ofNullable(byLowerName.get(name.toLowerCase(Locale.ROOT)));
  }

  /// @return the first member declared with the value, if any
  public Optional<Member> memberForValue(@NotNull BigInteger value) {
    Objects.requireNonNull(value, "value must not be null");
    return Optional.ofNullable(byValue.get(value));
  }

  /// @return true if some member is declared with exactly this value
  public boolean isDefined(@NotNull BigInteger value) {
    Objects.requireNonNull(value, "value must not be null");
    return byValue.containsKey(value);
  }

  /// 64 bit hash of the type id, width and the ordered members. Equal declarations give equal signatures.
  public long signature() {
    return signature;
  }

  /// Computes a 64 bit signature by hashing with SHA-256 then packing the first `Long.BYTES` big endian bytes
  /// into a long.
  static long hashSignature(String uniqueNess) {
    final MessageDigest digest;
    try {
      digest = MessageDigest.getInstance(SHA_256);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
    final byte[] hash = digest.digest(uniqueNess.getBytes(StandardCharsets.UTF_8));
    //      Byte Index:   0       1       2        3        4        5        6        7
    //      Shift:      <<56   <<48   <<40    <<32    <<24    <<16    <<8     <<0
    return IntStream.range(0, Long.BYTES)
        .mapToLong(i -> (hash[i] & FFL) << (56 - i * 8))
        .reduce(0L, (a, b) -> a | b);
  }

  @Override
  public String toString() {
    return "EnumDescriptor{typeId=" + typeId + ", width=" + width + ", flags=" + declaredFlags +
        ", members=" + members + "}";
  }

  /// Fluent collection of members in declaration order
  public static final class Builder {
    private final String typeId;
    private final IntegralWidth width;
    private final List<Member> members = new ArrayList<>();
    private boolean flags;

    private Builder(String typeId, IntegralWidth width) {
      this.typeId = Objects.requireNonNull(typeId, "typeId must not be null");
      this.width = Objects.requireNonNull(width, "width must not be null");
    }

    public Builder member(@NotNull String name, long value) {
      members.add(new Member(name, value));
      return this;
    }

    public Builder member(@NotNull String name, @NotNull BigInteger value) {
      members.add(new Member(name, value));
      return this;
    }

    public Builder flags(boolean flags) {
      this.flags = flags;
      return this;
    }

    public EnumDescriptor build() {
      return EnumDescriptor.build(typeId, members, width, flags);
    }
  }
}
