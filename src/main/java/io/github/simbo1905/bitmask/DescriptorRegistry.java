// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static io.github.simbo1905.bitmask.Bitmask.LOGGER;

/// Thread-safe cache of descriptors keyed by type id. Each descriptor is built lazily on first use and at most once
/// even when many threads ask for the same type at the same time. Entries live as long as the registry: the host
/// application creates one and passes it to whatever needs it.
public final class DescriptorRegistry {
  private final Map<String, EnumDescriptor> descriptors = new ConcurrentHashMap<>();

  /// Return the cached descriptor for the type id, building it with the factory on first use.
  /// @throws IllegalArgumentException if the factory builds a descriptor for a different type id
  public EnumDescriptor descriptor(@NotNull String typeId, @NotNull Supplier<EnumDescriptor> factory) {
    Objects.requireNonNull(typeId, "typeId must not be null");
    Objects.requireNonNull(factory, "factory must not be null");
    return descriptors.computeIfAbsent(typeId, key -> {
      final EnumDescriptor built = Objects.requireNonNull(factory.get(), "factory returned null for " + key);
      if (!key.equals(built.typeId())) {
        throw new IllegalArgumentException("Factory for " + key + " built a descriptor for " + built.typeId());
      }
      LOGGER.fine(() -> "DescriptorRegistry cached " + key + " signature 0x" + Long.toHexString(built.signature()));
      return built;
    });
  }

  /// Register a prebuilt descriptor. Registering an identical declaration again is a no-op.
  /// @return the cached descriptor
  /// @throws IllegalStateException if a different declaration is already registered under the same type id
  public EnumDescriptor register(@NotNull EnumDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    final EnumDescriptor existing = descriptors.putIfAbsent(descriptor.typeId(), descriptor);
    if (existing == null) {
      LOGGER.fine(() -> "DescriptorRegistry registered " + descriptor.typeId() + " signature 0x" + Long.toHexString(descriptor.signature()));
      return descriptor;
    }
    if (existing.signature() != descriptor.signature()) {
      LOGGER.warning(() -> "DescriptorRegistry signature conflict for " + descriptor.typeId() + ": cached 0x" +
          Long.toHexString(existing.signature()) + " offered 0x" + Long.toHexString(descriptor.signature()));
      throw new IllegalStateException("Type " + descriptor.typeId() + " is already registered with different members: " +
          existing.members() + " versus " + descriptor.members());
    }
    return existing;
  }

  public Optional<EnumDescriptor> lookup(@NotNull String typeId) {
    Objects.requireNonNull(typeId, "typeId must not be null");
    return Optional.ofNullable(descriptors.get(typeId));
  }

  public int size() {
    return descriptors.size();
  }

  /// Enumerate the constants of a `Symbolic` enum once and cache the descriptor under the enum's class name.
  /// The width comes from `Symbolic.Width`, defaulting to `INT32`, and `@Flags` marks it as combinable.
  /// @throws DescriptorBuildException if a constant's value does not fit the width
  public <E extends Enum<E> & Symbolic> EnumDescriptor forEnum(@NotNull Class<E> enumType) {
    Objects.requireNonNull(enumType, "enumType must not be null");
    return descriptor(enumType.getName(), () -> describe(enumType));
  }

  static <E extends Enum<E> & Symbolic> EnumDescriptor describe(Class<E> enumType) {
    final Symbolic.Width declaredWidth = enumType.getAnnotation(Symbolic.Width.class);
    final IntegralWidth width = declaredWidth == null ? IntegralWidth.INT32 : declaredWidth.value();
    final var builder = EnumDescriptor.builder(enumType.getName(), width)
        .flags(enumType.isAnnotationPresent(Flags.class));
    Arrays.stream(enumType.getEnumConstants())
        .forEach(c -> builder.member(c.name(), width.fromLongBits(c.integralValue())));
    LOGGER.finer(() -> "DescriptorRegistry enumerated " + enumType.getEnumConstants().length + " constants of " + enumType.getName());
    return builder.build();
  }
}
