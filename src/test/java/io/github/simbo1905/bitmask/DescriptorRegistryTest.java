// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DescriptorRegistryTest {
  DescriptorRegistry registry;

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @BeforeEach
  void freshRegistry() {
    registry = new DescriptorRegistry();
  }

  @Test
  void buildsOnceAndCaches() {
    final var builds = new AtomicInteger();
    final EnumDescriptor first = registry.descriptor("Sides", () -> {
      builds.incrementAndGet();
      return SampleTypes.sides();
    });
    final EnumDescriptor second = registry.descriptor("Sides", () -> {
      builds.incrementAndGet();
      return SampleTypes.sides();
    });
    assertThat(second).isSameAs(first);
    assertThat(builds).hasValue(1);
    assertThat(registry.lookup("Sides")).containsSame(first);
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void buildsAtMostOnceUnderConcurrentFirstUse() throws Exception {
    final int threads = 16;
    final var builds = new AtomicInteger();
    final var start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<EnumDescriptor>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          return registry.descriptor("Sides", () -> {
            builds.incrementAndGet();
            return SampleTypes.sides();
          });
        }));
      }
      start.countDown();
      final EnumDescriptor expected = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<EnumDescriptor> future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(expected);
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(builds).hasValue(1);
  }

  @Test
  void rejectsFactoryForAnotherType() {
    assertThatThrownBy(() -> registry.descriptor("Other", SampleTypes::sides))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Other");
    assertThat(registry.lookup("Other")).isEmpty();
  }

  @Test
  void failedBuildIsNotCached() {
    assertThatThrownBy(() -> registry.descriptor("Bad", () -> EnumDescriptor.builder("Bad", IntegralWidth.UINT8)
        .member("Big", 1000)
        .build()))
        .isInstanceOf(DescriptorBuildException.class);
    assertThat(registry.lookup("Bad")).isEmpty();
  }

  @Test
  void registerIsIdempotentForSameDeclaration() {
    final EnumDescriptor first = registry.register(SampleTypes.sides());
    assertThat(registry.register(SampleTypes.sides())).isSameAs(first);
  }

  @Test
  void registerRejectsConflictingDeclaration() {
    registry.register(SampleTypes.sides());
    final var conflicting = EnumDescriptor.builder("Sides", IntegralWidth.INT32).member("Left", 16).build();
    assertThatThrownBy(() -> registry.register(conflicting))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Sides");
  }

  @Test
  void forEnumReadsWidthAndFlags() {
    final EnumDescriptor wide = registry.forEnum(SampleTypes.Wide.class);
    assertThat(wide.typeId()).isEqualTo(SampleTypes.Wide.class.getName());
    assertThat(wide.width()).isEqualTo(IntegralWidth.UINT64);
    assertThat(wide.declaredFlags()).isTrue();
    assertThat(wide.member("Top")).map(Member::value).contains(BigInteger.ONE.shiftLeft(63));
    assertThat(registry.forEnum(SampleTypes.Wide.class)).isSameAs(wide);
  }

  @Test
  void forEnumDefaultsToInt32AndOrdinals() {
    final EnumDescriptor status = registry.forEnum(SampleTypes.TaskStatus.class);
    assertThat(status.width()).isEqualTo(IntegralWidth.INT32);
    assertThat(status.declaredFlags()).isFalse();
    assertThat(status.names()).containsExactly("NotStarted", "InProgress", "Completed", "Cancelled");
    assertThat(status.values()).containsExactly(BigInteger.ZERO, BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3));
  }

  @Test
  void forEnumRejectsValuesOutsideDeclaredWidth() {
    assertThatThrownBy(() -> registry.forEnum(SampleTypes.TooWide.class))
        .isInstanceOfSatisfying(DescriptorBuildException.class,
            e -> assertThat(e.kind()).isEqualTo(DescriptorBuildException.Kind.VALUE_OUT_OF_RANGE))
        .hasMessageContaining("Overflows");
  }
}
