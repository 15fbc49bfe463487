// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntegralWidthTest {
  static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void rangesFollowBitsAndSign() {
    assertThat(IntegralWidth.INT8.min()).isEqualTo(BigInteger.valueOf(-128));
    assertThat(IntegralWidth.INT8.max()).isEqualTo(BigInteger.valueOf(127));
    assertThat(IntegralWidth.UINT8.max()).isEqualTo(BigInteger.valueOf(255));
    assertThat(IntegralWidth.INT64.min()).isEqualTo(BigInteger.valueOf(Long.MIN_VALUE));
    assertThat(IntegralWidth.UINT64.min()).isEqualTo(BigInteger.ZERO);
    assertThat(IntegralWidth.UINT64.max()).isEqualTo(TWO_TO_64.subtract(BigInteger.ONE));
  }

  @Test
  void fitsIsInclusive() {
    assertThat(IntegralWidth.UINT8.fits(BigInteger.valueOf(255))).isTrue();
    assertThat(IntegralWidth.UINT8.fits(BigInteger.valueOf(256))).isFalse();
    assertThat(IntegralWidth.UINT8.fits(BigInteger.valueOf(-1))).isFalse();
    assertThat(IntegralWidth.INT16.fits(BigInteger.valueOf(-32768))).isTrue();
  }

  @Test
  void wrapBehavesAsUncheckedCast() {
    assertThat(IntegralWidth.UINT8.wrap(BigInteger.valueOf(300))).isEqualTo(BigInteger.valueOf(44));
    assertThat(IntegralWidth.INT8.wrap(BigInteger.valueOf(200))).isEqualTo(BigInteger.valueOf(-56));
    assertThat(IntegralWidth.INT8.wrap(BigInteger.valueOf(-1))).isEqualTo(BigInteger.valueOf(-1));
    assertThat(IntegralWidth.UINT64.wrap(BigInteger.valueOf(-1))).isEqualTo(TWO_TO_64.subtract(BigInteger.ONE));
  }

  @Test
  void bitPatternIsUnsignedWithinWidth() {
    assertThat(IntegralWidth.INT8.toBitPattern(BigInteger.valueOf(-1))).isEqualTo(BigInteger.valueOf(255));
    assertThat(IntegralWidth.INT8.toBitPattern(BigInteger.valueOf(-128))).isEqualTo(BigInteger.valueOf(128));
    assertThat(IntegralWidth.UINT8.toBitPattern(BigInteger.valueOf(200))).isEqualTo(BigInteger.valueOf(200));
    // out of range values keep every bit
    assertThat(IntegralWidth.INT8.toBitPattern(BigInteger.valueOf(-200))).isEqualTo(BigInteger.valueOf(-200));
  }

  @Test
  void onlyUint64ReadsLongsAsUnsigned() {
    assertThat(IntegralWidth.UINT64.fromLongBits(-1L)).isEqualTo(TWO_TO_64.subtract(BigInteger.ONE));
    assertThat(IntegralWidth.INT64.fromLongBits(-1L)).isEqualTo(BigInteger.valueOf(-1));
    assertThat(IntegralWidth.UINT32.fromLongBits(4294967295L)).isEqualTo(BigInteger.valueOf(4294967295L));
  }

  @Test
  void boxPreservesWidth() {
    assertThat(IntegralWidth.INT8.box(BigInteger.valueOf(5))).isInstanceOf(Byte.class).isEqualTo((byte) 5);
    assertThat(IntegralWidth.UINT8.box(BigInteger.valueOf(200))).isInstanceOf(Short.class).isEqualTo((short) 200);
    assertThat(IntegralWidth.INT32.box(BigInteger.valueOf(-7))).isInstanceOf(Integer.class).isEqualTo(-7);
    assertThat(IntegralWidth.UINT32.box(BigInteger.valueOf(4294967295L))).isInstanceOf(Long.class).isEqualTo(4294967295L);
    assertThat(IntegralWidth.UINT64.box(TWO_TO_64.subtract(BigInteger.ONE))).isInstanceOf(BigInteger.class);
  }

  @Test
  void boxRejectsValuesThatDoNotFit() {
    assertThatThrownBy(() -> IntegralWidth.INT8.box(BigInteger.valueOf(128)))
        .isInstanceOf(IntegralOverflowException.class)
        .hasMessageContaining("INT8");
  }

  @Test
  void lookupByBitsAndSign() {
    assertThat(IntegralWidth.of(16, false)).isEqualTo(IntegralWidth.UINT16);
    assertThat(IntegralWidth.of(64, true)).isEqualTo(IntegralWidth.INT64);
    assertThatThrownBy(() -> IntegralWidth.of(12, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("12 bits");
  }

  @Test
  void hexDigitsCoverWidth() {
    assertThat(IntegralWidth.INT8.hexDigits()).isEqualTo(2);
    assertThat(IntegralWidth.UINT64.hexDigits()).isEqualTo(16);
  }
}
