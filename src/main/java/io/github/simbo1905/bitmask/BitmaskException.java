// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

/// Base of every error raised by the bitmask library. Decomposition and formatting never raise one.
public abstract class BitmaskException extends RuntimeException {
  BitmaskException(String message) {
    super(message);
  }
}
