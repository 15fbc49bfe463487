// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

/// Raised when the declared members of a symbolic type cannot form a descriptor. Fatal to registration.
public final class DescriptorBuildException extends BitmaskException {

  public enum Kind {
    EMPTY_MEMBERS,
    VALUE_OUT_OF_RANGE,
    DUPLICATE_NAME,
    INVALID_NAME
  }

  private final Kind kind;
  private final String typeId;

  DescriptorBuildException(Kind kind, String typeId, String message) {
    super(typeId + ": " + message);
    this.kind = kind;
    this.typeId = typeId;
  }

  public Kind kind() {
    return kind;
  }

  public String typeId() {
    return typeId;
  }
}
