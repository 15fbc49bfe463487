// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bitmask;

import java.util.Optional;

/// Text could not be parsed into a combined value. Recoverable: present a validation message to the user.
public final class SymbolParseException extends BitmaskException {

  public enum Kind {
    EMPTY_INPUT,
    UNKNOWN_MEMBER
  }

  private final Kind kind;
  private final String token;

  private SymbolParseException(Kind kind, String token, String message) {
    super(message);
    this.kind = kind;
    this.token = token;
  }

  static SymbolParseException emptyInput(String typeId) {
    return new SymbolParseException(Kind.EMPTY_INPUT, null, "Empty input cannot be parsed as " + typeId);
  }

  static SymbolParseException unknownMember(String typeId, String token) {
    return new SymbolParseException(Kind.UNKNOWN_MEMBER, token,
        "Requested value '" + token + "' was not found in " + typeId);
  }

  public Kind kind() {
    return kind;
  }

  /// @return the offending token, empty for `EMPTY_INPUT`
  public Optional<String> token() {
    return Optional.ofNullable(token);
  }
}
