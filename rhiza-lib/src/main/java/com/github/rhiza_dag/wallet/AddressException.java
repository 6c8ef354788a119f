// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.wallet;

/// A string is not a valid [Address].
public class AddressException extends Exception {

  public enum Reason {
    INVALID_ENCODING("invalid address encoding"),
    INVALID_HRP("invalid human-readable prefix (expected 'rhz')"),
    INVALID_LENGTH("invalid address data length");

    private final String message;

    Reason(String message) {
      this.message = message;
    }
  }

  private final Reason reason;

  public AddressException(Reason reason) {
    super(reason.message);
    this.reason = reason;
  }

  public AddressException(Reason reason, Throwable cause) {
    super(reason.message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
