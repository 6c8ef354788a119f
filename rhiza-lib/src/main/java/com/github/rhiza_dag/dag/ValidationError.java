// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

/// Why [TransactionValidator] rejected a transaction. These are plain values for the caller to discard, log or relay.
/// They are never thrown.
public sealed interface ValidationError permits
    ValidationError.InvalidId,
    ValidationError.InvalidSignature,
    ValidationError.InsufficientBalance,
    ValidationError.ZeroAmount,
    ValidationError.ExceedsMaxSupply,
    ValidationError.ParentNotFound,
    ValidationError.SelfReference,
    ValidationError.InvalidRelayReward,
    ValidationError.InvalidTimestamp,
    ValidationError.FounderAllocationNotAdmissible {

  String message();

  ValidationError INVALID_ID = new InvalidId();
  ValidationError INVALID_SIGNATURE = new InvalidSignature();
  ValidationError ZERO_AMOUNT = new ZeroAmount();
  ValidationError EXCEEDS_MAX_SUPPLY = new ExceedsMaxSupply();
  ValidationError PARENT_NOT_FOUND = new ParentNotFound();
  ValidationError INVALID_RELAY_REWARD = new InvalidRelayReward();
  ValidationError FOUNDER_ALLOCATION_NOT_ADMISSIBLE = new FounderAllocationNotAdmissible();

  /// The id does not match the payload, or a second genesis.
  record InvalidId() implements ValidationError {
    @Override
    public String message() {
      return "invalid transaction ID";
    }
  }

  record InvalidSignature() implements ValidationError {
    @Override
    public String message() {
      return "invalid signature";
    }
  }

  /// @param have the sender's balance
  /// @param need amount plus fee, saturated at the unsigned maximum
  record InsufficientBalance(long have, long need) implements ValidationError {
    @Override
    public String message() {
      return "insufficient balance: have " + Long.toUnsignedString(have) + ", need " + Long.toUnsignedString(need);
    }
  }

  record ZeroAmount() implements ValidationError {
    @Override
    public String message() {
      return "zero amount transfer";
    }
  }

  record ExceedsMaxSupply() implements ValidationError {
    @Override
    public String message() {
      return "amount exceeds maximum supply";
    }
  }

  record ParentNotFound() implements ValidationError {
    @Override
    public String message() {
      return "parent transaction not found";
    }
  }

  /// Reserved. No rule produces this.
  record SelfReference() implements ValidationError {
    @Override
    public String message() {
      return "self-referencing parents";
    }
  }

  record InvalidRelayReward() implements ValidationError {
    @Override
    public String message() {
      return "relay reward exceeds allowed amount";
    }
  }

  /// Reserved. No rule produces this.
  record InvalidTimestamp(String reason) implements ValidationError {
    @Override
    public String message() {
      return "invalid timestamp: " + reason;
    }
  }

  /// Founder allocations only enter the ledger through the privileged path used when a node creates its genesis.
  record FounderAllocationNotAdmissible() implements ValidationError {
    @Override
    public String message() {
      return "founder allocation is not admissible through validation";
    }
  }
}
