// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.crypto.Digest;

/// Why [Ledger#insert(Vertex)] refused a vertex. Nothing is inserted when one of these is returned.
public sealed interface LedgerError permits
    LedgerError.DuplicateTransaction,
    LedgerError.MissingParent,
    LedgerError.InvalidTransaction {

  String message();

  /// The id is already in the ledger.
  record DuplicateTransaction(Digest id) implements LedgerError {
    @Override
    public String message() {
      return "duplicate transaction " + id;
    }
  }

  /// A non-genesis vertex names a parent the ledger does not hold.
  record MissingParent(Digest parent) implements LedgerError {
    @Override
    public String message() {
      return "missing parent transaction: " + parent;
    }
  }

  /// The vertex breaks the genesis shape: a second genesis, a genesis with real parents, or a non-genesis with two
  /// zero parents.
  record InvalidTransaction(String reason) implements LedgerError {
    @Override
    public String message() {
      return "invalid transaction: " + reason;
    }
  }
}
