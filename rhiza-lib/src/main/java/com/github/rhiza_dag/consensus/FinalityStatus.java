// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.consensus;

/// The confirmation state of a transaction as seen by the local ledger.
public sealed interface FinalityStatus permits
    FinalityStatus.Unknown,
    FinalityStatus.Pending,
    FinalityStatus.Confirming,
    FinalityStatus.Final {

  FinalityStatus UNKNOWN = new Unknown();
  FinalityStatus PENDING = new Pending();
  FinalityStatus FINAL = new Final();

  /// The transaction is not in the ledger.
  record Unknown() implements FinalityStatus {
  }

  /// Only its own weight. Nothing approves it yet.
  record Pending() implements FinalityStatus {
  }

  /// Approved by at least one descendant but below the threshold.
  ///
  /// @param weight the current cumulative weight
  /// @param needed the finality threshold
  record Confirming(long weight, long needed) implements FinalityStatus {
  }

  record Final() implements FinalityStatus {
  }
}
