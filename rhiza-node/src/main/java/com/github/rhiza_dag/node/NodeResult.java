// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.github.rhiza_dag.dag.LedgerError;
import com.github.rhiza_dag.dag.Transaction;
import com.github.rhiza_dag.dag.ValidationError;

/// The outcome of asking a [LedgerNode] to admit a transaction. Rejections are normal outcomes that the host may
/// log, drop or report back to a peer.
public sealed interface NodeResult permits
    NodeResult.Accepted,
    NodeResult.Invalid,
    NodeResult.Refused,
    NodeResult.NoRewardAvailable {

  default boolean accepted() {
    return this instanceof Accepted;
  }

  /// @param transaction The transaction now in the ledger.
  /// @param relayReward What this node earned for relaying it, zero when none.
  record Accepted(Transaction transaction, long relayReward) implements NodeResult {
  }

  /// The validator rejected the transaction.
  record Invalid(ValidationError error) implements NodeResult {
  }

  /// The ledger refused the insertion.
  record Refused(LedgerError error) implements NodeResult {
  }

  /// A relay reward claim when the schedule pays nothing.
  record NoRewardAvailable() implements NodeResult {
  }
}
