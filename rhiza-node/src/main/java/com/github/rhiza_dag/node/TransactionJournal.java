// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.github.rhiza_dag.dag.Transaction;

import java.util.Optional;

/// The durable store of admitted transactions. A node journals every transaction it inserts, in insertion order,
/// keyed by a sequence number that starts at zero. At startup [LedgerNode#replay()] reads them back in sequence
/// order and reinserts them so every parent is present before its children.
///
/// Writes need not be durable until [#sync()] returns. [NodeEngine] calls sync at the end of every operation and
/// before it hands any reply back to the host, so a reply is never sent for a transaction that could be lost.
///
/// MVStore is the storage subsystem of H2 and makes a good embedded journal, see [MVStoreTransactionJournal].
public interface TransactionJournal extends AutoCloseable {

  /// @param sequence The insertion sequence number. Numbers are written in order with no gaps.
  void writeTransaction(long sequence, Transaction transaction);

  Optional<Transaction> readTransaction(long sequence);

  /// The number of journaled transactions, which is also the next sequence number.
  long size();

  /// Make all writes crash durable.
  void sync();

  @Override
  void close();
}
