// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.github.rhiza_dag.dag.Transaction;
import com.github.rhiza_dag.msg.DeserializationException;
import com.github.rhiza_dag.msg.PickleGossip;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.util.Optional;

/// A [TransactionJournal] over one H2 MVStore map of pickled transactions keyed by sequence number.
public class MVStoreTransactionJournal implements TransactionJournal {
  static final String MAP_NAME = "com.github.rhiza_dag.node#transactions";

  private final MVStore store;
  private final MVMap<Long, byte[]> transactions;

  public MVStoreTransactionJournal(MVStore store) {
    this.store = store;
    this.transactions = store.openMap(MAP_NAME);
  }

  @Override
  public void writeTransaction(long sequence, Transaction transaction) {
    transactions.put(sequence, PickleGossip.pickle(transaction));
  }

  /// @throws IllegalStateException if the stored bytes are corrupt
  @Override
  public Optional<Transaction> readTransaction(long sequence) {
    final var bytes = transactions.get(sequence);
    if (bytes == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(PickleGossip.unpickleTransaction(bytes));
    } catch (DeserializationException e) {
      throw new IllegalStateException("corrupt journal entry at sequence " + sequence, e);
    }
  }

  @Override
  public long size() {
    return transactions.isEmpty() ? 0 : transactions.lastKey() + 1;
  }

  @Override
  public void sync() {
    store.commit();
  }

  @Override
  public void close() {
    store.close();
  }
}
