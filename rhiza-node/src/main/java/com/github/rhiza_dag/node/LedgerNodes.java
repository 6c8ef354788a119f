// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.github.rhiza_dag.crypto.KeyPair;
import org.h2.mvstore.MVStore;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;

import static com.github.rhiza_dag.RhizaLogger.LOGGER;

/// Wires a node from its config: opens the MVStore journal, replays it and creates the genesis when the journal
/// is empty.
public final class LedgerNodes {

  private LedgerNodes() {
  }

  /// @throws IOException if the data directory cannot be created
  public static NodeEngine open(NodeConfig config, KeyPair keyPair) throws IOException {
    Files.createDirectories(config.dataPath());
    final var store = new MVStore.Builder()
        .fileName(config.journalPath().toString())
        .open();
    final MVStoreTransactionJournal journal;
    try {
      journal = new MVStoreTransactionJournal(store);
    } catch (RuntimeException e) {
      store.close();
      throw e;
    }
    return open(config, keyPair, journal, Clock.systemUTC());
  }

  /// The engine takes ownership of the journal. If replay or genesis creation fails the journal is closed before
  /// the failure is rethrown so that its file lock is released.
  public static NodeEngine open(NodeConfig config, KeyPair keyPair, TransactionJournal journal, Clock clock) {
    try {
      final var node = new LedgerNode(config.level(), keyPair, journal, clock);
      final var engine = new NodeEngine(node);
      node.replay();
      final var founder = config.founderKey().orElse(keyPair.publicKey());
      if (engine.initializeGenesis(founder)) {
        LOGGER.info(() -> config.name() + " initialised a new ledger at " + config.journalPath());
      }
      LOGGER.info(() -> config.name() + " address " + node.address());
      return engine;
    } catch (RuntimeException e) {
      LOGGER.severe(() -> config.name() + " failed to start so closing its journal: " + e);
      try {
        journal.close();
      } catch (RuntimeException closing) {
        e.addSuppressed(closing);
      }
      throw e;
    }
  }
}
