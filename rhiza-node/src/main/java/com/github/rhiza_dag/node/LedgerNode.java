// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.github.rhiza_dag.consensus.FinalityChecker;
import com.github.rhiza_dag.consensus.FinalityStatus;
import com.github.rhiza_dag.consensus.RelayTracker;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.KeyPair;
import com.github.rhiza_dag.crypto.PublicKey;
import com.github.rhiza_dag.dag.*;
import com.github.rhiza_dag.wallet.Address;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;

import static com.github.rhiza_dag.RhizaLogger.LOGGER;

/// The state of one node: its [Ledger], its [RelayTracker], its signing key and its [TransactionJournal]. This is
/// the explicit context object that the host owns in place of any process wide mutable state.
///
/// This class is not thread safe. The [NodeEngine] wraps it with a mutex so that exactly one logical operation runs
/// at a time.
///
/// Every transaction inserted is written to the journal under the next sequence number. The journal is not synced
/// here. That is the job of the [NodeEngine] after each operation.
///
/// This class will mark itself as crashed if an operation throws, which can only be a journal failure or a broken
/// internal invariant. After logging to JUL and stderr it rethrows. From then on every operation throws an
/// [IllegalStateException] and the node must be restarted from its journal.
public class LedgerNode {
  static final String CRASHED = "CRASHED ";

  /// We log relay rewards and genesis creation at this level.
  private final Level logAtLevel;

  private final KeyPair keyPair;

  final Ledger ledger;

  final RelayTracker relayTracker;

  final TransactionJournal journal;

  private final Clock clock;

  /// The sequence number the next journaled transaction is written under.
  private long nextSequence;

  volatile private boolean crashed = false;

  /// @param logAtLevel The level to log rewards, genesis creation and finality at.
  /// @param keyPair    This node's signing key. Relay rewards and transfers are signed with it.
  /// @param journal    The durable log of inserted transactions. Call [#replay()] to load it.
  /// @param clock      The source of transaction timestamps.
  public LedgerNode(Level logAtLevel, KeyPair keyPair, TransactionJournal journal, Clock clock) {
    this(logAtLevel, keyPair, journal, clock, new RelayTracker());
  }

  LedgerNode(Level logAtLevel, KeyPair keyPair, TransactionJournal journal, Clock clock, RelayTracker relayTracker) {
    this.relayTracker = relayTracker;
    this.logAtLevel = logAtLevel;
    this.keyPair = keyPair;
    this.journal = journal;
    this.clock = clock;
    this.ledger = new Ledger(logAtLevel);
    this.nextSequence = 0;
  }

  public LedgerNode(KeyPair keyPair, TransactionJournal journal) {
    this(Level.INFO, keyPair, journal, Clock.systemUTC());
  }

  /// Reinsert every journaled transaction in sequence order. The journal only holds transactions that were already
  /// admitted so they go through the privileged path with no validation. Relay counts are not journaled so the
  /// relay tracker starts afresh.
  ///
  /// @return the number of transactions replayed
  /// @throws IllegalStateException if the journal does not replay cleanly onto an empty ledger
  public long replay() {
    return guarded(() -> {
      if (!ledger.isEmpty()) {
        throw new IllegalStateException("replay requires an empty ledger but it holds " + ledger.len());
      }
      final long size = journal.size();
      for (long sequence = 0; sequence < size; sequence++) {
        final long s = sequence;
        final var transaction = journal.readTransaction(sequence)
            .orElseThrow(() -> new IllegalStateException("journal has no transaction at sequence " + s));
        final var error = ledger.insert(new Vertex(transaction, nextDepth(transaction)));
        if (error.isPresent()) {
          throw new IllegalStateException("journal sequence " + s + " does not replay: " + error.get().message());
        }
      }
      nextSequence = size;
      LOGGER.info(() -> "replayed " + size + " transactions to depth " + ledger.depth());
      return size;
    });
  }

  /// Create the genesis and the founder allocation when the ledger is empty. Both go in through the privileged path
  /// because the founder allocation is not admissible through validation.
  ///
  /// @param founder The key that receives the founder allocation.
  /// @return true if the ledger was empty and has now been initialised
  public boolean initializeGenesis(PublicKey founder) {
    return guarded(() -> {
      if (!ledger.isEmpty()) {
        LOGGER.fine(() -> "ledger already initialised with genesis " + ledger.genesisId().orElse(null));
        return false;
      }
      final var genesis = Transaction.genesis(keyPair);
      insertPrivileged(genesis);
      LOGGER.log(logAtLevel, () -> "created genesis transaction " + genesis.id());
      final var allocation = Transaction.founderAllocation(keyPair, founder, genesis.id());
      insertPrivileged(allocation);
      LOGGER.log(logAtLevel, () -> "created founder allocation of " + allocation.data().amount() + " units to " + founder);
      return true;
    });
  }

  private void insertPrivileged(Transaction transaction) {
    final var error = ledger.insert(new Vertex(transaction, nextDepth(transaction)));
    if (error.isPresent()) {
      throw new IllegalStateException("privileged insert of " + transaction.id() + " failed: " + error.get().message());
    }
    journal.writeTransaction(nextSequence++, transaction);
  }

  /// Admit a transaction received from a peer. It is validated, inserted, journaled and then counted as a relay by
  /// this node, which may earn a reward. A founder allocation is only admitted under
  /// [TransactionValidator#validateGenesisGrant(Transaction, Ledger)] so that a node can sync a ledger it did not
  /// create.
  public NodeResult process(Transaction transaction) {
    return guarded(() -> {
      final var result = admit(transaction);
      if (result instanceof NodeResult.Accepted) {
        final long reward = relayTracker.recordRelay(keyPair.publicKey());
        if (reward > 0) {
          LOGGER.log(logAtLevel, () -> "relay reward: " + reward + " units");
        }
        return new NodeResult.Accepted(transaction, reward);
      }
      return result;
    });
  }

  /// Sign and admit a transfer from this node's key. The nonce is the ledger size.
  public NodeResult send(PublicKey recipient, long amount) {
    return guarded(() -> {
      final var transaction = Transaction.transfer(
          keyPair, recipient, amount, ledger.selectParents(), ledger.len(), clock.millis());
      return admit(transaction);
    });
  }

  /// Claim the reward for this node's next relay and count the claim as that relay. The claim is priced once, at
  /// the relay count it will have and under the supply cap, and the transaction mints exactly what the
  /// [RelayTracker] books.
  public NodeResult claimRelayReward() {
    return guarded(() -> {
      final long reward = relayTracker.nextReward(keyPair.publicKey());
      if (reward == 0) {
        return new NodeResult.NoRewardAvailable();
      }
      final var transaction = Transaction.relayReward(
          keyPair, reward, ledger.selectParents(), ledger.len(), clock.millis());
      final var result = admit(transaction);
      if (result instanceof NodeResult.Accepted) {
        final long issued = relayTracker.recordRelay(keyPair.publicKey());
        if (issued != reward) {
          throw new IllegalStateException("relay tracker issued " + issued + " for a claim minting " + reward);
        }
        LOGGER.log(logAtLevel, () -> "claimed relay reward of " + reward + " units");
        return new NodeResult.Accepted(transaction, reward);
      }
      return result;
    });
  }

  private NodeResult admit(Transaction transaction) {
    final var invalid = transaction.type() == TransactionType.FOUNDER_ALLOCATION
        ? TransactionValidator.validateGenesisGrant(transaction, ledger)
        : TransactionValidator.validate(transaction, ledger);
    if (invalid.isPresent()) {
      LOGGER.fine(() -> "rejected " + transaction.id() + ": " + invalid.get().message());
      return new NodeResult.Invalid(invalid.get());
    }
    final var refused = ledger.insert(new Vertex(transaction, nextDepth(transaction)));
    if (refused.isPresent()) {
      LOGGER.fine(() -> "refused " + transaction.id() + ": " + refused.get().message());
      return new NodeResult.Refused(refused.get());
    }
    journal.writeTransaction(nextSequence++, transaction);
    return new NodeResult.Accepted(transaction, 0L);
  }

  /// The genesis sits at depth zero and everything else one deeper than the deepest vertex so far. That makes depth
  /// strictly increase from parent to child.
  private long nextDepth(Transaction transaction) {
    return transaction.type() == TransactionType.GENESIS ? 0L : ledger.depth() + 1;
  }

  /// The transactions we hold with the given ids, parents before children. An empty list of ids means all of them.
  public List<Transaction> knownTransactions(List<Digest> ids) {
    final var wanted = ids.isEmpty() ? ledger.transactionIds() : ids;
    return wanted.stream()
        .distinct()
        .map(ledger::get)
        .flatMap(Optional::stream)
        .sorted(Comparator.comparingLong(Vertex::depth).thenComparing(Vertex::id))
        .map(Vertex::transaction)
        .toList();
  }

  /// The ids in the list that we do not hold.
  public List<Digest> unknown(List<Digest> ids) {
    return ids.stream().filter(id -> !id.isZero() && !ledger.contains(id)).distinct().toList();
  }

  public long balance() {
    return ledger.getBalance(keyPair.publicKey());
  }

  public Address address() {
    return Address.fromPublicKey(keyPair.publicKey());
  }

  public PublicKey publicKey() {
    return keyPair.publicKey();
  }

  public FinalityStatus finalityStatus(Digest id) {
    return FinalityChecker.finalityStatus(ledger, id);
  }

  public List<Digest> tips() {
    return ledger.tips();
  }

  public long depth() {
    return ledger.depth();
  }

  public long relayCount() {
    return relayTracker.relayCount(keyPair.publicKey());
  }

  /// A node is marked as crashed if the journal threw or an internal invariant broke. The operator must restart it
  /// so that it reloads from the journal.
  public boolean isCrashed() {
    return crashed;
  }

  /// Run one operation. Any throwable marks the node as crashed before it is rethrown.
  private <T> T guarded(Supplier<T> operation) {
    if (crashed) {
      LOGGER.severe(CRASHED);
      // Just in case the host application has not set up JUL logging we log to stderr as a last resort.
      System.err.println(CRASHED);
      throw new IllegalStateException(CRASHED);
    }
    try {
      return operation.get();
    } catch (Throwable e) {
      crashed = true;
      LOGGER.log(Level.SEVERE, CRASHED + e, e);
      System.err.println(CRASHED + e);
      //noinspection CallToPrintStackTrace
      e.printStackTrace();
      throw e;
    }
  }

  void crash() {
    crashed = true;
  }

  @TestOnly
  public Ledger ledger() {
    return ledger;
  }
}
