// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.node;

import com.github.rhiza_dag.consensus.FinalityStatus;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.PublicKey;
import com.github.rhiza_dag.dag.Transaction;
import com.github.rhiza_dag.dag.ValidationError;
import com.github.rhiza_dag.msg.GossipMessage;
import com.github.rhiza_dag.wallet.Address;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.logging.Level;

import static com.github.rhiza_dag.RhizaLogger.LOGGER;

/// Manages thread safety around one [LedgerNode]. Ensures:
/// - Single threaded access to the node via a mutex held for exactly one logical operation
/// - Crash durability by syncing the journal before any result is returned
/// - Dispatch of inbound gossip to the node and the replies to send back
///
/// It is closable to use try-with-resources to ensure that the journal is closed properly on exceptions due to bad
/// data or journal write exceptions.
public class NodeEngine implements AutoCloseable {

  final protected LedgerNode node;

  /// The Semaphore acts as a mutex with:
  /// - Non-reentrant locking
  /// - Fair queuing of threads
  /// - Automatic release on close/crash
  private final Semaphore mutex = new Semaphore(1, true);

  private volatile boolean closed = false;

  public NodeEngine(LedgerNode node) {
    this.node = node;
  }

  /// The main entry point for peers. This method is thread safe and allows only one thread at a time:
  ///
  /// 1. `NewTransaction` is validated and admitted. If its parents are unknown we ask the sender for them.
  /// 2. `SyncRequest` is answered with the requested transactions we hold, all of them if none are named.
  /// 3. `SyncResponse` transactions are admitted in order.
  /// 4. `TipAnnounce` tips we do not hold are requested.
  /// 5. `RelayAnnounce` proofs are verified and logged.
  /// 6. `Ping` is answered with a `Pong` carrying the same timestamp.
  /// 7. `Pong` needs no reply.
  ///
  /// The journal is synced before the replies are returned.
  ///
  /// @return the messages to send back to the peer, possibly empty
  public List<GossipMessage> gossip(GossipMessage message) {
    return underMutex(() -> {
      LOGGER.finer(() -> "<~ " + message.typeName());
      final var replies = dispatch(message);
      node.journal.sync();
      return replies;
    });
  }

  private List<GossipMessage> dispatch(GossipMessage message) {
    if (message instanceof GossipMessage.NewTransaction m) {
      final var result = node.process(m.transaction());
      return askForMissingParents(m.transaction().parents(), result);
    } else if (message instanceof GossipMessage.SyncRequest m) {
      return List.of(new GossipMessage.SyncResponse(node.knownTransactions(m.missing())));
    } else if (message instanceof GossipMessage.SyncResponse m) {
      final var missing = new ArrayList<Digest>();
      for (var transaction : m.transactions()) {
        final var result = node.process(transaction);
        if (result instanceof NodeResult.Invalid invalid && invalid.error() instanceof ValidationError.ParentNotFound) {
          missing.addAll(node.unknown(transaction.parents()));
        }
      }
      final var stillMissing = node.unknown(missing);
      return stillMissing.isEmpty() ? List.of() : List.of(new GossipMessage.SyncRequest(stillMissing));
    } else if (message instanceof GossipMessage.TipAnnounce m) {
      final var unknown = node.unknown(m.tips());
      return unknown.isEmpty() ? List.of() : List.of(new GossipMessage.SyncRequest(unknown));
    } else if (message instanceof GossipMessage.RelayAnnounce m) {
      final var proof = m.proof();
      if (proof.verify()) {
        LOGGER.fine(() -> "relay of " + proof.transactionId() + " by " + proof.relayer() + " hops=" + proof.hopCount());
      } else {
        LOGGER.fine(() -> "dropping relay proof with bad signature from " + proof.relayer());
      }
      return List.of();
    } else if (message instanceof GossipMessage.Ping m) {
      return List.of(new GossipMessage.Pong(m.timestamp()));
    } else if (message instanceof GossipMessage.Pong) {
      return List.of();
    }
    throw new IllegalArgumentException("Unknown message type: " + message.getClass());
  }

  private List<GossipMessage> askForMissingParents(List<Digest> parents, NodeResult result) {
    if (result instanceof NodeResult.Invalid invalid && invalid.error() instanceof ValidationError.ParentNotFound) {
      final var unknown = node.unknown(parents);
      if (!unknown.isEmpty()) {
        return List.of(new GossipMessage.SyncRequest(unknown));
      }
    }
    return List.of();
  }

  /// Announce our frontier so that peers can request what they are missing.
  public GossipMessage.TipAnnounce tipAnnounce() {
    return underMutex(() -> new GossipMessage.TipAnnounce(node.tips(), node.depth()));
  }

  public boolean initializeGenesis(PublicKey founder) {
    return underMutex(() -> {
      final var created = node.initializeGenesis(founder);
      node.journal.sync();
      return created;
    });
  }

  public NodeResult process(Transaction transaction) {
    return underMutex(() -> {
      final var result = node.process(transaction);
      node.journal.sync();
      return result;
    });
  }

  public NodeResult send(PublicKey recipient, long amount) {
    return underMutex(() -> {
      final var result = node.send(recipient, amount);
      node.journal.sync();
      return result;
    });
  }

  public NodeResult claimRelayReward() {
    return underMutex(() -> {
      final var result = node.claimRelayReward();
      node.journal.sync();
      return result;
    });
  }

  public long balance() {
    return underMutex(node::balance);
  }

  public Address address() {
    return node.address();
  }

  public FinalityStatus finalityStatus(Digest id) {
    return underMutex(() -> node.finalityStatus(id));
  }

  /// Run one logical operation while holding the mutex. A failure syncing the journal crashes the node.
  private <T> T underMutex(Supplier<T> operation) {
    if (closed) {
      throw new IllegalStateException("NodeEngine is closed");
    }
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warning("NodeEngine was interrupted probably to shutdown while under load.");
      throw new IllegalStateException("interrupted awaiting the node mutex", e);
    }
    try {
      if (node.isCrashed()) {
        LOGGER.severe(LedgerNode.CRASHED);
        System.err.println(LedgerNode.CRASHED);
        throw new IllegalStateException(LedgerNode.CRASHED);
      }
      return operation.get();
    } catch (Throwable e) {
      if (!node.isCrashed()) {
        // The node crashes itself on its own failures so this is the journal sync or the dispatch around it.
        node.crash();
        LOGGER.log(Level.SEVERE, LedgerNode.CRASHED + e, e);
        System.err.println(LedgerNode.CRASHED + e);
      }
      throw e;
    } finally {
      mutex.release();
    }
  }

  public boolean isCrashed() {
    return node.isCrashed();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    LOGGER.info("Closing NodeEngine and its journal.");
    closed = true;
    node.journal.close();
  }

  @TestOnly
  public LedgerNode node() {
    return node;
  }
}
