// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.PublicKey;

import java.math.BigInteger;
import java.util.*;
import java.util.logging.Level;

import static com.github.rhiza_dag.RhizaLogger.LOGGER;

/// The DAG store. It owns every admitted [Vertex] keyed by transaction id, the reverse adjacency from a vertex to the
/// vertices that approve it, the tip frontier and the identity of the genesis. Edges are id lookups into the vertex
/// map so there are no object references between vertices.
///
/// The ledger does not validate signatures or balances. That is the job of [TransactionValidator], which the host
/// must run before calling [#insert(Vertex)] for anything that came from the network. It only guards its own
/// structural invariants:
///
/// 1. At most one genesis, and it names the zero digest as both parents.
/// 2. No dangling parent references.
/// 3. `cumulativeWeight(v) = 1 + |distinct descendants of v|`.
/// 4. A vertex is final from the moment its weight first reaches [Protocol#FINALITY_THRESHOLD] and stays final.
/// 5. The tips are exactly the vertices that no other vertex names as a parent.
///
/// Nothing is ever removed. This class is not thread safe. The host application must ensure a single writer and
/// must not read concurrently with a write.
public class Ledger {

  /// We log when vertices become final.
  private final Level logAtLevel;

  private final Map<Digest, Vertex> vertices = new HashMap<>();

  /// Vertex id to the ids of the vertices that name it as a parent, in insertion order.
  private final Map<Digest, List<Digest>> children = new HashMap<>();

  /// Kept in insertion order which is the tie-break of [#selectParents()].
  private final LinkedHashSet<Digest> tips = new LinkedHashSet<>();

  private final BalanceIndex balanceIndex = new BalanceIndex();

  private Digest genesisId = null;

  private long maxDepth = 0;

  public Ledger() {
    this(Level.FINE);
  }

  /// @param logAtLevel The level to log when a vertex becomes final which is logged as "FINAL".
  public Ledger(Level logAtLevel) {
    this.logAtLevel = logAtLevel;
  }

  /// Insert a vertex and propagate its weight to every ancestor. On any error nothing is changed.
  ///
  /// @return empty on success else the reason the vertex was refused
  public Optional<LedgerError> insert(Vertex vertex) {
    final var id = vertex.id();
    if (vertices.containsKey(id)) {
      return Optional.of(new LedgerError.DuplicateTransaction(id));
    }
    final var data = vertex.transaction().data();
    final boolean genesisShaped = data.hasZeroParents();
    if (genesisShaped) {
      if (data.type() != TransactionType.GENESIS) {
        return Optional.of(new LedgerError.InvalidTransaction(data.type() + " with two zero parents"));
      }
      if (genesisId != null) {
        return Optional.of(new LedgerError.InvalidTransaction("ledger already has genesis " + genesisId));
      }
    } else {
      if (data.type() == TransactionType.GENESIS) {
        return Optional.of(new LedgerError.InvalidTransaction("genesis must name two zero parents"));
      }
      for (var parent : vertex.parents()) {
        if (!vertices.containsKey(parent)) {
          return Optional.of(new LedgerError.MissingParent(parent));
        }
      }
    }

    // From here on there is no failure path so the insertion is all or nothing.
    if (!genesisShaped) {
      for (var parent : new LinkedHashSet<>(vertex.parents())) {
        children.computeIfAbsent(parent, k -> new ArrayList<>()).add(id);
        tips.remove(parent);
      }
    } else {
      genesisId = id;
    }
    tips.add(id);
    vertices.put(id, vertex);
    maxDepth = Math.max(maxDepth, vertex.depth());
    balanceIndex.apply(data);

    final var newlyFinal = propagateWeight(vertex);
    if (!newlyFinal.isEmpty()) {
      LOGGER.log(logAtLevel, () -> "FINAL " + newlyFinal + " after " + id);
    }
    LOGGER.finer(() -> "inserted " + vertex);
    return Optional.empty();
  }

  /// Walk the ancestors of the new vertex with an explicit stack. The visited set makes sure an ancestor reachable
  /// by several paths, or named as both parents, gains exactly one unit of weight.
  private List<Digest> propagateWeight(Vertex inserted) {
    final var newlyFinal = new ArrayList<Digest>();
    final Deque<Digest> stack = new ArrayDeque<>();
    final Set<Digest> visited = new HashSet<>();
    pushParents(inserted, stack);
    while (!stack.isEmpty()) {
      final var id = stack.pop();
      if (!visited.add(id)) {
        continue;
      }
      final var ancestor = vertices.get(id);
      if (ancestor == null) {
        // insert checked every parent is present and nothing is ever removed
        throw new IllegalStateException("ancestor " + id + " of " + inserted.id() + " is not in the ledger");
      }
      if (ancestor.approve(Protocol.FINALITY_THRESHOLD)) {
        newlyFinal.add(id);
      }
      pushParents(ancestor, stack);
    }
    return newlyFinal;
  }

  private static void pushParents(Vertex vertex, Deque<Digest> stack) {
    for (var parent : vertex.parents()) {
      if (!parent.isZero()) {
        stack.push(parent);
      }
    }
  }

  /// Pick the parents for a new transaction.
  ///
  /// - No tips: the zero pair, which is only good for building a genesis.
  /// - One tip: that tip twice.
  /// - Otherwise the two deepest tips. On equal depth the tip that became a tip first wins.
  public List<Digest> selectParents() {
    if (tips.isEmpty()) {
      return List.of(Digest.ZERO, Digest.ZERO);
    }
    if (tips.size() == 1) {
      final var only = tips.iterator().next();
      return List.of(only, only);
    }
    final var byDepth = tips.stream()
        .map(vertices::get)
        .sorted(Comparator.comparingLong(Vertex::depth).reversed())
        .limit(Protocol.PARENT_COUNT)
        .map(Vertex::id)
        .toList();
    return List.of(byDepth.get(0), byDepth.get(1));
  }

  /// Full scan balance. Credit every amount paid to the key and debit amount plus fee for every payment the key made
  /// to someone else. Self-payments such as relay rewards do not debit the sender. A negative total is clamped to zero.
  public long getBalance(PublicKey key) {
    var balance = BigInteger.ZERO;
    for (var vertex : vertices.values()) {
      final var data = vertex.transaction().data();
      if (data.recipient().equals(key)) {
        balance = balance.add(BalanceIndex.unsigned(data.amount()));
      }
      if (data.sender().equals(key) && !data.recipient().equals(key)) {
        balance = balance.subtract(BalanceIndex.unsigned(data.amount())).subtract(BalanceIndex.unsigned(data.fee()));
      }
    }
    if (balance.signum() < 0) {
      final var negative = balance;
      LOGGER.warning(() -> "clamping negative balance " + negative + " of " + key + " to zero");
    }
    return BalanceIndex.clamp(balance);
  }

  /// The same answer as [#getBalance(PublicKey)] from the incrementally maintained index.
  public long indexedBalance(PublicKey key) {
    return BalanceIndex.clamp(balanceIndex.running(key));
  }

  public Optional<Vertex> get(Digest id) {
    return Optional.ofNullable(vertices.get(id));
  }

  public boolean contains(Digest id) {
    return vertices.containsKey(id);
  }

  /// The ids of the vertices that name this id as a parent.
  public List<Digest> children(Digest id) {
    return List.copyOf(children.getOrDefault(id, List.of()));
  }

  public List<Digest> tips() {
    return List.copyOf(tips);
  }

  public Optional<Digest> genesisId() {
    return Optional.ofNullable(genesisId);
  }

  /// The greatest depth of any vertex, zero when empty.
  public long depth() {
    return maxDepth;
  }

  public List<Digest> transactionIds() {
    return List.copyOf(vertices.keySet());
  }

  public int len() {
    return vertices.size();
  }

  public boolean isEmpty() {
    return vertices.isEmpty();
  }
}
