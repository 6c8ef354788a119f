// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.consensus.WeightCalculator;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.KeyPair;
import net.jqwik.api.*;

import java.util.*;

import static com.github.rhiza_dag.dag.TestLedgers.*;

/// Builds random DAGs from a list of choices and checks the ledger invariants after every insertion:
/// - weights match the from-scratch audit
/// - the tips are exactly the vertices nobody names as a parent
/// - the balance index agrees with the full scan
/// - finality flips once when the weight first reaches the threshold and never reverts
public class LedgerPropertyTests {

  static final List<KeyPair> KEYS = List.of(ALICE, BOB, CAROL);

  /// Each choice picks two parents from everything inserted so far, a sender, a recipient and an amount.
  record Step(int parent0, int parent1, int sender, int recipient, long amount) {
  }

  @Provide
  Arbitrary<List<Step>> steps() {
    final var index = Arbitraries.integers().between(0, Integer.MAX_VALUE);
    final var key = Arbitraries.integers().between(0, KEYS.size() - 1);
    final var amount = Arbitraries.longs().between(1, 2_000);
    return Combinators.combine(index, index, key, key, amount).as(Step::new).list().ofMinSize(1).ofMaxSize(40);
  }

  @Property(tries = 40)
  void incrementalStateMatchesFromScratchState(@ForAll("steps") List<Step> steps) {
    final var ledger = withGenesis();
    final var inserted = new ArrayList<Digest>(ledger.transactionIds());
    final var finalSince = new HashMap<Digest, Long>();

    long nonce = 0;
    for (var step : steps) {
      final var p0 = inserted.get(step.parent0() % inserted.size());
      final var p1 = inserted.get(step.parent1() % inserted.size());
      final var tx = transfer(KEYS.get(step.sender()), KEYS.get(step.recipient()).publicKey(), step.amount(),
          List.of(p0, p1), ++nonce);
      assert ledger.insert(new Vertex(tx, ledger.depth() + 1)).isEmpty();
      inserted.add(tx.id());

      assertWeightsMatchAudit(ledger);
      assertTipsHaveNoChildren(ledger);
      assertFinalityIsMonotone(ledger, finalSince);
    }
    for (var key : KEYS) {
      assert ledger.indexedBalance(key.publicKey()) == ledger.getBalance(key.publicKey());
    }
  }

  @Property(tries = 20)
  void rejectedInsertionsChangeNothing(@ForAll("steps") List<Step> steps) {
    final var ledger = withGenesis();
    long nonce = 0;
    for (var step : steps) {
      mustInsert(ledger, transfer(KEYS.get(step.sender()), KEYS.get(step.recipient()).publicKey(), step.amount(),
          ledger.selectParents(), ++nonce));
    }
    final var before = WeightCalculator.calculateAllWeights(ledger);
    final var tipsBefore = ledger.tips();

    final var existing = ledger.get(ledger.tips().get(0)).orElseThrow().transaction();
    assert ledger.insert(new Vertex(existing, 1)).orElseThrow() instanceof LedgerError.DuplicateTransaction;
    final var orphan = transfer(ALICE, BOB.publicKey(), 1, List.of(Digest.of(new byte[]{1}), tipsBefore.get(0)), 0);
    assert ledger.insert(new Vertex(orphan, 1)).orElseThrow() instanceof LedgerError.MissingParent;
    assert ledger.insert(new Vertex(Transaction.genesis(BOB), 0)).orElseThrow() instanceof LedgerError.InvalidTransaction;

    assert before.equals(WeightCalculator.calculateAllWeights(ledger));
    assert tipsBefore.equals(ledger.tips());
  }

  static void assertWeightsMatchAudit(Ledger ledger) {
    final var audit = WeightCalculator.calculateAllWeights(ledger);
    for (var id : ledger.transactionIds()) {
      final var vertex = ledger.get(id).orElseThrow();
      assert audit.get(id) == vertex.cumulativeWeight() :
          "audit " + audit.get(id) + " but incremental " + vertex.cumulativeWeight() + " for " + id;
    }
  }

  static void assertTipsHaveNoChildren(Ledger ledger) {
    final Set<Digest> named = new HashSet<>();
    for (var id : ledger.transactionIds()) {
      ledger.get(id).orElseThrow().parents().forEach(named::add);
    }
    final var expected = new HashSet<>(ledger.transactionIds());
    expected.removeAll(named);
    assert expected.equals(new HashSet<>(ledger.tips())) : "tips " + ledger.tips() + " expected " + expected;
    for (var tip : ledger.tips()) {
      assert ledger.children(tip).isEmpty();
    }
  }

  static void assertFinalityIsMonotone(Ledger ledger, Map<Digest, Long> finalSince) {
    for (var id : ledger.transactionIds()) {
      final var vertex = ledger.get(id).orElseThrow();
      final boolean reached = vertex.cumulativeWeight() >= Protocol.FINALITY_THRESHOLD;
      assert vertex.isFinal() == reached;
      if (finalSince.containsKey(id)) {
        assert vertex.isFinal() : "finality reverted for " + id;
      } else if (vertex.isFinal()) {
        finalSince.put(id, vertex.cumulativeWeight());
      }
    }
  }
}
