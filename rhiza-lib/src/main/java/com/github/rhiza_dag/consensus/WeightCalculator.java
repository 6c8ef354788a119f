// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.consensus;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.dag.Ledger;
import com.github.rhiza_dag.dag.Vertex;

import java.util.*;

/// Recomputes every cumulative weight from scratch. This deliberately shares no code with the incremental walk in
/// [Ledger#insert(Vertex)] so that each can be used to check the other.
public final class WeightCalculator {

  private WeightCalculator() {
  }

  /// Start every vertex at its own weight then, for every vertex, walk its ancestors once each and add one.
  public static Map<Digest, Long> calculateAllWeights(Ledger ledger) {
    final Map<Digest, Long> weights = new HashMap<>();
    final var ids = ledger.transactionIds();
    ids.forEach(id -> weights.put(id, Vertex.OWN_WEIGHT));
    for (var source : ids) {
      final Set<Digest> visited = new HashSet<>();
      final Deque<Digest> stack = new ArrayDeque<>(parentsOf(ledger, source));
      while (!stack.isEmpty()) {
        final var ancestor = stack.pop();
        if (visited.add(ancestor)) {
          weights.merge(ancestor, 1L, Long::sum);
          stack.addAll(parentsOf(ledger, ancestor));
        }
      }
    }
    return weights;
  }

  private static List<Digest> parentsOf(Ledger ledger, Digest id) {
    final var vertex = ledger.get(id)
        .orElseThrow(() -> new IllegalStateException("vertex " + id + " missing during weight audit"));
    return vertex.parents().stream().filter(p -> !p.isZero()).toList();
  }

  /// How far a weight is towards finality, capped at one.
  public static double confirmationScore(long weight) {
    return Math.min((double) weight / Protocol.FINALITY_THRESHOLD, 1.0);
  }
}
