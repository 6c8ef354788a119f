// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.consensus;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.dag.Ledger;
import com.github.rhiza_dag.dag.Vertex;

import java.util.Set;
import java.util.stream.Collectors;

/// Read only view of finality derived from the weights the [Ledger] maintains.
public final class FinalityChecker {

  private FinalityChecker() {
  }

  public static boolean isFinal(Ledger ledger, Digest id) {
    return ledger.get(id).map(v -> v.cumulativeWeight() >= Protocol.FINALITY_THRESHOLD).orElse(false);
  }

  public static FinalityStatus finalityStatus(Ledger ledger, Digest id) {
    final var vertex = ledger.get(id);
    if (vertex.isEmpty()) {
      return FinalityStatus.UNKNOWN;
    }
    final long weight = vertex.get().cumulativeWeight();
    if (weight >= Protocol.FINALITY_THRESHOLD) {
      return FinalityStatus.FINAL;
    } else if (weight > Vertex.OWN_WEIGHT) {
      return new FinalityStatus.Confirming(weight, Protocol.FINALITY_THRESHOLD);
    }
    return FinalityStatus.PENDING;
  }

  public static Set<Digest> getFinalTransactions(Ledger ledger) {
    return ledger.transactionIds().stream()
        .filter(id -> isFinal(ledger, id))
        .collect(Collectors.toUnmodifiableSet());
  }
}
