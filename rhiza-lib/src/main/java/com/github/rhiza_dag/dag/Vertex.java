// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.crypto.Digest;

import java.util.List;
import java.util.Objects;

/// A transaction plus the metadata the [Ledger] derives for it. Only the ledger mutates a vertex and only
/// monotonically: the weight only goes up and finality only flips from false to true.
public final class Vertex {
  /// Every valid transaction contributes this much weight to itself.
  public static final long OWN_WEIGHT = 1;

  private final Transaction transaction;
  private final long depth;
  private long cumulativeWeight = OWN_WEIGHT;
  private boolean isFinal = false;

  /// @param transaction The transaction at this vertex.
  /// @param depth       An insertion order hint that parent selection prefers. It is not a strict distance from
  ///                    the genesis.
  public Vertex(Transaction transaction, long depth) {
    this.transaction = Objects.requireNonNull(transaction, "transaction");
    this.depth = depth;
  }

  public Digest id() {
    return transaction.id();
  }

  public List<Digest> parents() {
    return transaction.parents();
  }

  public Transaction transaction() {
    return transaction;
  }

  public long depth() {
    return depth;
  }

  public long ownWeight() {
    return OWN_WEIGHT;
  }

  /// One plus the number of distinct descendants inserted so far.
  public long cumulativeWeight() {
    return cumulativeWeight;
  }

  public boolean isFinal() {
    return isFinal;
  }

  /// Count one more descendant.
  ///
  /// @return true only on the call where the weight first reaches the threshold
  boolean approve(long finalityThreshold) {
    cumulativeWeight++;
    if (!isFinal && cumulativeWeight >= finalityThreshold) {
      isFinal = true;
      return true;
    }
    return false;
  }

  @Override
  public String toString() {
    return "Vertex(" + id() + ",w=" + cumulativeWeight + ",d=" + depth + (isFinal ? ",final" : "") + ")";
  }
}
