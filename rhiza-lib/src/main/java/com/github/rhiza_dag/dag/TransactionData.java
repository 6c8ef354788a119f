// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.PublicKey;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The signed payload of a transaction. The transaction id is the digest of [Pickle#canonical(TransactionData)] and
/// the signature covers the same bytes.
///
/// Amounts, fee, timestamp and nonce are unsigned 64 bit values held in a `long`. Compare them with
/// [Long#compareUnsigned(long, long)].
///
/// @param type      The type tag.
/// @param parents   Exactly two parent ids. The genesis uses [Digest#ZERO] twice. The same id may appear twice.
/// @param sender    The signer.
/// @param recipient The payee. Equal to the sender for relay rewards and the genesis.
/// @param amount    Smallest units.
/// @param fee       Smallest units. Always zero in the current protocol but validated generically.
/// @param timestamp Unix epoch milliseconds.
/// @param nonce     A uniqueness and ordering hint. The ledger does not enforce global uniqueness.
/// @param memo      Optional free text.
public record TransactionData(TransactionType type,
                              List<Digest> parents,
                              PublicKey sender,
                              PublicKey recipient,
                              long amount,
                              long fee,
                              long timestamp,
                              long nonce,
                              Optional<String> memo) {
  public TransactionData {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(memo, "memo");
    parents = List.copyOf(parents);
    if (parents.size() != Protocol.PARENT_COUNT) {
      throw new IllegalArgumentException("expected " + Protocol.PARENT_COUNT + " parents but got " + parents.size());
    }
  }

  /// Both parents are the zero digest. Only a genesis may look like this.
  public boolean hasZeroParents() {
    return parents.get(0).isZero() && parents.get(1).isZero();
  }

  public boolean isSelfPayment() {
    return sender.equals(recipient);
  }
}
