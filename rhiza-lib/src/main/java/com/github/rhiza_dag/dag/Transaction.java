// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.KeyPair;
import com.github.rhiza_dag.crypto.PublicKey;
import com.github.rhiza_dag.crypto.Signature;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An immutable signed transaction. Nothing here is trusted on the way in: [TransactionValidator] recomputes the
/// id and checks the signature of every transaction it admits.
///
/// @param id        The digest of the canonical encoding of `data`.
/// @param data      The signed payload.
/// @param signature The sender's signature over the canonical encoding of `data`.
public record Transaction(Digest id, TransactionData data, Signature signature) {

  public static final String GENESIS_MEMO = "Rhiza Genesis - The root of true decentralization";
  public static final String FOUNDER_MEMO = "Rhiza Founder Allocation - 5% genesis grant";

  public Transaction {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(signature, "signature");
  }

  /// Sign the payload and derive its id.
  public static Transaction sign(TransactionData data, KeyPair keyPair) {
    final var canonical = Pickle.canonical(data);
    return new Transaction(Digest.of(canonical), data, keyPair.sign(canonical));
  }

  /// The genesis is fully deterministic so the same key pair always creates the same genesis id.
  public static Transaction genesis(KeyPair keyPair) {
    final var key = keyPair.publicKey();
    return sign(new TransactionData(
        TransactionType.GENESIS,
        List.of(Digest.ZERO, Digest.ZERO),
        key,
        key,
        0L,
        0L,
        0L,
        0L,
        Optional.of(GENESIS_MEMO)), keyPair);
  }

  /// The one-time grant of [Protocol#FOUNDER_ALLOCATION] signed by the genesis key and approving the genesis twice.
  public static Transaction founderAllocation(KeyPair genesisKeyPair, PublicKey founder, Digest genesisId) {
    return sign(new TransactionData(
        TransactionType.FOUNDER_ALLOCATION,
        List.of(genesisId, genesisId),
        genesisKeyPair.publicKey(),
        founder,
        Protocol.FOUNDER_ALLOCATION,
        0L,
        0L,
        1L,
        Optional.of(FOUNDER_MEMO)), genesisKeyPair);
  }

  public static Transaction transfer(KeyPair sender,
                                     PublicKey recipient,
                                     long amount,
                                     List<Digest> parents,
                                     long nonce,
                                     long timestampMillis) {
    return sign(new TransactionData(
        TransactionType.TRANSFER,
        parents,
        sender.publicKey(),
        recipient,
        amount,
        0L,
        timestampMillis,
        nonce,
        Optional.empty()), sender);
  }

  public static Transaction relayReward(KeyPair keyPair,
                                        long rewardAmount,
                                        List<Digest> parents,
                                        long nonce,
                                        long timestampMillis) {
    return sign(new TransactionData(
        TransactionType.RELAY_REWARD,
        parents,
        keyPair.publicKey(),
        keyPair.publicKey(),
        rewardAmount,
        0L,
        timestampMillis,
        nonce,
        Optional.empty()), keyPair);
  }

  public boolean verifyId() {
    return id.equals(Digest.of(Pickle.canonical(data)));
  }

  public boolean verifySignature() {
    return data.sender().verify(Pickle.canonical(data), signature);
  }

  public TransactionType type() {
    return data.type();
  }

  public List<Digest> parents() {
    return data.parents();
  }
}
