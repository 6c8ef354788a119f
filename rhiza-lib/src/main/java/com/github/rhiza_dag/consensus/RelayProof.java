// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.consensus;

import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.KeyPair;
import com.github.rhiza_dag.crypto.PublicKey;
import com.github.rhiza_dag.crypto.Signature;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// A relayer's signed statement that it forwarded a transaction. The signed bytes are the ASCII tag `RELAY:`, the
/// transaction id, one hop count byte and the little-endian u64 timestamp.
///
/// @param relayer       The key that signed the proof.
/// @param transactionId The transaction that was relayed.
/// @param hopCount      An unsigned byte.
/// @param timestamp     Milliseconds since the epoch.
/// @param signature     The relayer's signature.
public record RelayProof(PublicKey relayer, Digest transactionId, int hopCount, long timestamp, Signature signature) {

  private static final byte[] TAG = "RELAY:".getBytes(StandardCharsets.US_ASCII);

  public RelayProof {
    Objects.requireNonNull(relayer, "relayer");
    Objects.requireNonNull(transactionId, "transactionId");
    Objects.requireNonNull(signature, "signature");
    if (hopCount < 0 || hopCount > 0xFF) {
      throw new IllegalArgumentException("hop count must fit in an unsigned byte: " + hopCount);
    }
  }

  public static RelayProof create(KeyPair keyPair, Digest transactionId, int hopCount, long timestampMillis) {
    final var signature = keyPair.sign(signingData(transactionId, hopCount, timestampMillis));
    return new RelayProof(keyPair.publicKey(), transactionId, hopCount, timestampMillis, signature);
  }

  public boolean verify() {
    return relayer.verify(signingData(transactionId, hopCount, timestamp), signature);
  }

  static byte[] signingData(Digest transactionId, int hopCount, long timestamp) {
    return ByteBuffer.allocate(TAG.length + Digest.SIZE + 1 + Long.BYTES)
        .order(ByteOrder.LITTLE_ENDIAN)
        .put(TAG)
        .put(transactionId.bytes())
        .put((byte) hopCount)
        .putLong(timestamp)
        .array();
  }
}
