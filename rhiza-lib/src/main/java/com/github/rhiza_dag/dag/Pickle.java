// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.PublicKey;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/// Pickle writes the canonical encoding of [TransactionData]. The transaction id and signature are computed over
/// these bytes so the layout must be reproducible bit for bit by every node:
///
/// ```
/// u32  type tag               (little-endian)
/// [32] parent 0
/// [32] parent 1
/// [32] sender public key
/// [32] recipient public key
/// u64  amount
/// u64  fee
/// u64  timestamp millis
/// u64  nonce
/// u8   memo flag              0 = absent, 1 = present
/// u64  memo byte length       only when present, followed by the UTF-8 bytes
/// ```
///
/// This class does things the boilerplate way.
public final class Pickle {

  private Pickle() {
  }

  static final int FIXED_SIZE = Integer.BYTES + 4 * Digest.SIZE + 4 * Long.BYTES + 1;

  public static byte[] canonical(TransactionData data) {
    final byte[] memo = data.memo().map(m -> m.getBytes(StandardCharsets.UTF_8)).orElse(null);
    final int size = FIXED_SIZE + (memo == null ? 0 : Long.BYTES + memo.length);
    final ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    write(data, memo, buffer);
    return buffer.array();
  }

  private static void write(TransactionData data, byte[] memo, ByteBuffer buffer) {
    buffer.putInt(data.type().tag());
    buffer.put(data.parents().get(0).bytes());
    buffer.put(data.parents().get(1).bytes());
    buffer.put(data.sender().bytes());
    buffer.put(data.recipient().bytes());
    buffer.putLong(data.amount());
    buffer.putLong(data.fee());
    buffer.putLong(data.timestamp());
    buffer.putLong(data.nonce());
    if (memo == null) {
      buffer.put((byte) 0);
    } else {
      buffer.put((byte) 1);
      buffer.putLong(memo.length);
      buffer.put(memo);
    }
  }

  /// Decode canonical bytes that must contain exactly one payload.
  ///
  /// @throws IllegalArgumentException if the bytes are truncated, malformed or have trailing bytes
  public static TransactionData readData(byte[] canonical) {
    final ByteBuffer buffer = ByteBuffer.wrap(canonical).order(ByteOrder.LITTLE_ENDIAN);
    final var data = readData(buffer);
    if (buffer.hasRemaining()) {
      throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after transaction data");
    }
    return data;
  }

  /// Decode one payload from a little-endian buffer positioned at its first byte.
  ///
  /// @throws IllegalArgumentException if the bytes are truncated or malformed
  public static TransactionData readData(ByteBuffer buffer) {
    try {
      final int tag = buffer.getInt();
      final var type = TransactionType.fromTag(tag);
      if (type == null) {
        throw new IllegalArgumentException("unknown transaction type tag " + tag);
      }
      final var parent0 = Digest.fromBytes(readBytes(buffer, Digest.SIZE));
      final var parent1 = Digest.fromBytes(readBytes(buffer, Digest.SIZE));
      final var sender = PublicKey.fromBytes(readBytes(buffer, PublicKey.SIZE));
      final var recipient = PublicKey.fromBytes(readBytes(buffer, PublicKey.SIZE));
      final long amount = buffer.getLong();
      final long fee = buffer.getLong();
      final long timestamp = buffer.getLong();
      final long nonce = buffer.getLong();
      final Optional<String> memo = switch (buffer.get()) {
        case 0 -> Optional.empty();
        case 1 -> {
          final long length = buffer.getLong();
          if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("memo length " + Long.toUnsignedString(length) + " exceeds remaining " + buffer.remaining());
          }
          yield Optional.of(new String(readBytes(buffer, (int) length), StandardCharsets.UTF_8));
        }
        default -> throw new IllegalArgumentException("invalid memo flag");
      };
      return new TransactionData(type, List.of(parent0, parent1), sender, recipient, amount, fee, timestamp, nonce, memo);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("truncated transaction data", e);
    }
  }

  private static byte[] readBytes(ByteBuffer buffer, int length) {
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }
}
