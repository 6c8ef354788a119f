// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.msg;

import com.github.rhiza_dag.consensus.RelayProof;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.PublicKey;
import com.github.rhiza_dag.crypto.Signature;
import com.github.rhiza_dag.dag.Pickle;
import com.github.rhiza_dag.dag.Transaction;

import java.io.*;
import java.util.ArrayList;
import java.util.List;

/// Pickles [GossipMessage]s. Each message is one type byte followed by its body. Lists are prefixed with an int
/// count. A transaction is its canonical payload prefixed with an int length, then its id and signature, so that
/// a receiver can recheck the id against exactly the bytes that were hashed.
public final class PickleGossip {

  /// Refuse absurd counts before allocating anything.
  static final int MAX_LIST_SIZE = 1 << 20;

  private PickleGossip() {
  }

  public static byte[] pickle(GossipMessage message) {
    final var bytes = new ByteArrayOutputStream();
    try (var out = new DataOutputStream(bytes)) {
      out.writeByte(message.tag());
      writeBody(message, out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  private static void writeBody(GossipMessage message, DataOutputStream out) throws IOException {
    if (message instanceof GossipMessage.NewTransaction m) {
      write(m.transaction(), out);
    } else if (message instanceof GossipMessage.RelayAnnounce m) {
      write(m.proof(), out);
    } else if (message instanceof GossipMessage.SyncRequest m) {
      writeDigests(m.missing(), out);
    } else if (message instanceof GossipMessage.SyncResponse m) {
      out.writeInt(m.transactions().size());
      for (var transaction : m.transactions()) {
        write(transaction, out);
      }
    } else if (message instanceof GossipMessage.TipAnnounce m) {
      writeDigests(m.tips(), out);
      out.writeLong(m.depth());
    } else if (message instanceof GossipMessage.Ping m) {
      out.writeLong(m.timestamp());
    } else if (message instanceof GossipMessage.Pong m) {
      out.writeLong(m.timestamp());
    } else {
      throw new IllegalArgumentException("Unknown message type: " + message.getClass());
    }
  }

  /// @throws DeserializationException if the bytes are truncated, have trailing bytes or are otherwise malformed
  public static GossipMessage unpickle(byte[] bytes) throws DeserializationException {
    try (var in = new DataInputStream(new ByteArrayInputStream(bytes))) {
      final byte type = in.readByte();
      final GossipMessage message = switch (type) {
        case 1 -> new GossipMessage.NewTransaction(readTransaction(in));
        case 2 -> new GossipMessage.RelayAnnounce(readRelayProof(in));
        case 3 -> new GossipMessage.SyncRequest(readDigests(in));
        case 4 -> new GossipMessage.SyncResponse(readTransactions(in));
        case 5 -> new GossipMessage.TipAnnounce(readDigests(in), in.readLong());
        case 6 -> new GossipMessage.Ping(in.readLong());
        case 7 -> new GossipMessage.Pong(in.readLong());
        default -> throw new DeserializationException("Unknown gossip message type: " + type);
      };
      if (in.available() > 0) {
        throw new DeserializationException(in.available() + " trailing bytes after " + message.typeName());
      }
      return message;
    } catch (DeserializationException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new DeserializationException("Failed to decode gossip message: " + e.getMessage(), e);
    }
  }

  /// One transaction on its own, as a journal stores it.
  public static byte[] pickle(Transaction transaction) {
    final var bytes = new ByteArrayOutputStream();
    try (var out = new DataOutputStream(bytes)) {
      write(transaction, out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  public static Transaction unpickleTransaction(byte[] bytes) throws DeserializationException {
    try (var in = new DataInputStream(new ByteArrayInputStream(bytes))) {
      final var transaction = readTransaction(in);
      if (in.available() > 0) {
        throw new DeserializationException(in.available() + " trailing bytes after transaction");
      }
      return transaction;
    } catch (DeserializationException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new DeserializationException("Failed to decode transaction: " + e.getMessage(), e);
    }
  }

  public static void write(Transaction transaction, DataOutputStream out) throws IOException {
    final byte[] canonical = Pickle.canonical(transaction.data());
    out.writeInt(canonical.length);
    out.write(canonical);
    out.write(transaction.id().bytes());
    out.write(transaction.signature().bytes());
  }

  public static Transaction readTransaction(DataInputStream in) throws IOException {
    final int length = in.readInt();
    if (length < 0 || length > in.available()) {
      throw new DeserializationException("transaction length " + length + " exceeds the message");
    }
    final var data = Pickle.readData(readBytes(in, length));
    final var id = Digest.fromBytes(readBytes(in, Digest.SIZE));
    final var signature = Signature.fromBytes(readBytes(in, Signature.SIZE));
    return new Transaction(id, data, signature);
  }

  private static List<Transaction> readTransactions(DataInputStream in) throws IOException {
    final int count = readCount(in);
    final var transactions = new ArrayList<Transaction>(count);
    for (int i = 0; i < count; i++) {
      transactions.add(readTransaction(in));
    }
    return transactions;
  }

  public static void write(RelayProof proof, DataOutputStream out) throws IOException {
    out.write(proof.relayer().bytes());
    out.write(proof.transactionId().bytes());
    out.writeByte(proof.hopCount());
    out.writeLong(proof.timestamp());
    out.write(proof.signature().bytes());
  }

  public static RelayProof readRelayProof(DataInputStream in) throws IOException {
    final var relayer = PublicKey.fromBytes(readBytes(in, PublicKey.SIZE));
    final var transactionId = Digest.fromBytes(readBytes(in, Digest.SIZE));
    final int hopCount = in.readUnsignedByte();
    final long timestamp = in.readLong();
    final var signature = Signature.fromBytes(readBytes(in, Signature.SIZE));
    return new RelayProof(relayer, transactionId, hopCount, timestamp, signature);
  }

  private static void writeDigests(List<Digest> digests, DataOutputStream out) throws IOException {
    out.writeInt(digests.size());
    for (var digest : digests) {
      out.write(digest.bytes());
    }
  }

  private static List<Digest> readDigests(DataInputStream in) throws IOException {
    final int count = readCount(in);
    final var digests = new ArrayList<Digest>(count);
    for (int i = 0; i < count; i++) {
      digests.add(Digest.fromBytes(readBytes(in, Digest.SIZE)));
    }
    return digests;
  }

  private static int readCount(DataInputStream in) throws IOException {
    final int count = in.readInt();
    if (count < 0 || count > MAX_LIST_SIZE) {
      throw new DeserializationException("invalid list size " + count);
    }
    return count;
  }

  private static byte[] readBytes(DataInputStream in, int length) throws IOException {
    final byte[] bytes = new byte[length];
    in.readFully(bytes);
    return bytes;
  }
}
