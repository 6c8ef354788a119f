// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.msg;

import com.github.rhiza_dag.consensus.RelayProof;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.dag.Transaction;

import java.util.List;
import java.util.Objects;

/// The messages peers exchange. Only the shapes and their encoding in [PickleGossip] are defined here. How peers
/// reconcile their tip sets is up to the host.
public sealed interface GossipMessage permits
    GossipMessage.NewTransaction,
    GossipMessage.RelayAnnounce,
    GossipMessage.SyncRequest,
    GossipMessage.SyncResponse,
    GossipMessage.TipAnnounce,
    GossipMessage.Ping,
    GossipMessage.Pong {

  /// This must match the lookup table in [PickleGossip#unpickle(byte[])].
  byte tag();

  /// A short name for logging.
  String typeName();

  record NewTransaction(Transaction transaction) implements GossipMessage {
    public NewTransaction {
      Objects.requireNonNull(transaction, "transaction");
    }

    @Override
    public byte tag() {
      return 1;
    }

    @Override
    public String typeName() {
      return "NewTransaction";
    }
  }

  record RelayAnnounce(RelayProof proof) implements GossipMessage {
    public RelayAnnounce {
      Objects.requireNonNull(proof, "proof");
    }

    @Override
    public byte tag() {
      return 2;
    }

    @Override
    public String typeName() {
      return "RelayAnnounce";
    }
  }

  /// Ask a peer for the transactions with these ids.
  record SyncRequest(List<Digest> missing) implements GossipMessage {
    public SyncRequest {
      missing = List.copyOf(missing);
    }

    @Override
    public byte tag() {
      return 3;
    }

    @Override
    public String typeName() {
      return "SyncRequest";
    }
  }

  /// Transactions in an order where every parent comes before its children.
  record SyncResponse(List<Transaction> transactions) implements GossipMessage {
    public SyncResponse {
      transactions = List.copyOf(transactions);
    }

    @Override
    public byte tag() {
      return 4;
    }

    @Override
    public String typeName() {
      return "SyncResponse";
    }
  }

  record TipAnnounce(List<Digest> tips, long depth) implements GossipMessage {
    public TipAnnounce {
      tips = List.copyOf(tips);
    }

    @Override
    public byte tag() {
      return 5;
    }

    @Override
    public String typeName() {
      return "TipAnnounce";
    }
  }

  record Ping(long timestamp) implements GossipMessage {
    @Override
    public byte tag() {
      return 6;
    }

    @Override
    public String typeName() {
      return "Ping";
    }
  }

  record Pong(long timestamp) implements GossipMessage {
    @Override
    public byte tag() {
      return 7;
    }

    @Override
    public String typeName() {
      return "Pong";
    }
  }
}
