// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains the protocol constants for the Rhiza DAG ledger.
///
/// The library keeps an append-only ledger of signed transactions where every transaction approves two earlier
/// transactions. Each node admits a transaction only if it is structurally and economically valid against its
/// *local* ledger state. A transaction is final once enough later transactions approve it, directly or indirectly.
///
/// The core is single-writer and synchronous. It is not thread safe. The host application must make sure that only
/// one thread mutates a [com.github.rhiza_dag.dag.Ledger] or a [com.github.rhiza_dag.consensus.RelayTracker] at a time.
///
/// - [com.github.rhiza_dag.crypto]: SHA-256 digests and Ed25519 signatures.
/// - [com.github.rhiza_dag.dag]: the transaction model, the canonical encoding, the ledger and the admission rules.
/// - [com.github.rhiza_dag.consensus]: finality, the weight audit and Proof of Relay rewards.
/// - [com.github.rhiza_dag.msg]: the gossip messages and their wire codec.
/// - [com.github.rhiza_dag.wallet]: bech32m addresses.
package com.github.rhiza_dag;
