// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The service layer around the ledger core. A [com.github.rhiza_dag.node.LedgerNode] is the single-writer
/// context, a [com.github.rhiza_dag.node.NodeEngine] guards it with a mutex and dispatches gossip, and a
/// [com.github.rhiza_dag.node.TransactionJournal] makes admitted transactions durable across restarts.
package com.github.rhiza_dag.node;
