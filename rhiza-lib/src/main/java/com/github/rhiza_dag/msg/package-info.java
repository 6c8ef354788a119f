// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The gossip message schema and its binary encoding. Decoding never trusts the sender: a decoded transaction
/// still has to pass [com.github.rhiza_dag.dag.TransactionValidator] before it is inserted.
package com.github.rhiza_dag.msg;
