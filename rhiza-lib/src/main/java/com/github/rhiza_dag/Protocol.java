// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag;

/// The protocol constants. Every node that shares a ledger must agree on all of these values.
public final class Protocol {

  private Protocol() {
  }

  /// The human-readable prefix of an encoded [com.github.rhiza_dag.wallet.Address].
  public static final String ADDRESS_HRP = "rhz";

  /// Smallest units per whole unit: 1 RHZ = 10^8.
  public static final long UNITS_PER_RHZ = 100_000_000L;

  /// Maximum supply of 21,000,000 RHZ in smallest units.
  public static final long MAX_SUPPLY = 21_000_000L * UNITS_PER_RHZ;

  /// Every transaction names exactly this many parents.
  public static final int PARENT_COUNT = 2;

  /// The cumulative weight at which a vertex is final.
  public static final long FINALITY_THRESHOLD = 10;

  /// The relay reward for a participant with fewer than [#RELAY_HALVING_INTERVAL] relays (0.01 RHZ).
  public static final long BASE_RELAY_REWARD = 1_000_000L;

  /// The reward divisor steps up by one after each block of this many relays by the same participant.
  public static final long RELAY_HALVING_INTERVAL = 1_000L;

  /// The one-time founder grant: 5% of [#MAX_SUPPLY].
  public static final long FOUNDER_ALLOCATION = MAX_SUPPLY / 20;
}
