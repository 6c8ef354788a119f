// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The type tag of a transaction. The tag value is written into the canonical encoding so it must never change.
public enum TransactionType {
  /// Move funds between keys.
  TRANSFER(0),
  /// The root of the ledger. It names the zero digest as both parents.
  GENESIS(1),
  /// A self-payment claiming a relay reward.
  RELAY_REWARD(2),
  /// The one-time founder grant made next to the genesis.
  FOUNDER_ALLOCATION(3);

  private final int tag;

  TransactionType(int tag) {
    this.tag = tag;
  }

  public int tag() {
    return tag;
  }

  static final Map<Integer, TransactionType> TAG_TO_TYPE_MAP = Arrays.stream(values())
      .collect(Collectors.toMap(TransactionType::tag, Function.identity()));

  /// @return the type for the tag or null if the tag is unknown
  public static TransactionType fromTag(int tag) {
    return TAG_TO_TYPE_MAP.get(tag);
  }
}
