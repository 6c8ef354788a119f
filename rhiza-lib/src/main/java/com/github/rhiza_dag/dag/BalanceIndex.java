// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.crypto.PublicKey;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/// Per key running balances maintained as transactions are inserted. It applies the same credit and debit rule as
/// the full scan in [Ledger#getBalance(PublicKey)] and must always agree with it.
final class BalanceIndex {
  static final BigInteger U64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  private final Map<PublicKey, BigInteger> balances = new HashMap<>();

  void apply(TransactionData data) {
    credit(data.recipient(), unsigned(data.amount()));
    if (!data.isSelfPayment()) {
      credit(data.sender(), unsigned(data.amount()).add(unsigned(data.fee())).negate());
    }
  }

  private void credit(PublicKey key, BigInteger delta) {
    balances.merge(key, delta, BigInteger::add);
  }

  /// The raw running total which may be negative if admission rules were bypassed.
  BigInteger running(PublicKey key) {
    return balances.getOrDefault(key, BigInteger.ZERO);
  }

  static BigInteger unsigned(long value) {
    return new BigInteger(Long.toUnsignedString(value));
  }

  /// Clamp a running total into the unsigned 64 bit range.
  static long clamp(BigInteger total) {
    if (total.signum() < 0) {
      return 0L;
    }
    return total.min(U64_MAX).longValue();
  }
}
