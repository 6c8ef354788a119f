// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;

import java.util.List;
import java.util.Optional;

/// Admission control for a candidate transaction against the local ledger. Validation is read only: it never
/// mutates the ledger and does no I/O. The checks short-circuit on the first failure:
///
/// 1. The id must be the digest of the canonical payload.
/// 2. The signature must verify against the payload and the declared sender.
/// 3. The per type rules of [#validateType(Transaction, Ledger)].
///
/// Amounts and fees are unsigned 64 bit values so every comparison here is unsigned.
public final class TransactionValidator {

  private TransactionValidator() {
  }

  /// @return empty if the transaction may be inserted else the first rule it broke
  public static Optional<ValidationError> validate(Transaction transaction, Ledger ledger) {
    if (!transaction.verifyId()) {
      return Optional.of(ValidationError.INVALID_ID);
    }
    if (!transaction.verifySignature()) {
      return Optional.of(ValidationError.INVALID_SIGNATURE);
    }
    return validateType(transaction, ledger);
  }

  /// The one rule under which a founder allocation may enter a ledger that did not create it, as when a node syncs
  /// from a peer. It is never part of [#validate(Transaction, Ledger)]. The grant must be signed by the genesis key,
  /// name the genesis as both parents, carry exactly [Protocol#FOUNDER_ALLOCATION] and be the first such grant.
  ///
  /// @return empty if the grant may be inserted else the first rule it broke
  public static Optional<ValidationError> validateGenesisGrant(Transaction transaction, Ledger ledger) {
    if (!transaction.verifyId()) {
      return Optional.of(ValidationError.INVALID_ID);
    }
    if (!transaction.verifySignature()) {
      return Optional.of(ValidationError.INVALID_SIGNATURE);
    }
    final var data = transaction.data();
    if (data.type() != TransactionType.FOUNDER_ALLOCATION) {
      return Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE);
    }
    final var genesis = ledger.genesisId().flatMap(ledger::get);
    if (genesis.isEmpty() || !data.parents().stream().allMatch(genesis.get().id()::equals)) {
      return Optional.of(ValidationError.PARENT_NOT_FOUND);
    }
    final boolean alreadyGranted = ledger.children(genesis.get().id()).stream()
        .map(ledger::get)
        .flatMap(Optional::stream)
        .anyMatch(v -> v.transaction().type() == TransactionType.FOUNDER_ALLOCATION);
    if (alreadyGranted
        || !data.sender().equals(genesis.get().transaction().data().sender())
        || data.amount() != Protocol.FOUNDER_ALLOCATION) {
      return Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE);
    }
    return Optional.empty();
  }

  static Optional<ValidationError> validateType(Transaction transaction, Ledger ledger) {
    final var data = transaction.data();
    return switch (data.type()) {
      case GENESIS -> validateGenesis(data, ledger);
      case TRANSFER -> validateTransfer(data, ledger);
      case RELAY_REWARD -> validateRelayReward(data, ledger);
      case FOUNDER_ALLOCATION -> Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE);
    };
  }

  private static Optional<ValidationError> validateGenesis(TransactionData data, Ledger ledger) {
    if (ledger.genesisId().isPresent()) {
      return Optional.of(ValidationError.INVALID_ID);
    }
    if (!data.hasZeroParents()) {
      return Optional.of(ValidationError.PARENT_NOT_FOUND);
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> validateTransfer(TransactionData data, Ledger ledger) {
    if (data.amount() == 0L) {
      return Optional.of(ValidationError.ZERO_AMOUNT);
    }
    if (Long.compareUnsigned(data.amount(), Protocol.MAX_SUPPLY) > 0) {
      return Optional.of(ValidationError.EXCEEDS_MAX_SUPPLY);
    }
    if (!parentsPresent(data.parents(), ledger)) {
      return Optional.of(ValidationError.PARENT_NOT_FOUND);
    }
    final long have = ledger.getBalance(data.sender());
    final long need = saturatingAdd(data.amount(), data.fee());
    if (Long.compareUnsigned(have, need) < 0) {
      return Optional.of(new ValidationError.InsufficientBalance(have, need));
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> validateRelayReward(TransactionData data, Ledger ledger) {
    if (!data.isSelfPayment()) {
      return Optional.of(ValidationError.INVALID_RELAY_REWARD);
    }
    if (!parentsPresent(data.parents(), ledger)) {
      return Optional.of(ValidationError.PARENT_NOT_FOUND);
    }
    if (Long.compareUnsigned(data.amount(), Protocol.BASE_RELAY_REWARD) > 0) {
      return Optional.of(ValidationError.INVALID_RELAY_REWARD);
    }
    return Optional.empty();
  }

  private static boolean parentsPresent(List<Digest> parents, Ledger ledger) {
    return parents.stream().allMatch(ledger::contains);
  }

  /// Unsigned addition that sticks at the unsigned maximum rather than wrapping.
  static long saturatingAdd(long a, long b) {
    final long sum = a + b;
    return Long.compareUnsigned(sum, a) < 0 ? -1L : sum;
  }
}
