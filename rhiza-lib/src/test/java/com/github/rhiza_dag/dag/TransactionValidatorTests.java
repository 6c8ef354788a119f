// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.dag;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.Signature;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.github.rhiza_dag.dag.TestLedgers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TransactionValidatorTests {

  @Test
  public void testGenesisOnEmptyLedgerIsValid() {
    assertEquals(Optional.empty(), TransactionValidator.validate(Transaction.genesis(ALICE), new Ledger()));
  }

  @Test
  public void testSecondGenesisIsInvalidId() {
    assertEquals(Optional.of(ValidationError.INVALID_ID),
        TransactionValidator.validate(Transaction.genesis(BOB), withGenesis()));
  }

  @Test
  public void testGenesisWithRealParentsIsParentNotFound() {
    final var key = ALICE.publicKey();
    final var data = new TransactionData(TransactionType.GENESIS, List.of(Digest.of(new byte[]{1}), Digest.ZERO),
        key, key, 0, 0, 0, 0, Optional.empty());
    assertEquals(Optional.of(ValidationError.PARENT_NOT_FOUND),
        TransactionValidator.validate(Transaction.sign(data, ALICE), new Ledger()));
  }

  @Test
  public void testTamperedIdIsInvalidId() {
    final var ledger = withGenesis();
    final var tx = transfer(BOB, CAROL.publicKey(), 1, ledger.selectParents(), 1);
    final var tampered = new Transaction(Digest.of(new byte[]{9}), tx.data(), tx.signature());
    assertEquals(Optional.of(ValidationError.INVALID_ID), TransactionValidator.validate(tampered, ledger));
  }

  @Test
  public void testTamperedPayloadIsInvalidSignature() {
    final var ledger = withGenesis();
    final var tx = transfer(BOB, CAROL.publicKey(), 1, ledger.selectParents(), 1);
    final var d = tx.data();
    final var inflated = new TransactionData(d.type(), d.parents(), d.sender(), d.recipient(), 1_000, d.fee(),
        d.timestamp(), d.nonce(), d.memo());
    // recompute the id so that only the signature is wrong
    final var forged = new Transaction(Digest.of(Pickle.canonical(inflated)), inflated, tx.signature());
    assertEquals(Optional.of(ValidationError.INVALID_SIGNATURE), TransactionValidator.validate(forged, ledger));
  }

  @Test
  public void testSignatureByAnotherKeyIsInvalidSignature() {
    final var ledger = withGenesis();
    final var tx = transfer(BOB, CAROL.publicKey(), 1, ledger.selectParents(), 1);
    final Signature carolSigned = CAROL.sign(Pickle.canonical(tx.data()));
    assertEquals(Optional.of(ValidationError.INVALID_SIGNATURE),
        TransactionValidator.validate(new Transaction(tx.id(), tx.data(), carolSigned), ledger));
  }

  @Test
  public void testZeroAmountTransfer() {
    final var ledger = withGenesis();
    assertEquals(Optional.of(ValidationError.ZERO_AMOUNT),
        TransactionValidator.validate(transfer(BOB, CAROL.publicKey(), 0, ledger.selectParents(), 1), ledger));
  }

  @Test
  public void testTransferAboveMaxSupply() {
    final var ledger = withGenesis();
    assertEquals(Optional.of(ValidationError.EXCEEDS_MAX_SUPPLY),
        TransactionValidator.validate(
            transfer(BOB, CAROL.publicKey(), Protocol.MAX_SUPPLY + 1, ledger.selectParents(), 1), ledger));
    // unsigned amounts above Long.MAX_VALUE are also above the supply
    assertEquals(Optional.of(ValidationError.EXCEEDS_MAX_SUPPLY),
        TransactionValidator.validate(transfer(BOB, CAROL.publicKey(), -1L, ledger.selectParents(), 1), ledger));
  }

  @Test
  public void testTransferWithUnknownParent() {
    final var ledger = withGenesis();
    final var parents = List.of(ledger.genesisId().orElseThrow(), Digest.of(new byte[]{3}));
    assertEquals(Optional.of(ValidationError.PARENT_NOT_FOUND),
        TransactionValidator.validate(transfer(BOB, CAROL.publicKey(), 5, parents, 1), ledger));
  }

  @Test
  public void testInsufficientBalanceReportsHaveAndNeed() {
    final var ledger = withGenesis();
    reward(ledger, BOB, 1_000_000);
    final var tx = transfer(BOB, CAROL.publicKey(), 1_500_000, ledger.selectParents(), 2);
    assertEquals(Optional.of(new ValidationError.InsufficientBalance(1_000_000, 1_500_000)),
        TransactionValidator.validate(tx, ledger));
  }

  @Test
  public void testAffordableTransferIsValid() {
    final var ledger = withGenesis();
    reward(ledger, BOB, 1_000_000);
    final var tx = transfer(BOB, CAROL.publicKey(), 1_000_000, ledger.selectParents(), 2);
    assertEquals(Optional.empty(), TransactionValidator.validate(tx, ledger));
  }

  @Test
  public void testFeeCountsTowardsNeedWithoutOverflow() {
    final var ledger = withGenesis();
    reward(ledger, BOB, 10);
    final var base = transfer(BOB, CAROL.publicKey(), 5, ledger.selectParents(), 2).data();
    final var data = new TransactionData(base.type(), base.parents(), base.sender(), base.recipient(), 5, -1L,
        base.timestamp(), base.nonce(), base.memo());
    assertEquals(Optional.of(new ValidationError.InsufficientBalance(10, -1L)),
        TransactionValidator.validate(Transaction.sign(data, BOB), ledger));
  }

  @Test
  public void testRelayRewardRules() {
    final var ledger = withGenesis();
    final var parents = ledger.selectParents();
    assertEquals(Optional.empty(),
        TransactionValidator.validate(Transaction.relayReward(BOB, Protocol.BASE_RELAY_REWARD, parents, 1, 1), ledger));
    assertEquals(Optional.of(ValidationError.INVALID_RELAY_REWARD),
        TransactionValidator.validate(Transaction.relayReward(BOB, Protocol.BASE_RELAY_REWARD + 1, parents, 1, 1), ledger));
    assertEquals(Optional.of(ValidationError.PARENT_NOT_FOUND),
        TransactionValidator.validate(
            Transaction.relayReward(BOB, 1, List.of(Digest.of(new byte[]{5}), parents.get(0)), 1, 1), ledger));

    final var base = Transaction.relayReward(BOB, 1, parents, 1, 1).data();
    final var toCarol = new TransactionData(TransactionType.RELAY_REWARD, parents, base.sender(), CAROL.publicKey(),
        1, 0, 1, 1, Optional.empty());
    assertEquals(Optional.of(ValidationError.INVALID_RELAY_REWARD),
        TransactionValidator.validate(Transaction.sign(toCarol, BOB), ledger));
  }

  @Test
  public void testFounderAllocationIsNotAdmissible() {
    final var ledger = withGenesis();
    final var allocation = Transaction.founderAllocation(ALICE, BOB.publicKey(), ledger.genesisId().orElseThrow());
    assertEquals(Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE),
        TransactionValidator.validate(allocation, ledger));
  }

  @Test
  public void testValidationDoesNotMutate() {
    final var ledger = withGenesis();
    final var tx = Transaction.relayReward(BOB, 1, ledger.selectParents(), 1, 1);
    TransactionValidator.validate(tx, ledger);
    assertEquals(1, ledger.len());
    assertEquals(1, ledger.get(ledger.genesisId().orElseThrow()).orElseThrow().cumulativeWeight());
  }

  @Test
  public void testGenesisGrantRule() {
    final var ledger = withGenesis();
    final var g = ledger.genesisId().orElseThrow();
    final var grant = Transaction.founderAllocation(ALICE, BOB.publicKey(), g);
    assertEquals(Optional.empty(), TransactionValidator.validateGenesisGrant(grant, ledger));

    // only the genesis key may sign the grant
    assertEquals(Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE),
        TransactionValidator.validateGenesisGrant(Transaction.founderAllocation(CAROL, BOB.publicKey(), g), ledger));
    // it must approve the genesis
    assertEquals(Optional.of(ValidationError.PARENT_NOT_FOUND),
        TransactionValidator.validateGenesisGrant(Transaction.founderAllocation(ALICE, BOB.publicKey(), Digest.ZERO), ledger));
    assertEquals(Optional.of(ValidationError.PARENT_NOT_FOUND),
        TransactionValidator.validateGenesisGrant(grant, new Ledger()));
    // other types never qualify
    assertEquals(Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE),
        TransactionValidator.validateGenesisGrant(Transaction.relayReward(BOB, 1, List.of(g, g), 1, 1), ledger));

    mustInsert(ledger, grant);
    assertEquals(Optional.of(ValidationError.FOUNDER_ALLOCATION_NOT_ADMISSIBLE),
        TransactionValidator.validateGenesisGrant(Transaction.founderAllocation(ALICE, CAROL.publicKey(), g), ledger));
  }
}
