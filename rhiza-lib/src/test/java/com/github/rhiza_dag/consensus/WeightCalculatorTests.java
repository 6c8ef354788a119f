// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.consensus;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.dag.Ledger;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.rhiza_dag.dag.TestLedgers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class WeightCalculatorTests {

  @Test
  public void testEmptyLedger() {
    assertEquals(Map.of(), WeightCalculator.calculateAllWeights(new Ledger()));
  }

  @Test
  public void testDiamond() {
    final var ledger = withGenesis();
    final var g = ledger.genesisId().orElseThrow();
    final var left = mustInsert(ledger, transfer(BOB, CAROL.publicKey(), 1, List.of(g, g), 1));
    final var right = mustInsert(ledger, transfer(CAROL, BOB.publicKey(), 1, List.of(g, g), 2));
    final var join = mustInsert(ledger, transfer(BOB, CAROL.publicKey(), 1, List.of(left.id(), right.id()), 3));

    assertEquals(Map.of(g, 4L, left.id(), 2L, right.id(), 2L, join.id(), 1L),
        WeightCalculator.calculateAllWeights(ledger));
  }

  @Test
  public void testConfirmationScore() {
    assertEquals(0.1, WeightCalculator.confirmationScore(1), 1e-9);
    assertEquals(0.5, WeightCalculator.confirmationScore(5), 1e-9);
    assertEquals(1.0, WeightCalculator.confirmationScore(Protocol.FINALITY_THRESHOLD), 1e-9);
    assertEquals(1.0, WeightCalculator.confirmationScore(1_000), 1e-9);
  }
}
