// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.consensus;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.PublicKey;
import org.jetbrains.annotations.TestOnly;

import java.util.HashMap;
import java.util.Map;

/// Proof of Relay bookkeeping. Each participant has a relay count and the reward for a relay is
/// `BASE_RELAY_REWARD / (1 + count / RELAY_HALVING_INTERVAL)` with integer division, so it steps down after every
/// block of [Protocol#RELAY_HALVING_INTERVAL] relays. The reward depends only on the count never on who relays.
///
/// Total issuance never exceeds [Protocol#MAX_SUPPLY]. Once a reward would cross it the relay still counts but
/// pays zero. That is a normal outcome not an error.
///
/// This class is not thread safe.
public class RelayTracker {

  private final Map<PublicKey, Long> relayCounts = new HashMap<>();
  private long totalRelays = 0;
  private long totalRewards = 0;

  public RelayTracker() {
  }

  @TestOnly
  public RelayTracker(long totalRewards) {
    this.totalRewards = totalRewards;
  }

  /// Count a relay by this participant and issue its reward.
  ///
  /// @return the reward issued, zero if it would exceed the maximum supply
  public long recordRelay(PublicKey relayer) {
    final long reward = nextReward(relayer);
    relayCounts.merge(relayer, 1L, Long::sum);
    totalRelays++;
    totalRewards += reward;
    return reward;
  }

  /// The reward that [#recordRelay(PublicKey)] would issue for this participant's next relay, with the supply cap
  /// applied. Nothing is recorded.
  public long nextReward(PublicKey relayer) {
    final long reward = calculateReward(relayCount(relayer) + 1);
    return totalRewards + reward > Protocol.MAX_SUPPLY ? 0L : reward;
  }

  /// The reward schedule without any bookkeeping.
  public static long calculateReward(long relayCount) {
    final long divisor = 1 + Long.divideUnsigned(relayCount, Protocol.RELAY_HALVING_INTERVAL);
    return Protocol.BASE_RELAY_REWARD / divisor;
  }

  public long relayCount(PublicKey relayer) {
    return relayCounts.getOrDefault(relayer, 0L);
  }

  public long totalRelays() {
    return totalRelays;
  }

  public long totalRewards() {
    return totalRewards;
  }
}
