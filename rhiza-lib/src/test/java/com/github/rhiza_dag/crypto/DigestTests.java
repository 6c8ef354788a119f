// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class DigestTests {

  @Test
  public void testKnownSha256Vector() {
    final var digest = Digest.of("abc".getBytes(StandardCharsets.US_ASCII));
    assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", digest.toHex());
  }

  @Test
  public void testZeroIsTheAllZeroSentinel() {
    assertThat(Digest.ZERO.isZero()).isTrue();
    assertThat(Digest.ZERO.bytes()).containsOnly((byte) 0).hasSize(Digest.SIZE);
    assertThat(Digest.of(new byte[0]).isZero()).isFalse();
  }

  @Test
  public void testStreamingEqualsConcatenation() {
    final var a = "hello ".getBytes(StandardCharsets.UTF_8);
    final var b = "world".getBytes(StandardCharsets.UTF_8);
    assertEquals(Digest.of("hello world".getBytes(StandardCharsets.UTF_8)), Digest.ofAll(a, b));
  }

  @Test
  public void testDifferentInputsDiffer() {
    assertNotEquals(Digest.of(new byte[]{1}), Digest.of(new byte[]{2}));
  }

  @Test
  public void testFromBytesRejectsWrongLength() {
    assertThatThrownBy(() -> Digest.fromBytes(new byte[31])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testBytesAreDefensivelyCopied() {
    final var digest = Digest.of(new byte[]{7});
    final var bytes = digest.bytes();
    bytes[0] ^= 1;
    assertNotEquals(Digest.fromBytes(bytes), digest);
  }

  @Property
  void deterministicAndHexRoundTrips(@ForAll byte[] data) {
    final var digest = Digest.of(data);
    assert digest.equals(Digest.of(data));
    assert digest.equals(Digest.fromHex(digest.toHex()));
    assert digest.hashCode() == Digest.fromBytes(digest.bytes()).hashCode();
    assert digest.compareTo(Digest.fromBytes(digest.bytes())) == 0;
  }

  @Property
  void flippingAnyBitChangesTheDigest(@ForAll byte[] data) {
    if (data.length == 0) {
      return;
    }
    final var flipped = Arrays.copyOf(data, data.length);
    flipped[flipped.length / 2] ^= 0x10;
    assert !Digest.of(data).equals(Digest.of(flipped));
  }
}
