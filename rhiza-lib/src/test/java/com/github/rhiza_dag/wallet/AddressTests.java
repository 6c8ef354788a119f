// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.wallet;

import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.KeyPair;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.github.rhiza_dag.dag.TestLedgers.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

public class AddressTests {

  @Test
  public void testPrefixAndDeterminism() {
    final var address = Address.fromPublicKey(ALICE.publicKey());
    assertThat(address.asString()).startsWith("rhz1").hasSize(3 + 1 + 32 + 6);
    assertEquals(address, Address.fromPublicKey(ALICE.publicKey()));
    assertNotEquals(address, Address.fromPublicKey(BOB.publicKey()));
    assertTrue(address.matches(ALICE.publicKey()));
  }

  @Test
  public void testHashIsFirstTwentyDigestBytes() {
    final var address = Address.fromPublicKey(BOB.publicKey());
    assertArrayEquals(Arrays.copyOf(Digest.of(BOB.publicKey().bytes()).bytes(), 20), address.hash20());
  }

  @Test
  public void testParseRoundTrip() throws AddressException {
    final var address = Address.fromPublicKey(CAROL.publicKey());
    final var parsed = Address.parse(address.asString());
    assertEquals(address, parsed);
    assertArrayEquals(address.hash20(), parsed.hash20());
    assertEquals(address, Address.parse(address.asString().toUpperCase()));
  }

  @Test
  public void testBip350TestVectors() {
    // valid Bech32m strings from BIP-350
    for (var valid : new String[]{"a1lqfn3a", "abcdef1l7aum6echk45nj3s0wdvt2fg8x9yrzpqzd3ryx", "?1v759aa"}) {
      final var decoded = Bech32m.decode(valid);
      assertEquals(valid.substring(0, valid.lastIndexOf('1')), decoded.hrp());
      assertEquals(valid.length() - decoded.hrp().length() - 1 - 6, decoded.data().length);
    }
    // a plain Bech32 checksum is not accepted
    assertThatThrownBy(() -> Bech32m.decode("a12uel5l")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testBadChecksumIsInvalidEncoding() {
    final var s = Address.fromPublicKey(ALICE.publicKey()).asString();
    final char last = s.charAt(s.length() - 1);
    final var corrupted = s.substring(0, s.length() - 1) + (last == 'q' ? 'p' : 'q');
    assertReason(corrupted, AddressException.Reason.INVALID_ENCODING);
    assertReason("not an address", AddressException.Reason.INVALID_ENCODING);
    assertReason("rhz1", AddressException.Reason.INVALID_ENCODING);
  }

  @Test
  public void testWrongPrefixIsInvalidHrp() {
    final var hash = Address.fromPublicKey(ALICE.publicKey()).hash20();
    assertReason(Bech32m.encode("btc", hash), AddressException.Reason.INVALID_HRP);
  }

  @Test
  public void testWrongLengthIsInvalidLength() {
    assertReason(Bech32m.encode("rhz", new byte[19]), AddressException.Reason.INVALID_LENGTH);
    assertReason(Bech32m.encode("rhz", new byte[32]), AddressException.Reason.INVALID_LENGTH);
  }

  @Property(tries = 50)
  void everyKeyRoundTrips(@ForAll @Size(min = 32, max = 32) byte[] seed) throws AddressException {
    final var address = Address.fromPublicKey(KeyPair.fromSecretBytes(seed).publicKey());
    assert address.asString().startsWith("rhz1");
    assert address.equals(Address.parse(address.asString()));
  }

  static void assertReason(String input, AddressException.Reason reason) {
    assertThatThrownBy(() -> Address.parse(input))
        .isInstanceOf(AddressException.class)
        .satisfies(e -> assertEquals(reason, ((AddressException) e).reason()));
  }
}
