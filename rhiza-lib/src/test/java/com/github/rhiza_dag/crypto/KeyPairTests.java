// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class KeyPairTests {

  static final byte[] MESSAGE = "rhiza".getBytes(StandardCharsets.UTF_8);

  @Test
  public void testRfc8032TestVectorOne() {
    final var keyPair = KeyPair.fromSecretBytes(
        Hex.decode("9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60"));
    assertEquals("d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a", keyPair.publicKey().toHex());
    final var signature = keyPair.sign(new byte[0]);
    assertEquals("e5564300c360ac729086e2cc806e828a84877f1eb8e5d974d873e06522490155"
        + "5fb8821590a33bacc61e39701cf9b46bd25bf5f0595bbe24655141438e7a100b", signature.toHex());
  }

  @Test
  public void testRestoreFromSecretGivesSamePublicKey() {
    final var original = KeyPair.generate();
    final var restored = KeyPair.fromSecretBytes(original.secretBytes());
    assertEquals(original.publicKey(), restored.publicKey());
    assertEquals(original.sign(MESSAGE), restored.sign(MESSAGE));
  }

  @Test
  public void testWrongKeyDoesNotVerify() {
    final var signer = KeyPair.generate();
    final var other = KeyPair.generate();
    assertFalse(other.publicKey().verify(MESSAGE, signer.sign(MESSAGE)));
  }

  @Test
  public void testMalformedSignatureDoesNotVerify() {
    final var keyPair = KeyPair.generate();
    final var junk = Signature.fromBytes(new byte[Signature.SIZE]);
    assertFalse(keyPair.publicKey().verify(MESSAGE, junk));
  }

  @Test
  public void testToStringRedactsSecret() {
    final var keyPair = KeyPair.generate();
    assertThat(keyPair.toString()).contains("REDACTED").doesNotContain(Hex.encode(keyPair.secretBytes()));
  }

  @Property(tries = 50)
  void signThenVerify(@ForAll @Size(min = 32, max = 32) byte[] seed, @ForAll byte[] message) {
    final var keyPair = KeyPair.fromSecretBytes(seed);
    final var signature = keyPair.sign(message);
    assert keyPair.publicKey().verify(message, signature);
    assert signature.equals(keyPair.sign(message));
  }

  @Property(tries = 50)
  void alteredMessageDoesNotVerify(@ForAll @Size(min = 32, max = 32) byte[] seed,
                                   @ForAll @Size(min = 1, max = 64) byte[] message) {
    final var keyPair = KeyPair.fromSecretBytes(seed);
    final var signature = keyPair.sign(message);
    final var altered = message.clone();
    altered[0] ^= 1;
    assert !keyPair.publicKey().verify(altered, signature);
  }
}
