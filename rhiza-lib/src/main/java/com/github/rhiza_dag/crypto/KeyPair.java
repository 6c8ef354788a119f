// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.spec.NamedParameterSpec;

/// An Ed25519 signing key and its public key. Signing is deterministic (RFC 8032) so the same secret and message
/// always give the same signature.
///
/// The secret is the 32 byte seed. It is never part of any transaction data. Persisting it is the job of the host
/// application's wallet layer.
public final class KeyPair {
  static final String ALGORITHM = "Ed25519";

  private final PrivateKey signingKey;
  private final byte[] secret;
  private final PublicKey publicKey;

  private KeyPair(PrivateKey signingKey, byte[] secret, PublicKey publicKey) {
    this.signingKey = signingKey;
    this.secret = secret;
    this.publicKey = publicKey;
  }

  /// Generate a new random key pair.
  public static KeyPair generate() {
    final var seed = new byte[32];
    new SecureRandom().nextBytes(seed);
    return fromSecretBytes(seed);
  }

  /// Restore a key pair from its 32 byte seed. The restored public key equals the original.
  public static KeyPair fromSecretBytes(byte[] seed) {
    final var secret = Hex.exactly(32, seed, "secret key");
    try {
      // The JDK derives the key pair from the first 32 random bytes it draws so we hand it the seed.
      final var generator = KeyPairGenerator.getInstance(ALGORITHM);
      generator.initialize(NamedParameterSpec.ED25519, new SeedRandom(secret));
      final var jdkPair = generator.generateKeyPair();
      return new KeyPair(jdkPair.getPrivate(), secret, PublicKey.fromJdk(jdkPair.getPublic()));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Ed25519 is not available in this JDK", e);
    }
  }

  public PublicKey publicKey() {
    return publicKey;
  }

  /// @return a copy of the 32 byte seed
  public byte[] secretBytes() {
    return secret.clone();
  }

  public Signature sign(byte[] message) {
    try {
      final var signer = java.security.Signature.getInstance(ALGORITHM);
      signer.initSign(signingKey);
      signer.update(message);
      return Signature.fromBytes(signer.sign());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Ed25519 signing failed", e);
    }
  }

  @Override
  public String toString() {
    return "KeyPair(" + publicKey + ", secret=[REDACTED])";
  }

  /// Feeds a fixed seed to the key pair generator. This relies on the JDK Ed25519 generator drawing the whole
  /// 32 byte private key with one `nextBytes` call. `KeyPairTests.testRfc8032TestVectorOne` pins that behaviour.
  private static final class SeedRandom extends SecureRandom {
    private final byte[] seed;

    SeedRandom(byte[] seed) {
      this.seed = seed;
    }

    @Override
    public void nextBytes(byte[] bytes) {
      System.arraycopy(seed, 0, bytes, 0, Math.min(seed.length, bytes.length));
    }
  }
}
