// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/// The raw 32 byte encoding of an Ed25519 public key. This is what transactions carry as sender and recipient.
public final class PublicKey {
  public static final int SIZE = 32;

  /// The DER header of an X.509 SubjectPublicKeyInfo for Ed25519. The raw key follows it.
  private static final byte[] X509_PREFIX = Hex.decode("302a300506032b6570032100");

  private final byte[] bytes;

  private PublicKey(byte[] bytes) {
    this.bytes = bytes;
  }

  public static PublicKey fromBytes(byte[] bytes) {
    return new PublicKey(Hex.exactly(SIZE, bytes, "public key"));
  }

  public static PublicKey fromHex(String hex) {
    return fromBytes(Hex.decode(hex));
  }

  /// Recover the raw key from the JDK's X.509 encoding.
  static PublicKey fromJdk(java.security.PublicKey key) {
    final var encoded = key.getEncoded();
    return new PublicKey(Arrays.copyOfRange(encoded, encoded.length - SIZE, encoded.length));
  }

  /// Verify a signature over the message. This is a pure predicate: bytes that do not decode to a curve point or
  /// a malformed signature simply do not verify.
  public boolean verify(byte[] message, Signature signature) {
    try {
      final var spec = new X509EncodedKeySpec(concat(X509_PREFIX, bytes));
      final var jdkKey = KeyFactory.getInstance(KeyPair.ALGORITHM).generatePublic(spec);
      final var verifier = java.security.Signature.getInstance(KeyPair.ALGORITHM);
      verifier.initVerify(jdkKey);
      verifier.update(message);
      return verifier.verify(signature.bytes());
    } catch (GeneralSecurityException e) {
      return false;
    }
  }

  public byte[] bytes() {
    return bytes.clone();
  }

  public String toHex() {
    return Hex.encode(bytes);
  }

  static byte[] concat(byte[] prefix, byte[] body) {
    final var out = Arrays.copyOf(prefix, prefix.length + body.length);
    System.arraycopy(body, 0, out, prefix.length, body.length);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PublicKey other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "PublicKey(" + Hex.encode(Arrays.copyOf(bytes, 8)) + ")";
  }
}
