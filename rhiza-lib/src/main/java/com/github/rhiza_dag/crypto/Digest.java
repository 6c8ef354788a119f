// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/// A 32 byte SHA-256 content hash. Transaction ids are digests of the canonical transaction payload.
///
/// The all zero digest [#ZERO] is the "no parent" sentinel that only the genesis transaction uses.
/// Instances are immutable and compare by their bytes so that they can be used as map keys.
public final class Digest implements Comparable<Digest> {
  public static final int SIZE = 32;

  public static final Digest ZERO = new Digest(new byte[SIZE]);

  private final byte[] bytes;

  private Digest(byte[] bytes) {
    this.bytes = bytes;
  }

  /// Hash arbitrary data.
  public static Digest of(byte[] data) {
    return new Digest(sha256().digest(data));
  }

  /// Hash several pieces of data as one stream. This equals the digest of their concatenation.
  public static Digest ofAll(byte[]... parts) {
    final var md = sha256();
    for (byte[] part : parts) {
      md.update(part);
    }
    return new Digest(md.digest());
  }

  /// Wrap 32 raw bytes that are already a digest, e.g. read off the wire.
  public static Digest fromBytes(byte[] bytes) {
    return new Digest(Hex.exactly(SIZE, bytes, "digest"));
  }

  public static Digest fromHex(String hex) {
    return fromBytes(Hex.decode(hex));
  }

  public boolean isZero() {
    return equals(ZERO);
  }

  /// @return a copy of the raw bytes
  public byte[] bytes() {
    return bytes.clone();
  }

  public String toHex() {
    return Hex.encode(bytes);
  }

  static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // every JDK must ship SHA-256
      throw new IllegalStateException(e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Digest other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public int compareTo(Digest that) {
    return Arrays.compareUnsigned(this.bytes, that.bytes);
  }

  @Override
  public String toString() {
    return "Digest(" + Hex.encode(Arrays.copyOf(bytes, 8)) + "..)";
  }
}
