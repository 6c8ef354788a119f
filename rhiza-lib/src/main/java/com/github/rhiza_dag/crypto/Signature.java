// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import java.util.Arrays;

/// A 64 byte Ed25519 signature.
public final class Signature {
  public static final int SIZE = 64;

  private final byte[] bytes;

  private Signature(byte[] bytes) {
    this.bytes = bytes;
  }

  public static Signature fromBytes(byte[] bytes) {
    return new Signature(Hex.exactly(SIZE, bytes, "signature"));
  }

  public byte[] bytes() {
    return bytes.clone();
  }

  public String toHex() {
    return Hex.encode(bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Signature other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Sig(" + Hex.encode(Arrays.copyOf(bytes, 8)) + "..)";
  }
}
