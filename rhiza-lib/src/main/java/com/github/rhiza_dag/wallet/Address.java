// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.wallet;

import com.github.rhiza_dag.Protocol;
import com.github.rhiza_dag.crypto.Digest;
import com.github.rhiza_dag.crypto.PublicKey;

import java.util.Arrays;
import java.util.Objects;

/// A human friendly account address: the first 20 bytes of the digest of a public key, Bech32m encoded under the
/// prefix [Protocol#ADDRESS_HRP]. An address is one way. It identifies a key but cannot be turned back into it.
public final class Address {
  public static final int HASH_LENGTH = 20;

  private final String value;
  private final byte[] hash;

  private Address(String value, byte[] hash) {
    this.value = value;
    this.hash = hash;
  }

  public static Address fromPublicKey(PublicKey key) {
    final byte[] hash = Arrays.copyOf(Digest.of(key.bytes()).bytes(), HASH_LENGTH);
    return new Address(Bech32m.encode(Protocol.ADDRESS_HRP, hash), hash);
  }

  /// @throws AddressException if the checksum fails, the prefix is not ours or the payload is not 20 bytes
  public static Address parse(String str) throws AddressException {
    Objects.requireNonNull(str, "str");
    final Bech32m.Decoded decoded;
    final byte[] hash;
    try {
      decoded = Bech32m.decode(str);
    } catch (IllegalArgumentException e) {
      throw new AddressException(AddressException.Reason.INVALID_ENCODING, e);
    }
    if (!decoded.hrp().equals(Protocol.ADDRESS_HRP)) {
      throw new AddressException(AddressException.Reason.INVALID_HRP);
    }
    try {
      hash = Bech32m.convertBits(decoded.data(), 5, 8, false);
    } catch (IllegalArgumentException e) {
      throw new AddressException(AddressException.Reason.INVALID_ENCODING, e);
    }
    if (hash.length != HASH_LENGTH) {
      throw new AddressException(AddressException.Reason.INVALID_LENGTH);
    }
    return new Address(Bech32m.encode(Protocol.ADDRESS_HRP, hash), hash);
  }

  /// The canonical lower case string.
  public String asString() {
    return value;
  }

  /// @return a copy of the 20 byte key hash
  public byte[] hash20() {
    return hash.clone();
  }

  public boolean matches(PublicKey key) {
    return equals(fromPublicKey(key));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Address other)) return false;
    return value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
