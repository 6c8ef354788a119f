// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.crypto;

import java.util.HexFormat;

/// Lower case hex used for logging, configuration and [Object#toString()] of the fixed size byte values.
public final class Hex {
  private static final HexFormat HEX = HexFormat.of();

  private Hex() {
  }

  public static String encode(byte[] bytes) {
    return HEX.formatHex(bytes);
  }

  /// @throws IllegalArgumentException if the string is not an even number of hex digits
  public static byte[] decode(String hex) {
    return HEX.parseHex(hex);
  }

  static byte[] exactly(int length, byte[] bytes, String what) {
    if (bytes == null || bytes.length != length) {
      throw new IllegalArgumentException(what + " must be " + length + " bytes but was " + (bytes == null ? "null" : bytes.length));
    }
    return bytes.clone();
  }
}
