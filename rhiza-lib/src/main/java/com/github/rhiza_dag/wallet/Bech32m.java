// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.wallet;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;

/// The Bech32m checksummed base-32 string encoding of BIP-350. Only the Bech32m constant is accepted: a string
/// carrying a plain Bech32 checksum does not decode.
final class Bech32m {

  private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
  private static final int CONST = 0x2bc830a3;
  private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
  private static final int CHECKSUM_LENGTH = 6;
  static final int MAX_LENGTH = 90;

  private static final byte[] CHARSET_REV = new byte[128];

  static {
    Arrays.fill(CHARSET_REV, (byte) -1);
    for (int i = 0; i < CHARSET.length(); i++) {
      CHARSET_REV[CHARSET.charAt(i)] = (byte) i;
    }
  }

  /// @param hrp  the human-readable prefix, already lower case
  /// @param data the 5 bit groups of [#decode(String)]
  record Decoded(String hrp, byte[] data) {
  }

  private Bech32m() {
  }

  /// Encode bytes under a prefix. The bytes are regrouped into 5 bit values with zero padding.
  static String encode(String hrp, byte[] payload) {
    final byte[] data = convertBits(payload, 8, 5, true);
    final byte[] checksum = checksum(hrp, data);
    final var sb = new StringBuilder(hrp.length() + 1 + data.length + CHECKSUM_LENGTH);
    sb.append(hrp).append('1');
    for (byte b : data) {
      sb.append(CHARSET.charAt(b));
    }
    for (byte b : checksum) {
      sb.append(CHARSET.charAt(b));
    }
    return sb.toString();
  }

  /// Decode and verify a string.
  ///
  /// @return the prefix and the 5 bit groups without the checksum
  /// @throws IllegalArgumentException if the string is not valid Bech32m
  static Decoded decode(String str) {
    if (str.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("too long: " + str.length());
    }
    boolean lower = false;
    boolean upper = false;
    for (int i = 0; i < str.length(); i++) {
      final char c = str.charAt(i);
      if (c < 33 || c > 126) {
        throw new IllegalArgumentException("invalid character at " + i);
      }
      lower |= Character.isLowerCase(c);
      upper |= Character.isUpperCase(c);
    }
    if (lower && upper) {
      throw new IllegalArgumentException("mixed case");
    }
    final String s = str.toLowerCase(Locale.ROOT);
    final int separator = s.lastIndexOf('1');
    if (separator < 1) {
      throw new IllegalArgumentException("missing prefix");
    }
    if (separator + 1 + CHECKSUM_LENGTH > s.length()) {
      throw new IllegalArgumentException("too short for a checksum");
    }
    final String hrp = s.substring(0, separator);
    final byte[] values = new byte[s.length() - separator - 1];
    for (int i = 0; i < values.length; i++) {
      final char c = s.charAt(separator + 1 + i);
      if (CHARSET_REV[c] == -1) {
        throw new IllegalArgumentException("invalid data character '" + c + "'");
      }
      values[i] = CHARSET_REV[c];
    }
    if (polymod(hrpExpand(hrp), values) != CONST) {
      throw new IllegalArgumentException("bad checksum");
    }
    return new Decoded(hrp, Arrays.copyOfRange(values, 0, values.length - CHECKSUM_LENGTH));
  }

  /// Regroup bits. Without padding any leftover bits must be fewer than `fromBits` and all zero.
  static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) {
    int acc = 0;
    int bits = 0;
    final int maxv = (1 << toBits) - 1;
    final int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
    final var out = new ByteArrayOutputStream();
    for (byte b : in) {
      final int value = b & 0xff;
      if ((value >>> fromBits) != 0) {
        throw new IllegalArgumentException("value out of range: " + value);
      }
      acc = ((acc << fromBits) | value) & maxAcc;
      bits += fromBits;
      while (bits >= toBits) {
        bits -= toBits;
        out.write((acc >>> bits) & maxv);
      }
    }
    if (pad) {
      if (bits > 0) {
        out.write((acc << (toBits - bits)) & maxv);
      }
    } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
      throw new IllegalArgumentException("non-zero padding");
    }
    return out.toByteArray();
  }

  private static byte[] checksum(String hrp, byte[] data) {
    final byte[] expanded = hrpExpand(hrp);
    final byte[] values = Arrays.copyOf(data, data.length + CHECKSUM_LENGTH);
    final int mod = polymod(expanded, values) ^ CONST;
    final byte[] checksum = new byte[CHECKSUM_LENGTH];
    for (int i = 0; i < CHECKSUM_LENGTH; i++) {
      checksum[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
    }
    return checksum;
  }

  private static byte[] hrpExpand(String hrp) {
    final int n = hrp.length();
    final byte[] out = new byte[n * 2 + 1];
    for (int i = 0; i < n; i++) {
      final char c = hrp.charAt(i);
      out[i] = (byte) (c >>> 5);
      out[n + 1 + i] = (byte) (c & 31);
    }
    return out;
  }

  private static int polymod(byte[] prefix, byte[] values) {
    int chk = 1;
    chk = polymod(chk, prefix);
    return polymod(chk, values);
  }

  private static int polymod(int chk, byte[] values) {
    for (byte v : values) {
      final int top = chk >>> 25;
      chk = ((chk & 0x1ffffff) << 5) ^ (v & 0xff);
      for (int i = 0; i < 5; i++) {
        if (((top >>> i) & 1) == 1) {
          chk ^= GENERATOR[i];
        }
      }
    }
    return chk;
  }
}
