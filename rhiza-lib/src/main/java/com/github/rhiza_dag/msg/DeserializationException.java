// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.rhiza_dag.msg;

import java.io.IOException;

/// Bytes received from a peer could not be decoded. The cause holds the underlying failure.
public class DeserializationException extends IOException {
  public DeserializationException(String message) {
    super(message);
  }

  public DeserializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
