package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.crypto.VaultCipherSuite;
import com.codeheadsystems.lockr.crypto.VaultKey;
import com.codeheadsystems.lockr.server.error.VaultException;

final class KeyParsing {

  private KeyParsing() {
  }

  static VaultKey parse(String encoded, VaultCipherSuite suite, String fieldName) {
    if (encoded == null || encoded.isBlank()) {
      throw VaultException.validation(fieldName + " is required");
    }
    try {
      return VaultKey.fromBase64(encoded, suite);
    } catch (IllegalArgumentException e) {
      throw VaultException.validation(fieldName + " is malformed: " + e.getMessage());
    }
  }
}
