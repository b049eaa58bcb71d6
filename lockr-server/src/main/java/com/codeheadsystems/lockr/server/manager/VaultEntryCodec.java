package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.model.vault.VaultEntryPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * Serializes entry payloads to the bytes that get sealed, and back.
 */
public class VaultEntryCodec {

  /**
   * Category of the server-sealed entry used only to verify keys. Reserved; hidden from listings.
   */
  public static final String KEY_CHECK_CATEGORY = "system";

  private static final VaultEntryPayload KEY_CHECK_PAYLOAD = new VaultEntryPayload(
      "System Validation Entry", null, null, null, null,
      "Created by the server so that unlocking this vault can be verified.");

  private final ObjectMapper objectMapper;

  public VaultEntryCodec() {
    this(new ObjectMapper());
  }

  public VaultEntryCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] encode(VaultEntryPayload payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize entry payload", e);
    }
  }

  /**
   * Decodes plaintext produced by {@link #encode}.
   *
   * @param plaintext the plaintext
   * @return the payload
   * @throws IllegalStateException if the plaintext is not a payload document
   */
  public VaultEntryPayload decode(byte[] plaintext) {
    try {
      return objectMapper.readValue(plaintext, VaultEntryPayload.class);
    } catch (IOException e) {
      throw new IllegalStateException("Decrypted entry is not a valid payload", e);
    }
  }

  public byte[] keyCheckPlaintext() {
    return encode(KEY_CHECK_PAYLOAD);
  }

  public static boolean isKeyCheck(String category) {
    return KEY_CHECK_CATEGORY.equals(category);
  }
}
