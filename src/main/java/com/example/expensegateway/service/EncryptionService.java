package com.example.expensegateway.service;

import com.example.expensegateway.exception.EncryptionException;
import com.example.expensegateway.properties.ApplicationProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for bearer credentials at rest.
 *
 * The key is a base64 encoded 32 byte value from {@code app.store.encryption-key}.
 * Ciphertext layout is {@code base64(iv || ciphertext+tag)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class EncryptionService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int KEY_LENGTH_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final ApplicationProperties properties;

  private volatile SecretKey currentKey;

  @PostConstruct
  public void initialize() {
    currentKey = loadEncryptionKey(properties.store().encryptionKey());
    log.info("Credential encryption key loaded");
  }

  /**
   * Encrypt data using AES-256-GCM
   */
  public String encrypt(String plaintext) {
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, currentKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getEncoder().encodeToString(combined);

    } catch (Exception e) {
      log.error("Encryption failed", e);
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  /**
   * Decrypt data using AES-256-GCM
   */
  public String decrypt(String encryptedData) {
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        throw new EncryptionException("Ciphertext too short");
      }

      byte[] iv = new byte[GCM_IV_LENGTH];
      byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH];
      System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH);
      System.arraycopy(combined, GCM_IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, currentKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);

    } catch (Exception e) {
      log.error("Decryption failed", e);
      throw new EncryptionException("Failed to decrypt data", e);
    }
  }

  static SecretKey loadEncryptionKey(String keyBase64) {
    if (keyBase64 == null || keyBase64.isBlank()) {
      throw new EncryptionException("app.store.encryption-key is required for the redis credential store");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(keyBase64.trim());
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Encryption key is not valid base64", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new EncryptionException("Invalid key length: expected 256 bits");
    }
    return new SecretKeySpec(keyBytes, "AES");
  }
}
