package dev.workflowcron.scheduler.credential;

import dev.workflowcron.scheduler.exceptions.CredentialException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-GCM encryption for stored credential secrets. Ciphertexts are {@code v1:} followed by the
 * base64 of the 12 byte IV and the sealed bytes.
 */
public class SecretCipher {

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final String VERSION_PREFIX = "v1:";
  private static final int GCM_TAG_BITS = 128;
  private static final int GCM_IV_BYTES = 12;

  private final SecretKeySpec key;
  private final SecureRandom secureRandom = new SecureRandom();

  /**
   * @param base64Key a base64 encoded AES key of 16, 24 or 32 bytes
   */
  public SecretCipher(String base64Key) {
    Objects.requireNonNull(base64Key, "encryption key must not be null");
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(base64Key.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("encryption key is not valid base64", e);
    }
    if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
      throw new IllegalArgumentException(
          "encryption key must be 16, 24 or 32 bytes, got %d".formatted(raw.length));
    }
    this.key = new SecretKeySpec(raw, "AES");
  }

  /** Generates a random 256 bit key, base64 encoded. */
  public static String generateKey() {
    byte[] raw = new byte[32];
    new SecureRandom().nextBytes(raw);
    return Base64.getEncoder().encodeToString(raw);
  }

  public String encrypt(String plaintext) {
    Objects.requireNonNull(plaintext);
    byte[] iv = new byte[GCM_IV_BYTES];
    secureRandom.nextBytes(iv);
    try {
      var cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
      byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      var buffer = ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed);
      return VERSION_PREFIX + Base64.getEncoder().encodeToString(buffer.array());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to encrypt credential secret", e);
    }
  }

  /**
   * @throws CredentialException if the value is malformed or was not sealed with this key
   */
  public String decrypt(String ciphertext) {
    if (ciphertext == null || !ciphertext.startsWith(VERSION_PREFIX)) {
      throw new CredentialException(null, "Stored credential secret has an unknown format");
    }
    try {
      byte[] data = Base64.getDecoder().decode(ciphertext.substring(VERSION_PREFIX.length()));
      if (data.length <= GCM_IV_BYTES) {
        throw new CredentialException(null, "Stored credential secret is truncated");
      }
      var cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, data, 0, GCM_IV_BYTES));
      byte[] plain = cipher.doFinal(data, GCM_IV_BYTES, data.length - GCM_IV_BYTES);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new CredentialException(null, "Failed to decrypt credential secret", e);
    }
  }
}
