package com.gentoro.onesync.sync;

import com.gentoro.onesync.model.ContentItem;
import com.gentoro.onesync.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content fingerprint: lowercase hex SHA-256 over the canonical JSON of the content-only fields.
 * Canonical JSON sorts keys and omits absent optional fields, so equal content always yields the
 * same digest.
 */
public final class ContentHasher {
  private ContentHasher() {}

  public static String hash(ContentItem content) {
    return sha256Hex(JacksonUtility.toCanonicalJson(content));
  }

  static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
