package com.hatch.domain.messages;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Derives the conversation identifier shared by both directions of a contact pair.
 *
 * <p>The two endpoints are sorted, concatenated and hashed with SHA-256; the first 16 bytes of the
 * digest form the UUID. Version and variant bits are left as hashed so identifiers match rows
 * written before this service existed.
 */
public final class ConversationIds {
  private ConversationIds() {}

  public static UUID derive(String firstContact, String secondContact) {
    requireNonBlank(firstContact, "firstContact");
    requireNonBlank(secondContact, "secondContact");
    boolean inOrder = compareCodePoints(firstContact, secondContact) <= 0;
    String joined = inOrder ? firstContact + secondContact : secondContact + firstContact;
    byte[] digest = sha256(joined.getBytes(StandardCharsets.UTF_8));
    ByteBuffer buffer = ByteBuffer.wrap(digest, 0, 16);
    return new UUID(buffer.getLong(), buffer.getLong());
  }

  /** Orders by Unicode code point; UTF-16 unit order differs once surrogate pairs are involved. */
  static int compareCodePoints(String left, String right) {
    int[] a = left.codePoints().toArray();
    int[] b = right.codePoints().toArray();
    int shared = Math.min(a.length, b.length);
    for (int i = 0; i < shared; i++) {
      if (a[i] != b[i]) {
        return Integer.compare(a[i], b[i]);
      }
    }
    return Integer.compare(a.length, b.length);
  }

  private static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new MessageDomainException(fieldName + " must not be blank");
    }
  }
}
