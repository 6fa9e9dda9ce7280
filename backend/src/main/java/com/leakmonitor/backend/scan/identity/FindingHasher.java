package com.leakmonitor.backend.scan.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-addressed identity of a scanner detection: SHA-256 over {@code
 * scanner:detector:repo:file:commit:line}, hex encoded and cut to {@link #HASH_LENGTH} characters.
 * Missing parts are rendered as empty strings.
 */
public final class FindingHasher {

  public static final int HASH_LENGTH = 16;

  private FindingHasher() {}

  public static String hash(
      String scanner,
      String detector,
      String repoFullName,
      String filePath,
      String commit,
      Integer line) {
    String material =
        String.join(
            ":",
            nullToEmpty(scanner),
            nullToEmpty(detector),
            nullToEmpty(repoFullName),
            nullToEmpty(filePath),
            nullToEmpty(commit),
            line == null ? "" : line.toString());
    return HexFormat.of().formatHex(sha256(material)).substring(0, HASH_LENGTH);
  }

  private static byte[] sha256(String material) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
