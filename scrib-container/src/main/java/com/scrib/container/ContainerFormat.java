package com.scrib.container;

import java.nio.charset.StandardCharsets;

/**
 * Fixed byte layout of a {@code .scrb} container.
 *
 * <pre>
 *   [0:4]    magic "SCRB"
 *   [4:5]    version
 *   [5:21]   IV (16)
 *   [21:53]  salt (32)
 *   [53:85]  HMAC-SHA256 over version || iv || salt || ciphertext   (v2 only)
 *   [53:] / [85:]  AES-256-CBC ciphertext, PKCS#7 padded
 * </pre>
 */
public final class ContainerFormat {

  public static final byte[] MAGIC = "SCRB".getBytes(StandardCharsets.US_ASCII);
  public static final int MAGIC_LENGTH = 4;
  public static final int VERSION_OFFSET = 4;
  public static final int IV_OFFSET = 5;
  public static final int IV_LENGTH = 16;
  public static final int SALT_OFFSET = IV_OFFSET + IV_LENGTH;
  public static final int SALT_LENGTH = 32;
  public static final int MAC_OFFSET = SALT_OFFSET + SALT_LENGTH;
  public static final int MAC_LENGTH = 32;

  /**
   * Magic plus version byte: the least a file must hold before the version can be read.
   */
  public static final int PREAMBLE_LENGTH = MAGIC_LENGTH + 1;

  /**
   * Encryption key length shared by both versions (AES-256).
   */
  public static final int ENC_KEY_LENGTH = 32;

  private ContainerFormat() {
  }
}
