package com.scrib.container.crypto;

import com.scrib.common.ByteUtils;
import com.scrib.container.ContainerFormat;
import com.scrib.container.ContainerVersion;
import java.nio.charset.StandardCharsets;

/**
 * Password-derived keys for a single encode or decode call.
 * <p>
 * For v2 the 64 derived bytes split into {@code encKey} (0-31) and {@code macKey} (32-63);
 * v1 derives only the 32-byte encryption key. Every buffer is zeroed by {@link #close()},
 * so instances belong in a try-with-resources block and are never cached or shared.
 */
public final class KeyMaterial implements AutoCloseable {

  private final byte[] raw;
  private final byte[] encKey;
  private final byte[] macKey;
  private boolean closed;

  private KeyMaterial(byte[] raw, boolean withMacKey) {
    this.raw = raw;
    this.encKey = ByteUtils.slice(raw, 0, ContainerFormat.ENC_KEY_LENGTH);
    this.macKey = withMacKey
        ? ByteUtils.slice(raw, ContainerFormat.ENC_KEY_LENGTH, ContainerFormat.MAC_LENGTH)
        : null;
  }

  /**
   * Derives the key material a container version needs.
   *
   * @param password the password
   * @param salt     the container salt
   * @param version  the container version, which fixes iteration count and output length
   * @return the key material
   */
  public static KeyMaterial derive(String password, byte[] salt, ContainerVersion version) {
    byte[] passwordBytes = password.getBytes(StandardCharsets.UTF_8);
    try {
      byte[] raw = KeyDerivation.derive(passwordBytes, salt, version.iterations(),
          version.keyMaterialLength());
      return new KeyMaterial(raw, version.authenticated());
    } finally {
      ByteUtils.zero(passwordBytes);
    }
  }

  public byte[] encKey() {
    checkOpen();
    return encKey;
  }

  /**
   * The MAC key.
   *
   * @return the byte [ ]
   * @throws IllegalStateException for v1 material, which has no MAC key
   */
  public byte[] macKey() {
    checkOpen();
    if (macKey == null) {
      throw new IllegalStateException("Legacy key material has no MAC key");
    }
    return macKey;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    ByteUtils.zero(raw, encKey, macKey);
    closed = true;
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Key material already wiped");
    }
  }
}
