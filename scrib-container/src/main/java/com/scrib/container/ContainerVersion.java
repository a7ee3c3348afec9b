package com.scrib.container;

import java.util.Optional;

/**
 * Container format versions and their key-derivation cost.
 * <p>
 * {@link #V1} is read-only: it carries no MAC and exists so files written by older releases
 * still open. New containers are always {@link #V2} (encrypt-then-MAC).
 */
public enum ContainerVersion {

  V1((byte) 0x01, 10_000, ContainerFormat.ENC_KEY_LENGTH, false),
  V2((byte) 0x02, 100_000, ContainerFormat.ENC_KEY_LENGTH + ContainerFormat.MAC_LENGTH, true);

  private final byte id;
  private final int iterations;
  private final int keyMaterialLength;
  private final boolean authenticated;

  ContainerVersion(byte id, int iterations, int keyMaterialLength, boolean authenticated) {
    this.id = id;
    this.iterations = iterations;
    this.keyMaterialLength = keyMaterialLength;
    this.authenticated = authenticated;
  }

  /**
   * Looks up a version by its on-disk byte.
   *
   * @param id the version byte
   * @return the version, or empty for an unknown byte
   */
  public static Optional<ContainerVersion> fromId(byte id) {
    for (ContainerVersion v : values()) {
      if (v.id == id) {
        return Optional.of(v);
      }
    }
    return Optional.empty();
  }

  public byte id() {
    return id;
  }

  /**
   * PBKDF2-HMAC-SHA256 iteration count.
   */
  public int iterations() {
    return iterations;
  }

  /**
   * Bytes of key material derived from the password: 32 for v1, 32 + 32 for v2.
   */
  public int keyMaterialLength() {
    return keyMaterialLength;
  }

  public boolean authenticated() {
    return authenticated;
  }

  /**
   * Offset of the first ciphertext byte.
   */
  public int headerLength() {
    return ContainerFormat.MAC_OFFSET + (authenticated ? ContainerFormat.MAC_LENGTH : 0);
  }

  /**
   * Smallest valid container: the header plus at least one ciphertext byte.
   */
  public int minimumLength() {
    return headerLength() + 1;
  }
}
