package com.scrib.container.crypto;

import static com.scrib.container.ContainerFormat.IV_LENGTH;
import static com.scrib.container.ContainerFormat.SALT_LENGTH;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Draws the per-container IV and salt. Every encode takes a fresh pair, so two containers
 * never share a key or a cipher stream even under the same password.
 */
public record ContainerRandom(SecureRandom random) {

  public ContainerRandom {
    Objects.requireNonNull(random, "random");
  }

  public ContainerRandom() {
    this(new SecureRandom());
  }

  /**
   * @return a fresh {@value com.scrib.container.ContainerFormat#IV_LENGTH}-byte AES-CBC IV
   */
  public byte[] iv() {
    return draw(IV_LENGTH);
  }

  /**
   * @return a fresh {@value com.scrib.container.ContainerFormat#SALT_LENGTH}-byte PBKDF2 salt
   */
  public byte[] salt() {
    return draw(SALT_LENGTH);
  }

  private byte[] draw(int length) {
    byte[] out = new byte[length];
    random.nextBytes(out);
    return out;
  }
}
