package com.scrib.container.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2 with HMAC-SHA256 as the PRF.
 * <p>
 * Deliberately expensive (100,000 iterations for current containers); callers on an
 * interactive thread must run it on a worker.
 */
public class KeyDerivation {

  private KeyDerivation() {
  }

  /**
   * Derives {@code outputLen} bytes from a password and salt.
   *
   * @param password   the password bytes
   * @param salt       the salt
   * @param iterations the PBKDF2 iteration count, at least 1
   * @param outputLen  number of bytes to produce, at least 1
   * @return the derived key bytes, owned by the caller
   */
  public static byte[] derive(byte[] password, byte[] salt, int iterations, int outputLen) {
    if (password == null || salt == null) {
      throw new IllegalArgumentException("Password and salt are required");
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("Iterations must be positive: " + iterations);
    }
    if (outputLen < 1) {
      throw new IllegalArgumentException("Output length must be positive: " + outputLen);
    }
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(password, salt, iterations);
    KeyParameter key = (KeyParameter) generator.generateDerivedParameters(outputLen * 8);
    return key.getKey();
  }
}
