package com.scrib.container.crypto;

import com.scrib.common.ByteUtils;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

/**
 * Low-level cryptographic primitives for the container.
 * Wraps BouncyCastle HMAC-SHA256 and AES-256-CBC with PKCS#7 padding.
 */
public class ContainerCrypto {

  private static final int HMAC_LENGTH = 32;

  private ContainerCrypto() {
  }

  /**
   * HMAC-SHA256(key, parts[0] || parts[1] || ...).
   */
  public static byte[] hmacSha256(byte[] key, byte[]... parts) {
    KeyParameter keyParameter = new KeyParameter(key);
    try {
      HMac hmac = new HMac(new SHA256Digest());
      hmac.init(keyParameter);
      for (byte[] part : parts) {
        hmac.update(part, 0, part.length);
      }
      byte[] out = new byte[HMAC_LENGTH];
      hmac.doFinal(out, 0);
      return out;
    } finally {
      ByteUtils.zero(keyParameter.getKey());
    }
  }

  /**
   * AES-256-CBC encryption with PKCS#7 padding.
   */
  public static byte[] encrypt(byte[] key, byte[] iv, byte[] plaintext) {
    try {
      return process(true, key, iv, plaintext);
    } catch (InvalidCipherTextException e) {
      // padding is only checked when decrypting
      throw new IllegalStateException("Encryption failed", e);
    }
  }

  /**
   * AES-256-CBC decryption with PKCS#7 padding.
   *
   * @throws InvalidCipherTextException if the padding is invalid
   * @throws org.bouncycastle.crypto.DataLengthException if the ciphertext is not a whole
   *                                                     number of blocks
   */
  public static byte[] decrypt(byte[] key, byte[] iv, byte[] ciphertext)
      throws InvalidCipherTextException {
    return process(false, key, iv, ciphertext);
  }

  private static byte[] process(boolean forEncryption, byte[] key, byte[] iv, byte[] input)
      throws InvalidCipherTextException {
    KeyParameter keyParameter = new KeyParameter(key);
    byte[] out = null;
    try {
      PaddedBufferedBlockCipher cipher = new PaddedBufferedBlockCipher(
          CBCBlockCipher.newInstance(AESEngine.newInstance()), new PKCS7Padding());
      cipher.init(forEncryption, new ParametersWithIV(keyParameter, iv));
      out = new byte[cipher.getOutputSize(input.length)];
      int len = cipher.processBytes(input, 0, input.length, out, 0);
      len += cipher.doFinal(out, len);
      return Arrays.copyOf(out, len);
    } finally {
      ByteUtils.zero(keyParameter.getKey(), out);
    }
  }
}
