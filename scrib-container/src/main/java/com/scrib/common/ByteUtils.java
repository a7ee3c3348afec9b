package com.scrib.common;

import java.util.Arrays;

/**
 * Utility methods for byte array assembly and secret wiping.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Copies {@code length} bytes starting at {@code offset}.
   *
   * @param source the source array
   * @param offset first byte to copy
   * @param length number of bytes to copy
   * @return the byte [ ]
   * @throws IllegalArgumentException if the range falls outside the source
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > source.length) {
      throw new IllegalArgumentException(
          "Range [" + offset + ", " + (offset + length) + ") outside array of length " + source.length);
    }
    return Arrays.copyOfRange(source, offset, offset + length);
  }

  /**
   * True when {@code source} begins with every byte of {@code prefix}.
   *
   * @param source the source
   * @param prefix the prefix
   * @return the boolean
   */
  public static boolean startsWith(byte[] source, byte[] prefix) {
    if (source == null || source.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (source[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Overwrites every given array with zeros. Null entries are ignored.
   *
   * @param arrays the arrays to wipe
   */
  public static void zero(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }
}
