package com.scrib.container.exceptions;

/**
 * The bytes are not a container this release can read: bad magic, a header shorter than its
 * version requires, or an unknown version byte.
 */
public class CorruptFormatException extends RuntimeException {

  /**
   * Instantiates a new Corrupt format exception.
   *
   * @param message the message
   */
  public CorruptFormatException(final String message) {
    super(message);
  }
}
