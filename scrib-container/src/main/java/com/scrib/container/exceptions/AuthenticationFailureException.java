package com.scrib.container.exceptions;

/**
 * Wrong password or tampered container.
 * <p>
 * Raised for a MAC mismatch, a padding failure and undecodable plaintext alike; the message
 * is identical for every cause so callers cannot tell which check failed.
 */
public class AuthenticationFailureException extends SecurityException {

  public static final String MESSAGE = "Wrong password or corrupt file";

  /**
   * Instantiates a new Authentication failure exception.
   */
  public AuthenticationFailureException() {
    super(MESSAGE);
  }
}
