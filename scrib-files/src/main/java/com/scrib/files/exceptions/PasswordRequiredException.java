package com.scrib.files.exceptions;

import java.nio.file.Path;

/**
 * An encrypted file was opened without a password. The caller prompts and opens again.
 */
public class PasswordRequiredException extends RuntimeException {

  private final transient Path path;

  public PasswordRequiredException(Path path) {
    super("Password required to open " + path.getFileName());
    this.path = path;
  }

  public Path path() {
    return path;
  }

  public String fileName() {
    return String.valueOf(path.getFileName());
  }
}
