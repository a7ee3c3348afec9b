package com.scrib.files;

import java.nio.file.Path;
import java.util.Locale;

/**
 * How a file is stored, decided by its extension.
 */
public enum FileType {

  ENCRYPTED(".scrb"),
  RICH_MARKUP(".rtf"),
  PLAIN_TEXT(".txt");

  private final String extension;

  FileType(String extension) {
    this.extension = extension;
  }

  /**
   * Resolves the type of a path. Matching is case-insensitive; unknown or missing extensions
   * are plain text.
   *
   * @param path the path
   * @return the file type
   */
  public static FileType fromPath(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return PLAIN_TEXT;
    }
    String name = fileName.toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(ENCRYPTED.extension)) {
      return ENCRYPTED;
    }
    if (name.endsWith(RICH_MARKUP.extension)) {
      return RICH_MARKUP;
    }
    return PLAIN_TEXT;
  }

  public String extension() {
    return extension;
  }
}
