package com.scrib.files.model;

import com.scrib.markup.model.Document;
import java.util.Objects;

/**
 * What an opened file holds: plain text, or a rich document with its plain-text view.
 *
 * @param mode      plain or rich
 * @param plainText the text, for rich content the document's plain-text view
 * @param document  the rich document, null in plain mode
 */
public record EditorContent(Mode mode, String plainText, Document document) {

  /**
   * Editing mode of the content.
   */
  public enum Mode {
    PLAIN_TEXT,
    RICH_TEXT
  }

  public EditorContent {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(plainText, "plainText");
    if ((mode == Mode.RICH_TEXT) != (document != null)) {
      throw new IllegalArgumentException("A document is required exactly for rich content");
    }
  }

  public static EditorContent plain(String text) {
    return new EditorContent(Mode.PLAIN_TEXT, text, null);
  }

  public static EditorContent rich(Document document) {
    return new EditorContent(Mode.RICH_TEXT, document.plainText(), document);
  }

  public boolean isRich() {
    return mode == Mode.RICH_TEXT;
  }
}
