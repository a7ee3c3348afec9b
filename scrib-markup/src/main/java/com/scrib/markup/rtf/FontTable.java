package com.scrib.markup.rtf;

import com.scrib.markup.model.Document;
import com.scrib.markup.model.DocumentElement;
import com.scrib.markup.model.StyledRun;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Font table of an exported document. Index 0 is always the default font.
 */
public final class FontTable {

  public static final String DEFAULT_FONT = "Times New Roman";

  /** A literal {@code ;} inside a name, which would otherwise end the entry. */
  private static final String ENTRY_SEPARATOR_HEX = "\\'3b";

  private final List<String> names;

  private FontTable(List<String> names) {
    this.names = Collections.unmodifiableList(names);
  }

  /**
   * Collects the distinct fonts used by a document, in first-use order after the default.
   *
   * @param document the document
   * @return the table
   */
  public static FontTable of(Document document) {
    List<String> names = new ArrayList<>();
    names.add(DEFAULT_FONT);
    for (DocumentElement element : document.elements()) {
      if (element instanceof StyledRun) {
        String font = ((StyledRun) element).attributes().font();
        if (font != null && !names.contains(font)) {
          names.add(font);
        }
      }
    }
    return new FontTable(names);
  }

  public List<String> names() {
    return names;
  }

  /**
   * Index of a font in the table.
   *
   * @param font the font name
   * @return the index
   * @throws IllegalArgumentException if the font was not collected
   */
  public int indexOf(String font) {
    int index = names.indexOf(font);
    if (index < 0) {
      throw new IllegalArgumentException("Font not in table: " + font);
    }
    return index;
  }

  /**
   * Renders the {@code \fonttbl} group.
   *
   * @return the markup
   */
  public String toMarkup() {
    StringBuilder sb = new StringBuilder("{\\fonttbl");
    for (int i = 0; i < names.size(); i++) {
      sb.append("{\\f").append(i).append("\\fswiss ")
          .append(RtfEscaper.escape(names.get(i)).replace(";", ENTRY_SEPARATOR_HEX)).append(";}");
    }
    return sb.append('}').toString();
  }
}
