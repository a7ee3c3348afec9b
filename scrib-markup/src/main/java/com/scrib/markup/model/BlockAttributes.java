package com.scrib.markup.model;

/**
 * Paragraph formatting. Carried by the {@link BlockMarker} that ends the paragraph, never by
 * the text before it.
 *
 * @param headingLevel heading level 1..6, null for body text
 * @param blockquote   whether the paragraph is a block quote
 * @param listKind     list style, null outside lists
 */
public record BlockAttributes(Integer headingLevel, boolean blockquote, ListKind listKind) {

  public static final BlockAttributes NONE = new BlockAttributes(null, false, null);

  public static final int MAX_HEADING_LEVEL = 6;

  public BlockAttributes {
    if (headingLevel != null && (headingLevel < 1 || headingLevel > MAX_HEADING_LEVEL)) {
      throw new IllegalArgumentException("Heading level must be 1.." + MAX_HEADING_LEVEL + ": " + headingLevel);
    }
  }

  public static BlockAttributes heading(int level) {
    return new BlockAttributes(level, false, null);
  }

  public static BlockAttributes quote() {
    return new BlockAttributes(null, true, null);
  }

  public static BlockAttributes list(ListKind kind) {
    return new BlockAttributes(null, false, kind);
  }

  public boolean isEmpty() {
    return NONE.equals(this);
  }
}
