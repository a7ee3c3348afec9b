package com.scrib.markup.model;

import java.util.Objects;

/**
 * A contiguous span of text sharing one set of inline attributes. The text may contain
 * newlines; each one ends a paragraph that has no block formatting.
 *
 * @param text       the text
 * @param attributes the inline attributes
 */
public record StyledRun(String text, InlineAttributes attributes) implements DocumentElement {

  public StyledRun {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(attributes, "attributes");
  }

  public static StyledRun plain(String text) {
    return new StyledRun(text, InlineAttributes.NONE);
  }
}
