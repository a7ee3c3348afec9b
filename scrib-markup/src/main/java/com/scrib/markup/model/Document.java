package com.scrib.markup.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of styled runs and paragraph terminators. A well-formed document ends
 * with a paragraph break, either a {@link BlockMarker} or a run whose text ends in a newline.
 *
 * @param elements the elements, in reading order
 */
public record Document(List<DocumentElement> elements) {

  public Document {
    Objects.requireNonNull(elements, "elements");
    elements = List.copyOf(elements);
  }

  /**
   * The empty document: a single plain paragraph break.
   *
   * @return the document
   */
  public static Document empty() {
    return new Document(List.of(BlockMarker.PARAGRAPH));
  }

  /**
   * Wraps unformatted text as one run followed by a paragraph break.
   *
   * @param text the text
   * @return the document
   */
  public static Document fromPlainText(String text) {
    Objects.requireNonNull(text, "text");
    if (text.isEmpty()) {
      return empty();
    }
    return new Document(List.of(StyledRun.plain(text), BlockMarker.PARAGRAPH));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The text content, with one newline per paragraph break and no formatting.
   *
   * @return the plain text
   */
  public String plainText() {
    StringBuilder sb = new StringBuilder();
    for (DocumentElement element : elements) {
      if (element instanceof StyledRun) {
        sb.append(((StyledRun) element).text());
      } else {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  public boolean isNewlineTerminated() {
    if (elements.isEmpty()) {
      return false;
    }
    DocumentElement last = elements.get(elements.size() - 1);
    if (last instanceof BlockMarker) {
      return true;
    }
    return ((StyledRun) last).text().endsWith("\n");
  }

  /**
   * Drops empty runs and merges neighbouring runs with equal attributes. Two documents that
   * render identically compare equal after normalizing.
   *
   * @return the normalized document
   */
  public Document normalized() {
    List<DocumentElement> result = new ArrayList<>();
    for (DocumentElement element : elements) {
      if (element instanceof StyledRun) {
        StyledRun run = (StyledRun) element;
        if (run.text().isEmpty()) {
          continue;
        }
        int lastIndex = result.size() - 1;
        if (lastIndex >= 0 && result.get(lastIndex) instanceof StyledRun) {
          StyledRun previous = (StyledRun) result.get(lastIndex);
          if (previous.attributes().equals(run.attributes())) {
            result.set(lastIndex, new StyledRun(previous.text() + run.text(), run.attributes()));
            continue;
          }
        }
      }
      result.add(element);
    }
    return new Document(result);
  }

  /**
   * Builder for {@link Document}.
   */
  public static class Builder {
    private final List<DocumentElement> elements = new ArrayList<>();

    public Builder text(String text) {
      return text(text, InlineAttributes.NONE);
    }

    public Builder text(String text, InlineAttributes attributes) {
      elements.add(new StyledRun(text, attributes));
      return this;
    }

    public Builder paragraph() {
      return paragraph(BlockAttributes.NONE);
    }

    public Builder paragraph(BlockAttributes attributes) {
      elements.add(new BlockMarker(attributes));
      return this;
    }

    public Document build() {
      return new Document(elements);
    }
  }
}
