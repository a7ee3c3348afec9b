package com.scrib.markup.rtf;

import com.scrib.markup.model.BlockAttributes;
import com.scrib.markup.model.BlockMarker;
import com.scrib.markup.model.Document;
import com.scrib.markup.model.DocumentElement;
import com.scrib.markup.model.InlineAttributes;
import com.scrib.markup.model.ListKind;
import com.scrib.markup.model.StyledRun;

/**
 * Serializes a {@link Document} to rich-text markup.
 * <p>
 * Paragraph content is buffered until its terminator is seen, because the block wrapper
 * (heading, quote, list) belongs before the text but is only known at the end. Consecutive
 * runs with equal attributes share one inline group. A newline inside a run ends a plain
 * paragraph; trailing text without a terminator is written unwrapped.
 */
public class RtfWriter {

  private static final int[] HEADING_HALF_POINTS = {48, 40, 32, 28, 24, 20};

  /**
   * Writes the full markup document, header and font table included.
   *
   * @param document the document
   * @return the markup
   */
  public String write(Document document) {
    FontTable fonts = FontTable.of(document);
    Session session = new Session(fonts);
    for (DocumentElement element : document.elements()) {
      if (element instanceof StyledRun) {
        session.run((StyledRun) element);
      } else {
        session.paragraph(((BlockMarker) element).attributes());
      }
    }
    session.finish();
    return "{\\rtf1\\ansi\\deff0\n" + fonts.toMarkup() + "\n" + session.content + "}";
  }

  static String blockOpen(BlockAttributes block, int ordinal) {
    if (block.headingLevel() != null) {
      int level = block.headingLevel();
      return "{\\outlinelevel" + (level - 1) + "\\b\\fs" + HEADING_HALF_POINTS[level - 1] + " ";
    }
    if (block.blockquote()) {
      return "{\\li720 ";
    }
    if (block.listKind() == ListKind.BULLET) {
      return "{\\ls1\\li720\\fi-360{\\pntext \\'95\\tab}";
    }
    if (block.listKind() == ListKind.ORDERED) {
      return "{\\ls2\\li720\\fi-360{\\pntext " + ordinal + ".\\tab}";
    }
    return "";
  }

  static String inlineOpen(InlineAttributes attributes, FontTable fonts) {
    StringBuilder sb = new StringBuilder("{");
    if (attributes.bold()) {
      sb.append("\\b");
    }
    if (attributes.italic()) {
      sb.append("\\i");
    }
    if (attributes.underline()) {
      sb.append("\\ul");
    }
    if (attributes.strike()) {
      sb.append("\\strike");
    }
    if (attributes.font() != null) {
      sb.append("\\f").append(fonts.indexOf(attributes.font()));
    }
    if (attributes.sizePt() != null) {
      sb.append("\\fs").append(Math.round(attributes.sizePt() * 2));
    }
    return sb.append(' ').toString();
  }

  private static final class Session {
    private final FontTable fonts;
    private final StringBuilder content = new StringBuilder();
    private final StringBuilder paragraph = new StringBuilder();
    private InlineAttributes open;
    private int ordinal;

    private Session(FontTable fonts) {
      this.fonts = fonts;
    }

    void run(StyledRun run) {
      String[] lines = run.text().split("\n", -1);
      for (int i = 0; i < lines.length; i++) {
        if (!lines[i].isEmpty()) {
          text(lines[i], run.attributes());
        }
        if (i < lines.length - 1) {
          paragraph(BlockAttributes.NONE);
        }
      }
    }

    private void text(String text, InlineAttributes attributes) {
      if (!attributes.equals(open)) {
        closeInline();
        if (!attributes.isEmpty()) {
          paragraph.append(inlineOpen(attributes, fonts));
          open = attributes;
        }
      }
      paragraph.append(RtfEscaper.escape(text));
    }

    private void closeInline() {
      if (open != null) {
        paragraph.append('}');
        open = null;
      }
    }

    void paragraph(BlockAttributes block) {
      closeInline();
      ordinal = block.headingLevel() == null && !block.blockquote() && block.listKind() == ListKind.ORDERED
          ? ordinal + 1 : 0;
      String wrapper = blockOpen(block, ordinal);
      content.append(wrapper).append(paragraph);
      if (!wrapper.isEmpty()) {
        content.append('}');
      }
      content.append("\\par\n");
      paragraph.setLength(0);
    }

    void finish() {
      closeInline();
      if (paragraph.length() > 0) {
        content.append(paragraph).append("\\par\n");
        paragraph.setLength(0);
      }
    }
  }
}
