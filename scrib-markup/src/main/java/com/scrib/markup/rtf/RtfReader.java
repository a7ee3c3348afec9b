package com.scrib.markup.rtf;

import com.scrib.markup.model.BlockAttributes;
import com.scrib.markup.model.BlockMarker;
import com.scrib.markup.model.Document;
import com.scrib.markup.model.DocumentElement;
import com.scrib.markup.model.InlineAttributes;
import com.scrib.markup.model.ListKind;
import com.scrib.markup.model.StyledRun;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tolerant reader for rich-text markup. Unknown control words are ignored, metadata groups
 * are skipped whole, and unbalanced braces never fail the read.
 * <p>
 * Character formatting is scoped to groups: it is saved on {@code {} and restored on
 * {@code }}. Paragraph formatting is collected until {@code \par} and cleared by it.
 */
public class RtfReader {

  private static final Logger log = LoggerFactory.getLogger(RtfReader.class);

  static final String SIGNATURE = "{\\rtf";

  private static final Set<String> SKIPPED_GROUPS = Set.of(
      "fonttbl", "colortbl", "stylesheet", "info", "pict", "pntext",
      "listtable", "listoverridetable");

  /**
   * Reads markup into a document. Input without the markup signature is taken as plain text.
   *
   * @param markup the markup
   * @return the document, always newline-terminated
   */
  public Document read(String markup) {
    if (!markup.startsWith(SIGNATURE)) {
      log.debug("read(): no markup signature, treating as plain text");
      return Document.fromPlainText(markup);
    }
    Map<Integer, String> fonts = readFontTable(markup);
    log.debug("read(): fonts={}", fonts);
    return new Scan(markup, fonts).run();
  }

  /**
   * Reads the {@code \fonttbl} group into index to name.
   */
  static Map<Integer, String> readFontTable(String markup) {
    Map<Integer, String> fonts = new HashMap<>();
    int start = markup.indexOf("{\\fonttbl");
    if (start < 0) {
      return fonts;
    }
    int depth = 0;
    Integer index = null;
    StringBuilder name = new StringBuilder();
    int unicodeSkip = 1;
    int pendingSkip = 0;
    int i = start;
    while (i < markup.length()) {
      char c = markup.charAt(i);
      if (c == '{') {
        depth++;
        i++;
      } else if (c == '}') {
        depth--;
        i++;
        if (depth == 0) {
          break;
        }
      } else if (c == '\\') {
        ControlWord word = ControlWord.parse(markup, i);
        if (word == null) {
          if (i + 1 < markup.length() && depth <= 2) {
            char next = markup.charAt(i + 1);
            if (next == '\'' && i + 3 < markup.length()) {
              Integer hex = parseHex(markup, i + 2);
              if (pendingSkip > 0) {
                pendingSkip--;
              } else if (hex != null) {
                name.append(RtfEscaper.decodeHex(hex));
              }
              i += 4;
              continue;
            }
            if (next == '\\' || next == '{' || next == '}') {
              name.append(next);
            }
          }
          i += 2;
        } else {
          if (word.param() != null && depth <= 2) {
            switch (word.name()) {
              case "f" -> {
                index = word.param();
                name.setLength(0);
              }
              case "uc" -> unicodeSkip = Math.max(0, word.param());
              case "u" -> {
                int unit = word.param();
                name.append((char) (unit < 0 ? unit + 65536 : unit));
                pendingSkip = unicodeSkip;
              }
              default -> {
              }
            }
          }
          i = word.end();
        }
      } else if (c == ';') {
        if (index != null && depth <= 2) {
          fonts.put(index, name.toString().trim());
          index = null;
        }
        name.setLength(0);
        pendingSkip = 0;
        i++;
      } else {
        if (depth <= 2 && c != '\n' && c != '\r') {
          if (pendingSkip > 0) {
            pendingSkip--;
          } else {
            name.append(c);
          }
        }
        i++;
      }
    }
    return fonts;
  }

  static Integer parseHex(String s, int at) {
    if (at + 2 > s.length()) {
      return null;
    }
    try {
      return Integer.parseInt(s.substring(at, at + 2), 16);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * A control word: letters, an optional signed numeric parameter, and the index just past
   * its optional single-space delimiter.
   */
  record ControlWord(String name, Integer param, int end) {

    static ControlWord parse(String s, int at) {
      int i = at + 1;
      int n = s.length();
      if (i >= n || !isLetter(s.charAt(i))) {
        return null;
      }
      int nameStart = i;
      while (i < n && isLetter(s.charAt(i))) {
        i++;
      }
      String name = s.substring(nameStart, i);
      Integer param = null;
      int paramStart = i;
      if (i < n && s.charAt(i) == '-') {
        i++;
      }
      int digitsStart = i;
      while (i < n && Character.isDigit(s.charAt(i)) && i - digitsStart < 10) {
        i++;
      }
      if (i > digitsStart) {
        try {
          param = Integer.parseInt(s.substring(paramStart, i));
        } catch (NumberFormatException e) {
          param = null;
        }
      } else {
        i = paramStart;
      }
      if (i < n && s.charAt(i) == ' ') {
        i++;
      }
      return new ControlWord(name, param, i);
    }

    private static boolean isLetter(char c) {
      return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
  }

  /**
   * Character formatting of one group level.
   */
  private static final class CharacterState {
    boolean bold;
    boolean italic;
    boolean underline;
    boolean strike;
    String font;
    Double sizePt;
    int unicodeSkip = 1;
    // set by a heading level: its own bold and size are presentation, not run formatting
    boolean headingPreset;

    CharacterState copy() {
      CharacterState copy = new CharacterState();
      copy.bold = bold;
      copy.italic = italic;
      copy.underline = underline;
      copy.strike = strike;
      copy.font = font;
      copy.sizePt = sizePt;
      copy.unicodeSkip = unicodeSkip;
      return copy;
    }

    void reset() {
      bold = false;
      italic = false;
      underline = false;
      strike = false;
      font = null;
      sizePt = null;
    }

    InlineAttributes toAttributes() {
      return new InlineAttributes(bold, italic, underline, strike, font, sizePt);
    }
  }

  /**
   * Paragraph formatting pending for the next {@code \par}.
   */
  private static final class ParagraphState {
    Integer headingLevel;
    ListKind listKind;
    int leftIndent;

    void reset() {
      headingLevel = null;
      listKind = null;
      leftIndent = 0;
    }

    BlockAttributes toAttributes() {
      if (headingLevel != null) {
        return BlockAttributes.heading(headingLevel);
      }
      if (listKind != null) {
        return BlockAttributes.list(listKind);
      }
      if (leftIndent > 0) {
        return BlockAttributes.quote();
      }
      return BlockAttributes.NONE;
    }
  }

  private static final class Scan {
    private final String s;
    private final Map<Integer, String> fonts;
    private final List<DocumentElement> elements = new ArrayList<>();
    private final Deque<CharacterState> stack = new ArrayDeque<>();
    private final StringBuilder text = new StringBuilder();
    private final ParagraphState paragraph = new ParagraphState();
    private CharacterState state = new CharacterState();
    private int pendingSkip;

    Scan(String s, Map<Integer, String> fonts) {
      this.s = s;
      this.fonts = fonts;
    }

    Document run() {
      int i = 0;
      int n = s.length();
      while (i < n) {
        char c = s.charAt(i);
        switch (c) {
          case '{' -> i = openGroup(i);
          case '}' -> {
            flushText();
            pendingSkip = 0;
            if (!stack.isEmpty()) {
              state = stack.pop();
            }
            i++;
          }
          case '\\' -> i = escape(i);
          case '\n', '\r' -> i++;
          default -> {
            literal(c);
            i++;
          }
        }
      }
      flushText();
      if (!new Document(elements).isNewlineTerminated()) {
        elements.add(BlockMarker.PARAGRAPH);
      }
      return new Document(elements);
    }

    private int openGroup(int at) {
      pendingSkip = 0;
      int next = at + 1;
      if (next + 1 < s.length() && s.charAt(next) == '\\') {
        char marker = s.charAt(next + 1);
        ControlWord word = ControlWord.parse(s, next);
        if (marker == '*' || (word != null && SKIPPED_GROUPS.contains(word.name()))) {
          return skipGroup(at);
        }
      }
      stack.push(state);
      state = state.copy();
      return next;
    }

    private int skipGroup(int at) {
      int depth = 0;
      int i = at;
      while (i < s.length()) {
        char c = s.charAt(i);
        if (c == '\\') {
          i += 2;
          continue;
        }
        if (c == '{') {
          depth++;
        } else if (c == '}') {
          depth--;
          if (depth == 0) {
            return i + 1;
          }
        }
        i++;
      }
      return i;
    }

    private void literal(char c) {
      if (pendingSkip > 0) {
        pendingSkip--;
        return;
      }
      text.append(c);
    }

    private int escape(int at) {
      if (at + 1 >= s.length()) {
        return at + 1;
      }
      char next = s.charAt(at + 1);
      switch (next) {
        case '\\', '{', '}' -> {
          literal(next);
          return at + 2;
        }
        case '\'' -> {
          Integer hex = parseHex(s, at + 2);
          if (hex == null) {
            return at + 2;
          }
          literal(RtfEscaper.decodeHex(hex));
          return at + 4;
        }
        case '~' -> {
          literal('\u00A0');
          return at + 2;
        }
        case '_' -> {
          literal('-');
          return at + 2;
        }
        case '\n', '\r' -> {
          endParagraph();
          return at + 2;
        }
        default -> {
          ControlWord word = ControlWord.parse(s, at);
          if (word == null) {
            return at + 2;
          }
          controlWord(word);
          return word.end();
        }
      }
    }

    private void controlWord(ControlWord word) {
      Integer param = word.param();
      boolean on = param == null || param != 0;
      if (!word.name().equals("u")) {
        pendingSkip = 0;
      }
      switch (word.name()) {
        case "b" -> {
          if (!state.headingPreset) {
            flushText();
            state.bold = on;
          }
        }
        case "i" -> {
          flushText();
          state.italic = on;
        }
        case "ul" -> {
          flushText();
          state.underline = on;
        }
        case "ulnone" -> {
          flushText();
          state.underline = false;
        }
        case "strike" -> {
          flushText();
          state.strike = on;
        }
        case "f" -> {
          if (param != null && fonts.containsKey(param)) {
            flushText();
            state.font = fonts.get(param);
          }
        }
        case "fs" -> {
          if (param != null && param > 0 && !state.headingPreset) {
            flushText();
            state.sizePt = param / 2.0;
          }
        }
        case "plain" -> {
          flushText();
          state.reset();
          state.headingPreset = false;
        }
        case "par" -> endParagraph();
        case "pard" -> {
          paragraph.reset();
          state.headingPreset = false;
        }
        case "line" -> text.append('\n');
        case "tab" -> text.append('\t');
        case "u" -> {
          if (param != null) {
            text.append((char) (param < 0 ? param + 65536 : param));
            pendingSkip = state.unicodeSkip;
          }
        }
        case "uc" -> {
          if (param != null && param >= 0) {
            state.unicodeSkip = param;
          }
        }
        case "outlinelevel" -> {
          if (param != null && param >= 0 && param < BlockAttributes.MAX_HEADING_LEVEL) {
            paragraph.headingLevel = param + 1;
            state.headingPreset = true;
          }
        }
        case "ls" -> paragraph.listKind = param != null && param == 2 ? ListKind.ORDERED : ListKind.BULLET;
        case "li" -> paragraph.leftIndent = param == null ? 0 : param;
        default -> {
          // not a formatting we carry
        }
      }
    }

    private void endParagraph() {
      flushText();
      elements.add(new BlockMarker(paragraph.toAttributes()));
      paragraph.reset();
      state.headingPreset = false;
    }

    private void flushText() {
      if (text.length() == 0) {
        return;
      }
      elements.add(new StyledRun(text.toString(), state.toAttributes()));
      text.setLength(0);
    }
  }
}
