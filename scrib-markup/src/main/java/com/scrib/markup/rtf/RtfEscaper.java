package com.scrib.markup.rtf;

import java.nio.charset.Charset;

/**
 * Text escaping for the markup format.
 */
public final class RtfEscaper {

  /**
   * Code page used by {@code \'hh} escapes.
   */
  static final Charset CP1252 = Charset.forName("windows-1252");

  private RtfEscaper() {
  }

  /**
   * Escapes literal text. Backslash and braces are quoted, tabs become {@code \tab}, and
   * anything outside printable ASCII becomes a Unicode control word with a {@code ?} fallback.
   * Carriage returns are dropped. Newlines are not handled here; they end paragraphs.
   *
   * @param text the text
   * @return the escaped text
   */
  public static String escape(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '{' -> sb.append("\\{");
        case '}' -> sb.append("\\}");
        case '\t' -> sb.append("\\tab ");
        case '\r' -> {
        }
        default -> {
          if (c > 0x7e || c < 0x20) {
            // signed 16-bit value, as readers of the format expect
            sb.append("\\u").append((int) (short) c).append('?');
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  /**
   * Decodes the byte of a {@code \'hh} escape. Bytes the code page leaves undefined map to
   * the Latin-1 character of the same value.
   *
   * @param value the byte value, 0..255
   * @return the character
   */
  static char decodeHex(int value) {
    String decoded = new String(new byte[]{(byte) value}, CP1252);
    if (decoded.length() != 1 || decoded.charAt(0) == '\uFFFD') {
      return (char) value;
    }
    return decoded.charAt(0);
  }
}
