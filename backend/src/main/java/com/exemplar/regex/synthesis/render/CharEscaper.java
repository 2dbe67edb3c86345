package com.exemplar.regex.synthesis.render;

import com.exemplar.regex.synthesis.RegExpConfig;

/** Escapes code points for use inside rendered patterns, both in literals and bracket classes. */
public final class CharEscaper {

  private static final String LITERAL_METACHARACTERS = "\\()[]{}+*-.?|^$";
  private static final String CLASS_METACHARACTERS = "[]\\-^$";

  private CharEscaper() {}

  public static String escapeLiteral(String text, RegExpConfig config) {
    StringBuilder escaped = new StringBuilder(text.length());
    text.codePoints()
        .forEach(codePoint -> appendEscaped(escaped, codePoint, LITERAL_METACHARACTERS, config));
    return escaped.toString();
  }

  /**
   * Escapes one member of a bracket class. A vertical tab becomes {@code \x0B}, since {@code \v}
   * inside a class denotes all vertical whitespace and cannot end a range.
   */
  public static String escapeClassMember(int codePoint, RegExpConfig config) {
    if (codePoint == 0x0B) {
      return "\\x0B";
    }
    StringBuilder escaped = new StringBuilder(2);
    appendEscaped(escaped, codePoint, CLASS_METACHARACTERS, config);
    return escaped.toString();
  }

  /**
   * Renders a non-ASCII code point as a four digit hex escape. Astral code points become either
   * {@code \x{XXXXX}} or a surrogate pair of hex escapes.
   */
  public static String escapeNonAscii(int codePoint, boolean useSurrogatePairs) {
    if (Character.isBmpCodePoint(codePoint)) {
      return String.format("\\u%04x", codePoint);
    }
    if (useSurrogatePairs) {
      return String.format(
          "\\u%04x\\u%04x",
          (int) Character.highSurrogate(codePoint),
          (int) Character.lowSurrogate(codePoint));
    }
    return String.format("\\x{%x}", codePoint);
  }

  private static void appendEscaped(
      StringBuilder buf, int codePoint, String metacharacters, RegExpConfig config) {
    if (codePoint < 128 && metacharacters.indexOf(codePoint) >= 0) {
      buf.append('\\').appendCodePoint(codePoint);
    } else if (codePoint == '\n') {
      buf.append("\\n");
    } else if (codePoint == '\r') {
      buf.append("\\r");
    } else if (codePoint == '\t') {
      buf.append("\\t");
    } else if (codePoint > 127 && config.isNonAsciiCharEscaped()) {
      buf.append(escapeNonAscii(codePoint, config.isAstralCodePointConvertedToSurrogate()));
    } else {
      buf.appendCodePoint(codePoint);
    }
  }
}
