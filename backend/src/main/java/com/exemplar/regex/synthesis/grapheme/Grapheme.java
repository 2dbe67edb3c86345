package com.exemplar.regex.synthesis.grapheme;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.render.CharEscaper;
import com.exemplar.regex.synthesis.render.ColorizableString;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One symbol of the automaton alphabet. A unit grapheme carries the text of a single grapheme
 * cluster as one or more pieces, where a piece is either literal text or a shorthand class token
 * such as {@code \d}. A group grapheme carries a nested sequence of graphemes. Both may be
 * repeated a fixed number of times.
 */
@Getter
@EqualsAndHashCode
public final class Grapheme {

  static final Set<String> SHORTHAND_CLASSES =
      Set.of("\\d", "\\D", "\\s", "\\S", "\\w", "\\W");

  private final List<String> chars;
  private final List<Grapheme> members;
  private final int count;

  private Grapheme(List<String> chars, List<Grapheme> members, int count) {
    this.chars = chars;
    this.members = members;
    this.count = count;
  }

  public static Grapheme of(String text) {
    return new Grapheme(List.of(text), List.of(), 1);
  }

  static Grapheme ofPieces(List<String> pieces) {
    return new Grapheme(List.copyOf(pieces), List.of(), 1);
  }

  static Grapheme group(List<Grapheme> members, int count) {
    return new Grapheme(List.of(), List.copyOf(members), count);
  }

  Grapheme repeated(int times) {
    return new Grapheme(chars, members, times);
  }

  public boolean isGroup() {
    return !members.isEmpty();
  }

  /** Unrendered text of this grapheme, ignoring its own repetition count. */
  public String value() {
    if (isGroup()) {
      StringBuilder buf = new StringBuilder();
      members.forEach(member -> buf.append(member.value().repeat(member.count)));
      return buf.toString();
    }
    return String.join("", chars);
  }

  /** True for a unit consisting of exactly one code point or one shorthand class. */
  public boolean isSingleChar() {
    if (isGroup() || chars.size() != 1) return false;
    String piece = chars.get(0);
    return SHORTHAND_CLASSES.contains(piece) || piece.codePointCount(0, piece.length()) == 1;
  }

  /**
   * True if this grapheme is a plain, unrepeated literal code point and may therefore join a
   * bracketed character class.
   */
  public boolean isSingleCodePointLiteral() {
    return count == 1 && isSingleChar() && !SHORTHAND_CLASSES.contains(chars.get(0));
  }

  public int codePoint() {
    if (!isSingleCodePointLiteral()) {
      throw new IllegalStateException("not a single code point: " + this);
    }
    return chars.get(0).codePointAt(0);
  }

  /**
   * Replaces code points with shorthand classes, in the order digit, word, space, non-digit,
   * non-word, non-space. Returns this instance if nothing was converted.
   */
  Grapheme withCharClasses(RegExpConfig config) {
    String text = value();
    List<String> pieces = new ArrayList<>();
    boolean converted = false;
    for (int offset = 0; offset < text.length(); ) {
      int codePoint = text.codePointAt(offset);
      String shorthand = shorthandFor(codePoint, config);
      if (shorthand != null) {
        pieces.add(shorthand);
        converted = true;
      } else {
        pieces.add(new String(Character.toChars(codePoint)));
      }
      offset += Character.charCount(codePoint);
    }
    return converted ? ofPieces(pieces) : this;
  }

  private static String shorthandFor(int codePoint, RegExpConfig config) {
    boolean digit = Character.isDigit(codePoint);
    boolean word = Character.isLetterOrDigit(codePoint) || codePoint == '_';
    boolean space =
        Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == 0x85;
    if (config.isDigitConverted() && digit) return "\\d";
    if (config.isWordConverted() && word) return "\\w";
    if (config.isSpaceConverted() && space) return "\\s";
    if (config.isNonDigitConverted() && !digit) return "\\D";
    if (config.isNonWordConverted() && !word) return "\\W";
    if (config.isNonSpaceConverted() && !space) return "\\S";
    return null;
  }

  public String render(RegExpConfig config) {
    StringBuilder value = new StringBuilder();
    if (isGroup()) {
      members.forEach(member -> value.append(member.render(config)));
    } else {
      for (String piece : chars) {
        value.append(
            SHORTHAND_CLASSES.contains(piece) ? piece : CharEscaper.escapeLiteral(piece, config));
      }
    }
    if (count == 1) {
      return value.toString();
    }

    boolean colorized = config.isOutputColorized();
    StringBuilder buf = new StringBuilder();
    if (isSingleChar()) {
      buf.append(value);
    } else {
      buf.append(
              ColorizableString.leftParenthesis(config.isCapturingGroupEnabled())
                  .toColorizedString(colorized))
          .append(value)
          .append(ColorizableString.RIGHT_PARENTHESIS.toColorizedString(colorized));
    }
    return buf.append(ColorizableString.LEFT_BRACE.toColorizedString(colorized))
        .append(count)
        .append(ColorizableString.RIGHT_BRACE.toColorizedString(colorized))
        .toString();
  }

  @Override
  public String toString() {
    String base = isGroup() ? members.toString() : String.join("", chars);
    return count == 1 ? base : base + "{" + count + "}";
  }
}
