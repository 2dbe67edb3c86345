package com.exemplar.regex.synthesis.render;

/**
 * Fixed regex syntax fragments that may be highlighted with ANSI SGR escape sequences when output
 * colorization is switched on.
 */
public enum ColorizableString {
  ASTERISK("*", "1;35"),
  CAPTURING_LEFT_PARENTHESIS("(", "1;32"),
  CARET("^", "1;33"),
  DOLLAR_SIGN("$", "1;33"),
  EMPTY_STRING("", null),
  IGNORE_CASE_FLAG("(?i)", "40;93"),
  LEFT_BRACE("{", "104;37"),
  LEFT_BRACKET("[", "1;36"),
  NON_CAPTURING_LEFT_PARENTHESIS("(?:", "1;32"),
  PIPE("|", "1;31"),
  QUESTION_MARK("?", "1;35"),
  RIGHT_BRACE("}", "104;37"),
  RIGHT_BRACKET("]", "1;36"),
  RIGHT_PARENTHESIS(")", "1;32"),
  VERBOSE_MODE_FLAG("(?x)", "103;30");

  public static final String ESCAPE = "\u001B[";
  public static final String RESET = ESCAPE + "0m";

  private final String text;
  private final String style;

  ColorizableString(String text, String style) {
    this.text = text;
    this.style = style;
  }

  public String getText() {
    return text;
  }

  public String toColorizedString(boolean colorized) {
    if (!colorized || style == null) {
      return text;
    }
    return ESCAPE + style + "m" + text + RESET;
  }

  /** Left group token chosen by the capturing-group switch. */
  public static ColorizableString leftParenthesis(boolean capturing) {
    return capturing ? CAPTURING_LEFT_PARENTHESIS : NON_CAPTURING_LEFT_PARENTHESIS;
  }

  /** Removes every SGR escape sequence from already rendered text. */
  public static String strip(String text) {
    return text.replaceAll("\u001B\\[[0-9;]*m", "");
  }
}
