package com.exemplar.regex.synthesis.render;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reformats a rendered single-line pattern into verbose mode: a header line with the verbose flag,
 * then one token per line, indented two spaces per open group. Tokens are recognized on the
 * rendered text itself, so color escape sequences around a token stay attached to it. A counted
 * quantifier stays on one line, as whitespace inside braces is not allowed in comments mode.
 */
public final class VerboseModeFormatter {

  private static final String COLOR =
      "(?:\u001B\\[(?:1;31m|1;35m|1;33m|1;32m|1;36m|104;37m|40;93m|103;30m))?";
  private static final String COLOR_RESET = "(?:\u001B\\[0m)?";

  private static final Pattern TOKEN =
      Pattern.compile(
          COLOR
              + "(?:"
              + "\\(\\?:"
              + "|\\(\\?i\\)"
              + "|\\[(?:\\\\.|[^\\\\\\]])+\\]"
              + "|\\\\(?:[dDsSwW]|u[0-9a-f]{4}|x\\{[0-9a-f]+\\})"
              + "|\\{(?:\u001B\\[0m)?[0-9]+(?:\u001B\\[104;37m)?\\}"
              + "|\\\\[\\^(){}\\[\\]|$*+?\\\\nrtv.-]"
              + "|[\\^(){}\\[\\]|$*+?\\\\.-]"
              + "|(?:[^\\^(){}\\[\\]|$*+?\\\\.\\-\u001B]|\u001B(?!\\[[0-9;]*m))+"
              + ")"
              + COLOR_RESET);

  private static final String[] SPACE_SEPARATORS = {
    "\u00A0", "\u2000", "\u2001", "\u2002", "\u2003", "\u2004", "\u205F", "\u0085"
  };

  private static final String INDENT = "  ";

  private VerboseModeFormatter() {}

  public static String format(String regexp, String verboseModeFlag) {
    List<String> lines = new ArrayList<>();
    lines.add(verboseModeFlag);
    int nestingLevel = 0;

    Matcher matcher = TOKEN.matcher(regexp);
    while (matcher.find()) {
      String token = escapeWhitespace(matcher.group());
      String plain = ColorizableString.strip(token);
      boolean charClass = plain.startsWith("[") && plain.endsWith("]");

      if (!charClass && plain.contains(")") && !plain.contains("\\)")) {
        nestingLevel--;
      }
      lines.add(INDENT.repeat(Math.max(nestingLevel, 0)) + token);
      if (!charClass && plain.contains("(") && !plain.contains("\\(")) {
        nestingLevel++;
      }
    }
    return String.join("\n", lines);
  }

  private static String escapeWhitespace(String token) {
    String escaped = token.replace("#", "\\#");
    for (String separator : SPACE_SEPARATORS) {
      escaped = escaped.replace(separator, "\\s");
    }
    return escaped.replace(" ", "\\ ");
  }
}
