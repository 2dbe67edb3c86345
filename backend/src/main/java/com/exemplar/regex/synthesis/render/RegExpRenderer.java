package com.exemplar.regex.synthesis.render;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.ast.Alternation;
import com.exemplar.regex.synthesis.ast.Expression;

/**
 * Turns an expression tree into the final pattern text: optional ignore-case flag, anchors, and a
 * group around a top-level alternation. Rendering is pure and is repeated on every call.
 */
public final class RegExpRenderer {

  private RegExpRenderer() {}

  public static String render(Expression ast, RegExpConfig config) {
    boolean colorized = config.isOutputColorized();
    String ignoreCaseFlag =
        (config.isCaseInsensitiveMatching()
                ? ColorizableString.IGNORE_CASE_FLAG
                : ColorizableString.EMPTY_STRING)
            .toColorizedString(colorized);
    String verboseModeFlag = ColorizableString.VERBOSE_MODE_FLAG.toColorizedString(colorized);
    String leftAnchor = ColorizableString.CARET.toColorizedString(colorized);
    String leftParenthesis =
        ColorizableString.leftParenthesis(config.isCapturingGroupEnabled())
            .toColorizedString(colorized);
    String rightParenthesis = ColorizableString.RIGHT_PARENTHESIS.toColorizedString(colorized);
    String rightAnchor = ColorizableString.DOLLAR_SIGN.toColorizedString(colorized);

    StringBuilder regexp = new StringBuilder().append(ignoreCaseFlag).append(leftAnchor);
    if (ast instanceof Alternation) {
      regexp.append(leftParenthesis).append(ast.render(config)).append(rightParenthesis);
    } else {
      regexp.append(ast.render(config));
    }
    regexp.append(rightAnchor);

    // U+000B line tabulation
    String rendered = regexp.toString().replace("\u000B", "\\v");

    if (config.isVerboseModeEnabled()) {
      return VerboseModeFormatter.format(rendered, verboseModeFlag);
    }
    return rendered;
  }
}
