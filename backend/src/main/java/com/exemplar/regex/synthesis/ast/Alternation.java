package com.exemplar.regex.synthesis.ast;

import java.util.List;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.render.ColorizableString;

import lombok.EqualsAndHashCode;

/**
 * Matches any one of several mutually exclusive options, separated by {@code |}. The grouping
 * around a top-level alternation is added by the renderer.
 */
@EqualsAndHashCode(callSuper = false)
public final class Alternation extends Expression {
  private final List<Expression> options;

  Alternation(List<Expression> options) {
    this.options = List.copyOf(options);
  }

  public List<Expression> getOptions() {
    return options;
  }

  @Override
  int precedence() {
    return 1;
  }

  @Override
  int length() {
    return options.get(0).length();
  }

  @Override
  boolean isSingleCodePoint() {
    return false;
  }

  @Override
  void render(StringBuilder buf, RegExpConfig config) {
    String pipe = ColorizableString.PIPE.toColorizedString(config.isOutputColorized());
    for (int i = 0; i < options.size(); i++) {
      if (i > 0) buf.append(pipe);
      renderOperand(buf, options.get(i), config);
    }
  }
}
