package com.exemplar.regex.synthesis.ast;

import com.exemplar.regex.synthesis.render.ColorizableString;

/** Quantifiers produced by state elimination. */
public enum Quantifier {
  KLEENE_STAR(ColorizableString.ASTERISK),
  QUESTION_MARK(ColorizableString.QUESTION_MARK);

  private final ColorizableString symbol;

  Quantifier(ColorizableString symbol) {
    this.symbol = symbol;
  }

  public ColorizableString getSymbol() {
    return symbol;
  }
}
