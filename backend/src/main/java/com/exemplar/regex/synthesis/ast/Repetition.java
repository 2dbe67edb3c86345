package com.exemplar.regex.synthesis.ast;

import com.exemplar.regex.synthesis.RegExpConfig;

import lombok.EqualsAndHashCode;

/** Matches an expression zero or more times, or optionally. */
@EqualsAndHashCode(callSuper = false)
public final class Repetition extends Expression {
  private final Expression base;
  private final Quantifier quantifier;

  Repetition(Expression base, Quantifier quantifier) {
    this.base = base;
    this.quantifier = quantifier;
  }

  public Expression getBase() {
    return base;
  }

  public Quantifier getQuantifier() {
    return quantifier;
  }

  @Override
  int precedence() {
    return 3;
  }

  @Override
  int length() {
    return base.length();
  }

  @Override
  boolean isSingleCodePoint() {
    return false;
  }

  @Override
  void render(StringBuilder buf, RegExpConfig config) {
    renderOperand(buf, base, config);
    buf.append(quantifier.getSymbol().toColorizedString(config.isOutputColorized()));
  }
}
