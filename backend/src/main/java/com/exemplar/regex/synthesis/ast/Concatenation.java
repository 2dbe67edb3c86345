package com.exemplar.regex.synthesis.ast;

import com.exemplar.regex.synthesis.RegExpConfig;

import lombok.EqualsAndHashCode;

/** Matches one expression followed by another. */
@EqualsAndHashCode(callSuper = false)
public final class Concatenation extends Expression {
  private final Expression first;
  private final Expression second;

  Concatenation(Expression first, Expression second) {
    this.first = first;
    this.second = second;
  }

  public Expression getFirst() {
    return first;
  }

  public Expression getSecond() {
    return second;
  }

  @Override
  int precedence() {
    return 2;
  }

  @Override
  int length() {
    return first.length() + second.length();
  }

  @Override
  boolean isSingleCodePoint() {
    return false;
  }

  @Override
  void render(StringBuilder buf, RegExpConfig config) {
    renderOperand(buf, first, config);
    renderOperand(buf, second, config);
  }
}
