package com.exemplar.regex.synthesis.ast;

import java.util.List;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.grapheme.Grapheme;

import lombok.EqualsAndHashCode;

/** Matches a fixed sequence of graphemes. */
@EqualsAndHashCode(callSuper = false)
public final class Literal extends Expression {
  private final List<Grapheme> graphemes;

  Literal(List<Grapheme> graphemes) {
    this.graphemes = List.copyOf(graphemes);
  }

  public List<Grapheme> getGraphemes() {
    return graphemes;
  }

  @Override
  int precedence() {
    return 2;
  }

  @Override
  int length() {
    return graphemes.size();
  }

  @Override
  boolean isSingleCodePoint() {
    return graphemes.size() == 1
        && graphemes.get(0).isSingleChar()
        && graphemes.get(0).getCount() == 1;
  }

  @Override
  public boolean isEmpty() {
    return graphemes.isEmpty();
  }

  @Override
  void render(StringBuilder buf, RegExpConfig config) {
    for (Grapheme grapheme : graphemes) buf.append(grapheme.render(config));
  }
}
