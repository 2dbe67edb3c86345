package com.exemplar.regex.synthesis.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.render.CharEscaper;
import com.exemplar.regex.synthesis.render.ColorizableString;

import lombok.EqualsAndHashCode;

/**
 * Matches any one of a set of code points, rendered as a bracket expression. Runs of three or more
 * consecutive code points are written as ranges.
 */
@EqualsAndHashCode(callSuper = false)
public final class CharacterClass extends Expression {
  private final SortedSet<Integer> codePoints;

  CharacterClass(SortedSet<Integer> codePoints) {
    this.codePoints = codePoints;
  }

  public SortedSet<Integer> getCodePoints() {
    return Collections.unmodifiableSortedSet(codePoints);
  }

  @Override
  int precedence() {
    return 1;
  }

  @Override
  int length() {
    return 1;
  }

  @Override
  boolean isSingleCodePoint() {
    return true;
  }

  @Override
  void render(StringBuilder buf, RegExpConfig config) {
    boolean colorized = config.isOutputColorized();
    buf.append(ColorizableString.LEFT_BRACKET.toColorizedString(colorized));
    List<Integer> run = new ArrayList<>();
    for (int codePoint : codePoints) {
      if (!run.isEmpty() && run.get(run.size() - 1) + 1 != codePoint) {
        appendRun(buf, run, config);
        run.clear();
      }
      run.add(codePoint);
    }
    appendRun(buf, run, config);
    buf.append(ColorizableString.RIGHT_BRACKET.toColorizedString(colorized));
  }

  private static void appendRun(StringBuilder buf, List<Integer> run, RegExpConfig config) {
    if (run.size() <= 2) {
      for (int codePoint : run) buf.append(CharEscaper.escapeClassMember(codePoint, config));
    } else {
      buf.append(CharEscaper.escapeClassMember(run.get(0), config))
          .append('-')
          .append(CharEscaper.escapeClassMember(run.get(run.size() - 1), config));
    }
  }
}
