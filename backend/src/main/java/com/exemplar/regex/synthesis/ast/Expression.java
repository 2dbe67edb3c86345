package com.exemplar.regex.synthesis.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.grapheme.Grapheme;
import com.exemplar.regex.synthesis.render.ColorizableString;

/**
 * Represents a synthesized regular expression structurally. The set of variants is closed: {@link
 * Literal}, {@link CharacterClass}, {@link Repetition}, {@link Concatenation} and {@link
 * Alternation}. Trees are immutable and compare structurally. Convert to text with {@link
 * #render(RegExpConfig)}.
 */
public abstract class Expression {
  Expression() {}

  /**
   * Create an expression matching a sequence of graphemes literally.
   *
   * @param graphemes the graphemes to match in order
   * @return the literal expression
   */
  public static Literal literal(List<Grapheme> graphemes) {
    return new Literal(graphemes);
  }

  /**
   * Create a bracketed character class.
   *
   * @param codePoints the code points to include
   * @return an expression matching any one of the code points
   */
  public static CharacterClass characterClass(Collection<Integer> codePoints) {
    SortedSet<Integer> members = new TreeSet<>(codePoints);
    if (members.isEmpty()) throw new IllegalArgumentException("empty character class");
    return new CharacterClass(members);
  }

  /**
   * Create an expression matching one expression followed by another.
   *
   * @param first the leading expression
   * @param second the trailing expression
   * @return the concatenation
   */
  public static Concatenation concatenation(Expression first, Expression second) {
    return new Concatenation(first, second);
  }

  /**
   * Create a quantified expression.
   *
   * @param base the repeated expression
   * @param quantifier how often it may occur
   * @return the repetition
   */
  public static Repetition repetition(Expression base, Quantifier quantifier) {
    return new Repetition(base, quantifier);
  }

  /**
   * Create a choice between two expressions. Nested alternations are flattened, and the options
   * are stably ordered from the longest to the shortest.
   *
   * @param first the first option
   * @param second the second option
   * @return the alternation
   */
  public static Alternation alternation(Expression first, Expression second) {
    List<Expression> options = new ArrayList<>();
    flatten(first, options);
    flatten(second, options);
    options.sort(Comparator.comparingInt(Expression::length).reversed());
    return new Alternation(options);
  }

  private static void flatten(Expression expression, List<Expression> options) {
    if (expression instanceof Alternation) {
      options.addAll(((Alternation) expression).getOptions());
    } else {
      options.add(expression);
    }
  }

  /** Binding strength used to decide where groups are required. */
  abstract int precedence();

  /** Number of graphemes along the first path through the expression. */
  abstract int length();

  /** Determine whether the expression stands for exactly one code point or shorthand class. */
  abstract boolean isSingleCodePoint();

  /**
   * Determine whether this expression matches only the empty string.
   *
   * @return {@code true} for an empty literal
   */
  public boolean isEmpty() {
    return false;
  }

  abstract void render(StringBuilder buf, RegExpConfig config);

  /**
   * Render the expression as regular expression text, without anchors.
   *
   * @param config controls escaping, grouping and highlighting
   * @return the expression text
   */
  public final String render(RegExpConfig config) {
    StringBuilder buf = new StringBuilder();
    render(buf, config);
    return buf.toString();
  }

  /** Renders a sub-expression, grouping it if it binds less tightly than this one. */
  final void renderOperand(StringBuilder buf, Expression operand, RegExpConfig config) {
    if (operand.precedence() < precedence() && !operand.isSingleCodePoint()) {
      boolean colorized = config.isOutputColorized();
      buf.append(
          ColorizableString.leftParenthesis(config.isCapturingGroupEnabled())
              .toColorizedString(colorized));
      operand.render(buf, config);
      buf.append(ColorizableString.RIGHT_PARENTHESIS.toColorizedString(colorized));
    } else {
      operand.render(buf, config);
    }
  }

  @Override
  public String toString() {
    return render(RegExpConfig.defaults());
  }
}
