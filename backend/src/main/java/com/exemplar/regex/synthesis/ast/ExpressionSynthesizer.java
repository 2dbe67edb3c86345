package com.exemplar.regex.synthesis.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.exemplar.regex.synthesis.fsm.Dfa;
import com.exemplar.regex.synthesis.grapheme.Grapheme;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts a minimal DFA into an equivalent expression tree with the Brzozowski algebraic method.
 * Each state contributes one equation; states are eliminated from the highest number down to the
 * initial state, whose solution is the result. Transitions are kept per state in sparse maps, and
 * eliminating a state only touches its actual predecessors and successors.
 */
@Slf4j
public final class ExpressionSynthesizer {

  private ExpressionSynthesizer() {}

  public static Expression synthesize(Dfa dfa) {
    int stateCount = dfa.stateCount();
    List<NavigableMap<Integer, Expression>> a = new ArrayList<>(stateCount);
    List<NavigableSet<Integer>> predecessors = new ArrayList<>(stateCount);
    Expression[] b = new Expression[stateCount];

    for (int state = 0; state < stateCount; state++) {
      a.add(new TreeMap<>());
      predecessors.add(new TreeSet<>());
    }
    for (int state = 0; state < stateCount; state++) {
      if (dfa.isFinalState(state)) b[state] = emptyLiteral();
      for (Dfa.Edge edge : dfa.outgoingEdges(state)) {
        Expression label = Expression.literal(List.of(edge.getLabel()));
        a.get(state).merge(edge.getTarget(), label, ExpressionSynthesizer::union);
        predecessors.get(edge.getTarget()).add(state);
      }
    }

    for (int n = stateCount - 1; n >= 0; n--) {
      NavigableMap<Integer, Expression> row = a.get(n);
      Expression self = row.remove(n);
      if (self != null) {
        Expression loop = Expression.repetition(self, Quantifier.KLEENE_STAR);
        b[n] = concatenate(loop, b[n]);
        row.headMap(n, false).replaceAll((j, expression) -> concatenate(loop, expression));
      }
      NavigableMap<Integer, Expression> successors = row.headMap(n, false);
      for (int i : predecessors.get(n).headSet(n, false)) {
        Expression entry = a.get(i).remove(n);
        b[i] = union(b[i], concatenate(entry, b[n]));
        for (Map.Entry<Integer, Expression> successor : successors.entrySet()) {
          int j = successor.getKey();
          a.get(i).merge(j, concatenate(entry, successor.getValue()), ExpressionSynthesizer::union);
          predecessors.get(j).add(i);
        }
      }
      a.set(n, null);
      predecessors.set(n, null);
    }

    Expression result = stateCount > 0 && b[0] != null ? b[0] : emptyLiteral();
    log.debug("Eliminated {} states into {}", stateCount, result.getClass().getSimpleName());
    return result;
  }

  static Literal emptyLiteral() {
    return Expression.literal(List.of());
  }

  /** Concatenation that treats {@code null} as the empty language and merges adjacent literals. */
  static Expression concatenate(Expression first, Expression second) {
    if (first == null || second == null) return null;
    if (first.isEmpty()) return second;
    if (second.isEmpty()) return first;

    if (first instanceof Literal && second instanceof Literal) {
      return join((Literal) first, (Literal) second);
    }
    if (first instanceof Literal && second instanceof Concatenation) {
      Concatenation tail = (Concatenation) second;
      if (tail.getFirst() instanceof Literal) {
        return Expression.concatenation(
            join((Literal) first, (Literal) tail.getFirst()), tail.getSecond());
      }
    }
    if (first instanceof Concatenation && second instanceof Literal) {
      Concatenation head = (Concatenation) first;
      if (head.getSecond() instanceof Literal) {
        return Expression.concatenation(
            head.getFirst(), join((Literal) head.getSecond(), (Literal) second));
      }
    }
    return Expression.concatenation(first, second);
  }

  /** Union that treats {@code null} as the empty language. */
  static Expression union(Expression first, Expression second) {
    if (first == null) return second;
    if (second == null) return first;
    if (first.equals(second)) return first;

    if (first.isEmpty()) return optional(second);
    if (second.isEmpty()) return optional(first);

    if (first instanceof Literal && second instanceof Literal) {
      Expression factored = factorLiterals((Literal) first, (Literal) second);
      if (factored != null) return factored;
    }

    if (isClassMember(first) && isClassMember(second)) {
      Set<Integer> codePoints = new TreeSet<>();
      addCodePoints(first, codePoints);
      addCodePoints(second, codePoints);
      return Expression.characterClass(codePoints);
    }
    return Expression.alternation(first, second);
  }

  private static Expression optional(Expression expression) {
    if (expression instanceof Repetition) return expression;
    return Expression.repetition(expression, Quantifier.QUESTION_MARK);
  }

  /** Pulls a shared prefix or suffix out of two distinct literals, or returns {@code null}. */
  private static Expression factorLiterals(Literal first, Literal second) {
    List<Grapheme> x = first.getGraphemes();
    List<Grapheme> y = second.getGraphemes();
    int shorter = Math.min(x.size(), y.size());

    int prefix = 0;
    while (prefix < shorter && x.get(prefix).equals(y.get(prefix))) prefix++;
    if (prefix > 0) {
      Expression rest =
          union(
              Expression.literal(x.subList(prefix, x.size())),
              Expression.literal(y.subList(prefix, y.size())));
      return concatenate(Expression.literal(x.subList(0, prefix)), rest);
    }

    int suffix = 0;
    while (suffix < shorter
        && x.get(x.size() - 1 - suffix).equals(y.get(y.size() - 1 - suffix))) {
      suffix++;
    }
    if (suffix > 0) {
      Expression rest =
          union(
              Expression.literal(x.subList(0, x.size() - suffix)),
              Expression.literal(y.subList(0, y.size() - suffix)));
      return concatenate(rest, Expression.literal(x.subList(x.size() - suffix, x.size())));
    }
    return null;
  }

  private static Literal join(Literal first, Literal second) {
    List<Grapheme> graphemes = new ArrayList<>(first.getGraphemes());
    graphemes.addAll(second.getGraphemes());
    return Expression.literal(graphemes);
  }

  private static boolean isClassMember(Expression expression) {
    if (expression instanceof CharacterClass) return true;
    if (!(expression instanceof Literal)) return false;
    List<Grapheme> graphemes = ((Literal) expression).getGraphemes();
    return graphemes.size() == 1 && graphemes.get(0).isSingleCodePointLiteral();
  }

  private static void addCodePoints(Expression expression, Set<Integer> codePoints) {
    if (expression instanceof CharacterClass) {
      codePoints.addAll(((CharacterClass) expression).getCodePoints());
    } else {
      codePoints.add(((Literal) expression).getGraphemes().get(0).codePoint());
    }
  }
}
