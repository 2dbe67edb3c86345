package com.exemplar.regex.synthesis.fsm;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.exemplar.regex.synthesis.grapheme.Grapheme;
import com.exemplar.regex.synthesis.grapheme.GraphemeCluster;

/**
 * Interns graphemes as single {@code char} symbols so that the character automata of
 * dk.brics.automaton can run over grapheme sequences. Symbols are handed out in first-seen order.
 */
final class SymbolAlphabet {

  private static final int CAPACITY = Character.MAX_VALUE + 1;

  private final Map<Grapheme, Character> symbols = new HashMap<>();
  private final List<Grapheme> graphemes = new ArrayList<>();

  char intern(Grapheme grapheme) {
    Character symbol = symbols.get(grapheme);
    if (symbol != null) {
      return symbol;
    }
    if (graphemes.size() == CAPACITY) {
      throw new IllegalStateException(
          "alphabet exhausted: more than " + CAPACITY + " distinct graphemes");
    }
    char next = (char) graphemes.size();
    symbols.put(grapheme, next);
    graphemes.add(grapheme);
    return next;
  }

  String encode(GraphemeCluster cluster) {
    StringBuilder encoded = new StringBuilder(cluster.size());
    for (Grapheme grapheme : cluster.getGraphemes()) {
      encoded.append(intern(grapheme));
    }
    return encoded.toString();
  }

  Grapheme grapheme(char symbol) {
    return graphemes.get(symbol);
  }

  int size() {
    return graphemes.size();
  }
}
