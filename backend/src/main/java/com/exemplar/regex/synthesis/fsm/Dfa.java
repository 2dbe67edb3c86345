package com.exemplar.regex.synthesis.fsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.exemplar.regex.synthesis.grapheme.Grapheme;
import com.exemplar.regex.synthesis.grapheme.GraphemeCluster;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.BasicAutomata;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;
import lombok.extern.slf4j.Slf4j;

/**
 * Minimal deterministic acceptor of a finite set of grapheme sequences. States are numbered in
 * depth-first pre-order from the initial state, which is always state {@code 0}; outgoing edges are
 * visited and reported in ascending symbol order, so numbering is stable for a fixed input.
 */
@Slf4j
public final class Dfa {

  private final List<State> states;
  private final Map<State, Integer> numbers;
  private final SymbolAlphabet alphabet;

  private Dfa(List<State> states, Map<State, Integer> numbers, SymbolAlphabet alphabet) {
    this.states = states;
    this.numbers = numbers;
    this.alphabet = alphabet;
  }

  public static Dfa from(List<GraphemeCluster> clusters) {
    SymbolAlphabet alphabet = new SymbolAlphabet();
    List<Automaton> automata = new ArrayList<>(clusters.size());
    for (GraphemeCluster cluster : clusters) {
      automata.add(BasicAutomata.makeString(alphabet.encode(cluster)));
    }

    Automaton automaton = automata.isEmpty() ? BasicAutomata.makeEmpty() : Automaton.union(automata);
    automaton.minimize();

    List<State> states = new ArrayList<>();
    Map<State, Integer> numbers = new HashMap<>();
    Deque<State> pending = new ArrayDeque<>();
    pending.push(automaton.getInitialState());
    while (!pending.isEmpty()) {
      State state = pending.pop();
      if (numbers.containsKey(state)) continue;
      numbers.put(state, states.size());
      states.add(state);
      List<Transition> transitions = sorted(state);
      for (int i = transitions.size() - 1; i >= 0; i--) {
        State target = transitions.get(i).getDest();
        if (!numbers.containsKey(target)) pending.push(target);
      }
    }

    log.debug(
        "Built minimal DFA with {} states over {} symbols from {} sequences",
        states.size(),
        alphabet.size(),
        clusters.size());
    return new Dfa(states, numbers, alphabet);
  }

  public int stateCount() {
    return states.size();
  }

  public boolean isFinalState(int state) {
    return states.get(state).isAccept();
  }

  /** Edges leaving the given state, one per grapheme, in ascending symbol order. */
  public List<Edge> outgoingEdges(int state) {
    List<Edge> edges = new ArrayList<>();
    for (Transition transition : sorted(states.get(state))) {
      int target = numbers.get(transition.getDest());
      for (int symbol = transition.getMin(); symbol <= transition.getMax(); symbol++) {
        edges.add(new Edge(alphabet.grapheme((char) symbol), target));
      }
    }
    return edges;
  }

  private static List<Transition> sorted(State state) {
    List<Transition> transitions = new ArrayList<>(state.getTransitions());
    transitions.sort(Comparator.comparingInt(Transition::getMin));
    return transitions;
  }

  /** A labelled transition to another state. */
  public static final class Edge {
    private final Grapheme label;
    private final int target;

    Edge(Grapheme label, int target) {
      this.label = label;
      this.target = target;
    }

    public Grapheme getLabel() {
      return label;
    }

    public int getTarget() {
      return target;
    }
  }
}
