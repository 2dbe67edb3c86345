package com.exemplar.regex.synthesis.grapheme;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.exemplar.regex.synthesis.RegExpConfig;

/**
 * The symbol sequence of one example. Feature passes rewrite the sequence in place; the automaton
 * builder consumes it afterwards.
 */
public final class GraphemeCluster {

  private List<Grapheme> graphemes;
  private final RegExpConfig config;

  private GraphemeCluster(List<Grapheme> graphemes, RegExpConfig config) {
    this.graphemes = graphemes;
    this.config = config;
  }

  public static GraphemeCluster from(String text, RegExpConfig config) {
    List<Grapheme> graphemes = new ArrayList<>();
    for (String cluster : GraphemeSegmenter.segment(text)) {
      graphemes.add(Grapheme.of(cluster));
    }
    return new GraphemeCluster(graphemes, config);
  }

  public List<Grapheme> getGraphemes() {
    return Collections.unmodifiableList(graphemes);
  }

  public int size() {
    return graphemes.size();
  }

  public void convertToCharClasses() {
    graphemes.replaceAll(grapheme -> grapheme.withCharClasses(config));
  }

  public void convertRepetitions() {
    graphemes =
        new RepetitionFolder(config.getMinimumRepetitions(), config.getMinimumSubstringLength())
            .fold(graphemes);
  }

  @Override
  public String toString() {
    return graphemes.toString();
  }
}
