package com.exemplar.regex.synthesis;

import java.util.ArrayList;
import java.util.List;

import com.exemplar.regex.synthesis.grapheme.GraphemeCluster;

import lombok.extern.slf4j.Slf4j;

/**
 * Segments canonical examples into grapheme sequences and runs the configured feature passes over
 * them. Character class conversion always runs before repetition folding.
 */
@Slf4j
public final class FeaturePassOrchestrator {

  private FeaturePassOrchestrator() {}

  public static List<GraphemeCluster> apply(List<String> examples, RegExpConfig config) {
    List<GraphemeCluster> clusters = new ArrayList<>(examples.size());
    for (String example : examples) {
      clusters.add(GraphemeCluster.from(example, config));
    }

    if (config.isCharClassFeatureEnabled()) {
      log.debug("Converting {} sequences to character classes", clusters.size());
      clusters.forEach(GraphemeCluster::convertToCharClasses);
    }
    if (config.isRepetitionConverted()) {
      log.debug(
          "Folding repetitions (minimum repetitions {}, minimum substring length {})",
          config.getMinimumRepetitions(),
          config.getMinimumSubstringLength());
      clusters.forEach(GraphemeCluster::convertRepetitions);
    }
    return clusters;
  }
}
