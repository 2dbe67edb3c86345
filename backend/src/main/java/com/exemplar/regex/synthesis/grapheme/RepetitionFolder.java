package com.exemplar.regex.synthesis.grapheme;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds back-to-back occurrences of the same substring into a single repeated grapheme. At every
 * position the substring length covering the most graphemes wins; on a tie the shorter substring
 * is kept, so {@code aaaa} becomes {@code a{4}} rather than {@code (?:aa){2}}.
 */
final class RepetitionFolder {

  private final int minimumRepetitions;
  private final int minimumSubstringLength;

  RepetitionFolder(int minimumRepetitions, int minimumSubstringLength) {
    this.minimumRepetitions = Math.max(1, minimumRepetitions);
    this.minimumSubstringLength = Math.max(1, minimumSubstringLength);
  }

  List<Grapheme> fold(List<Grapheme> graphemes) {
    List<Grapheme> folded = new ArrayList<>(graphemes.size());
    int size = graphemes.size();
    int position = 0;
    while (position < size) {
      int bestLength = 0;
      int bestCount = 0;
      for (int length = minimumSubstringLength; length <= (size - position) / 2; length++) {
        int count = occurrences(graphemes, position, length);
        if (count - 1 < minimumRepetitions) continue;
        if (length * count > bestLength * bestCount) {
          bestLength = length;
          bestCount = count;
        }
      }

      if (bestCount == 0) {
        folded.add(graphemes.get(position++));
        continue;
      }

      List<Grapheme> substring = graphemes.subList(position, position + bestLength);
      if (bestLength == 1) {
        folded.add(substring.get(0).repeated(bestCount));
      } else {
        folded.add(Grapheme.group(fold(substring), bestCount));
      }
      position += bestLength * bestCount;
    }
    return folded;
  }

  private static int occurrences(List<Grapheme> graphemes, int position, int length) {
    List<Grapheme> substring = graphemes.subList(position, position + length);
    int count = 1;
    while (position + (count + 1) * length <= graphemes.size()
        && graphemes
            .subList(position + count * length, position + (count + 1) * length)
            .equals(substring)) {
      count++;
    }
    return count;
  }
}
