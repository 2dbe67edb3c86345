package com.exemplar.regex.synthesis.grapheme;

import java.util.ArrayList;
import java.util.List;

import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;

/**
 * Splits text into extended grapheme clusters. Concatenating the returned clusters in order
 * yields the input again, and no user-perceived character is ever split.
 */
public final class GraphemeSegmenter {

  private GraphemeSegmenter() {}

  public static List<String> segment(String text) {
    List<String> clusters = new ArrayList<>();
    if (text.isEmpty()) {
      return clusters;
    }
    BreakIterator boundaries = BreakIterator.getCharacterInstance(ULocale.ROOT);
    boundaries.setText(text);
    int start = boundaries.first();
    for (int end = boundaries.next(); end != BreakIterator.DONE; end = boundaries.next()) {
      clusters.add(text.substring(start, end));
      start = end;
    }
    return clusters;
  }
}
