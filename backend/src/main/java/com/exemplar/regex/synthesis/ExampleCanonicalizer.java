package com.exemplar.regex.synthesis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Brings an example list into canonical order: lowercased when matching case-insensitively, free
 * of duplicates, and sorted by length with ties broken lexicographically.
 */
public final class ExampleCanonicalizer {

  static final Comparator<String> CANONICAL_ORDER =
      Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

  private ExampleCanonicalizer() {}

  /** Canonicalizes the examples in place. */
  public static void canonicalize(List<String> examples, RegExpConfig config) {
    if (config.isCaseInsensitiveMatching()) {
      examples.replaceAll(example -> example.toLowerCase(Locale.ROOT));
    }
    List<String> unique = new ArrayList<>(new LinkedHashSet<>(examples));
    unique.sort(CANONICAL_ORDER);
    examples.clear();
    examples.addAll(unique);
  }
}
