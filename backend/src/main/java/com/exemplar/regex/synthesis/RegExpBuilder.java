package com.exemplar.regex.synthesis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fluent entry point of the synthesizer.
 *
 * <pre>
 * String pattern = RegExpBuilder.from(List.of("a", "aa", "aaa"))
 *     .withConversionOfRepetitions()
 *     .build();
 * </pre>
 *
 * The builder copies the examples it is given, so the caller's collection is never modified.
 */
public final class RegExpBuilder {

  private final List<String> examples;
  private final RegExpConfig.RegExpConfigBuilder config = RegExpConfig.builder();

  private RegExpBuilder(List<String> examples) {
    this.examples = examples;
  }

  /**
   * Start a builder over some examples.
   *
   * @param examples the strings the pattern must match
   * @return a builder with every feature switched off
   * @throws IllegalArgumentException if the collection or one of its elements is {@code null}
   */
  public static RegExpBuilder from(Collection<String> examples) {
    if (examples == null) {
      throw new IllegalArgumentException("No examples have been provided");
    }
    List<String> copy = new ArrayList<>(examples.size());
    for (String example : examples) {
      if (example == null) {
        throw new IllegalArgumentException("Examples must not contain null values");
      }
      copy.add(example);
    }
    return new RegExpBuilder(copy);
  }

  /** Convert any Unicode decimal digit to {@code \d}. */
  public RegExpBuilder withConversionOfDigits() {
    config.digitConverted(true);
    return this;
  }

  /** Convert any character which is not a Unicode decimal digit to {@code \D}. */
  public RegExpBuilder withConversionOfNonDigits() {
    config.nonDigitConverted(true);
    return this;
  }

  /** Convert any Unicode whitespace character to {@code \s}. */
  public RegExpBuilder withConversionOfWhitespace() {
    config.spaceConverted(true);
    return this;
  }

  /** Convert any character which is not a Unicode whitespace character to {@code \S}. */
  public RegExpBuilder withConversionOfNonWhitespace() {
    config.nonSpaceConverted(true);
    return this;
  }

  /** Convert any Unicode word character to {@code \w}. */
  public RegExpBuilder withConversionOfWords() {
    config.wordConverted(true);
    return this;
  }

  /** Convert any character which is not a Unicode word character to {@code \W}. */
  public RegExpBuilder withConversionOfNonWords() {
    config.nonWordConverted(true);
    return this;
  }

  /** Detect repeated non-overlapping substrings and convert them to {@code {n}} quantifiers. */
  public RegExpBuilder withConversionOfRepetitions() {
    config.repetitionConverted(true);
    return this;
  }

  public RegExpBuilder withMinimumRepetitions(int quantity) {
    if (quantity <= 0) {
      throw new IllegalArgumentException("Quantity of minimum repetitions must be greater than zero");
    }
    config.minimumRepetitions(quantity);
    return this;
  }

  public RegExpBuilder withMinimumSubstringLength(int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("Minimum substring length must be greater than zero");
    }
    config.minimumSubstringLength(length);
    return this;
  }

  public RegExpBuilder withCaseInsensitiveMatching() {
    config.caseInsensitiveMatching(true);
    return this;
  }

  public RegExpBuilder withCapturingGroups() {
    config.capturingGroupEnabled(true);
    return this;
  }

  /**
   * Escape every character outside the ASCII range.
   *
   * @param useSurrogatePairs write astral code points as a surrogate pair instead of a single
   *     braced hex escape
   */
  public RegExpBuilder withEscapingOfNonAsciiChars(boolean useSurrogatePairs) {
    config.nonAsciiCharEscaped(true);
    config.astralCodePointConvertedToSurrogate(useSurrogatePairs);
    return this;
  }

  public RegExpBuilder withVerboseMode() {
    config.verboseModeEnabled(true);
    return this;
  }

  public RegExpBuilder withSyntaxHighlighting() {
    config.outputColorized(true);
    return this;
  }

  /** Synthesize the pattern object. */
  public RegExp buildRegExp() {
    return RegExp.from(new ArrayList<>(examples), config.build());
  }

  /** Synthesize the pattern and render it. */
  public String build() {
    return buildRegExp().toString();
  }
}
