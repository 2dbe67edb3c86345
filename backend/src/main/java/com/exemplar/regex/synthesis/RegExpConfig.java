package com.exemplar.regex.synthesis;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable set of switches consumed by every stage of the synthesis pipeline, from example
 * canonicalization to rendering. Instances are shared by reference and never change after {@link
 * #builder()} has built them.
 */
@Value
@Builder(toBuilder = true)
public class RegExpConfig {

  boolean digitConverted;
  boolean nonDigitConverted;
  boolean spaceConverted;
  boolean nonSpaceConverted;
  boolean wordConverted;
  boolean nonWordConverted;

  boolean repetitionConverted;
  @Builder.Default int minimumRepetitions = 1;
  @Builder.Default int minimumSubstringLength = 1;

  boolean caseInsensitiveMatching;
  boolean capturingGroupEnabled;

  boolean nonAsciiCharEscaped;
  boolean astralCodePointConvertedToSurrogate;

  boolean verboseModeEnabled;
  boolean outputColorized;

  public static RegExpConfig defaults() {
    return builder().build();
  }

  /** True if at least one shorthand character class conversion is switched on. */
  public boolean isCharClassFeatureEnabled() {
    return digitConverted
        || nonDigitConverted
        || spaceConverted
        || nonSpaceConverted
        || wordConverted
        || nonWordConverted;
  }

  public List<Feature> enabledFeatures() {
    List<Feature> features = new ArrayList<>();
    if (digitConverted) features.add(Feature.DIGIT);
    if (nonDigitConverted) features.add(Feature.NON_DIGIT);
    if (spaceConverted) features.add(Feature.SPACE);
    if (nonSpaceConverted) features.add(Feature.NON_SPACE);
    if (wordConverted) features.add(Feature.WORD);
    if (nonWordConverted) features.add(Feature.NON_WORD);
    if (repetitionConverted) features.add(Feature.REPETITION);
    if (caseInsensitiveMatching) features.add(Feature.CASE_INSENSITIVITY);
    if (capturingGroupEnabled) features.add(Feature.CAPTURING_GROUP);
    if (nonAsciiCharEscaped) features.add(Feature.NON_ASCII_ESCAPE);
    if (astralCodePointConvertedToSurrogate) features.add(Feature.SURROGATE_PAIRS);
    if (verboseModeEnabled) features.add(Feature.VERBOSE_MODE);
    if (outputColorized) features.add(Feature.SYNTAX_HIGHLIGHTING);
    return features;
  }
}
