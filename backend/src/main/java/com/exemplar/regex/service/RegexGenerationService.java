package com.exemplar.regex.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.exemplar.regex.config.ApplicationProperties;
import com.exemplar.regex.dto.RegexGenerationRequest;
import com.exemplar.regex.dto.RegexGenerationResponse;
import com.exemplar.regex.synthesis.ExampleCanonicalizer;
import com.exemplar.regex.synthesis.RegExp;
import com.exemplar.regex.synthesis.RegExpBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies request options on top of the configured defaults and synthesizes a pattern. Stateless;
 * every call builds its own {@link RegExp}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegexGenerationService {

  private final ApplicationProperties applicationProperties;

  public RegexGenerationResponse generate(RegexGenerationRequest request) {
    List<String> examples = request.getExamples();
    if (examples == null) {
      throw new IllegalArgumentException("No examples have been provided");
    }
    validateLimits(examples);
    log.info("Generating pattern from {} examples", examples.size());

    RegExp regExp = configure(RegExpBuilder.from(examples), request).buildRegExp();

    List<String> canonicalExamples = new ArrayList<>(examples);
    ExampleCanonicalizer.canonicalize(canonicalExamples, regExp.getConfig());

    String pattern = regExp.toString();
    log.info(
        "Generated pattern of length {} from {} distinct examples",
        pattern.length(),
        canonicalExamples.size());

    return RegexGenerationResponse.builder()
        .pattern(pattern)
        .canonicalExamples(canonicalExamples)
        .exampleCount(canonicalExamples.size())
        .features(regExp.getConfig().enabledFeatures())
        .build();
  }

  private void validateLimits(List<String> examples) {
    ApplicationProperties.Limits limits = applicationProperties.getLimits();
    if (examples.size() > limits.getMaxExamples()) {
      throw new IllegalArgumentException(
          "Too many examples: "
              + examples.size()
              + " exceeds the maximum of "
              + limits.getMaxExamples());
    }
    for (int i = 0; i < examples.size(); i++) {
      String example = examples.get(i);
      if (example != null && example.length() > limits.getMaxExampleLength()) {
        throw new IllegalArgumentException(
            "Example at index "
                + i
                + " is longer than the maximum of "
                + limits.getMaxExampleLength()
                + " characters");
      }
    }
  }

  private RegExpBuilder configure(RegExpBuilder builder, RegexGenerationRequest request) {
    ApplicationProperties.Defaults defaults = applicationProperties.getDefaults();

    if (resolve(request.getDigits(), defaults.isDigits())) builder.withConversionOfDigits();
    if (resolve(request.getNonDigits(), defaults.isNonDigits())) {
      builder.withConversionOfNonDigits();
    }
    if (resolve(request.getSpaces(), defaults.isSpaces())) builder.withConversionOfWhitespace();
    if (resolve(request.getNonSpaces(), defaults.isNonSpaces())) {
      builder.withConversionOfNonWhitespace();
    }
    if (resolve(request.getWords(), defaults.isWords())) builder.withConversionOfWords();
    if (resolve(request.getNonWords(), defaults.isNonWords())) builder.withConversionOfNonWords();

    if (resolve(request.getRepetitions(), defaults.isRepetitions())) {
      builder
          .withConversionOfRepetitions()
          .withMinimumRepetitions(resolve(request.getMinRepetitions(), defaults.getMinRepetitions()))
          .withMinimumSubstringLength(
              resolve(request.getMinSubstringLength(), defaults.getMinSubstringLength()));
    }

    if (resolve(request.getCaseInsensitive(), defaults.isCaseInsensitive())) {
      builder.withCaseInsensitiveMatching();
    }
    if (resolve(request.getCapturingGroups(), defaults.isCapturingGroups())) {
      builder.withCapturingGroups();
    }
    if (resolve(request.getEscapeNonAscii(), defaults.isEscapeNonAscii())) {
      builder.withEscapingOfNonAsciiChars(
          resolve(request.getSurrogatePairs(), defaults.isSurrogatePairs()));
    }
    if (resolve(request.getVerbose(), defaults.isVerbose())) builder.withVerboseMode();
    if (resolve(request.getColorize(), defaults.isColorize())) builder.withSyntaxHighlighting();
    return builder;
  }

  private static boolean resolve(Boolean requested, boolean fallback) {
    return requested != null ? requested : fallback;
  }

  private static int resolve(Integer requested, int fallback) {
    return requested != null ? requested : fallback;
  }
}
