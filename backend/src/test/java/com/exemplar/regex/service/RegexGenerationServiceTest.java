package com.exemplar.regex.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.exemplar.regex.config.ApplicationProperties;
import com.exemplar.regex.dto.RegexGenerationRequest;
import com.exemplar.regex.dto.RegexGenerationResponse;
import com.exemplar.regex.synthesis.Feature;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RegexGenerationService Tests")
class RegexGenerationServiceTest {

  @Mock private ApplicationProperties applicationProperties;

  @InjectMocks private RegexGenerationService regexGenerationService;

  private ApplicationProperties.Defaults defaults;
  private ApplicationProperties.Limits limits;

  @BeforeEach
  void setUp() {
    defaults = new ApplicationProperties.Defaults();
    limits = new ApplicationProperties.Limits();
    when(applicationProperties.getDefaults()).thenReturn(defaults);
    when(applicationProperties.getLimits()).thenReturn(limits);
  }

  private static RegexGenerationRequest request(String... examples) {
    return RegexGenerationRequest.builder().examples(Arrays.asList(examples)).build();
  }

  @Nested
  @DisplayName("Pattern generation")
  class PatternGeneration {

    @Test
    @DisplayName("Should generate an anchored pattern with canonical examples")
    void shouldGeneratePattern() {
      RegexGenerationResponse response = regexGenerationService.generate(request("b", "a", "b"));

      assertThat(response.getPattern()).isEqualTo("^[ab]$");
      assertThat(response.getCanonicalExamples()).containsExactly("a", "b");
      assertThat(response.getExampleCount()).isEqualTo(2);
      assertThat(response.getFeatures()).isEmpty();
    }

    @Test
    @DisplayName("Should apply request options")
    void shouldApplyRequestOptions() {
      RegexGenerationRequest request = request("AAA", "aaa");
      request.setRepetitions(true);
      request.setCaseInsensitive(true);

      RegexGenerationResponse response = regexGenerationService.generate(request);

      assertThat(response.getPattern()).isEqualTo("(?i)^a{3}$");
      assertThat(response.getCanonicalExamples()).containsExactly("aaa");
      assertThat(response.getFeatures())
          .containsExactly(Feature.REPETITION, Feature.CASE_INSENSITIVITY);
    }

    @Test
    @DisplayName("Should fall back to configured defaults")
    void shouldUseDefaults() {
      defaults.setDigits(true);
      defaults.setCapturingGroups(true);

      RegexGenerationResponse response = regexGenerationService.generate(request("12", "ab"));

      assertThat(response.getPattern()).startsWith("^(").contains("\\d\\d").doesNotContain("(?:");
      assertThat(response.getFeatures()).containsExactly(Feature.DIGIT, Feature.CAPTURING_GROUP);
    }

    @Test
    @DisplayName("Should let the request switch off a default")
    void shouldOverrideDefaults() {
      defaults.setDigits(true);
      RegexGenerationRequest request = request("12");
      request.setDigits(false);

      assertThat(regexGenerationService.generate(request).getPattern()).isEqualTo("^12$");
    }

    @Test
    @DisplayName("Should pass minimum repetition settings through")
    void shouldApplyMinimumRepetitions() {
      RegexGenerationRequest request = request("aab", "aaab");
      request.setRepetitions(true);
      request.setMinRepetitions(2);

      String pattern = regexGenerationService.generate(request).getPattern();

      assertThat(pattern).contains("a{3}").doesNotContain("a{2}");
      assertThat(Pattern.matches(pattern, "aab")).isTrue();
      assertThat(Pattern.matches(pattern, "aaab")).isTrue();
    }

    @Test
    @DisplayName("Should produce an empty match for no examples")
    void shouldHandleEmptyExamples() {
      RegexGenerationResponse response =
          regexGenerationService.generate(
              RegexGenerationRequest.builder().examples(Collections.emptyList()).build());

      assertThat(response.getPattern()).isEqualTo("^$");
      assertThat(response.getExampleCount()).isZero();
    }
  }

  @Nested
  @DisplayName("Validation")
  class Validation {

    @Test
    void shouldRejectMissingExamples() {
      assertThatThrownBy(() -> regexGenerationService.generate(new RegexGenerationRequest()))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNullExample() {
      assertThatThrownBy(() -> regexGenerationService.generate(request("a", null)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("null");
    }

    @Test
    void shouldRejectTooManyExamples() {
      limits.setMaxExamples(2);

      assertThatThrownBy(() -> regexGenerationService.generate(request("a", "b", "c")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("Too many examples");
    }

    @Test
    void shouldRejectOverlongExample() {
      limits.setMaxExampleLength(3);

      assertThatThrownBy(() -> regexGenerationService.generate(request("abc", "abcd")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("index 1");
    }

    @Test
    void shouldRejectNonPositiveMinimum() {
      RegexGenerationRequest request = request("a");
      request.setRepetitions(true);
      request.setMinSubstringLength(0);

      assertThatThrownBy(() -> regexGenerationService.generate(request))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNotModifyRequestExamples() {
      List<String> examples = new ArrayList<>(List.of("b", "a"));

      regexGenerationService.generate(RegexGenerationRequest.builder().examples(examples).build());

      assertThat(examples).containsExactly("b", "a");
    }
  }
}
