package com.exemplar.regex.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Examples to synthesize a pattern from. Options left out fall back to {@code regex.defaults}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Regular expression generation request")
public class RegexGenerationRequest {

  @NotNull
  @JsonProperty("examples")
  @Schema(description = "Strings the generated pattern must match", example = "[\"a\", \"aa\"]")
  private List<String> examples;

  @JsonProperty("digits")
  private Boolean digits;

  @JsonProperty("non_digits")
  private Boolean nonDigits;

  @JsonProperty("spaces")
  private Boolean spaces;

  @JsonProperty("non_spaces")
  private Boolean nonSpaces;

  @JsonProperty("words")
  private Boolean words;

  @JsonProperty("non_words")
  private Boolean nonWords;

  @JsonProperty("repetitions")
  private Boolean repetitions;

  @Positive
  @JsonProperty("min_repetitions")
  private Integer minRepetitions;

  @Positive
  @JsonProperty("min_substring_length")
  private Integer minSubstringLength;

  @JsonProperty("case_insensitive")
  private Boolean caseInsensitive;

  @JsonProperty("capturing_groups")
  private Boolean capturingGroups;

  @JsonProperty("escape_non_ascii")
  private Boolean escapeNonAscii;

  @JsonProperty("surrogate_pairs")
  private Boolean surrogatePairs;

  @JsonProperty("verbose")
  private Boolean verbose;

  @JsonProperty("colorize")
  private Boolean colorize;
}
