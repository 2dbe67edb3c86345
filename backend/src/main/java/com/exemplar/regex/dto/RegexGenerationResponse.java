package com.exemplar.regex.dto;

import java.util.List;

import com.exemplar.regex.synthesis.Feature;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Generated regular expression")
public class RegexGenerationResponse {

  @JsonProperty("pattern")
  @Schema(description = "Anchored pattern matching exactly the examples", example = "^a(?:a)?$")
  private String pattern;

  @JsonProperty("canonical_examples")
  @Schema(description = "Examples after lowercasing, deduplication and sorting")
  private List<String> canonicalExamples;

  @JsonProperty("example_count")
  private int exampleCount;

  @JsonProperty("features")
  private List<Feature> features;
}
