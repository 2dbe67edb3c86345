package com.exemplar.regex.controller;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.exemplar.regex.dto.RegexGenerationRequest;
import com.exemplar.regex.dto.RegexGenerationResponse;
import com.exemplar.regex.service.RegexGenerationService;
import com.exemplar.regex.synthesis.Feature;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Regex Generation", description = "Regular expression synthesis from examples")
public class RegexGenerationController {

  private final RegexGenerationService regexGenerationService;

  @PostMapping(
      value = "/regex/generate",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate a regular expression",
      description = "Synthesizes an anchored pattern that matches exactly the given examples")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Pattern generated",
            content = @Content(schema = @Schema(implementation = RegexGenerationResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<RegexGenerationResponse> generate(
      @Valid @RequestBody RegexGenerationRequest request) {
    log.info(
        "Received generation request with {} examples",
        request.getExamples() != null ? request.getExamples().size() : 0);
    return ResponseEntity.ok(regexGenerationService.generate(request));
  }

  @GetMapping(value = "/regex/features", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List features", description = "Names of all supported feature switches")
  public ResponseEntity<List<String>> features() {
    return ResponseEntity.ok(
        Arrays.stream(Feature.values()).map(Feature::getName).collect(Collectors.toList()));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }
}
