package com.exemplar.regex.controller;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.exemplar.regex.dto.RegexGenerationRequest;
import com.exemplar.regex.dto.RegexGenerationResponse;
import com.exemplar.regex.service.RegexGenerationService;
import com.exemplar.regex.service.data_processing.ExampleFileParsingService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "Generate a pattern from an uploaded example file")
public class FileUploadController {

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:txt,csv}")
  private Set<String> allowedExtensions;

  private final RegexGenerationService regexGenerationService;
  private final ExampleFileParsingService exampleFileParsingService;

  @PostMapping(
      value = "/regex/generate/file",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate a regular expression from a file",
      description =
          "Reads examples from a text file (one per line) or from one column of a CSV file")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Pattern generated",
            content = @Content(schema = @Schema(implementation = RegexGenerationResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or request",
            content = @Content)
      })
  public ResponseEntity<RegexGenerationResponse> generateFromFile(
      @Parameter(description = "Examples file (txt or csv)", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "CSV column header, defaults to the first column")
          @RequestParam(value = "column", required = false)
          String column,
      @RequestParam(value = "digits", required = false) Boolean digits,
      @RequestParam(value = "non_digits", required = false) Boolean nonDigits,
      @RequestParam(value = "spaces", required = false) Boolean spaces,
      @RequestParam(value = "non_spaces", required = false) Boolean nonSpaces,
      @RequestParam(value = "words", required = false) Boolean words,
      @RequestParam(value = "non_words", required = false) Boolean nonWords,
      @RequestParam(value = "repetitions", required = false) Boolean repetitions,
      @RequestParam(value = "min_repetitions", required = false) Integer minRepetitions,
      @RequestParam(value = "min_substring_length", required = false) Integer minSubstringLength,
      @RequestParam(value = "case_insensitive", required = false) Boolean caseInsensitive,
      @RequestParam(value = "capturing_groups", required = false) Boolean capturingGroups,
      @RequestParam(value = "escape_non_ascii", required = false) Boolean escapeNonAscii,
      @RequestParam(value = "surrogate_pairs", required = false) Boolean surrogatePairs,
      @RequestParam(value = "verbose", required = false) Boolean verbose,
      @RequestParam(value = "colorize", required = false) Boolean colorize) {
    validateFile(file);
    String fileName = file.getOriginalFilename();
    List<String> examples = readExamples(file, extractFileExtension(fileName), column);
    log.info("Read {} examples from {}", examples.size(), fileName);

    RegexGenerationRequest request =
        RegexGenerationRequest.builder()
            .examples(examples)
            .digits(digits)
            .nonDigits(nonDigits)
            .spaces(spaces)
            .nonSpaces(nonSpaces)
            .words(words)
            .nonWords(nonWords)
            .repetitions(repetitions)
            .minRepetitions(minRepetitions)
            .minSubstringLength(minSubstringLength)
            .caseInsensitive(caseInsensitive)
            .capturingGroups(capturingGroups)
            .escapeNonAscii(escapeNonAscii)
            .surrogatePairs(surrogatePairs)
            .verbose(verbose)
            .colorize(colorize)
            .build();
    return ResponseEntity.ok(regexGenerationService.generate(request));
  }

  private List<String> readExamples(MultipartFile file, String extension, String column) {
    try (InputStream stream = file.getInputStream()) {
      if ("csv".equalsIgnoreCase(extension)) {
        return exampleFileParsingService.parseCsvColumn(stream, column);
      }
      return exampleFileParsingService.parseLines(stream);
    } catch (IOException e) {
      throw new IllegalArgumentException("Could not read uploaded file: " + e.getMessage(), e);
    }
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }
    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }
    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }
    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase())) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
