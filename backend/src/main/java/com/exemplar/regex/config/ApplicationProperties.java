package com.exemplar.regex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "regex")
public class ApplicationProperties {

  private String version;

  private Defaults defaults = new Defaults();
  private Limits limits = new Limits();

  /** Feature switches applied when a request leaves them out. */
  @Data
  public static class Defaults {
    private boolean digits;
    private boolean nonDigits;
    private boolean spaces;
    private boolean nonSpaces;
    private boolean words;
    private boolean nonWords;
    private boolean repetitions;
    private int minRepetitions = 1;
    private int minSubstringLength = 1;
    private boolean caseInsensitive;
    private boolean capturingGroups;
    private boolean escapeNonAscii;
    private boolean surrogatePairs;
    private boolean verbose;
    private boolean colorize;
  }

  @Data
  public static class Limits {
    private int maxExamples = 10000;
    private int maxExampleLength = 1000;
  }
}
