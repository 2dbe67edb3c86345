package com.exemplar.regex.synthesis;

import com.fasterxml.jackson.annotation.JsonValue;

/** Named switches of {@link RegExpConfig}, as reported to API clients. */
public enum Feature {
  DIGIT("digits"),
  NON_DIGIT("non-digits"),
  SPACE("spaces"),
  NON_SPACE("non-spaces"),
  WORD("words"),
  NON_WORD("non-words"),
  REPETITION("repetitions"),
  CASE_INSENSITIVITY("case-insensitive"),
  CAPTURING_GROUP("capturing-groups"),
  NON_ASCII_ESCAPE("escape-non-ascii"),
  SURROGATE_PAIRS("surrogate-pairs"),
  VERBOSE_MODE("verbose"),
  SYNTAX_HIGHLIGHTING("colorize");

  private final String name;

  Feature(String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }
}
