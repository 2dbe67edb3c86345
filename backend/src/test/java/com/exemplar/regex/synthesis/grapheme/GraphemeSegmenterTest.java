package com.exemplar.regex.synthesis.grapheme;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GraphemeSegmenter")
class GraphemeSegmenterTest {

  @Test
  void shouldSplitAsciiIntoSingleCharacters() {
    assertThat(GraphemeSegmenter.segment("abc")).containsExactly("a", "b", "c");
  }

  @Test
  void shouldReturnNothingForEmptyText() {
    assertThat(GraphemeSegmenter.segment("")).isEmpty();
  }

  @Test
  @DisplayName("Should keep a combining mark with its base character")
  void shouldKeepCombiningSequencesTogether() {
    assertThat(GraphemeSegmenter.segment("e\u0301x")).containsExactly("e\u0301", "x");
  }

  @Test
  @DisplayName("Should keep surrogate pairs and flag sequences together")
  void shouldKeepAstralClustersTogether() {
    String grinning = "\uD83D\uDE00";
    String flag = "\uD83C\uDDE9\uD83C\uDDEA";

    List<String> clusters = GraphemeSegmenter.segment(grinning + flag);

    assertThat(clusters).containsExactly(grinning, flag);
  }

  @Test
  @DisplayName("Should treat CRLF as one cluster")
  void shouldKeepCrLfTogether() {
    assertThat(GraphemeSegmenter.segment("a\r\nb")).containsExactly("a", "\r\n", "b");
  }

  @Test
  void shouldReassembleInput() {
    String text = "n\u00e4ive \uD83D\uDC4D\uD83C\uDFFD caf\u00e9";

    assertThat(String.join("", GraphemeSegmenter.segment(text))).isEqualTo(text);
  }
}
