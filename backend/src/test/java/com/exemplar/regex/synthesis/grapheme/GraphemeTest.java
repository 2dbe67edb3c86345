package com.exemplar.regex.synthesis.grapheme;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.exemplar.regex.synthesis.RegExpConfig;

@DisplayName("Grapheme")
class GraphemeTest {

  private final RegExpConfig defaults = RegExpConfig.defaults();

  @Nested
  @DisplayName("Classification")
  class Classification {

    @Test
    void shouldRecognizeSingleCodePointLiteral() {
      Grapheme grapheme = Grapheme.of("a");

      assertThat(grapheme.isSingleChar()).isTrue();
      assertThat(grapheme.isSingleCodePointLiteral()).isTrue();
      assertThat(grapheme.codePoint()).isEqualTo('a');
    }

    @Test
    void shouldTreatAstralCodePointAsSingleChar() {
      Grapheme grapheme = Grapheme.of("\uD83D\uDE00");

      assertThat(grapheme.isSingleCodePointLiteral()).isTrue();
      assertThat(grapheme.codePoint()).isEqualTo(0x1F600);
    }

    @Test
    void shouldNotTreatShorthandAsCodePointLiteral() {
      Grapheme grapheme = Grapheme.ofPieces(List.of("\\d"));

      assertThat(grapheme.isSingleChar()).isTrue();
      assertThat(grapheme.isSingleCodePointLiteral()).isFalse();
      assertThatThrownBy(grapheme::codePoint).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldNotTreatRepeatedGraphemeAsCodePointLiteral() {
      assertThat(Grapheme.of("a").repeated(3).isSingleCodePointLiteral()).isFalse();
    }

    @Test
    void shouldCompareStructurally() {
      assertThat(Grapheme.of("a")).isEqualTo(Grapheme.of("a"));
      assertThat(Grapheme.of("a")).isNotEqualTo(Grapheme.of("a").repeated(2));
      assertThat(Grapheme.group(List.of(Grapheme.of("a")), 2))
          .isEqualTo(Grapheme.group(List.of(Grapheme.of("a")), 2));
    }
  }

  @Nested
  @DisplayName("Rendering")
  class Rendering {

    @Test
    void shouldEscapeMetacharacters() {
      assertThat(Grapheme.of(".").render(defaults)).isEqualTo("\\.");
      assertThat(Grapheme.of("\t").render(defaults)).isEqualTo("\\t");
    }

    @Test
    void shouldRenderRepeatedSingleCharWithoutGroup() {
      assertThat(Grapheme.of("a").repeated(3).render(defaults)).isEqualTo("a{3}");
    }

    @Test
    void shouldWrapRepeatedClusterInGroup() {
      assertThat(Grapheme.of("e\u0301").repeated(2).render(defaults))
          .isEqualTo("(?:e\u0301){2}");
    }

    @Test
    void shouldUseCapturingGroupWhenEnabled() {
      RegExpConfig config = RegExpConfig.builder().capturingGroupEnabled(true).build();
      Grapheme group = Grapheme.group(List.of(Grapheme.of("a"), Grapheme.of("b")), 2);

      assertThat(group.render(config)).isEqualTo("(ab){2}");
    }

    @Test
    void shouldColorizeBraces() {
      RegExpConfig config = RegExpConfig.builder().outputColorized(true).build();

      assertThat(Grapheme.of("a").repeated(2).render(config))
          .isEqualTo("a\u001B[104;37m{\u001B[0m2\u001B[104;37m}\u001B[0m");
    }

    @Test
    void shouldKeepValueOfGroup() {
      Grapheme group = Grapheme.group(List.of(Grapheme.of("x"), Grapheme.of("y").repeated(2)), 3);

      assertThat(group.value()).isEqualTo("xyy");
      assertThat(group.isGroup()).isTrue();
    }
  }
}
