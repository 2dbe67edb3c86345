package com.exemplar.regex.synthesis.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.grapheme.Grapheme;

@DisplayName("Expression")
class ExpressionTest {

  private final RegExpConfig defaults = RegExpConfig.defaults();

  private static Literal literal(String... graphemes) {
    return Expression.literal(
        List.of(graphemes).stream().map(Grapheme::of).collect(Collectors.toList()));
  }

  @Nested
  @DisplayName("Grouping")
  class Grouping {

    @Test
    void shouldWrapMultiGraphemeLiteralUnderQuantifier() {
      Expression star = Expression.repetition(literal("a", "b"), Quantifier.KLEENE_STAR);

      assertThat(star.render(defaults)).isEqualTo("(?:ab)*");
    }

    @Test
    void shouldNotWrapSingleCodePointUnderQuantifier() {
      assertThat(Expression.repetition(literal("a"), Quantifier.QUESTION_MARK).render(defaults))
          .isEqualTo("a?");
    }

    @Test
    void shouldWrapConcatenationUnderQuantifier() {
      Expression optional =
          Expression.repetition(
              Expression.concatenation(
                  Expression.characterClass(List.of(0x61, 0x62)), literal("c")),
              Quantifier.QUESTION_MARK);

      assertThat(optional.render(defaults)).isEqualTo("(?:[ab]c)?");
    }

    @Test
    void shouldWrapAlternationInsideConcatenation() {
      Expression alternation = Expression.alternation(literal("a", "b"), literal("c", "d"));
      Expression expression = Expression.concatenation(alternation, literal("e"));

      assertThat(expression.render(defaults)).isEqualTo("(?:ab|cd)e");
    }

    @Test
    void shouldNotWrapCharacterClass() {
      Expression expression =
          Expression.repetition(
              Expression.characterClass(List.of(0x61, 0x62)), Quantifier.KLEENE_STAR);

      assertThat(expression.render(defaults)).isEqualTo("[ab]*");
    }

    @Test
    void shouldUseCapturingGroupWhenEnabled() {
      RegExpConfig config = RegExpConfig.builder().capturingGroupEnabled(true).build();
      Expression star = Expression.repetition(literal("a", "b"), Quantifier.KLEENE_STAR);

      assertThat(star.render(config)).isEqualTo("(ab)*");
    }
  }

  @Nested
  @DisplayName("Alternation")
  class AlternationOrdering {

    @Test
    void shouldFlattenNestedAlternations() {
      Expression inner = Expression.alternation(literal("a", "b"), literal("c", "d"));
      Alternation outer = Expression.alternation(inner, literal("e", "f"));

      assertThat(outer.getOptions()).hasSize(3);
    }

    @Test
    void shouldSortLongestFirstKeepingOrderOfEqualLengths() {
      Alternation alternation =
          Expression.alternation(
              Expression.alternation(literal("x"), literal("a", "b", "c")), literal("y"));

      assertThat(alternation.render(defaults)).isEqualTo("abc|x|y");
    }
  }

  @Nested
  @DisplayName("Character class")
  class CharacterClassRendering {

    @Test
    void shouldCollapseRunsOfThreeOrMore() {
      assertThat(Expression.characterClass(List.of(0x61, 0x62, 0x63, 0x65)).render(defaults))
          .isEqualTo("[a-ce]");
    }

    @Test
    void shouldKeepRunsOfTwo() {
      assertThat(Expression.characterClass(List.of(0x31, 0x32, 0x78)).render(defaults))
          .isEqualTo("[12x]");
    }

    @Test
    void shouldEscapeClassMetacharacters() {
      assertThat(Expression.characterClass(List.of((int) '-', (int) ']', (int) 'a'))
              .render(defaults))
          .isEqualTo("[\\-\\]a]");
    }

    @Test
    void shouldRejectEmptyClass() {
      assertThatThrownBy(() -> Expression.characterClass(List.of()))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  @DisplayName("Should escape literal metacharacters")
  void shouldEscapeLiteralMetacharacters() {
    assertThat(literal("a", ".", "*", "(", "$").render(defaults)).isEqualTo("a\\.\\*\\(\\$");
  }

  @Test
  void shouldCompareStructurally() {
    assertThat(Expression.concatenation(literal("a"), literal("b")))
        .isEqualTo(Expression.concatenation(literal("a"), literal("b")))
        .hasSameHashCodeAs(Expression.concatenation(literal("a"), literal("b")));
  }
}
