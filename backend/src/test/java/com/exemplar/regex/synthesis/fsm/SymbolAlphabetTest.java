package com.exemplar.regex.synthesis.fsm;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.exemplar.regex.synthesis.RegExpConfig;
import com.exemplar.regex.synthesis.grapheme.Grapheme;
import com.exemplar.regex.synthesis.grapheme.GraphemeCluster;

class SymbolAlphabetTest {

  @Test
  void shouldInternGraphemesInFirstSeenOrder() {
    SymbolAlphabet alphabet = new SymbolAlphabet();

    String encoded = alphabet.encode(GraphemeCluster.from("abca", RegExpConfig.defaults()));

    assertThat(encoded).isEqualTo("\u0000\u0001\u0002\u0000");
    assertThat(alphabet.size()).isEqualTo(3);
    assertThat(alphabet.grapheme('\u0001')).isEqualTo(Grapheme.of("b"));
  }

  @Test
  void shouldReuseSymbolForEqualGraphemes() {
    SymbolAlphabet alphabet = new SymbolAlphabet();

    char first = alphabet.intern(Grapheme.of("x"));
    char second = alphabet.intern(Grapheme.of("x"));

    assertThat(first).isEqualTo(second);
  }
}
