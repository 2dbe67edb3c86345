package com.exemplar.regex.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.exemplar.regex.synthesis.ast.Literal;

class RegExpTest {

  @Test
  void shouldCanonicalizeExamplesInPlace() {
    List<String> examples = new ArrayList<>(List.of("bb", "A", "a", "bb"));
    RegExpConfig config = RegExpConfig.builder().caseInsensitiveMatching(true).build();

    RegExp.from(examples, config);

    assertThat(examples).containsExactly("a", "bb");
  }

  @Test
  void shouldKeepTreeAndConfig() {
    RegExpConfig config = RegExpConfig.builder().capturingGroupEnabled(true).build();

    RegExp regExp = RegExp.from(new ArrayList<>(List.of("xyz")), config);

    assertThat(regExp.getAst()).isInstanceOf(Literal.class);
    assertThat(regExp.getConfig()).isSameAs(config);
    assertThat(regExp).hasToString("^xyz$");
  }

  @Test
  void shouldReportEnabledFeatures() {
    RegExpConfig config =
        RegExpConfig.builder().digitConverted(true).verboseModeEnabled(true).build();

    assertThat(config.enabledFeatures()).containsExactly(Feature.DIGIT, Feature.VERBOSE_MODE);
    assertThat(config.isCharClassFeatureEnabled()).isTrue();
  }
}
