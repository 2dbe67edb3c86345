package com.exemplar.regex.synthesis;

import java.util.List;

import com.exemplar.regex.synthesis.ast.Expression;
import com.exemplar.regex.synthesis.ast.ExpressionSynthesizer;
import com.exemplar.regex.synthesis.fsm.Dfa;
import com.exemplar.regex.synthesis.grapheme.GraphemeCluster;
import com.exemplar.regex.synthesis.render.RegExpRenderer;

import lombok.extern.slf4j.Slf4j;

/**
 * A regular expression synthesized from a finite set of examples. It matches exactly the
 * (canonicalized) examples. The expression tree and configuration are fixed at construction;
 * {@link #toString()} renders the pattern afresh on every call.
 *
 * <p>Instances are usually obtained through {@link RegExpBuilder}.
 */
@Slf4j
public final class RegExp {

  private final Expression ast;
  private final RegExpConfig config;

  private RegExp(Expression ast, RegExpConfig config) {
    this.ast = ast;
    this.config = config;
  }

  /**
   * Synthesize a pattern from examples.
   *
   * @param examples the examples; canonicalized in place
   * @param config the pipeline switches
   * @return the synthesized pattern
   */
  public static RegExp from(List<String> examples, RegExpConfig config) {
    ExampleCanonicalizer.canonicalize(examples, config);
    log.debug("Canonicalized to {} distinct examples", examples.size());

    List<GraphemeCluster> clusters = FeaturePassOrchestrator.apply(examples, config);
    Dfa dfa = Dfa.from(clusters);
    Expression ast = ExpressionSynthesizer.synthesize(dfa);
    return new RegExp(ast, config);
  }

  public Expression getAst() {
    return ast;
  }

  public RegExpConfig getConfig() {
    return config;
  }

  @Override
  public String toString() {
    return RegExpRenderer.render(ast, config);
  }
}
