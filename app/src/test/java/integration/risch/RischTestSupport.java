package integration.risch;

import integration.algebra.RationalFactorizer;
import integration.algebra.RationalField;
import integration.core.diagnostics.IntegrationObserver;
import integration.expr.ExprParser;
import integration.expr.Symbol;
import integration.frontend.TermClassifier;
import integration.frontend.TrigRewriter;
import integration.frontend.TrigStrategy;
import integration.tower.Tower;
import integration.tower.TowerBuilder;
import integration.tower.TowerElement;
import org.apache.commons.math3.fraction.BigFraction;

/** Builds rational towers and integrators for the tests of this package. */
final class RischTestSupport {
  static final Symbol X = new Symbol("x");
  static final RationalFactorizer FACTORIZER = new RationalFactorizer(1_000_000L);

  private RischTestSupport() {}

  static Tower<BigFraction> tower(String source) {
    var rewritten = TrigRewriter.rewrite(ExprParser.parse(source), X, TrigStrategy.HALF_ANGLE);
    return TowerBuilder.build(
        TermClassifier.classify(rewritten.expression(), X), RationalField.INSTANCE, X);
  }

  static TowerElement<BigFraction> element(Tower<BigFraction> tower, String source) {
    var rewritten = TrigRewriter.rewrite(ExprParser.parse(source), X, TrigStrategy.HALF_ANGLE);
    return tower.toElement(rewritten.expression());
  }

  static RischIntegrator<BigFraction> integrator(Tower<BigFraction> tower) {
    return new RischIntegrator<>(tower, FACTORIZER, IntegrationObserver.none());
  }
}
