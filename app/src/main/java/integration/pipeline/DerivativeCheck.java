package integration.pipeline;

import integration.algebra.AlgebraicClosureField;
import integration.core.IntegrationException;
import integration.core.IntegrationResult;
import integration.expr.Differentiator;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.Symbol;
import integration.frontend.RewriteResult;
import integration.frontend.TermClassifier;
import integration.frontend.TrigRewriter;
import integration.frontend.TrigStrategy;
import integration.tower.Tower;
import integration.tower.TowerBuilder;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies a result by differentiating it. The difference between the derivative and the
 * integrand is converted into a tower over {@code Q(I)} and tested for zero there.
 */
public final class DerivativeCheck {
  private static final Logger LOG = LoggerFactory.getLogger(DerivativeCheck.class);

  /** Outcome of a derivative check. */
  public enum Verdict {
    VERIFIED,
    MISMATCH,
    UNVERIFIABLE
  }

  private DerivativeCheck() {}

  public static Verdict verify(IntegrationResult result) {
    Optional<Expr> difference = difference(result);
    if (difference.isEmpty()) {
      return Verdict.UNVERIFIABLE;
    }
    try {
      return isZero(difference.get(), result.variable()) ? Verdict.VERIFIED : Verdict.MISMATCH;
    } catch (IntegrationException | ArithmeticException | IllegalArgumentException ex) {
      LOG.debug("Cannot check {}: {}", result.expression(), ex.getMessage());
      return Verdict.UNVERIFIABLE;
    }
  }

  /** {@code D(result) - integrand}, or empty when nothing was integrated. */
  static Optional<Expr> difference(IntegrationResult result) {
    Symbol x = result.variable();
    if (result instanceof IntegrationResult.Closed closed) {
      Expr derivative = Differentiator.differentiate(closed.antiderivative(), x);
      return Optional.of(Exprs.subtract(derivative, closed.integrand()));
    }
    if (result instanceof IntegrationResult.Partial partial) {
      Expr derivative =
          Exprs.add(Differentiator.differentiate(partial.integratedPart(), x), partial.residual());
      return Optional.of(Exprs.subtract(derivative, partial.integrand()));
    }
    return Optional.empty();
  }

  private static boolean isZero(Expr expr, Symbol variable) {
    RewriteResult rewritten = TrigRewriter.rewrite(expr, variable, TrigStrategy.HALF_ANGLE);
    Tower<?> tower =
        TowerBuilder.build(
            TermClassifier.classify(rewritten.expression(), variable),
            AlgebraicClosureField.INSTANCE,
            variable);
    return isZero(tower, rewritten.expression());
  }

  private static <C> boolean isZero(Tower<C> tower, Expr expr) {
    return tower.top().isZero(tower.toElement(expr));
  }
}
