package integration.frontend;

import integration.expr.Expr;
import java.util.Objects;

/**
 * Integrand after the trigonometric and hyperbolic rewrite.
 *
 * @param expression rewritten integrand, free of {@code sin}, {@code cos} and hyperbolic functions
 * @param requiresAlgebraicNumbers whether the rewrite introduced the imaginary unit
 */
public record RewriteResult(Expr expression, boolean requiresAlgebraicNumbers) {
  public RewriteResult {
    Objects.requireNonNull(expression, "expression");
  }
}
