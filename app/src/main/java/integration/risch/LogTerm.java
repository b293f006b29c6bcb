package integration.risch;

import integration.expr.Expr;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.Objects;

/**
 * Logarithmic (or arctangent) contribution to an antiderivative.
 *
 * @param expression the term as it appears in the result
 * @param derivative its derivative in the tower, or {@code null} when the term sums over roots
 *     that are not in the coefficient field
 */
public record LogTerm<C>(Expr expression, TowerElement<C> derivative) {
  public LogTerm {
    Objects.requireNonNull(expression, "expression");
  }

  public boolean hasDerivative() {
    return derivative != null;
  }

  LogTerm<C> lift(TowerLevel<C> level) {
    return new LogTerm<>(expression, derivative == null ? null : level.lift(derivative));
  }
}
