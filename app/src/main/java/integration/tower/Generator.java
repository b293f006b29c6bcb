package integration.tower;

import integration.expr.Expr;
import java.util.Objects;

/**
 * One monomial of a tower.
 *
 * @param height position in the tower; the integration variable has height 0
 * @param kind monomial kind
 * @param argument {@code u} in {@code log(u)}, {@code exp(u)} or {@code tan(u)}; the variable
 *     itself for the identity generator
 * @param expression symbolic definition used when rebuilding results
 * @param derivative symbolic derivative, written with lower generators and this one
 */
public record Generator(
    int height, GeneratorKind kind, Expr argument, Expr expression, Expr derivative) {

  public Generator {
    if (height < 0) {
      throw new IllegalArgumentException("Negative generator height: " + height);
    }
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(argument, "argument");
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(derivative, "derivative");
  }

  public String describe() {
    return "t" + height + " = " + expression + ", D(t" + height + ") = " + derivative;
  }
}
