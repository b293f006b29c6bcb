package integration.expr;

import java.util.Objects;

/**
 * Sum of {@code body} over the roots of {@code polynomial}, a polynomial in the bound {@code
 * variable} with constant coefficients.
 */
public record RootSum(Expr polynomial, Symbol variable, Expr body) implements Expr {
  public RootSum {
    Objects.requireNonNull(polynomial, "polynomial");
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(body, "body");
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
