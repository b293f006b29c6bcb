package integration.expr;

import java.util.Objects;

/** Unevaluated integral of {@code integrand} with respect to {@code variable}. */
public record Integral(Expr integrand, Symbol variable) implements Expr {
  public Integral {
    Objects.requireNonNull(integrand, "integrand");
    Objects.requireNonNull(variable, "variable");
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
