package integration.expr;

import java.util.Objects;

/** {@code base ^ exponent}. */
public record Power(Expr base, Expr exponent) implements Expr {
  public Power {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(exponent, "exponent");
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
