package integration.expr;

import java.util.Objects;
import org.apache.commons.math3.fraction.BigFraction;

/** An expression split into a rational coefficient and the remaining normalized factor. */
public record Scaled(BigFraction coefficient, Expr rest) {
  public Scaled {
    Objects.requireNonNull(coefficient, "coefficient");
    Objects.requireNonNull(rest, "rest");
  }

  public Expr toExpr() {
    return Exprs.multiply(new Num(coefficient), rest);
  }
}
