package integration.tower;

import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.Num;
import java.util.Objects;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Function applied to {@code coefficient * argument}, where {@code argument} carries no rational
 * content of its own.
 */
public record FunctionTerm(TermKind kind, BigFraction coefficient, Expr argument) implements Term {
  public FunctionTerm {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(coefficient, "coefficient");
    Objects.requireNonNull(argument, "argument");
  }

  public static FunctionTerm of(TermKind kind, Expr fullArgument) {
    var split = Exprs.split(fullArgument);
    return new FunctionTerm(kind, split.coefficient(), split.rest());
  }

  public Expr fullArgument() {
    return Exprs.multiply(new Num(coefficient), argument);
  }
}
