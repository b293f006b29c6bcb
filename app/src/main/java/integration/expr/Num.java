package integration.expr;

import integration.algebra.Rationals;
import java.util.Objects;
import org.apache.commons.math3.fraction.BigFraction;

/** Exact rational constant. */
public record Num(BigFraction value) implements Expr {
  public static final Num ZERO = new Num(BigFraction.ZERO);
  public static final Num ONE = new Num(BigFraction.ONE);
  public static final Num MINUS_ONE = new Num(BigFraction.MINUS_ONE);

  public Num {
    Objects.requireNonNull(value, "value");
  }

  public static Num of(long value) {
    return new Num(new BigFraction(value));
  }

  public boolean isZero() {
    return Rationals.isZero(value);
  }

  public boolean isOne() {
    return value.equals(BigFraction.ONE);
  }

  public boolean isInteger() {
    return Rationals.isInteger(value);
  }

  public boolean isNegative() {
    return Rationals.signum(value) < 0;
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
