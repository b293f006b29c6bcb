package integration.algebra;

import integration.expr.Expr;
import integration.expr.Num;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/** The field of rational numbers. */
public final class RationalField implements CoefficientField<BigFraction> {
  public static final RationalField INSTANCE = new RationalField();

  private RationalField() {}

  @Override
  public CoefficientFieldKind kind() {
    return CoefficientFieldKind.RATIONAL;
  }

  @Override
  public BigFraction zero() {
    return BigFraction.ZERO;
  }

  @Override
  public BigFraction one() {
    return BigFraction.ONE;
  }

  @Override
  public BigFraction add(BigFraction a, BigFraction b) {
    return a.add(b);
  }

  @Override
  public BigFraction subtract(BigFraction a, BigFraction b) {
    return a.subtract(b);
  }

  @Override
  public BigFraction negate(BigFraction a) {
    return a.negate();
  }

  @Override
  public BigFraction multiply(BigFraction a, BigFraction b) {
    return a.multiply(b);
  }

  @Override
  public BigFraction inverse(BigFraction a) {
    if (isZero(a)) {
      throw new ArithmeticException("Inverse of zero");
    }
    return a.reciprocal();
  }

  @Override
  public BigFraction fromRational(BigFraction value) {
    return value;
  }

  @Override
  public boolean isZero(BigFraction a) {
    return Rationals.isZero(a);
  }

  @Override
  public Optional<BigFraction> toRational(BigFraction value) {
    return Optional.of(value);
  }

  @Override
  public BigFraction conjugate(BigFraction value) {
    return value;
  }

  @Override
  public Optional<BigFraction> imaginaryUnit() {
    return Optional.empty();
  }

  @Override
  public Expr toExpression(BigFraction value) {
    return new Num(value);
  }

  @Override
  public String toString() {
    return "Q";
  }
}
