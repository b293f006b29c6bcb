package integration.algebra;

import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.Num;
import integration.expr.Symbol;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Constants used once algebraic numbers are enabled. Arithmetic is exact in {@code Q(I)}; roots of
 * residue polynomials that fall outside of it are carried symbolically by the log-part builder
 * (radicals for quadratics, root sums otherwise).
 */
public final class AlgebraicClosureField implements CoefficientField<ComplexRational> {
  public static final AlgebraicClosureField INSTANCE = new AlgebraicClosureField();

  private AlgebraicClosureField() {}

  @Override
  public CoefficientFieldKind kind() {
    return CoefficientFieldKind.ALGEBRAIC_CLOSURE;
  }

  @Override
  public ComplexRational zero() {
    return ComplexRational.ZERO;
  }

  @Override
  public ComplexRational one() {
    return ComplexRational.ONE;
  }

  @Override
  public ComplexRational add(ComplexRational a, ComplexRational b) {
    return a.add(b);
  }

  @Override
  public ComplexRational negate(ComplexRational a) {
    return a.negate();
  }

  @Override
  public ComplexRational multiply(ComplexRational a, ComplexRational b) {
    return a.multiply(b);
  }

  @Override
  public ComplexRational inverse(ComplexRational a) {
    return a.inverse();
  }

  @Override
  public ComplexRational fromRational(BigFraction value) {
    return ComplexRational.of(value);
  }

  @Override
  public boolean isZero(ComplexRational a) {
    return a.isZero();
  }

  @Override
  public Optional<BigFraction> toRational(ComplexRational value) {
    return value.isReal() ? Optional.of(value.real()) : Optional.empty();
  }

  @Override
  public ComplexRational conjugate(ComplexRational value) {
    return value.conjugate();
  }

  @Override
  public Optional<ComplexRational> imaginaryUnit() {
    return Optional.of(ComplexRational.I);
  }

  @Override
  public Expr toExpression(ComplexRational value) {
    return Exprs.add(
        new Num(value.real()), Exprs.multiply(new Num(value.imaginary()), Symbol.IMAGINARY_UNIT));
  }

  @Override
  public String toString() {
    return "Q(I)";
  }
}
