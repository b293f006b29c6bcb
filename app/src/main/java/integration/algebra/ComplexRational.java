package integration.algebra;

import java.util.Objects;
import org.apache.commons.math3.fraction.BigFraction;

/** Gaussian rational {@code real + imaginary * I}. */
public record ComplexRational(BigFraction real, BigFraction imaginary) {
  public static final ComplexRational ZERO =
      new ComplexRational(BigFraction.ZERO, BigFraction.ZERO);
  public static final ComplexRational ONE = new ComplexRational(BigFraction.ONE, BigFraction.ZERO);
  public static final ComplexRational I = new ComplexRational(BigFraction.ZERO, BigFraction.ONE);

  public ComplexRational {
    Objects.requireNonNull(real, "real");
    Objects.requireNonNull(imaginary, "imaginary");
  }

  public static ComplexRational of(BigFraction real) {
    return new ComplexRational(real, BigFraction.ZERO);
  }

  public boolean isReal() {
    return Rationals.isZero(imaginary);
  }

  public boolean isZero() {
    return Rationals.isZero(real) && Rationals.isZero(imaginary);
  }

  public ComplexRational add(ComplexRational other) {
    return new ComplexRational(real.add(other.real), imaginary.add(other.imaginary));
  }

  public ComplexRational negate() {
    return new ComplexRational(real.negate(), imaginary.negate());
  }

  public ComplexRational multiply(ComplexRational other) {
    return new ComplexRational(
        real.multiply(other.real).subtract(imaginary.multiply(other.imaginary)),
        real.multiply(other.imaginary).add(imaginary.multiply(other.real)));
  }

  public ComplexRational conjugate() {
    return new ComplexRational(real, imaginary.negate());
  }

  /** Squared modulus, always rational. */
  public BigFraction norm() {
    return real.multiply(real).add(imaginary.multiply(imaginary));
  }

  public ComplexRational inverse() {
    if (isZero()) {
      throw new ArithmeticException("Inverse of zero");
    }
    BigFraction norm = norm();
    return new ComplexRational(real.divide(norm), imaginary.negate().divide(norm));
  }

  @Override
  public String toString() {
    if (isReal()) {
      return Rationals.format(real);
    }
    return "(" + Rationals.format(real) + " + " + Rationals.format(imaginary) + "*I)";
  }
}
