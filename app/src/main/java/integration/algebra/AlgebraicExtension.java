package integration.algebra;

import java.util.Objects;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Simple algebraic extension {@code F[z]/(m)} of a field {@code F}. Elements are polynomials in
 * {@code z} reduced modulo the monic {@code m}; the structure is a field exactly when {@code m}
 * is irreducible, and {@link #inverse} reports a zero divisor otherwise.
 *
 * @param <E> coefficient type of the base field
 */
public final class AlgebraicExtension<E> implements Field<Polynomial<E>> {
  private final Field<E> base;
  private final Polynomial<E> modulus;

  public AlgebraicExtension(Polynomial<E> modulus) {
    Objects.requireNonNull(modulus, "modulus");
    if (modulus.degree() < 1) {
      throw new IllegalArgumentException("Modulus must have positive degree");
    }
    this.base = modulus.field();
    this.modulus = modulus.monic();
  }

  public Field<E> base() {
    return base;
  }

  public Polynomial<E> modulus() {
    return modulus;
  }

  /** The class of {@code z}. */
  public Polynomial<E> generator() {
    return Polynomial.variable(base).remainder(modulus);
  }

  public Polynomial<E> embed(E value) {
    return Polynomial.constant(base, value);
  }

  @Override
  public Polynomial<E> zero() {
    return Polynomial.zero(base);
  }

  @Override
  public Polynomial<E> one() {
    return Polynomial.one(base);
  }

  @Override
  public Polynomial<E> add(Polynomial<E> a, Polynomial<E> b) {
    return a.add(b);
  }

  @Override
  public Polynomial<E> negate(Polynomial<E> a) {
    return a.negate();
  }

  @Override
  public Polynomial<E> multiply(Polynomial<E> a, Polynomial<E> b) {
    return a.multiply(b).remainder(modulus);
  }

  @Override
  public Polynomial<E> inverse(Polynomial<E> a) {
    if (a.isZero()) {
      throw new ArithmeticException("Inverse of zero");
    }
    Polynomial.ExtendedGcd<E> xgcd = a.extendedGcd(modulus);
    if (xgcd.gcd().degree() > 0) {
      throw new ZeroDivisorException(xgcd.gcd().toString());
    }
    return xgcd.s().remainder(modulus);
  }

  @Override
  public Polynomial<E> fromRational(BigFraction value) {
    return Polynomial.constant(base, base.fromRational(value));
  }

  @Override
  public boolean isZero(Polynomial<E> a) {
    return a.isZero();
  }

  /** Signals that the modulus was reducible; carries the factor that was found. */
  public static final class ZeroDivisorException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    ZeroDivisorException(String factor) {
      super("Modulus has a non-trivial factor " + factor);
    }
  }
}
