package integration.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Factorization of square-free polynomials over a {@link CoefficientField}. Rational polynomials
 * are factored directly; polynomials with non-real coefficients through the rational norm {@code
 * p * conj(p)}, whose rational factors are intersected with {@code p}.
 */
public final class CoefficientFactorization {

  private CoefficientFactorization() {}

  /** Monic factors of the square-free {@code p}. */
  public static <C> List<Polynomial<C>> factor(
      CoefficientField<C> field, Polynomial<C> p, RationalFactorizer factorizer) {
    List<Polynomial<C>> factors = new ArrayList<>();
    if (p.degree() < 1) {
      return factors;
    }
    Optional<Polynomial<BigFraction>> rational = toRational(field, p);
    if (rational.isPresent()) {
      for (Polynomial<BigFraction> factor : factorizer.factor(rational.get())) {
        factors.add(factor.map(field, field::fromRational));
      }
      return factors;
    }
    Polynomial<C> norm = p.multiply(p.map(field, field::conjugate));
    Polynomial<BigFraction> rationalNorm =
        toRational(field, norm)
            .orElseThrow(() -> new ArithmeticException("Norm of " + p + " is not rational"));
    Polynomial<C> rest = p.monic();
    for (Polynomial<BigFraction> part : Polynomials.squareFree(rationalNorm)) {
      for (Polynomial<BigFraction> factor : factorizer.factor(part)) {
        Polynomial<C> common = factor.map(field, field::fromRational).gcd(rest);
        if (common.degree() >= 1) {
          factors.add(common);
          rest = rest.exactQuotient(common);
        }
      }
    }
    if (rest.degree() >= 1) {
      factors.add(rest);
    }
    return factors;
  }

  /** Rational roots of {@code p} that are positive integers. */
  public static <C> List<Integer> positiveIntegerRoots(
      CoefficientField<C> field, Polynomial<C> p, RationalFactorizer factorizer) {
    List<Integer> roots = new ArrayList<>();
    for (Polynomial<C> part : Polynomials.squareFree(p)) {
      for (Polynomial<C> factor : factor(field, part, factorizer)) {
        if (factor.degree() != 1) {
          continue;
        }
        Optional<BigFraction> root = field.toRational(field.negate(factor.constantTerm()));
        if (root.isPresent()
            && Rationals.isInteger(root.get())
            && Rationals.signum(root.get()) > 0
            && root.get().getNumerator().bitLength() < 31) {
          int n = root.get().getNumerator().intValueExact();
          if (!roots.contains(n)) {
            roots.add(n);
          }
        }
      }
    }
    return roots;
  }

  public static <C> Optional<Polynomial<BigFraction>> toRational(
      CoefficientField<C> field, Polynomial<C> p) {
    List<BigFraction> coefficients = new ArrayList<>(p.coefficients().size());
    for (C c : p.coefficients()) {
      Optional<BigFraction> value = field.toRational(c);
      if (value.isEmpty()) {
        return Optional.empty();
      }
      coefficients.add(value.get());
    }
    return Optional.of(Polynomial.of(RationalField.INSTANCE, coefficients));
  }
}
