package integration.algebra;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Splits square-free polynomials over {@code Q} into linear factors (rational root test) and
 * quadratic factors (Kronecker's interpolation search). Whatever is left is returned as a single
 * factor; it is irreducible whenever its degree is below six.
 */
public final class RationalFactorizer {
  private static final BigInteger TWO = BigInteger.valueOf(2);

  private final long searchBound;

  /**
   * @param searchBound largest integer whose divisors are enumerated; larger values only
   *     contribute the trivial divisors
   */
  public RationalFactorizer(long searchBound) {
    if (searchBound < 1) {
      throw new IllegalArgumentException("searchBound must be positive");
    }
    this.searchBound = searchBound;
  }

  /** Monic factors of the monic square-free {@code p}. */
  public List<Polynomial<BigFraction>> factor(Polynomial<BigFraction> p) {
    List<Polynomial<BigFraction>> factors = new ArrayList<>();
    Polynomial<BigFraction> rest = p.monic();
    while (rest.degree() >= 1) {
      Optional<BigFraction> root = rationalRoot(rest);
      if (root.isEmpty()) {
        break;
      }
      Polynomial<BigFraction> linear =
          Polynomial.of(RationalField.INSTANCE, root.get().negate(), BigFraction.ONE);
      factors.add(linear);
      rest = rest.exactQuotient(linear);
    }
    splitQuadratics(rest, factors);
    return factors;
  }

  /** Rational roots of {@code p}, without multiplicity. */
  public List<BigFraction> rationalRoots(Polynomial<BigFraction> p) {
    List<BigFraction> roots = new ArrayList<>();
    for (Polynomial<BigFraction> factor : factor(p.monic())) {
      if (factor.degree() == 1) {
        roots.add(factor.constantTerm().negate());
      }
    }
    return roots;
  }

  private void splitQuadratics(Polynomial<BigFraction> p, List<Polynomial<BigFraction>> factors) {
    if (p.degree() < 1) {
      return;
    }
    if (p.degree() < 4) {
      factors.add(p);
      return;
    }
    Optional<Polynomial<BigFraction>> quadratic = quadraticFactor(p);
    if (quadratic.isEmpty()) {
      factors.add(p);
      return;
    }
    Polynomial<BigFraction> q = quadratic.get().monic();
    factors.add(q);
    splitQuadratics(p.exactQuotient(q), factors);
  }

  private Optional<BigFraction> rationalRoot(Polynomial<BigFraction> p) {
    List<BigInteger> integral = primitive(p);
    BigInteger constant = integral.get(0);
    if (constant.signum() == 0) {
      return Optional.of(BigFraction.ZERO);
    }
    BigInteger leading = integral.get(integral.size() - 1);
    for (BigInteger numerator : divisors(constant.abs())) {
      for (BigInteger denominator : divisors(leading.abs())) {
        for (BigInteger signed : List.of(numerator, numerator.negate())) {
          BigFraction candidate = new BigFraction(signed, denominator);
          if (Rationals.isZero(p.evaluate(candidate))) {
            return Optional.of(candidate);
          }
        }
      }
    }
    return Optional.empty();
  }

  private Optional<Polynomial<BigFraction>> quadraticFactor(Polynomial<BigFraction> p) {
    List<BigInteger> integral = primitive(p);
    Polynomial<BigFraction> scaled =
        Polynomial.of(RationalField.INSTANCE, integral.stream().map(BigFraction::new).toList());
    BigInteger v0 = scaled.evaluate(BigFraction.ZERO).getNumerator();
    BigInteger v1 = scaled.evaluate(BigFraction.ONE).getNumerator();
    BigInteger v2 = scaled.evaluate(BigFraction.MINUS_ONE).getNumerator();
    for (BigInteger d0 : signedDivisors(v0)) {
      for (BigInteger d1 : signedDivisors(v1)) {
        for (BigInteger d2 : signedDivisors(v2)) {
          BigInteger sum = d1.add(d2);
          BigInteger difference = d1.subtract(d2);
          if (sum.testBit(0)) {
            continue;
          }
          BigInteger a = sum.divide(TWO).subtract(d0);
          BigInteger b = difference.divide(TWO);
          if (a.signum() <= 0) {
            continue;
          }
          Polynomial<BigFraction> candidate =
              Polynomial.of(
                  RationalField.INSTANCE,
                  new BigFraction(d0),
                  new BigFraction(b),
                  new BigFraction(a));
          if (p.isDivisibleBy(candidate)) {
            return Optional.of(candidate);
          }
        }
      }
    }
    return Optional.empty();
  }

  private List<BigInteger> signedDivisors(BigInteger value) {
    List<BigInteger> signed = new ArrayList<>();
    for (BigInteger divisor : divisors(value.abs())) {
      signed.add(divisor);
      signed.add(divisor.negate());
    }
    return signed;
  }

  private List<BigInteger> divisors(BigInteger value) {
    List<BigInteger> divisors = new ArrayList<>();
    if (value.signum() == 0) {
      return divisors;
    }
    if (value.bitLength() >= 63 || value.longValueExact() > searchBound) {
      divisors.add(BigInteger.ONE);
      if (!value.equals(BigInteger.ONE)) {
        divisors.add(value);
      }
      return divisors;
    }
    long n = value.longValueExact();
    List<Long> large = new ArrayList<>();
    for (long i = 1; i * i <= n; i++) {
      if (n % i == 0) {
        divisors.add(BigInteger.valueOf(i));
        if (i != n / i) {
          large.add(0, n / i);
        }
      }
    }
    for (Long divisor : large) {
      divisors.add(BigInteger.valueOf(divisor));
    }
    return divisors;
  }

  /** Clears denominators and content, returning integer coefficients lowest degree first. */
  private static List<BigInteger> primitive(Polynomial<BigFraction> p) {
    BigInteger lcm = BigInteger.ONE;
    for (BigFraction c : p.coefficients()) {
      BigInteger d = c.getDenominator();
      lcm = lcm.divide(lcm.gcd(d)).multiply(d);
    }
    List<BigInteger> integral = new ArrayList<>(p.coefficients().size());
    BigInteger content = BigInteger.ZERO;
    for (BigFraction c : p.coefficients()) {
      BigInteger value = c.multiply(new BigFraction(lcm)).getNumerator();
      integral.add(value);
      content = content.gcd(value);
    }
    if (content.signum() != 0 && !content.equals(BigInteger.ONE)) {
      for (int i = 0; i < integral.size(); i++) {
        integral.set(i, integral.get(i).divide(content));
      }
    }
    return integral;
  }
}
