package integration.risch;

import integration.algebra.Polynomial;
import integration.algebra.Polynomials;
import integration.tower.ExtensionLevel;
import integration.tower.GeneratorKind;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits {@code f} in {@code K(t)} as {@code polynomial + special/S^k + numerator/denominator}
 * where {@code S} is the special polynomial of the monomial ({@code t} for exponentials, {@code
 * 1 + t^2} for tangents, none otherwise), the last fraction is proper and its denominator is
 * coprime to {@code S}.
 *
 * @param polynomial polynomial part in {@code t}
 * @param special the special fraction as an element of the level, zero when absent
 * @param specialExponent {@code k}
 * @param numerator numerator of the normal part
 * @param denominator monic denominator of the normal part
 */
record CanonicalSplit<C>(
    Polynomial<TowerElement<C>> polynomial,
    TowerElement<C> special,
    int specialExponent,
    Polynomial<TowerElement<C>> numerator,
    Polynomial<TowerElement<C>> denominator) {

  static <C> CanonicalSplit<C> of(ExtensionLevel<C> level, TowerElement<C> f) {
    TowerLevel<C> lower = level.lower();
    Polynomial<TowerElement<C>> a = level.numerator(f);
    Polynomial<TowerElement<C>> d = level.denominator(f);
    Polynomial<TowerElement<C>> specialPolynomial = specialPolynomial(level);
    Polynomial<TowerElement<C>> specialPart = Polynomial.one(lower);
    int k = 0;
    if (specialPolynomial != null) {
      while (d.degree() >= 1 && d.isDivisibleBy(specialPolynomial)) {
        d = d.exactQuotient(specialPolynomial);
        specialPart = specialPart.multiply(specialPolynomial);
        k++;
      }
    }
    TowerElement<C> special = level.zero();
    Polynomial<TowerElement<C>> normal = a;
    if (k > 0) {
      Polynomials.Bezout<TowerElement<C>> split = Polynomials.diophantine(d, specialPart, a);
      special = level.fraction(split.s(), specialPart);
      normal = split.t();
    }
    Polynomial.DivisionResult<TowerElement<C>> division = normal.divideAndRemainder(d);
    return new CanonicalSplit<>(division.quotient(), special, k, division.remainder(), d);
  }

  /** {@code t} or {@code 1 + t^2}, or {@code null} for monomials without special polynomials. */
  static <C> Polynomial<TowerElement<C>> specialPolynomial(ExtensionLevel<C> level) {
    TowerLevel<C> lower = level.lower();
    if (level.kind() == GeneratorKind.EXP) {
      return level.variable();
    }
    if (level.kind() == GeneratorKind.TAN) {
      return Polynomial.of(lower, lower.one(), lower.zero(), lower.one());
    }
    return null;
  }

  /**
   * Coefficients of the Laurent polynomial {@code polynomial + special} in an exponential
   * extension, indexed from {@code -specialExponent}.
   */
  List<TowerElement<C>> laurentCoefficients(ExtensionLevel<C> level) {
    TowerLevel<C> lower = level.lower();
    int size = specialExponent + Math.max(polynomial.degree() + 1, 0);
    List<TowerElement<C>> coefficients = new ArrayList<>(Collections.nCopies(size, lower.zero()));
    if (specialExponent > 0) {
      Polynomial<TowerElement<C>> b = level.numerator(special);
      int shift = specialExponent - (level.denominator(special).degree());
      for (int i = 0; i <= b.degree(); i++) {
        coefficients.set(shift + i, b.coefficient(i));
      }
    }
    for (int i = 0; i <= polynomial.degree(); i++) {
      coefficients.set(specialExponent + i, polynomial.coefficient(i));
    }
    return coefficients;
  }
}
