package integration.risch;

import integration.algebra.Polynomial;
import integration.algebra.Polynomials;
import integration.core.AlgorithmFailureException;
import integration.tower.ExtensionLevel;
import integration.tower.TowerElement;
import java.util.List;

/**
 * Hermite reduction of a proper fraction {@code a/d} with normal denominator in a monomial
 * extension: finds {@code g} and a square-free {@code d*} with {@code a/d = D(g) + polynomial +
 * r/d*}. Each step removes one power of one repeated square-free factor.
 */
final class HermiteReduction {

  private HermiteReduction() {}

  /**
   * @param g the rational part
   * @param numerator {@code r}, with {@code deg r < deg d*}
   * @param denominator {@code d*}, monic and square-free
   * @param polynomial polynomial part produced by the reduction
   * @param steps number of reduction steps performed
   */
  record Result<C>(
      TowerElement<C> g,
      Polynomial<TowerElement<C>> numerator,
      Polynomial<TowerElement<C>> denominator,
      Polynomial<TowerElement<C>> polynomial,
      int steps) {}

  static <C> Result<C> reduce(
      ExtensionLevel<C> level, Polynomial<TowerElement<C>> a, Polynomial<TowerElement<C>> d) {
    TowerElement<C> g = level.zero();
    Polynomial<TowerElement<C>> numerator = a;
    Polynomial<TowerElement<C>> denominator = d.monic();
    int steps = 0;
    List<Polynomial<TowerElement<C>>> factors = Polynomials.squareFree(denominator);
    for (int i = 2; i <= factors.size(); i++) {
      Polynomial<TowerElement<C>> v = factors.get(i - 1);
      if (v.degree() < 1) {
        continue;
      }
      Polynomial<TowerElement<C>> u = denominator.exactQuotient(v.pow(i));
      Polynomial<TowerElement<C>> dv = level.derive(v);
      for (int j = i - 1; j >= 1; j--) {
        Polynomial<TowerElement<C>> rhs =
            numerator.scale(level.lower().inverse(level.lower().fromInteger(-j)));
        Polynomials.Bezout<TowerElement<C>> bc;
        try {
          bc = Polynomials.diophantine(u.multiply(dv), v, rhs);
        } catch (ArithmeticException e) {
          throw new AlgorithmFailureException("Hermite reduction met a special factor " + v, e);
        }
        g = level.add(g, level.fraction(bc.s(), v.pow(j)));
        numerator =
            bc.t()
                .scale(level.lower().fromInteger(-j))
                .subtract(u.multiply(level.derive(bc.s())));
        steps++;
      }
      denominator = u.multiply(v);
    }
    Polynomial.DivisionResult<TowerElement<C>> division = numerator.divideAndRemainder(denominator);
    return new Result<>(g, division.remainder(), denominator, division.quotient(), steps);
  }
}
