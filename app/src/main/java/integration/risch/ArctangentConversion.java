package integration.risch;

import integration.algebra.Polynomial;
import integration.core.AlgorithmFailureException;
import integration.tower.ExtensionLevel;
import integration.tower.TowerElement;
import java.util.ArrayList;
import java.util.List;

/**
 * Rioboo's conversion of {@code i log((A + iB)/(A - iB))} into a sum of arctangents of
 * polynomials, which avoids the spurious discontinuities of {@code atan(A/B)}.
 */
final class ArctangentConversion {

  private ArctangentConversion() {}

  /**
   * Returns arguments {@code h_k} such that {@code sum 2 atan(h_k)} has the same derivative as
   * {@code i log((A + iB)/(A - iB))}.
   */
  static <C> List<TowerElement<C>> logToAtan(
      ExtensionLevel<C> level, Polynomial<TowerElement<C>> a, Polynomial<TowerElement<C>> b) {
    List<TowerElement<C>> arguments = new ArrayList<>();
    Polynomial<TowerElement<C>> p = a;
    Polynomial<TowerElement<C>> q = b;
    while (true) {
      if (q.isZero()) {
        throw new AlgorithmFailureException("Arctangent conversion of " + p + " over zero");
      }
      if (p.isDivisibleBy(q)) {
        arguments.add(level.fraction(p, q));
        return arguments;
      }
      if (p.degree() < q.degree()) {
        Polynomial<TowerElement<C>> swapped = p;
        p = q.negate();
        q = swapped;
        continue;
      }
      // s*q - t*p = g
      Polynomial.ExtendedGcd<TowerElement<C>> xgcd = q.extendedGcd(p.negate());
      Polynomial<TowerElement<C>> s = xgcd.s();
      Polynomial<TowerElement<C>> t = xgcd.t();
      arguments.add(level.fraction(p.multiply(s).add(q.multiply(t)), xgcd.gcd()));
      p = s;
      q = t;
    }
  }
}
