package integration.risch;

import integration.algebra.Polynomial;
import integration.core.AlgorithmFailureException;
import integration.core.FieldExtensionRequiredException;
import integration.tower.ExtensionLevel;
import integration.tower.GeneratorKind;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Solves {@code D(b) - w c = p, D(c) + w b = q} for {@code b, c} in a level of the tower. This is
 * the real form of {@code D(b + ic) + iw (b + ic) = p + iq} and arises when reducing the powers of
 * {@code 1 + t^2} in a tangent extension.
 *
 * <p>Over {@code C(x)} the system is solved directly with a bounded ansatz. Higher levels go
 * through two Risch differential equations, {@code D(y1) + iw y1 = p + iq} and {@code D(y2) - iw
 * y2 = p - iq}, after which {@code b = (y1 + y2)/2} and {@code c = (y1 - y2)/2i}.
 */
final class CoupledSystemSolver<C> {

  private final RischDifferentialEquation<C> rde;

  CoupledSystemSolver(RischDifferentialEquation<C> rde) {
    this.rde = rde;
  }

  record Solution<C>(TowerElement<C> b, TowerElement<C> c) {}

  /**
   * Empty when no solution exists in {@code level} or none was found.
   *
   * @throws FieldExtensionRequiredException when {@code level} is above {@code C(x)} and its
   *     constants lack {@code I}
   */
  Optional<Solution<C>> solve(
      ExtensionLevel<C> level, TowerElement<C> w, TowerElement<C> p, TowerElement<C> q) {
    if (level.isZero(p) && level.isZero(q)) {
      return Optional.of(new Solution<>(level.zero(), level.zero()));
    }
    Optional<Solution<C>> solution =
        level.kind() == GeneratorKind.IDENTITY
            ? solveRational(level, w, p, q)
            : solveComplex(level, w, p, q);
    solution.ifPresent(s -> check(level, w, p, q, s.b(), s.c()));
    return solution;
  }

  private Optional<Solution<C>> solveComplex(
      ExtensionLevel<C> level, TowerElement<C> w, TowerElement<C> p, TowerElement<C> q) {
    TowerElement<C> i =
        level.fromConstant(
            level
                .coefficients()
                .imaginaryUnit()
                .orElseThrow(
                    () ->
                        new FieldExtensionRequiredException(
                            "Coupled system over " + level + " needs I")));
    TowerElement<C> iw = level.multiply(i, w);
    TowerElement<C> iq = level.multiply(i, q);
    Optional<TowerElement<C>> y1 = rde.solve(level, iw, level.add(p, iq));
    if (y1.isEmpty()) {
      return Optional.empty();
    }
    Optional<TowerElement<C>> y2 = rde.solve(level, level.negate(iw), level.subtract(p, iq));
    if (y2.isEmpty()) {
      return Optional.empty();
    }
    TowerElement<C> two = level.fromInteger(2);
    TowerElement<C> b = level.divide(level.add(y1.get(), y2.get()), two);
    TowerElement<C> c =
        level.divide(level.subtract(y1.get(), y2.get()), level.multiply(two, i));
    return Optional.of(new Solution<>(b, c));
  }

  private static <C> Optional<Solution<C>> solveRational(
      ExtensionLevel<C> level, TowerElement<C> w, TowerElement<C> p, TowerElement<C> q) {
    TowerLevel<C> constants = level.lower();
    Polynomial<TowerElement<C>> h = lcm(level.denominator(p), level.denominator(q));
    int degree =
        Math.max(degreeAtInfinity(level, p), degreeAtInfinity(level, q)) + h.degree() + 1;
    if (degree < 0) {
      return Optional.empty();
    }
    List<TowerElement<C>> basis = new ArrayList<>(degree + 1);
    for (int j = 0; j <= degree; j++) {
      basis.add(level.fraction(Polynomial.monomial(constants, constants.one(), j), h));
    }
    List<List<TowerElement<C>>> columns = new ArrayList<>(2 * basis.size());
    for (TowerElement<C> bj : basis) {
      columns.add(List.of(level.derive(bj), level.multiply(w, bj)));
    }
    for (TowerElement<C> cj : basis) {
      columns.add(List.of(level.negate(level.multiply(w, cj)), level.derive(cj)));
    }
    LinearCombination<C> combination = new LinearCombination<>(level);
    return combination
        .solve(columns, List.of(p, q))
        .map(
            coefficients -> {
              int n = basis.size();
              TowerElement<C> b = combination.combine(coefficients.subList(0, n), basis);
              TowerElement<C> c = combination.combine(coefficients.subList(n, 2 * n), basis);
              return new Solution<>(b, c);
            });
  }

  private static <C> void check(
      ExtensionLevel<C> level,
      TowerElement<C> w,
      TowerElement<C> p,
      TowerElement<C> q,
      TowerElement<C> b,
      TowerElement<C> c) {
    TowerElement<C> first = level.subtract(level.derive(b), level.multiply(w, c));
    TowerElement<C> second = level.add(level.derive(c), level.multiply(w, b));
    if (!level.isZero(level.subtract(first, p)) || !level.isZero(level.subtract(second, q))) {
      throw new AlgorithmFailureException("Coupled system solution does not check");
    }
  }

  private static <C> int degreeAtInfinity(ExtensionLevel<C> level, TowerElement<C> value) {
    if (level.isZero(value)) {
      return -1;
    }
    return level.numerator(value).degree() - level.denominator(value).degree();
  }

  private static <E> Polynomial<E> lcm(Polynomial<E> a, Polynomial<E> b) {
    return a.multiply(b).exactQuotient(a.gcd(b)).monic();
  }
}
