package integration.risch;

import integration.algebra.CoefficientFactorization;
import integration.algebra.CoefficientField;
import integration.algebra.Polynomial;
import integration.algebra.Polynomials;
import integration.algebra.RationalFactorizer;
import integration.algebra.Rationals;
import integration.core.AlgorithmFailureException;
import integration.tower.ExtensionLevel;
import integration.tower.GeneratorKind;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Solves the Risch differential equation {@code D(y) + f y = g} for {@code y} in the level that
 * contains {@code f} and {@code g}. An empty result means no solution was found in that level;
 * every solution returned satisfies the equation.
 */
final class RischDifferentialEquation<C> {

  /** Integrates an element of a level; used when {@code f = 0}. */
  @FunctionalInterface
  interface Integrator<C> {
    Antiderivative<C> integrate(TowerLevel<C> level, TowerElement<C> f);
  }

  private final Integrator<C> integrator;
  private final RationalFactorizer factorizer;

  RischDifferentialEquation(Integrator<C> integrator, RationalFactorizer factorizer) {
    this.integrator = integrator;
    this.factorizer = factorizer;
  }

  Optional<TowerElement<C>> solve(TowerLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    Optional<TowerElement<C>> y = solveUnchecked(level, f, g);
    if (y.isPresent()) {
      TowerElement<C> lhs =
          level.add(level.derive(y.get()), level.multiply(f, y.get()));
      if (!level.isZero(level.subtract(lhs, g))) {
        throw new AlgorithmFailureException(
            "Solution " + y.get() + " of D(y) + (" + f + ") y = " + g + " does not check");
      }
    }
    return y;
  }

  private Optional<TowerElement<C>> solveUnchecked(
      TowerLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    if (level.isZero(g)) {
      return Optional.of(level.zero());
    }
    if (!(level instanceof ExtensionLevel<C> extension)) {
      return level.isZero(f) ? Optional.empty() : Optional.of(level.divide(g, f));
    }
    if (level.isZero(f)) {
      return rationalIntegral(level, g);
    }
    if (extension.kind() == GeneratorKind.IDENTITY) {
      return solveRational(extension, f, g);
    }
    if (extension.isPolynomial(f) && extension.numerator(f).degree() <= 0) {
      TowerElement<C> below = extension.numerator(f).constantTerm();
      return switch (extension.kind()) {
        case EXP -> solveExponential(extension, below, g);
        case TAN -> solveTangent(extension, below, g);
        default -> solvePrimitive(extension, below, g);
      };
    }
    return cancelLeadingTerms(extension, f, g);
  }

  private Optional<TowerElement<C>> rationalIntegral(TowerLevel<C> level, TowerElement<C> g) {
    Antiderivative<C> integral = integrator.integrate(level, g);
    if (integral.logs().isEmpty() && integral.isElementary(level)) {
      return Optional.of(integral.rational());
    }
    return Optional.empty();
  }

  /** Power by power: {@code D(y_j) + (f + j D(u)) y_j = g_j}. */
  private Optional<TowerElement<C>> solveExponential(
      ExtensionLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    TowerLevel<C> lower = level.lower();
    Optional<Laurent<C>> laurent = Laurent.of(level, g);
    if (laurent.isEmpty()) {
      return Optional.empty();
    }
    TowerElement<C> y = level.zero();
    List<TowerElement<C>> coefficients = laurent.get().coefficients();
    for (int i = 0; i < coefficients.size(); i++) {
      if (lower.isZero(coefficients.get(i))) {
        continue;
      }
      int power = laurent.get().lowest() + i;
      TowerElement<C> shifted =
          lower.add(f, lower.multiply(lower.fromInteger(power), level.argumentDerivative()));
      Optional<TowerElement<C>> yj = solve(lower, shifted, coefficients.get(i));
      if (yj.isEmpty()) {
        return Optional.empty();
      }
      y = level.add(y, Laurent.monomial(level, yj.get(), power));
    }
    return Optional.of(y);
  }

  /** Top-down on the coefficients: {@code D(y_k) + f y_k = g_k - (k + 1) y_(k+1) D(t)}. */
  private Optional<TowerElement<C>> solvePrimitive(
      ExtensionLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    if (!level.isPolynomial(g)) {
      return Optional.empty();
    }
    TowerLevel<C> lower = level.lower();
    TowerElement<C> dt = level.generatorDerivative().constantTerm();
    Polynomial<TowerElement<C>> gp = level.numerator(g);
    List<TowerElement<C>> y = new ArrayList<>();
    for (int k = 0; k <= gp.degree(); k++) {
      y.add(lower.zero());
    }
    TowerElement<C> previous = lower.zero();
    for (int k = gp.degree(); k >= 0; k--) {
      TowerElement<C> rhs =
          lower.subtract(
              gp.coefficient(k),
              lower.multiply(lower.fromInteger(k + 1L), lower.multiply(previous, dt)));
      Optional<TowerElement<C>> yk = solve(lower, f, rhs);
      if (yk.isEmpty()) {
        return Optional.empty();
      }
      y.set(k, yk.get());
      previous = yk.get();
    }
    return Optional.of(level.polynomial(Polynomial.of(lower, y)));
  }

  /**
   * Polynomial solutions in {@code t = tan(u)}. With {@code D(t) = eta (1 + t^2)} the coefficient of
   * {@code t^j} in {@code D(y) + f y} is {@code D(y_j) + f y_j + eta ((j - 1) y_(j-1) + (j + 1)
   * y_(j+1))}, so the coefficients of {@code g} fix {@code y_(n-1)} down to {@code y_1} without
   * integration and {@code y_0} solves an equation below. Solutions with {@code 1 + t^2} in the
   * denominator are not searched for.
   */
  private Optional<TowerElement<C>> solveTangent(
      ExtensionLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    if (!level.isPolynomial(g)) {
      return Optional.empty();
    }
    TowerLevel<C> lower = level.lower();
    TowerElement<C> eta = level.argumentDerivative();
    Polynomial<TowerElement<C>> gp = level.numerator(g);
    int n = gp.degree();
    if (n == 1) {
      return Optional.empty();
    }
    List<TowerElement<C>> y = new ArrayList<>();
    for (int k = 0; k < Math.max(n, 1); k++) {
      y.add(lower.zero());
    }
    for (int j = n; j >= 2; j--) {
      TowerElement<C> yj = j < n ? y.get(j) : lower.zero();
      TowerElement<C> above = j + 1 < n ? y.get(j + 1) : lower.zero();
      TowerElement<C> known =
          lower.add(
              lower.add(lower.derive(yj), lower.multiply(f, yj)),
              lower.multiply(lower.multiply(lower.fromInteger(j + 1L), eta), above));
      y.set(
          j - 1,
          lower.divide(
              lower.subtract(gp.coefficient(j), known),
              lower.multiply(lower.fromInteger(j - 1L), eta)));
    }
    TowerElement<C> y1 = n >= 2 ? y.get(1) : lower.zero();
    Optional<TowerElement<C>> y0 =
        solve(lower, f, lower.subtract(gp.coefficient(0), lower.multiply(eta, y1)));
    if (y0.isEmpty()) {
      return Optional.empty();
    }
    y.set(0, y0.get());
    TowerElement<C> candidate = level.polynomial(Polynomial.of(lower, y));
    TowerElement<C> lhs = level.add(level.derive(candidate), level.multiply(f, candidate));
    return level.isZero(level.subtract(lhs, g)) ? Optional.of(candidate) : Optional.empty();
  }

  /** {@code f} of positive degree in {@code t}: the leading term of {@code f y} fixes {@code y}. */
  private Optional<TowerElement<C>> cancelLeadingTerms(
      ExtensionLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    if (!level.isPolynomial(f) || !level.isPolynomial(g)) {
      return Optional.empty();
    }
    TowerLevel<C> lower = level.lower();
    Polynomial<TowerElement<C>> fp = level.numerator(f);
    TowerElement<C> y = level.zero();
    TowerElement<C> rest = g;
    int budget = level.numerator(g).degree() + 1;
    while (!level.isZero(rest)) {
      Polynomial<TowerElement<C>> r = level.numerator(rest);
      int m = r.degree() - fp.degree();
      if (m < 0 || budget-- == 0 || !level.isPolynomial(rest)) {
        return Optional.empty();
      }
      TowerElement<C> term =
          level.polynomial(
              Polynomial.monomial(
                  lower, lower.divide(r.leadingCoefficient(), fp.leadingCoefficient()), m));
      y = level.add(y, term);
      rest = level.subtract(rest, level.add(level.derive(term), level.multiply(f, term)));
    }
    return Optional.of(y);
  }

  /**
   * Over {@code C(x)}: bounds the denominator and the degree of {@code y}, then solves for the
   * numerator coefficients.
   */
  private Optional<TowerElement<C>> solveRational(
      ExtensionLevel<C> level, TowerElement<C> f, TowerElement<C> g) {
    Polynomial<TowerElement<C>> a = level.numerator(f);
    Polynomial<TowerElement<C>> d = level.denominator(f);
    Polynomial<TowerElement<C>> b = level.numerator(g);
    Polynomial<TowerElement<C>> e = level.denominator(g);
    Polynomial<TowerElement<C>> h =
        e.gcd(e.derivative()).multiply(integerResiduePoles(level, a, d));
    int degreeF = a.degree() - d.degree();
    int degreeG = b.degree() - e.degree();
    int bound;
    if (degreeF >= 0) {
      bound = degreeG - degreeF;
    } else if (degreeF < -1) {
      bound = degreeG + 1;
    } else {
      bound = degreeG + 1;
      TowerLevel<C> constants = level.lower();
      Optional<BigFraction> c =
          constants.rationalValue(constants.divide(a.leadingCoefficient(), d.leadingCoefficient()));
      if (c.isPresent() && Rationals.isInteger(c.get()) && Rationals.signum(c.get()) < 0) {
        bound = Math.max(bound, -c.get().intValue());
      }
    }
    int n = bound + h.degree();
    if (n < 0) {
      return Optional.empty();
    }
    LinearCombination<C> combination = new LinearCombination<>(level);
    List<TowerElement<C>> basis = new ArrayList<>(n + 1);
    List<List<TowerElement<C>>> columns = new ArrayList<>(n + 1);
    for (int j = 0; j <= n; j++) {
      TowerElement<C> bj =
          level.fraction(Polynomial.monomial(level.lower(), level.lower().one(), j), h);
      basis.add(bj);
      columns.add(List.of(level.add(level.derive(bj), level.multiply(f, bj))));
    }
    return combination.solve(columns, List.of(g)).map(c -> combination.combine(c, basis));
  }

  /**
   * {@code prod gcd(A - n D(d1), d1)^n} over the positive integer residues {@code n} of {@code
   * f = a/d} at its simple poles {@code d1}.
   */
  private Polynomial<TowerElement<C>> integerResiduePoles(
      ExtensionLevel<C> level, Polynomial<TowerElement<C>> a, Polynomial<TowerElement<C>> d) {
    TowerLevel<C> constants = level.lower();
    CoefficientField<C> field = level.coefficients();
    Polynomial<TowerElement<C>> poles = Polynomial.one(constants);
    List<Polynomial<TowerElement<C>>> parts = Polynomials.squareFree(d);
    if (parts.isEmpty() || parts.get(0).degree() < 1) {
      return poles;
    }
    Polynomial<TowerElement<C>> d1 = parts.get(0);
    Polynomial<TowerElement<C>> cofactor = d.exactQuotient(d1);
    Polynomial<TowerElement<C>> residues =
        a.multiply(cofactor.extendedGcd(d1).s()).remainder(d1);
    Polynomial<TowerElement<C>> dd1 = d1.derivative();
    List<C> points = new ArrayList<>();
    List<C> values = new ArrayList<>();
    for (int z = 0; z <= d1.degree(); z++) {
      points.add(field.fromInteger(z));
      TowerElement<C> value =
          Polynomials.resultant(d1, residues.subtract(dd1.scale(constants.fromInteger(z))));
      values.add(constants.toConstant(value));
    }
    Polynomial<C> r = Polynomials.interpolate(field, points, values);
    for (int root : CoefficientFactorization.positiveIntegerRoots(field, r, factorizer)) {
      Polynomial<TowerElement<C>> factor =
          d1.gcd(residues.subtract(dd1.scale(constants.fromInteger(root))));
      poles = poles.multiply(factor.pow(root));
    }
    return poles;
  }

  /** Element whose denominator is a power of {@code t}, as coefficients from {@code t^lowest}. */
  record Laurent<C>(List<TowerElement<C>> coefficients, int lowest) {

    static <C> Optional<Laurent<C>> of(ExtensionLevel<C> level, TowerElement<C> value) {
      Polynomial<TowerElement<C>> denominator = level.denominator(value);
      int k = denominator.degree();
      if (!denominator.equals(level.variable().pow(k))) {
        return Optional.empty();
      }
      return Optional.of(new Laurent<>(level.numerator(value).coefficients(), -k));
    }

    static <C> TowerElement<C> monomial(
        ExtensionLevel<C> level, TowerElement<C> coefficient, int power) {
      TowerLevel<C> lower = level.lower();
      if (power >= 0) {
        return level.polynomial(Polynomial.monomial(lower, coefficient, power));
      }
      return level.fraction(
          Polynomial.constant(lower, coefficient), level.variable().pow(-power));
    }
  }
}
