package integration.risch;

import integration.algebra.Polynomial;
import integration.algebra.RationalFactorizer;
import integration.core.AlgorithmFailureException;
import integration.core.MalformedTowerException;
import integration.core.diagnostics.IntegrationDiagnostic;
import integration.core.diagnostics.IntegrationObserver;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.reconstruct.ResultReconstructor;
import integration.tower.ExtensionLevel;
import integration.tower.GeneratorKind;
import integration.tower.Tower;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Risch integration of elements of a tower. Each level splits its integrand into a polynomial
 * part, a special part and a normal part; the normal part goes through Hermite and residue
 * reduction, the others through the integrator or Risch differential equations of the level
 * below.
 *
 * @param <C> constant type
 */
public final class RischIntegrator<C> {
  private static final Logger LOG = LoggerFactory.getLogger(RischIntegrator.class);

  private final Tower<C> tower;
  private final ResultReconstructor<C> reconstructor;
  private final RationalFactorizer factorizer;
  private final IntegrationObserver observer;
  private final RischDifferentialEquation<C> rde;
  private final CoupledSystemSolver<C> coupled;

  public RischIntegrator(
      Tower<C> tower, RationalFactorizer factorizer, IntegrationObserver observer) {
    this.tower = Objects.requireNonNull(tower, "tower");
    this.reconstructor = new ResultReconstructor<>(tower);
    this.factorizer = Objects.requireNonNull(factorizer, "factorizer");
    this.observer = observer == null ? IntegrationObserver.none() : observer;
    this.rde = new RischDifferentialEquation<>(this::integrate, factorizer);
    this.coupled = new CoupledSystemSolver<>(rde);
  }

  public ResultReconstructor<C> reconstructor() {
    return reconstructor;
  }

  /**
   * Integrates {@code f} over the top of the tower. When every log term has a derivative in the
   * tower, the result is differentiated back and compared with {@code f}.
   *
   * @throws AlgorithmFailureException when the result does not differentiate back to {@code f}
   */
  public Antiderivative<C> integrate(TowerElement<C> f) {
    ExtensionLevel<C> top = tower.top();
    TowerElement<C> integrand = top.lift(f);
    Antiderivative<C> result = integrate(top, integrand);
    Optional<TowerElement<C>> derivative = result.derivative(top);
    if (derivative.isPresent() && !top.isZero(top.subtract(derivative.get(), integrand))) {
      throw new AlgorithmFailureException(
          "Antiderivative differentiates to " + derivative.get() + " instead of " + integrand);
    }
    return result;
  }

  Antiderivative<C> integrate(TowerLevel<C> level, TowerElement<C> f) {
    if (!(level instanceof ExtensionLevel<C> extension)) {
      throw new MalformedTowerException("Nothing to integrate over the constants");
    }
    if (level.isZero(f)) {
      return Antiderivative.zero(level);
    }
    if (extension.kind() != GeneratorKind.IDENTITY && isFromBelow(extension, f)) {
      TowerElement<C> below = extension.numerator(f).constantTerm();
      return integrate(extension.lower(), below).lift(extension);
    }
    LOG.debug("Integrating {} at {}", f, level);
    observer.onDiagnostic(
        IntegrationDiagnostic.levelDispatched(level.height(), extension.kind().name()));
    Antiderivative<C> result =
        switch (extension.kind()) {
          case IDENTITY -> integrateRational(extension, f);
          case LOG -> integratePrimitive(extension, f);
          case EXP -> integrateExponential(extension, f);
          case TAN -> integrateTangent(extension, f);
        };
    if (!result.isElementary(level)) {
      observer.onDiagnostic(
          IntegrationDiagnostic.nonElementary(
              level.height(), reconstructor.expression(result.residual()).toString()));
    }
    return result;
  }

  private static <C> boolean isFromBelow(ExtensionLevel<C> level, TowerElement<C> f) {
    return level.isPolynomial(f) && level.numerator(f).degree() <= 0;
  }

  private Antiderivative<C> integrateRational(ExtensionLevel<C> level, TowerElement<C> f) {
    CanonicalSplit<C> split = CanonicalSplit.of(level, f);
    NormalReduction<C> normal = reduceNormal(level, split.numerator(), split.denominator());
    Polynomial<TowerElement<C>> p = split.polynomial().add(normal.polynomial());
    TowerLevel<C> constants = level.lower();
    Polynomial<TowerElement<C>> integral = Polynomial.zero(constants);
    for (int i = 0; i <= p.degree(); i++) {
      TowerElement<C> c = constants.divide(p.coefficient(i), constants.fromInteger(i + 1L));
      integral = integral.add(Polynomial.monomial(constants, c, i + 1));
    }
    return normal.part().plusRational(level, level.polynomial(integral));
  }

  private Antiderivative<C> integratePrimitive(ExtensionLevel<C> level, TowerElement<C> f) {
    CanonicalSplit<C> split = CanonicalSplit.of(level, f);
    NormalReduction<C> normal = reduceNormal(level, split.numerator(), split.denominator());
    Polynomial<TowerElement<C>> p = split.polynomial().add(normal.polynomial());
    return normal.part().plus(level, integratePrimitivePolynomial(level, p));
  }

  /**
   * Integrates the polynomial {@code p} in {@code t = log(u)} from the leading coefficient down.
   * The leading coefficient must integrate to an element of the level below plus a constant
   * multiple of {@code t}.
   */
  private Antiderivative<C> integratePrimitivePolynomial(
      ExtensionLevel<C> level, Polynomial<TowerElement<C>> p) {
    TowerLevel<C> lower = level.lower();
    TowerElement<C> dt = level.generatorDerivative().constantTerm();
    Antiderivative<C> result = Antiderivative.zero(level);
    TowerElement<C> rest = level.polynomial(p);
    while (level.numerator(rest).degree() >= 1) {
      Polynomial<TowerElement<C>> current = level.numerator(rest);
      int m = current.degree();
      Antiderivative<C> leading = integrate(lower, current.leadingCoefficient());
      Optional<TowerElement<C>> logPart = leading.logDerivative(lower);
      if (!leading.isElementary(lower)
          || logPart.isEmpty()
          || !lower.isConstant(lower.divide(logPart.get(), dt))) {
        return result.plusResidual(level, rest);
      }
      TowerElement<C> c = lower.divide(logPart.get(), dt);
      TowerElement<C> term =
          level.add(
              level.polynomial(Polynomial.monomial(lower, leading.rational(), m)),
              level.polynomial(
                  Polynomial.monomial(lower, lower.divide(c, lower.fromInteger(m + 1L)), m + 1)));
      result = result.plusRational(level, term);
      rest = level.subtract(rest, level.derive(term));
    }
    TowerElement<C> constantTerm = level.numerator(rest).constantTerm();
    return result.plus(level, integrate(lower, constantTerm).lift(level));
  }

  private Antiderivative<C> integrateExponential(ExtensionLevel<C> level, TowerElement<C> f) {
    TowerLevel<C> lower = level.lower();
    CanonicalSplit<C> split = CanonicalSplit.of(level, f);
    NormalReduction<C> normal = reduceNormal(level, split.numerator(), split.denominator());
    Antiderivative<C> result = normal.part();
    if (normal.logs() != null) {
      C weight = level.coefficients().negate(normal.logs().weightedDegree());
      result =
          result.plusRational(
              level, level.lift(lower.multiply(lower.fromConstant(weight), level.argument())));
    }
    TowerElement<C> laurentPart =
        level.add(
            level.add(level.polynomial(split.polynomial()), split.special()),
            level.polynomial(normal.polynomial()));
    RischDifferentialEquation.Laurent<C> laurent =
        RischDifferentialEquation.Laurent.of(level, laurentPart)
            .orElseThrow(
                () -> new AlgorithmFailureException("Not a Laurent polynomial: " + laurentPart));
    List<TowerElement<C>> coefficients = laurent.coefficients();
    for (int i = 0; i < coefficients.size(); i++) {
      TowerElement<C> coefficient = coefficients.get(i);
      if (lower.isZero(coefficient)) {
        continue;
      }
      int power = laurent.lowest() + i;
      if (power == 0) {
        result = result.plus(level, integrate(lower, coefficient).lift(level));
        continue;
      }
      TowerElement<C> shift =
          lower.multiply(lower.fromInteger(power), level.argumentDerivative());
      Optional<TowerElement<C>> y = rde.solve(lower, shift, coefficient);
      if (y.isPresent()) {
        result =
            result.plusRational(
                level, RischDifferentialEquation.Laurent.monomial(level, y.get(), power));
      } else {
        result =
            result.plusResidual(
                level, RischDifferentialEquation.Laurent.monomial(level, coefficient, power));
      }
    }
    return result;
  }

  private Antiderivative<C> integrateTangent(ExtensionLevel<C> level, TowerElement<C> f) {
    CanonicalSplit<C> split = CanonicalSplit.of(level, f);
    NormalReduction<C> normal = reduceNormal(level, split.numerator(), split.denominator());
    Polynomial<TowerElement<C>> p = split.polynomial().add(normal.polynomial());
    Antiderivative<C> result = normal.part();
    if (normal.logs() != null && !normal.logs().terms().isEmpty()) {
      TowerElement<C> fraction = level.fraction(normal.numerator(), normal.denominator());
      Optional<TowerElement<C>> logDerivative = result.logDerivative(level);
      if (logDerivative.isPresent()) {
        TowerElement<C> remainder = level.subtract(fraction, logDerivative.get());
        if (!level.isPolynomial(remainder)) {
          throw new AlgorithmFailureException(
              "Residue reduction left a non-polynomial remainder " + remainder);
        }
        p = p.add(level.numerator(remainder));
      } else {
        result =
            Antiderivative.rational(level, normal.part().rational())
                .plusResidual(level, fraction);
      }
    }
    SpecialReduction<C> special = reduceTangentSpecial(level, split.special());
    p = p.add(special.polynomial());
    return result.plus(level, special.part()).plus(level, integrateTangentPolynomial(level, p));
  }

  /**
   * Removes {@code b/(1 + t^2)^m} one power at a time by subtracting {@code D((Bt + C)/(1 +
   * t^2)^m)}, where {@code B} and {@code C} solve a coupled differential system below.
   */
  private SpecialReduction<C> reduceTangentSpecial(
      ExtensionLevel<C> level, TowerElement<C> special) {
    TowerLevel<C> lower = level.lower();
    Polynomial<TowerElement<C>> s = CanonicalSplit.specialPolynomial(level);
    Antiderivative<C> result = Antiderivative.zero(level);
    Polynomial<TowerElement<C>> polynomial = Polynomial.zero(lower);
    TowerElement<C> rest = special;
    while (!level.isZero(rest)) {
      int m = level.denominator(rest).degree() / 2;
      Polynomial<TowerElement<C>> reduced = level.numerator(rest).remainder(s);
      TowerElement<C> w =
          lower.multiply(lower.fromInteger(2L * m), level.argumentDerivative());
      Optional<CoupledSystemSolver.Solution<C>> solution =
          lower instanceof ExtensionLevel<C> base
              ? coupled.solve(base, w, reduced.coefficient(1), reduced.coefficient(0))
              : Optional.empty();
      if (solution.isEmpty()) {
        return new SpecialReduction<>(result.plusResidual(level, rest), polynomial);
      }
      TowerElement<C> y =
          level.fraction(
              Polynomial.of(lower, solution.get().c(), solution.get().b()), s.pow(m));
      result = result.plusRational(level, y);
      CanonicalSplit<C> next = CanonicalSplit.of(level, level.subtract(rest, level.derive(y)));
      if (!next.numerator().isZero() || next.specialExponent() >= m) {
        throw new AlgorithmFailureException("Power of 1 + t^2 did not drop below " + m);
      }
      polynomial = polynomial.add(next.polynomial());
      rest = next.special();
    }
    return new SpecialReduction<>(result, polynomial);
  }

  private record SpecialReduction<C>(
      Antiderivative<C> part, Polynomial<TowerElement<C>> polynomial) {}

  /**
   * Lowers the degree of {@code p} in {@code t = tan(u)} with {@code D(c t^(m-1))}, then
   * integrates the linear term as a multiple of {@code log(1 + t^2)}.
   */
  private Antiderivative<C> integrateTangentPolynomial(
      ExtensionLevel<C> level, Polynomial<TowerElement<C>> p) {
    TowerLevel<C> lower = level.lower();
    TowerElement<C> eta = level.argumentDerivative();
    Antiderivative<C> result = Antiderivative.zero(level);
    TowerElement<C> rest = level.polynomial(p);
    while (level.numerator(rest).degree() > 1) {
      Polynomial<TowerElement<C>> current = level.numerator(rest);
      int m = current.degree();
      TowerElement<C> c =
          lower.divide(
              current.leadingCoefficient(), lower.multiply(lower.fromInteger(m - 1L), eta));
      TowerElement<C> term = level.polynomial(Polynomial.monomial(lower, c, m - 1));
      result = result.plusRational(level, term);
      rest = level.subtract(rest, level.derive(term));
    }
    Polynomial<TowerElement<C>> linear = level.numerator(rest);
    TowerElement<C> slope = linear.coefficient(1);
    if (!lower.isZero(slope)) {
      TowerElement<C> linearTerm = level.polynomial(Polynomial.monomial(lower, slope, 1));
      TowerElement<C> c = lower.divide(slope, lower.multiply(lower.fromInteger(2), eta));
      if (lower.isConstant(c)) {
        Expr expression =
            Exprs.multiply(
                reconstructor.expression(c),
                Exprs.call(
                    FunctionName.LOG,
                    reconstructor.polynomial(
                        CanonicalSplit.specialPolynomial(level), level.height())));
        result = result.plusLogs(List.of(new LogTerm<>(expression, linearTerm)));
      } else {
        result = result.plusResidual(level, linearTerm);
      }
    }
    return result.plus(level, integrate(lower, linear.constantTerm()).lift(level));
  }

  /**
   * Hermite reduction followed by residue reduction of {@code a/d}. When the residues are not
   * constant the reduced fraction becomes the residual and {@code logs} is {@code null}.
   */
  private NormalReduction<C> reduceNormal(
      ExtensionLevel<C> level, Polynomial<TowerElement<C>> a, Polynomial<TowerElement<C>> d) {
    if (a.isZero()) {
      return new NormalReduction<>(
          Antiderivative.zero(level),
          Polynomial.zero(level.lower()),
          a,
          d,
          new ResidueReduction.LogarithmicPart<>(List.of(), level.coefficients().zero()));
    }
    HermiteReduction.Result<C> hermite = HermiteReduction.reduce(level, a, d);
    if (hermite.steps() > 0) {
      observer.onDiagnostic(IntegrationDiagnostic.hermiteReduced(level.height(), hermite.steps()));
    }
    Antiderivative<C> part = Antiderivative.rational(level, hermite.g());
    Optional<ResidueReduction.LogarithmicPart<C>> logs =
        ResidueReduction.reduce(
            level, hermite.numerator(), hermite.denominator(), reconstructor, factorizer);
    if (logs.isEmpty()) {
      part =
          part.plusResidual(level, level.fraction(hermite.numerator(), hermite.denominator()));
      return new NormalReduction<>(
          part, hermite.polynomial(), hermite.numerator(), hermite.denominator(), null);
    }
    return new NormalReduction<>(
        part.plusLogs(logs.get().terms()),
        hermite.polynomial(),
        hermite.numerator(),
        hermite.denominator(),
        logs.get());
  }

  private record NormalReduction<C>(
      Antiderivative<C> part,
      Polynomial<TowerElement<C>> polynomial,
      Polynomial<TowerElement<C>> numerator,
      Polynomial<TowerElement<C>> denominator,
      ResidueReduction.LogarithmicPart<C> logs) {}
}
