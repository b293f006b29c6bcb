package integration.risch;

import integration.algebra.AlgebraicExtension;
import integration.algebra.CoefficientFactorization;
import integration.algebra.CoefficientField;
import integration.algebra.CoefficientFieldKind;
import integration.algebra.Polynomial;
import integration.algebra.Polynomials;
import integration.algebra.RationalFactorizer;
import integration.algebra.Rationals;
import integration.core.AlgorithmFailureException;
import integration.core.FieldExtensionRequiredException;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.expr.Num;
import integration.expr.RootSum;
import integration.expr.Symbol;
import integration.reconstruct.ResultReconstructor;
import integration.tower.ExtensionLevel;
import integration.tower.Generator;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Logarithmic part of {@code a/d} for a square-free normal {@code d} (Rothstein-Trager). The
 * residues are the roots of {@code R(z) = resultant_t(d, a - z D(d))}; each root {@code c}
 * contributes {@code c log(gcd(d, a - c D(d)))}. Conjugate pairs of roots of rational quadratic
 * factors, and of the rational factors whose roots {@link RadicalRoots} writes in radicals, are
 * written with real logarithms and arctangents. Other irrational roots become root sums.
 */
final class ResidueReduction<C> {
  static final Symbol ROOT = new Symbol("_Z");

  private final ExtensionLevel<C> level;
  private final TowerLevel<C> lower;
  private final CoefficientField<C> field;
  private final ResultReconstructor<C> reconstructor;
  private final RationalFactorizer factorizer;
  private final List<LogTerm<C>> terms = new ArrayList<>();
  private C weightedDegree;
  private int coveredDegree;

  private ResidueReduction(
      ExtensionLevel<C> level,
      ResultReconstructor<C> reconstructor,
      RationalFactorizer factorizer) {
    this.level = level;
    this.lower = level.lower();
    this.field = level.coefficients();
    this.reconstructor = reconstructor;
    this.factorizer = factorizer;
    this.weightedDegree = field.zero();
  }

  /**
   * Log terms of {@code a/d} and {@code sum deg_t(S_c) * c} over all residues {@code c}.
   *
   * @param terms the log terms
   * @param weightedDegree the weighted degree; {@code a/d} minus the derivative of the terms is
   *     {@code -D(u) * weightedDegree} in an exponential extension
   */
  record LogarithmicPart<C>(List<LogTerm<C>> terms, C weightedDegree) {
    boolean hasRootSums() {
      return terms.stream().anyMatch(term -> !term.hasDerivative());
    }
  }

  /**
   * Returns empty when some coefficient of the monic {@code R(z)} is not constant, in which case
   * {@code a/d} has no elementary integral.
   *
   * @throws FieldExtensionRequiredException when a residue is irrational and the constants are
   *     the rationals
   */
  static <C> Optional<LogarithmicPart<C>> reduce(
      ExtensionLevel<C> level,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      ResultReconstructor<C> reconstructor,
      RationalFactorizer factorizer) {
    ResidueReduction<C> reduction = new ResidueReduction<>(level, reconstructor, factorizer);
    if (a.isZero()) {
      return Optional.of(new LogarithmicPart<>(List.of(), level.coefficients().zero()));
    }
    return reduction.run(a, d);
  }

  private Optional<LogarithmicPart<C>> run(
      Polynomial<TowerElement<C>> a, Polynomial<TowerElement<C>> d) {
    Polynomial<TowerElement<C>> dd = level.derive(d);
    Optional<Polynomial<C>> r = residuePolynomial(a, d, dd);
    if (r.isEmpty()) {
      return Optional.empty();
    }
    for (Polynomial<C> part : Polynomials.squareFree(r.get())) {
      for (Polynomial<C> factor : CoefficientFactorization.factor(field, part, factorizer)) {
        addFactor(factor, a, d, dd);
      }
    }
    if (coveredDegree != d.degree()) {
      throw new AlgorithmFailureException(
          "Residues account for degree " + coveredDegree + " of " + d.degree());
    }
    return Optional.of(new LogarithmicPart<>(terms, weightedDegree));
  }

  /** {@code R(z)} made monic, interpolated from its values at {@code z = 0..deg d}. */
  private Optional<Polynomial<C>> residuePolynomial(
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    List<TowerElement<C>> points = new ArrayList<>();
    List<TowerElement<C>> values = new ArrayList<>();
    for (int j = 0; j <= d.degree(); j++) {
      TowerElement<C> z = lower.fromInteger(j);
      points.add(z);
      values.add(Polynomials.resultant(d, a.subtract(dd.scale(z))));
    }
    Polynomial<TowerElement<C>> r = Polynomials.interpolate(lower, points, values);
    if (r.isZero()) {
      throw new AlgorithmFailureException("Vanishing residue resultant for " + a + " / " + d);
    }
    r = r.monic();
    for (TowerElement<C> coefficient : r.coefficients()) {
      if (!lower.isConstant(coefficient)) {
        return Optional.empty();
      }
    }
    return Optional.of(r.map(field, lower::toConstant));
  }

  private void addFactor(
      Polynomial<C> m,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    if (m.degree() == 1) {
      addRoot(field.negate(m.constantTerm()), a, d, dd);
      return;
    }
    Optional<BigFraction> p = field.toRational(m.coefficient(1));
    Optional<BigFraction> q = field.toRational(m.coefficient(0));
    if (m.degree() == 2 && p.isPresent() && q.isPresent()) {
      addQuadratic(m, p.get(), q.get(), a, d, dd);
      return;
    }
    Optional<List<RadicalRoots.Root>> roots =
        rationalCoefficients(m).flatMap(RadicalRoots::of);
    if (roots.isPresent()) {
      addRadicalRoots(m, roots.get(), a, d, dd);
      return;
    }
    requireAlgebraic(m);
    addRootSum(m, a, d, dd);
  }

  private Optional<List<BigFraction>> rationalCoefficients(Polynomial<C> m) {
    List<BigFraction> coefficients = new ArrayList<>();
    C lead = m.leadingCoefficient();
    for (C c : m.coefficients()) {
      Optional<BigFraction> value = field.toRational(field.divide(c, lead));
      if (value.isEmpty()) {
        return Optional.empty();
      }
      coefficients.add(value.get());
    }
    return Optional.of(coefficients);
  }

  private void addRoot(
      C c,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    Polynomial<TowerElement<C>> s = d.gcd(a.subtract(dd.scale(lower.fromConstant(c))));
    TowerElement<C> se = level.polynomial(s);
    Expr expression =
        Exprs.multiply(
            field.toExpression(c),
            Exprs.call(FunctionName.LOG, reconstructor.polynomial(s, level.height())));
    TowerElement<C> derivative =
        level.multiply(level.fromConstant(c), level.divide(level.derive(se), se));
    terms.add(new LogTerm<>(expression, derivative));
    account(s.degree(), 1, c);
  }

  /** {@code z^2 + p z + q} with roots {@code alpha +- beta}, {@code beta^2 = delta}. */
  private void addQuadratic(
      Polynomial<C> m,
      BigFraction p,
      BigFraction q,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    BigFraction alpha = p.divide(-2);
    BigFraction delta = alpha.multiply(alpha).subtract(q);
    if (Rationals.signum(delta) < 0) {
      BigFraction r = delta.negate();
      Optional<BigFraction> s = Rationals.sqrt(r);
      Optional<C> i = field.imaginaryUnit();
      if (s.isPresent() && i.isPresent()) {
        addSplitConjugatePair(m, alpha, s.get(), i.get(), a, d, dd);
        return;
      }
      if (s.isEmpty()) {
        requireAlgebraic(m);
      }
      Polynomial<Polynomial<TowerElement<C>>> se = extensionGcd(m, a, d, dd);
      RealImaginary<C> parts = realImaginary(se, alpha);
      if (s.isPresent()) {
        Polynomial<TowerElement<C>> imaginary =
            parts.imaginary().scale(lower.fromRational(s.get()));
        addArctangentPair(alpha, s.get(), parts.real(), imaginary);
      } else {
        addIrrationalArctangent(alpha, r, parts.real(), parts.imaginary());
      }
      account(se.degree(), 2, field.negate(m.coefficient(1)));
      return;
    }
    requireAlgebraic(m);
    Polynomial<Polynomial<TowerElement<C>>> se = extensionGcd(m, a, d, dd);
    RealImaginary<C> parts = realImaginary(se, alpha);
    addRealPair(alpha, delta, parts.real(), parts.imaginary());
    account(se.degree(), 2, field.negate(m.coefficient(1)));
  }

  /** Both roots lie in the constants; their log arguments are conjugate when the tower is real. */
  private void addSplitConjugatePair(
      Polynomial<C> m,
      BigFraction alpha,
      BigFraction s,
      C i,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    C is = field.multiply(i, field.fromRational(s));
    C plus = field.add(field.fromRational(alpha), is);
    C minus = field.subtract(field.fromRational(alpha), is);
    Polynomial<TowerElement<C>> sPlus = d.gcd(a.subtract(dd.scale(lower.fromConstant(plus))));
    Polynomial<TowerElement<C>> sMinus = d.gcd(a.subtract(dd.scale(lower.fromConstant(minus))));
    if (!sPlus.map(lower, lower::conjugateCoefficients).equals(sMinus)) {
      addRoot(plus, a, d, dd);
      addRoot(minus, a, d, dd);
      return;
    }
    TowerElement<C> half = lower.fromRational(new BigFraction(1, 2));
    TowerElement<C> minusHalfI =
        lower.fromConstant(field.multiply(i, field.fromRational(new BigFraction(-1, 2))));
    Polynomial<TowerElement<C>> real = sPlus.add(sMinus).scale(half);
    Polynomial<TowerElement<C>> imaginary = sPlus.subtract(sMinus).scale(minusHalfI);
    addArctangentPair(alpha, s, real, imaginary);
    account(sPlus.degree(), 2, field.negate(m.coefficient(1)));
  }

  /**
   * {@code alpha log(P^2 + B^2) + s * sum 2 atan(h_k)}, the real form of {@code (alpha + i s)
   * log(P + iB) + (alpha - i s) log(P - iB)}.
   */
  private void addArctangentPair(
      BigFraction alpha,
      BigFraction s,
      Polynomial<TowerElement<C>> real,
      Polynomial<TowerElement<C>> imaginary) {
    Polynomial<TowerElement<C>> norm = real.multiply(real).add(imaginary.multiply(imaginary));
    List<Expr> parts = new ArrayList<>();
    TowerElement<C> derivative = logOfNormDerivative(alpha, norm, parts);
    Expr twiceS = new Num(s.multiply(2));
    for (TowerElement<C> argument : ArctangentConversion.logToAtan(level, real, imaginary)) {
      parts.add(
          Exprs.multiply(
              twiceS, Exprs.call(FunctionName.ATAN, reconstructor.expression(argument))));
    }
    TowerElement<C> p = level.polynomial(real);
    TowerElement<C> b = level.polynomial(imaginary);
    TowerElement<C> wronskian =
        level.subtract(level.multiply(level.derive(p), b), level.multiply(p, level.derive(b)));
    derivative =
        level.add(
            derivative,
            level.divide(
                level.multiply(level.fromRational(s.multiply(2)), wronskian),
                level.polynomial(norm)));
    terms.add(new LogTerm<>(Exprs.sum(parts), derivative));
  }

  /** {@code alpha log(P^2 + r Q^2) + 2 sqrt(r) atan(P / (sqrt(r) Q))}. */
  private void addIrrationalArctangent(
      BigFraction alpha,
      BigFraction r,
      Polynomial<TowerElement<C>> real,
      Polynomial<TowerElement<C>> imaginary) {
    TowerElement<C> rk = lower.fromRational(r);
    Polynomial<TowerElement<C>> norm =
        real.multiply(real).add(imaginary.multiply(imaginary).scale(rk));
    List<Expr> parts = new ArrayList<>();
    TowerElement<C> derivative = logOfNormDerivative(alpha, norm, parts);
    Expr sqrt = Exprs.call(FunctionName.SQRT, new Num(r));
    Expr argument =
        Exprs.divide(
            reconstructor.polynomial(real, level.height()),
            Exprs.multiply(sqrt, reconstructor.polynomial(imaginary, level.height())));
    parts.add(Exprs.multiply(Num.of(2), sqrt, Exprs.call(FunctionName.ATAN, argument)));
    TowerElement<C> p = level.polynomial(real);
    TowerElement<C> qt = level.polynomial(imaginary);
    TowerElement<C> wronskian =
        level.subtract(level.multiply(level.derive(p), qt), level.multiply(p, level.derive(qt)));
    derivative =
        level.add(
            derivative,
            level.divide(
                level.multiply(level.fromRational(r.multiply(2)), wronskian),
                level.polynomial(norm)));
    terms.add(new LogTerm<>(Exprs.sum(parts), derivative));
  }

  /**
   * {@code alpha log(P^2 - delta Q^2) + sqrt(delta) log((P + sqrt(delta) Q)/(P - sqrt(delta) Q))}.
   */
  private void addRealPair(
      BigFraction alpha,
      BigFraction delta,
      Polynomial<TowerElement<C>> real,
      Polynomial<TowerElement<C>> imaginary) {
    Polynomial<TowerElement<C>> norm =
        real.multiply(real)
            .subtract(imaginary.multiply(imaginary).scale(lower.fromRational(delta)));
    List<Expr> parts = new ArrayList<>();
    TowerElement<C> derivative = logOfNormDerivative(alpha, norm, parts);
    Expr sqrt = Exprs.call(FunctionName.SQRT, new Num(delta));
    Expr p = reconstructor.polynomial(real, level.height());
    Expr scaledQ = Exprs.multiply(sqrt, reconstructor.polynomial(imaginary, level.height()));
    parts.add(
        Exprs.multiply(
            sqrt,
            Exprs.call(
                FunctionName.LOG,
                Exprs.divide(Exprs.add(p, scaledQ), Exprs.subtract(p, scaledQ)))));
    TowerElement<C> pe = level.polynomial(real);
    TowerElement<C> qe = level.polynomial(imaginary);
    TowerElement<C> wronskian =
        level.subtract(level.multiply(pe, level.derive(qe)), level.multiply(qe, level.derive(pe)));
    derivative =
        level.add(
            derivative,
            level.divide(
                level.multiply(level.fromRational(delta.multiply(2)), wronskian),
                level.polynomial(norm)));
    terms.add(new LogTerm<>(Exprs.sum(parts), derivative));
  }

  private TowerElement<C> logOfNormDerivative(
      BigFraction alpha, Polynomial<TowerElement<C>> norm, List<Expr> parts) {
    if (Rationals.isZero(alpha)) {
      return level.zero();
    }
    parts.add(
        Exprs.multiply(
            new Num(alpha),
            Exprs.call(FunctionName.LOG, reconstructor.polynomial(norm, level.height()))));
    TowerElement<C> n = level.polynomial(norm);
    return level.multiply(level.fromRational(alpha), level.divide(level.derive(n), n));
  }

  /**
   * {@code sum c log(S(c))} over the roots {@code c} of {@code m} written in radicals. Over a real
   * tower each conjugate pair {@code a +- ib} with {@code S(a + ib) = P + iQ} becomes {@code a
   * log(P^2 + Q^2) - 2b atan(Q/P)}.
   */
  private void addRadicalRoots(
      Polynomial<C> m,
      List<RadicalRoots.Root> roots,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    Polynomial<Polynomial<TowerElement<C>>> se = extensionGcd(m, a, d, dd);
    boolean real = isReal(se);
    List<Expr> parts = new ArrayList<>();
    for (RadicalRoots.Root root : roots) {
      if (root.isReal()) {
        Expr[] value = evaluate(se, root.real(), Num.ZERO);
        parts.add(Exprs.multiply(root.real(), Exprs.call(FunctionName.LOG, value[0])));
      } else if (real) {
        Expr[] value = evaluate(se, root.real(), root.imaginary());
        Expr norm = Exprs.add(Exprs.power(value[0], 2), Exprs.power(value[1], 2));
        parts.add(Exprs.multiply(root.real(), Exprs.call(FunctionName.LOG, norm)));
        parts.add(
            Exprs.multiply(
                Num.of(-2),
                root.imaginary(),
                Exprs.call(FunctionName.ATAN, Exprs.divide(value[1], value[0]))));
      } else {
        for (Expr imaginary : List.of(root.imaginary(), Exprs.negate(root.imaginary()))) {
          Expr[] value = evaluate(se, root.real(), imaginary);
          Expr c = Exprs.add(root.real(), Exprs.multiply(Symbol.IMAGINARY_UNIT, imaginary));
          Expr argument = Exprs.add(value[0], Exprs.multiply(Symbol.IMAGINARY_UNIT, value[1]));
          parts.add(Exprs.multiply(c, Exprs.call(FunctionName.LOG, argument)));
        }
      }
    }
    terms.add(new LogTerm<>(Exprs.sum(parts), null));
    C trace = field.divide(m.coefficient(m.degree() - 1), m.leadingCoefficient());
    account(se.degree(), m.degree(), field.negate(trace));
  }

  /** {@code S(z)} at {@code z = re + I*im}, split as {@code [P, Q]} with {@code S = P + I*Q}. */
  private Expr[] evaluate(Polynomial<Polynomial<TowerElement<C>>> s, Expr re, Expr im) {
    int width = 0;
    for (Polynomial<TowerElement<C>> coefficient : s.coefficients()) {
      width = Math.max(width, coefficient.coefficients().size());
    }
    List<Expr> realPowers = new ArrayList<>(List.of(Num.ONE));
    List<Expr> imaginaryPowers = new ArrayList<>(List.of(Num.ZERO));
    for (int l = 1; l < width; l++) {
      Expr x = realPowers.get(l - 1);
      Expr y = imaginaryPowers.get(l - 1);
      realPowers.add(Exprs.subtract(Exprs.multiply(x, re), Exprs.multiply(y, im)));
      imaginaryPowers.add(Exprs.add(Exprs.multiply(x, im), Exprs.multiply(y, re)));
    }
    Expr t = reconstructor.generator(level.height());
    List<Expr> real = new ArrayList<>();
    List<Expr> imaginary = new ArrayList<>();
    for (int j = 0; j < s.coefficients().size(); j++) {
      List<TowerElement<C>> inner = s.coefficients().get(j).coefficients();
      for (int l = 0; l < inner.size(); l++) {
        if (lower.isZero(inner.get(l))) {
          continue;
        }
        Expr c = Exprs.multiply(reconstructor.expression(inner.get(l)), Exprs.power(t, j));
        real.add(Exprs.multiply(c, realPowers.get(l)));
        imaginary.add(Exprs.multiply(c, imaginaryPowers.get(l)));
      }
    }
    return new Expr[] {Exprs.sum(real), Exprs.sum(imaginary)};
  }

  /** Real generators and coefficients, so that {@code S} at a conjugate root is the conjugate. */
  private boolean isReal(Polynomial<Polynomial<TowerElement<C>>> s) {
    for (Generator generator : level.generators()) {
      if (!Exprs.isFreeOf(generator.expression(), Symbol.IMAGINARY_UNIT)) {
        return false;
      }
    }
    for (Polynomial<TowerElement<C>> coefficient : s.coefficients()) {
      for (TowerElement<C> c : coefficient.coefficients()) {
        if (!lower.isZero(lower.subtract(lower.conjugateCoefficients(c), c))) {
          return false;
        }
      }
    }
    return true;
  }

  private void addRootSum(
      Polynomial<C> m,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    Polynomial<Polynomial<TowerElement<C>>> se = extensionGcd(m, a, d, dd);
    Expr body =
        Exprs.multiply(
            ROOT,
            Exprs.call(
                FunctionName.LOG, reconstructor.algebraicPolynomial(se, ROOT, level.height())));
    RootSum rootSum = new RootSum(reconstructor.constantPolynomial(m, ROOT), ROOT, body);
    terms.add(new LogTerm<>(rootSum, null));
    account(se.degree(), m.degree(), field.negate(m.coefficient(m.degree() - 1)));
  }

  /** {@code gcd(d, a - z D(d))} over {@code K[z]/(m)}. */
  private Polynomial<Polynomial<TowerElement<C>>> extensionGcd(
      Polynomial<C> m,
      Polynomial<TowerElement<C>> a,
      Polynomial<TowerElement<C>> d,
      Polynomial<TowerElement<C>> dd) {
    AlgebraicExtension<TowerElement<C>> extension =
        new AlgebraicExtension<>(m.map(lower, lower::fromConstant));
    Polynomial<Polynomial<TowerElement<C>>> ae = a.map(extension, extension::embed);
    Polynomial<Polynomial<TowerElement<C>>> de = d.map(extension, extension::embed);
    Polynomial<Polynomial<TowerElement<C>>> dde = dd.map(extension, extension::embed);
    try {
      return de.gcd(ae.subtract(dde.scale(extension.generator())));
    } catch (AlgebraicExtension.ZeroDivisorException e) {
      throw new AlgorithmFailureException("Residue factor " + m + " is reducible", e);
    }
  }

  /** Writes {@code S(z)} at {@code z = alpha + beta} as {@code P + beta Q}. */
  private RealImaginary<C> realImaginary(
      Polynomial<Polynomial<TowerElement<C>>> s, BigFraction alpha) {
    TowerElement<C> alphaK = lower.fromRational(alpha);
    List<TowerElement<C>> real = new ArrayList<>();
    List<TowerElement<C>> imaginary = new ArrayList<>();
    for (Polynomial<TowerElement<C>> coefficient : s.coefficients()) {
      TowerElement<C> s1 = coefficient.coefficient(1);
      real.add(lower.add(coefficient.coefficient(0), lower.multiply(alphaK, s1)));
      imaginary.add(s1);
    }
    return new RealImaginary<>(Polynomial.of(lower, real), Polynomial.of(lower, imaginary));
  }

  private record RealImaginary<C>(
      Polynomial<TowerElement<C>> real, Polynomial<TowerElement<C>> imaginary) {}

  private void account(int logDegree, int roots, C trace) {
    coveredDegree += logDegree * roots;
    weightedDegree = field.add(weightedDegree, field.scale(trace, logDegree));
  }

  private void requireAlgebraic(Polynomial<C> m) {
    if (field.kind() != CoefficientFieldKind.ALGEBRAIC_CLOSURE) {
      throw new FieldExtensionRequiredException("Residues are the roots of " + m);
    }
  }
}
