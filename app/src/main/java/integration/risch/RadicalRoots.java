package integration.risch;

import integration.algebra.Rationals;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.Num;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Roots in radicals of rational residue polynomials of degree three and more: binomials {@code
 * z^n - g} whose arguments are multiples of {@code pi/12}, and biquadratics {@code z^4 + p z^2 +
 * q}. A root with a non-zero imaginary part stands for the pair {@code real +- I*imaginary}.
 */
final class RadicalRoots {
  private static final Num HALF = new Num(new BigFraction(1, 2));

  private RadicalRoots() {}

  record Root(Expr real, Expr imaginary) {
    boolean isReal() {
      return Exprs.isZero(imaginary);
    }
  }

  /**
   * @param m coefficients of a monic irreducible polynomial, constant term first
   * @return the real roots and one member of each conjugate pair, or empty when the roots have no
   *     form here
   */
  static Optional<List<Root>> of(List<BigFraction> m) {
    int n = m.size() - 1;
    if (n < 3 || Rationals.isZero(m.get(0))) {
      return Optional.empty();
    }
    boolean binomial = true;
    for (int i = 1; i < n; i++) {
      binomial &= Rationals.isZero(m.get(i));
    }
    if (binomial) {
      return binomial(n, m.get(0).negate());
    }
    if (n == 4 && Rationals.isZero(m.get(1)) && Rationals.isZero(m.get(3))) {
      return biquadratic(m.get(2), m.get(0));
    }
    return Optional.empty();
  }

  /** {@code z^n = g}: the modulus {@code |g|^(1/n)} times the n-th roots of {@code sign(g)}. */
  private static Optional<List<Root>> binomial(int n, BigFraction g) {
    Expr modulus = Exprs.power(new Num(g.abs()), new Num(new BigFraction(1, n)));
    int offset = Rationals.signum(g) < 0 ? 1 : 0;
    List<Root> roots = new ArrayList<>();
    for (int k = 0; 2 * k + offset <= n; k++) {
      Optional<Expr[]> unit = unitCircle(new BigFraction(2 * k + offset, n));
      if (unit.isEmpty()) {
        return Optional.empty();
      }
      roots.add(
          new Root(
              Exprs.multiply(modulus, unit.get()[0]), Exprs.multiply(modulus, unit.get()[1])));
    }
    return Optional.of(roots);
  }

  /**
   * {@code z^4 + p z^2 + q}. With a negative discriminant it is {@code (z^2 + s z + r)(z^2 - s z
   * + r)} for {@code r = sqrt(q)} and {@code s = sqrt(2r - p)}; otherwise {@code z^2} takes the
   * two real values {@code w = (-p +- sqrt(p^2 - 4q))/2}.
   */
  private static Optional<List<Root>> biquadratic(BigFraction p, BigFraction q) {
    BigFraction discriminant = p.multiply(p).subtract(q.multiply(4));
    List<Root> roots = new ArrayList<>();
    if (Rationals.signum(discriminant) < 0) {
      Expr r = sqrt(new Num(q));
      Expr twiceR = Exprs.multiply(Num.of(2), r);
      Expr s = sqrt(Exprs.subtract(twiceR, new Num(p)));
      Expr beta = Exprs.multiply(HALF, sqrt(Exprs.add(twiceR, new Num(p))));
      roots.add(new Root(Exprs.multiply(new Num(new BigFraction(-1, 2)), s), beta));
      roots.add(new Root(Exprs.multiply(HALF, s), beta));
      return Optional.of(roots);
    }
    if (Rationals.isZero(discriminant)) {
      return Optional.empty();
    }
    Expr root = sqrt(new Num(discriminant));
    Expr minusP = new Num(p.negate());
    Expr plus = Exprs.multiply(HALF, Exprs.add(minusP, root));
    Expr minus = Exprs.multiply(HALF, Exprs.subtract(minusP, root));
    boolean pNegative = Rationals.signum(p) < 0;
    addSquareRoots(roots, plus, pNegative || Rationals.signum(q) < 0);
    addSquareRoots(roots, minus, pNegative && Rationals.signum(q) > 0);
    return Optional.of(roots);
  }

  private static void addSquareRoots(List<Root> roots, Expr w, boolean positive) {
    if (positive) {
      Expr root = sqrt(w);
      roots.add(new Root(root, Num.ZERO));
      roots.add(new Root(Exprs.negate(root), Num.ZERO));
    } else {
      roots.add(new Root(Num.ZERO, sqrt(Exprs.negate(w))));
    }
  }

  /** {@code [cos(pi t), sin(pi t)]} for {@code 0 <= t <= 1} a multiple of {@code 1/12}. */
  private static Optional<Expr[]> unitCircle(BigFraction turns) {
    BigFraction twelfths = turns.multiply(12);
    if (!Rationals.isInteger(twelfths)) {
      return Optional.empty();
    }
    int j = twelfths.intValue();
    if (j > 6) {
      Expr[] mirrored = unitCircle(new BigFraction(12 - j, 12)).orElseThrow();
      return Optional.of(new Expr[] {Exprs.negate(mirrored[0]), mirrored[1]});
    }
    return Optional.of(new Expr[] {cosine(j), cosine(6 - j)});
  }

  /** {@code cos(j pi/12)} for {@code 0 <= j <= 6}. */
  private static Expr cosine(int j) {
    Expr quarter = new Num(new BigFraction(1, 4));
    return switch (j) {
      case 0 -> Num.ONE;
      case 1 -> Exprs.multiply(quarter, Exprs.add(sqrt(Num.of(6)), sqrt(Num.of(2))));
      case 2 -> Exprs.multiply(HALF, sqrt(Num.of(3)));
      case 3 -> Exprs.multiply(HALF, sqrt(Num.of(2)));
      case 4 -> HALF;
      case 5 -> Exprs.multiply(quarter, Exprs.subtract(sqrt(Num.of(6)), sqrt(Num.of(2))));
      case 6 -> Num.ZERO;
      default -> throw new IllegalArgumentException("Not in 0..6: " + j);
    };
  }

  private static Expr sqrt(Expr value) {
    return Exprs.power(value, HALF);
  }
}
