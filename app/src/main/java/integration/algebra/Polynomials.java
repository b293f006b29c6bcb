package integration.algebra;

import java.util.ArrayList;
import java.util.List;

/** Algorithms on univariate polynomials over a field. */
public final class Polynomials {

  private Polynomials() {}

  /** Resultant computed along the Euclidean remainder sequence. */
  public static <E> E resultant(Polynomial<E> a, Polynomial<E> b) {
    Field<E> field = a.field();
    if (a.isZero() || b.isZero()) {
      return field.zero();
    }
    E result = field.one();
    Polynomial<E> p = a;
    Polynomial<E> q = b;
    while (true) {
      int m = p.degree();
      int n = q.degree();
      if (n == 0) {
        return field.multiply(result, field.pow(q.leadingCoefficient(), m));
      }
      if (m == 0) {
        return field.multiply(result, field.pow(p.leadingCoefficient(), n));
      }
      Polynomial<E> r = p.remainder(q);
      if (r.isZero()) {
        return field.zero();
      }
      if ((m & 1) == 1 && (n & 1) == 1) {
        result = field.negate(result);
      }
      result = field.multiply(result, field.pow(q.leadingCoefficient(), m - r.degree()));
      p = q;
      q = r;
    }
  }

  /**
   * Yun's square-free decomposition. Returns {@code [s1, ..., sk]}, monic and pairwise coprime,
   * with {@code p = lc(p) * s1 * s2^2 * ... * sk^k}; constant inputs give an empty list.
   */
  public static <E> List<Polynomial<E>> squareFree(Polynomial<E> p) {
    List<Polynomial<E>> factors = new ArrayList<>();
    if (p.degree() < 1) {
      return factors;
    }
    Polynomial<E> f = p.monic();
    Polynomial<E> derivative = f.derivative();
    Polynomial<E> common = f.gcd(derivative);
    Polynomial<E> b = f.exactQuotient(common);
    Polynomial<E> c = derivative.exactQuotient(common);
    Polynomial<E> d = c.subtract(b.derivative());
    while (b.degree() >= 1) {
      Polynomial<E> a = b.gcd(d);
      factors.add(a);
      b = b.exactQuotient(a);
      c = d.exactQuotient(a);
      d = c.subtract(b.derivative());
    }
    return factors;
  }

  /**
   * Solves {@code s*a + t*b = c} with {@code deg s < deg b}.
   *
   * @throws ArithmeticException when {@code gcd(a, b)} does not divide {@code c}
   */
  public static <E> Bezout<E> diophantine(Polynomial<E> a, Polynomial<E> b, Polynomial<E> c) {
    Polynomial.ExtendedGcd<E> xgcd = a.extendedGcd(b);
    Polynomial.DivisionResult<E> scaled = c.divideAndRemainder(xgcd.gcd());
    if (!scaled.remainder().isZero()) {
      throw new ArithmeticException("Right-hand side is not in the ideal (a, b)");
    }
    Polynomial<E> s = scaled.quotient().multiply(xgcd.s());
    Polynomial<E> t = scaled.quotient().multiply(xgcd.t());
    if (!s.isZero() && s.degree() >= b.degree()) {
      Polynomial.DivisionResult<E> reduced = s.divideAndRemainder(b);
      s = reduced.remainder();
      t = t.add(reduced.quotient().multiply(a));
    }
    return new Bezout<>(s, t);
  }

  /** Newton interpolation through {@code (xs[i], ys[i])}; the points must be distinct. */
  public static <E> Polynomial<E> interpolate(Field<E> field, List<E> xs, List<E> ys) {
    int n = xs.size();
    if (n != ys.size() || n == 0) {
      throw new IllegalArgumentException("Interpolation needs matching non-empty point lists");
    }
    List<E> differences = new ArrayList<>(ys);
    for (int j = 1; j < n; j++) {
      for (int i = n - 1; i >= j; i--) {
        E numerator = field.subtract(differences.get(i), differences.get(i - 1));
        E denominator = field.subtract(xs.get(i), xs.get(i - j));
        differences.set(i, field.divide(numerator, denominator));
      }
    }
    Polynomial<E> t = Polynomial.variable(field);
    Polynomial<E> result = Polynomial.constant(field, differences.get(n - 1));
    for (int i = n - 2; i >= 0; i--) {
      Polynomial<E> factor = t.subtract(Polynomial.constant(field, xs.get(i)));
      result = result.multiply(factor).add(Polynomial.constant(field, differences.get(i)));
    }
    return result;
  }

  /** Solution {@code (s, t)} of a polynomial Diophantine equation. */
  public record Bezout<E>(Polynomial<E> s, Polynomial<E> t) {}
}
