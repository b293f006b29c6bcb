package integration.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Dense univariate polynomial over a {@link Field}. Coefficients are stored lowest degree first
 * with no trailing zeros, so the zero polynomial has an empty coefficient list and degree {@code
 * -1}. Equality compares coefficients only.
 *
 * @param <E> coefficient type
 */
public final class Polynomial<E> {
  private final Field<E> field;
  private final List<E> coefficients;

  private Polynomial(Field<E> field, List<E> coefficients) {
    this.field = field;
    this.coefficients = coefficients;
  }

  public static <E> Polynomial<E> of(Field<E> field, List<E> coefficients) {
    Objects.requireNonNull(field, "field");
    int size = coefficients.size();
    while (size > 0 && field.isZero(coefficients.get(size - 1))) {
      size--;
    }
    return new Polynomial<>(field, List.copyOf(coefficients.subList(0, size)));
  }

  @SafeVarargs
  public static <E> Polynomial<E> of(Field<E> field, E... coefficients) {
    return of(field, List.of(coefficients));
  }

  public static <E> Polynomial<E> zero(Field<E> field) {
    return new Polynomial<>(field, List.of());
  }

  public static <E> Polynomial<E> one(Field<E> field) {
    return constant(field, field.one());
  }

  public static <E> Polynomial<E> constant(Field<E> field, E value) {
    return of(field, List.of(value));
  }

  /** {@code value * t^degree}. */
  public static <E> Polynomial<E> monomial(Field<E> field, E value, int degree) {
    if (field.isZero(value)) {
      return zero(field);
    }
    List<E> coefficients = new ArrayList<>(Collections.nCopies(degree + 1, field.zero()));
    coefficients.set(degree, value);
    return new Polynomial<>(field, List.copyOf(coefficients));
  }

  /** The indeterminate {@code t}. */
  public static <E> Polynomial<E> variable(Field<E> field) {
    return monomial(field, field.one(), 1);
  }

  public Field<E> field() {
    return field;
  }

  public List<E> coefficients() {
    return coefficients;
  }

  public int degree() {
    return coefficients.size() - 1;
  }

  public boolean isZero() {
    return coefficients.isEmpty();
  }

  public boolean isConstant() {
    return coefficients.size() <= 1;
  }

  public boolean isOne() {
    return coefficients.size() == 1 && field.isOne(coefficients.get(0));
  }

  public E coefficient(int power) {
    return power >= 0 && power < coefficients.size() ? coefficients.get(power) : field.zero();
  }

  public E leadingCoefficient() {
    return isZero() ? field.zero() : coefficients.get(coefficients.size() - 1);
  }

  public E constantTerm() {
    return coefficient(0);
  }

  public Polynomial<E> add(Polynomial<E> other) {
    int size = Math.max(coefficients.size(), other.coefficients.size());
    List<E> sum = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      sum.add(field.add(coefficient(i), other.coefficient(i)));
    }
    return of(field, sum);
  }

  public Polynomial<E> subtract(Polynomial<E> other) {
    return add(other.negate());
  }

  public Polynomial<E> negate() {
    List<E> negated = new ArrayList<>(coefficients.size());
    for (E c : coefficients) {
      negated.add(field.negate(c));
    }
    return new Polynomial<>(field, List.copyOf(negated));
  }

  public Polynomial<E> multiply(Polynomial<E> other) {
    if (isZero() || other.isZero()) {
      return zero(field);
    }
    List<E> product =
        new ArrayList<>(Collections.nCopies(degree() + other.degree() + 1, field.zero()));
    for (int i = 0; i < coefficients.size(); i++) {
      E a = coefficients.get(i);
      if (field.isZero(a)) {
        continue;
      }
      for (int j = 0; j < other.coefficients.size(); j++) {
        E term = field.multiply(a, other.coefficients.get(j));
        product.set(i + j, field.add(product.get(i + j), term));
      }
    }
    return of(field, product);
  }

  public Polynomial<E> scale(E factor) {
    if (field.isZero(factor)) {
      return zero(field);
    }
    List<E> scaled = new ArrayList<>(coefficients.size());
    for (E c : coefficients) {
      scaled.add(field.multiply(c, factor));
    }
    return of(field, scaled);
  }

  /** Multiplies by {@code t^k}. */
  public Polynomial<E> shift(int k) {
    if (isZero() || k == 0) {
      return this;
    }
    List<E> shifted = new ArrayList<>(Collections.nCopies(k, field.zero()));
    shifted.addAll(coefficients);
    return new Polynomial<>(field, List.copyOf(shifted));
  }

  public Polynomial<E> pow(int exponent) {
    if (exponent < 0) {
      throw new IllegalArgumentException("Negative exponent: " + exponent);
    }
    Polynomial<E> result = one(field);
    for (int i = 0; i < exponent; i++) {
      result = result.multiply(this);
    }
    return result;
  }

  public DivisionResult<E> divideAndRemainder(Polynomial<E> divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("Polynomial division by zero");
    }
    if (degree() < divisor.degree()) {
      return new DivisionResult<>(zero(field), this);
    }
    E leadInverse = field.inverse(divisor.leadingCoefficient());
    List<E> remainder = new ArrayList<>(coefficients);
    List<E> quotient =
        new ArrayList<>(Collections.nCopies(degree() - divisor.degree() + 1, field.zero()));
    for (int i = degree(); i >= divisor.degree(); i--) {
      E c = remainder.get(i);
      if (field.isZero(c)) {
        continue;
      }
      E q = field.multiply(c, leadInverse);
      int shift = i - divisor.degree();
      quotient.set(shift, q);
      for (int j = 0; j <= divisor.degree(); j++) {
        E term = field.multiply(q, divisor.coefficients.get(j));
        remainder.set(shift + j, field.subtract(remainder.get(shift + j), term));
      }
    }
    return new DivisionResult<>(of(field, quotient), of(field, remainder));
  }

  public Polynomial<E> remainder(Polynomial<E> divisor) {
    return divideAndRemainder(divisor).remainder();
  }

  public boolean isDivisibleBy(Polynomial<E> divisor) {
    return remainder(divisor).isZero();
  }

  /**
   * Exact quotient.
   *
   * @throws ArithmeticException when {@code divisor} does not divide this polynomial
   */
  public Polynomial<E> exactQuotient(Polynomial<E> divisor) {
    DivisionResult<E> division = divideAndRemainder(divisor);
    if (!division.remainder().isZero()) {
      throw new ArithmeticException("Inexact polynomial division");
    }
    return division.quotient();
  }

  public Polynomial<E> monic() {
    if (isZero() || field.isOne(leadingCoefficient())) {
      return this;
    }
    return scale(field.inverse(leadingCoefficient()));
  }

  /**
   * Monic greatest common divisor; {@code gcd(0, 0) = 0}. Remainders are made monic as they are
   * produced, which keeps coefficients from nested fraction fields small.
   */
  public Polynomial<E> gcd(Polynomial<E> other) {
    if (isZero()) {
      return other.monic();
    }
    if (other.isZero()) {
      return monic();
    }
    if (isConstant() || other.isConstant()) {
      return one(field);
    }
    Polynomial<E> a = degree() >= other.degree() ? monic() : other.monic();
    Polynomial<E> b = degree() >= other.degree() ? other.monic() : monic();
    while (!b.isZero()) {
      Polynomial<E> r = a.remainder(b).monic();
      a = b;
      b = r;
    }
    return a;
  }

  /** Returns {@code (g, s, t)} with {@code s*this + t*other = g} and {@code g} monic. */
  public ExtendedGcd<E> extendedGcd(Polynomial<E> other) {
    Polynomial<E> r0 = this;
    Polynomial<E> r1 = other;
    Polynomial<E> s0 = one(field);
    Polynomial<E> s1 = zero(field);
    Polynomial<E> t0 = zero(field);
    Polynomial<E> t1 = one(field);
    while (!r1.isZero()) {
      DivisionResult<E> division = r0.divideAndRemainder(r1);
      Polynomial<E> q = division.quotient();
      Polynomial<E> r2 = division.remainder();
      Polynomial<E> s2 = s0.subtract(q.multiply(s1));
      Polynomial<E> t2 = t0.subtract(q.multiply(t1));
      if (!r2.isZero() && !field.isOne(r2.leadingCoefficient())) {
        E normalizer = field.inverse(r2.leadingCoefficient());
        r2 = r2.scale(normalizer);
        s2 = s2.scale(normalizer);
        t2 = t2.scale(normalizer);
      }
      r0 = r1;
      r1 = r2;
      s0 = s1;
      s1 = s2;
      t0 = t1;
      t1 = t2;
    }
    if (r0.isZero()) {
      return new ExtendedGcd<>(r0, s0, t0);
    }
    E normalizer = field.inverse(r0.leadingCoefficient());
    return new ExtendedGcd<>(r0.scale(normalizer), s0.scale(normalizer), t0.scale(normalizer));
  }

  /** Formal derivative {@code d/dt}. */
  public Polynomial<E> derivative() {
    if (degree() < 1) {
      return zero(field);
    }
    List<E> derivative = new ArrayList<>(degree());
    for (int i = 1; i < coefficients.size(); i++) {
      derivative.add(field.scale(coefficients.get(i), i));
    }
    return of(field, derivative);
  }

  public E evaluate(E point) {
    E result = field.zero();
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      result = field.add(field.multiply(result, point), coefficients.get(i));
    }
    return result;
  }

  /** Evaluates at another polynomial. */
  public Polynomial<E> compose(Polynomial<E> inner) {
    Polynomial<E> result = zero(field);
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      result = result.multiply(inner).add(constant(field, coefficients.get(i)));
    }
    return result;
  }

  public <F> Polynomial<F> map(Field<F> target, Function<? super E, ? extends F> mapping) {
    List<F> mapped = new ArrayList<>(coefficients.size());
    for (E c : coefficients) {
      mapped.add(mapping.apply(c));
    }
    return of(target, mapped);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Polynomial<?> other && coefficients.equals(other.coefficients);
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode();
  }

  @Override
  public String toString() {
    if (isZero()) {
      return "0";
    }
    StringBuilder out = new StringBuilder();
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      E c = coefficients.get(i);
      if (field.isZero(c)) {
        continue;
      }
      if (out.length() > 0) {
        out.append(" + ");
      }
      out.append('(').append(c).append(')');
      if (i > 0) {
        out.append("*t");
        if (i > 1) {
          out.append('^').append(i);
        }
      }
    }
    return out.toString();
  }

  /** Quotient and remainder of a polynomial division. */
  public record DivisionResult<E>(Polynomial<E> quotient, Polynomial<E> remainder) {}

  /** Bezout identity {@code s*a + t*b = gcd}. */
  public record ExtendedGcd<E>(Polynomial<E> gcd, Polynomial<E> s, Polynomial<E> t) {}
}
