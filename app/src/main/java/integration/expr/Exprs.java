package integration.expr;

import integration.algebra.Rationals;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Normalizing constructors for {@link Expr}.
 *
 * <p>Sums are flattened and like terms collected, products are flattened and equal bases merged,
 * integer powers of products are distributed and numeric subexpressions are folded. Operands are
 * kept in a canonical order, which makes structural equality a usable (if incomplete) test for
 * mathematical equality.
 */
public final class Exprs {
  private static final Comparator<Expr> ORDER =
      Comparator.comparingInt(Exprs::rank).thenComparing(ExprPrinter::print);
  private static final BigInteger FOUR = BigInteger.valueOf(4);
  private static final BigInteger ROOT_SEARCH_LIMIT = BigInteger.valueOf(10_000);

  private Exprs() {}

  public static Num num(long value) {
    return Num.of(value);
  }

  public static Num num(BigFraction value) {
    return new Num(value);
  }

  public static Symbol symbol(String name) {
    return new Symbol(name);
  }

  public static Expr add(Expr... terms) {
    return sum(Arrays.asList(terms));
  }

  public static Expr subtract(Expr a, Expr b) {
    return sum(List.of(a, negate(b)));
  }

  public static Expr negate(Expr a) {
    return product(List.of(Num.MINUS_ONE, a));
  }

  public static Expr multiply(Expr... factors) {
    return product(Arrays.asList(factors));
  }

  public static Expr divide(Expr numerator, Expr denominator) {
    if (denominator instanceof Num n && n.isZero()) {
      throw new ArithmeticException("Division by zero");
    }
    return product(List.of(numerator, power(denominator, Num.MINUS_ONE)));
  }

  public static Expr power(Expr base, long exponent) {
    return power(base, Num.of(exponent));
  }

  public static Expr call(FunctionName function, Expr argument) {
    switch (function) {
      case EXP:
        if (isZero(argument)) {
          return Num.ONE;
        }
        if (argument instanceof Call inner && inner.function() == FunctionName.LOG) {
          return inner.argument();
        }
        break;
      case LOG:
        if (argument instanceof Num n && n.isOne()) {
          return Num.ZERO;
        }
        if (argument instanceof Call inner && inner.function() == FunctionName.EXP) {
          return inner.argument();
        }
        break;
      case SIN:
      case TAN:
      case SINH:
      case TANH:
      case ATAN:
        if (isZero(argument)) {
          return Num.ZERO;
        }
        break;
      case COS:
      case COSH:
        if (isZero(argument)) {
          return Num.ONE;
        }
        break;
      case SQRT:
        if (argument instanceof Num n && !n.isNegative()) {
          return power(n, new Num(new BigFraction(1, 2)));
        }
        break;
      default:
        break;
    }
    return new Call(function, argument);
  }

  public static Expr sum(List<? extends Expr> terms) {
    List<Expr> flat = new ArrayList<>();
    for (Expr term : terms) {
      if (term instanceof Sum s) {
        flat.addAll(s.terms());
      } else {
        flat.add(term);
      }
    }
    BigFraction constant = BigFraction.ZERO;
    Map<Expr, BigFraction> coefficients = new LinkedHashMap<>();
    for (Expr term : flat) {
      if (term instanceof Num n) {
        constant = constant.add(n.value());
        continue;
      }
      Scaled scaled = leadingCoefficient(term);
      coefficients.merge(scaled.rest(), scaled.coefficient(), BigFraction::add);
    }
    List<Expr> out = new ArrayList<>();
    for (Map.Entry<Expr, BigFraction> entry : coefficients.entrySet()) {
      if (!Rationals.isZero(entry.getValue())) {
        out.add(scale(entry.getValue(), entry.getKey()));
      }
    }
    out.sort(ORDER);
    if (!Rationals.isZero(constant)) {
      out.add(new Num(constant));
    }
    if (out.isEmpty()) {
      return Num.ZERO;
    }
    return out.size() == 1 ? out.get(0) : new Sum(out);
  }

  public static Expr product(List<? extends Expr> factors) {
    List<Expr> flat = new ArrayList<>();
    for (Expr factor : factors) {
      if (factor instanceof Product p) {
        flat.addAll(p.factors());
      } else {
        flat.add(factor);
      }
    }
    BigFraction coefficient = BigFraction.ONE;
    Map<Expr, Expr> exponents = new LinkedHashMap<>();
    for (Expr factor : flat) {
      if (factor instanceof Num n) {
        coefficient = coefficient.multiply(n.value());
      } else if (factor instanceof Power p) {
        exponents.merge(p.base(), p.exponent(), Exprs::add);
      } else {
        exponents.merge(factor, Num.ONE, Exprs::add);
      }
    }
    if (Rationals.isZero(coefficient)) {
      return Num.ZERO;
    }
    List<Expr> out = new ArrayList<>();
    for (Map.Entry<Expr, Expr> entry : exponents.entrySet()) {
      Expr base = entry.getKey();
      Expr exponent = entry.getValue();
      if (base instanceof Symbol s && s.isImaginaryUnit() && isInteger(exponent)) {
        int quarter = ((Num) exponent).value().getNumerator().mod(FOUR).intValue();
        if (quarter >= 2) {
          coefficient = coefficient.negate();
        }
        if (quarter % 2 == 1) {
          out.add(base);
        }
        continue;
      }
      Expr factor = power(base, exponent);
      if (factor instanceof Num n) {
        coefficient = coefficient.multiply(n.value());
      } else {
        out.add(factor);
      }
    }
    if (Rationals.isZero(coefficient)) {
      return Num.ZERO;
    }
    if (out.stream().anyMatch(Product.class::isInstance)) {
      out.add(new Num(coefficient));
      return product(out);
    }
    out.sort(ORDER);
    if (out.isEmpty()) {
      return new Num(coefficient);
    }
    if (coefficient.equals(BigFraction.ONE)) {
      return out.size() == 1 ? out.get(0) : new Product(out);
    }
    out.add(0, new Num(coefficient));
    return new Product(out);
  }

  public static Expr power(Expr base, Expr exponent) {
    if (!(exponent instanceof Num e)) {
      if (base instanceof Num b && b.isOne()) {
        return Num.ONE;
      }
      return new Power(base, exponent);
    }
    if (e.isZero()) {
      return Num.ONE;
    }
    if (e.isOne()) {
      return base;
    }
    if (base instanceof Num b) {
      if (b.isOne()) {
        return Num.ONE;
      }
      if (e.isInteger()) {
        if (b.isZero()) {
          if (e.isNegative()) {
            throw new ArithmeticException("Division by zero");
          }
          return Num.ZERO;
        }
        return new Num(b.value().pow(e.value().getNumerator().intValueExact()));
      }
      if (b.isZero() && !e.isNegative()) {
        return Num.ZERO;
      }
      return b.isNegative() || b.isZero()
          ? new Power(base, exponent)
          : rationalPower(b.value(), e.value());
    }
    if (e.isInteger()) {
      if (base instanceof Symbol s && s.isImaginaryUnit()) {
        return product(List.of(new Power(base, exponent)));
      }
      if (base instanceof Power p) {
        return power(p.base(), multiply(p.exponent(), e));
      }
      if (base instanceof Product p) {
        List<Expr> powered = new ArrayList<>(p.factors().size());
        for (Expr factor : p.factors()) {
          powered.add(power(factor, e));
        }
        return product(powered);
      }
    }
    return new Power(base, exponent);
  }

  /**
   * {@code base^(p/q)} for a positive {@code base} and {@code q > 1}, as {@code c * r^(k/q)} with
   * an integral radicand {@code r} free of q-th powers of primes up to {@link #ROOT_SEARCH_LIMIT}
   * and {@code 0 < k < q}.
   */
  private static Expr rationalPower(BigFraction base, BigFraction exponent) {
    int q = exponent.getDenominator().intValueExact();
    int p = exponent.getNumerator().abs().intValueExact();
    BigInteger denominator = base.getDenominator();
    BigInteger radicand = base.getNumerator().multiply(denominator.pow(q - 1));
    BigInteger outside = BigInteger.ONE;
    for (BigInteger prime = BigInteger.TWO;
        prime.compareTo(ROOT_SEARCH_LIMIT) <= 0 && prime.pow(q).compareTo(radicand) <= 0;
        prime = prime.nextProbablePrime()) {
      BigInteger power = prime.pow(q);
      while (radicand.mod(power).signum() == 0) {
        radicand = radicand.divide(power);
        outside = outside.multiply(prime);
      }
    }
    BigFraction coefficient =
        new BigFraction(outside, denominator)
            .pow(p)
            .multiply(new BigFraction(radicand).pow(p / q));
    BigFraction rest = new BigFraction(p % q, q);
    if (exponent.getNumerator().signum() < 0) {
      coefficient = coefficient.reciprocal();
      rest = rest.negate();
    }
    if (radicand.equals(BigInteger.ONE)) {
      return new Num(coefficient);
    }
    Power radical = new Power(new Num(new BigFraction(radicand)), new Num(rest));
    if (coefficient.equals(BigFraction.ONE)) {
      return radical;
    }
    return new Product(List.of(new Num(coefficient), radical));
  }

  /**
   * Splits off a rational content: numbers yield {@code (value, 1)}, products their leading
   * coefficient and sums the rational gcd of their coefficients, signed so that the first term of
   * the rest is positive.
   */
  public static Scaled split(Expr expr) {
    if (expr instanceof Num n) {
      return new Scaled(n.value(), Num.ONE);
    }
    if (expr instanceof Sum s) {
      BigFraction content = BigFraction.ZERO;
      for (Expr term : s.terms()) {
        content = Rationals.gcd(content, leadingCoefficient(term).coefficient());
      }
      if (Rationals.signum(leadingCoefficient(s.terms().get(0)).coefficient()) < 0) {
        content = content.negate();
      }
      if (content.equals(BigFraction.ONE)) {
        return new Scaled(BigFraction.ONE, expr);
      }
      return new Scaled(content, multiply(new Num(content.reciprocal()), expr));
    }
    return leadingCoefficient(expr);
  }

  public static boolean isFreeOf(Expr expr, Symbol symbol) {
    if (expr instanceof Num) {
      return true;
    }
    if (expr instanceof Symbol s) {
      return !s.equals(symbol);
    }
    if (expr instanceof Sum s) {
      return s.terms().stream().allMatch(t -> isFreeOf(t, symbol));
    }
    if (expr instanceof Product p) {
      return p.factors().stream().allMatch(f -> isFreeOf(f, symbol));
    }
    if (expr instanceof Power p) {
      return isFreeOf(p.base(), symbol) && isFreeOf(p.exponent(), symbol);
    }
    if (expr instanceof Call c) {
      return isFreeOf(c.argument(), symbol);
    }
    if (expr instanceof Integral i) {
      return !i.variable().equals(symbol) && isFreeOf(i.integrand(), symbol);
    }
    RootSum r = (RootSum) expr;
    return r.variable().equals(symbol)
        || (isFreeOf(r.polynomial(), symbol) && isFreeOf(r.body(), symbol));
  }

  /** Replaces every free occurrence of {@code symbol}, renormalizing along the way. */
  public static Expr substitute(Expr expr, Symbol symbol, Expr value) {
    if (expr instanceof Num) {
      return expr;
    }
    if (expr instanceof Symbol s) {
      return s.equals(symbol) ? value : s;
    }
    if (expr instanceof Sum s) {
      List<Expr> terms = new ArrayList<>();
      for (Expr term : s.terms()) {
        terms.add(substitute(term, symbol, value));
      }
      return sum(terms);
    }
    if (expr instanceof Product p) {
      List<Expr> factors = new ArrayList<>();
      for (Expr factor : p.factors()) {
        factors.add(substitute(factor, symbol, value));
      }
      return product(factors);
    }
    if (expr instanceof Power p) {
      return power(substitute(p.base(), symbol, value), substitute(p.exponent(), symbol, value));
    }
    if (expr instanceof Call c) {
      return call(c.function(), substitute(c.argument(), symbol, value));
    }
    if (expr instanceof Integral i) {
      return i.variable().equals(symbol)
          ? i
          : new Integral(substitute(i.integrand(), symbol, value), i.variable());
    }
    RootSum r = (RootSum) expr;
    if (r.variable().equals(symbol)) {
      return r;
    }
    return new RootSum(
        substitute(r.polynomial(), symbol, value),
        r.variable(),
        substitute(r.body(), symbol, value));
  }

  /**
   * Rebuilds {@code expr} bottom-up, applying {@code rule} to every node after its children have
   * been rebuilt.
   */
  public static Expr transform(Expr expr, UnaryOperator<Expr> rule) {
    Expr rebuilt;
    if (expr instanceof Sum s) {
      List<Expr> terms = new ArrayList<>(s.terms().size());
      for (Expr term : s.terms()) {
        terms.add(transform(term, rule));
      }
      rebuilt = sum(terms);
    } else if (expr instanceof Product p) {
      List<Expr> factors = new ArrayList<>(p.factors().size());
      for (Expr factor : p.factors()) {
        factors.add(transform(factor, rule));
      }
      rebuilt = product(factors);
    } else if (expr instanceof Power p) {
      rebuilt = power(transform(p.base(), rule), transform(p.exponent(), rule));
    } else if (expr instanceof Call c) {
      rebuilt = call(c.function(), transform(c.argument(), rule));
    } else if (expr instanceof Integral i) {
      rebuilt = new Integral(transform(i.integrand(), rule), i.variable());
    } else if (expr instanceof RootSum r) {
      rebuilt = new RootSum(r.polynomial(), r.variable(), transform(r.body(), rule));
    } else {
      rebuilt = expr;
    }
    return rule.apply(rebuilt);
  }

  /** Distinct function applications in {@code expr}, innermost first. */
  public static List<Call> calls(Expr expr) {
    Set<Call> calls = new LinkedHashSet<>();
    collectCalls(expr, calls);
    return new ArrayList<>(calls);
  }

  private static void collectCalls(Expr expr, Set<Call> calls) {
    if (expr instanceof Sum s) {
      s.terms().forEach(term -> collectCalls(term, calls));
    } else if (expr instanceof Product p) {
      p.factors().forEach(factor -> collectCalls(factor, calls));
    } else if (expr instanceof Power p) {
      collectCalls(p.base(), calls);
      collectCalls(p.exponent(), calls);
    } else if (expr instanceof Call c) {
      collectCalls(c.argument(), calls);
      calls.add(c);
    } else if (expr instanceof Integral i) {
      collectCalls(i.integrand(), calls);
    } else if (expr instanceof RootSum r) {
      collectCalls(r.body(), calls);
    }
  }

  public static boolean isZero(Expr expr) {
    return expr instanceof Num n && n.isZero();
  }

  public static boolean isInteger(Expr expr) {
    return expr instanceof Num n && n.isInteger();
  }

  private static Scaled leadingCoefficient(Expr term) {
    if (term instanceof Num n) {
      return new Scaled(n.value(), Num.ONE);
    }
    if (term instanceof Product p && p.factors().get(0) instanceof Num n) {
      List<Expr> rest = p.factors().subList(1, p.factors().size());
      return new Scaled(n.value(), rest.size() == 1 ? rest.get(0) : new Product(rest));
    }
    return new Scaled(BigFraction.ONE, term);
  }

  private static Expr scale(BigFraction coefficient, Expr rest) {
    if (coefficient.equals(BigFraction.ONE)) {
      return rest;
    }
    if (rest instanceof Num n) {
      return new Num(n.value().multiply(coefficient));
    }
    List<Expr> factors = new ArrayList<>();
    factors.add(new Num(coefficient));
    if (rest instanceof Product p) {
      factors.addAll(p.factors());
    } else {
      factors.add(rest);
    }
    return new Product(factors);
  }

  private static int rank(Expr expr) {
    if (expr instanceof Num) {
      return 0;
    }
    if (expr instanceof Symbol) {
      return 1;
    }
    if (expr instanceof Power) {
      return 2;
    }
    if (expr instanceof Call) {
      return 3;
    }
    if (expr instanceof Product) {
      return 4;
    }
    if (expr instanceof Sum) {
      return 5;
    }
    return 6;
  }
}
