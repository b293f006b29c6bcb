package integration.expr;

import integration.algebra.Rationals;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;

/** Renders expressions in the infix syntax accepted by {@link ExprParser}. */
public final class ExprPrinter {
  private static final int SUM = 1;
  private static final int PRODUCT = 2;
  private static final int POWER = 4;
  private static final int ATOM = 5;
  private static final BigFraction HALF = new BigFraction(1, 2);

  private ExprPrinter() {}

  public static String print(Expr expr) {
    return print(expr, 0);
  }

  private static String print(Expr expr, int context) {
    if (expr instanceof Num n) {
      return number(n.value(), context);
    }
    if (expr instanceof Symbol s) {
      return s.name();
    }
    if (expr instanceof Sum s) {
      return wrap(sum(s), context > SUM);
    }
    if (expr instanceof Product p) {
      return wrap(product(p), context > PRODUCT);
    }
    if (expr instanceof Power p) {
      return power(p, context);
    }
    if (expr instanceof Call c) {
      return c.function().symbol() + "(" + print(c.argument(), 0) + ")";
    }
    if (expr instanceof Integral i) {
      return "integrate(" + print(i.integrand(), 0) + ", " + i.variable().name() + ")";
    }
    RootSum r = (RootSum) expr;
    return "RootSum("
        + print(r.polynomial(), 0)
        + ", "
        + r.variable().name()
        + " -> "
        + print(r.body(), 0)
        + ")";
  }

  private static String number(BigFraction value, int context) {
    String text = Rationals.format(value);
    boolean compound = Rationals.signum(value) < 0 || !Rationals.isInteger(value);
    return wrap(text, compound && context >= POWER);
  }

  private static String sum(Sum sum) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < sum.terms().size(); i++) {
      Expr term = sum.terms().get(i);
      if (i == 0) {
        out.append(print(term, SUM));
      } else if (isNegative(term)) {
        out.append(" - ").append(print(Exprs.negate(term), PRODUCT));
      } else {
        out.append(" + ").append(print(term, SUM));
      }
    }
    return out.toString();
  }

  private static String product(Product product) {
    BigFraction coefficient = BigFraction.ONE;
    List<String> numerator = new ArrayList<>();
    List<String> denominator = new ArrayList<>();
    for (Expr factor : product.factors()) {
      if (factor instanceof Num n) {
        coefficient = coefficient.multiply(n.value());
      } else if (factor instanceof Power p && p.exponent() instanceof Num e && e.isNegative()) {
        Expr inverted = Exprs.power(p.base(), new Num(e.value().negate()));
        denominator.add(print(inverted, PRODUCT + 1));
      } else {
        numerator.add(print(factor, PRODUCT + 1));
      }
    }
    StringBuilder out = new StringBuilder();
    if (Rationals.signum(coefficient) < 0) {
      out.append('-');
      coefficient = coefficient.negate();
    }
    BigInteger top = coefficient.getNumerator();
    BigInteger bottom = coefficient.getDenominator();
    if (!top.equals(BigInteger.ONE) || numerator.isEmpty()) {
      numerator.add(0, top.toString());
    }
    if (!bottom.equals(BigInteger.ONE)) {
      denominator.add(0, bottom.toString());
    }
    out.append(String.join("*", numerator));
    if (!denominator.isEmpty()) {
      out.append('/');
      String joined = String.join("*", denominator);
      out.append(denominator.size() == 1 ? joined : "(" + joined + ")");
    }
    return out.toString();
  }

  private static String power(Power power, int context) {
    if (power.exponent() instanceof Num e && e.isNegative()) {
      Expr inverted = Exprs.power(power.base(), new Num(e.value().negate()));
      return wrap("1/" + print(inverted, PRODUCT + 1), context > SUM);
    }
    if (power.exponent() instanceof Num e && e.value().equals(HALF)) {
      return "sqrt(" + print(power.base(), 0) + ")";
    }
    return print(power.base(), POWER + 1) + "^" + print(power.exponent(), ATOM);
  }

  private static boolean isNegative(Expr term) {
    if (term instanceof Num n) {
      return n.isNegative();
    }
    return term instanceof Product p && p.factors().get(0) instanceof Num n && n.isNegative();
  }

  private static String wrap(String text, boolean parenthesize) {
    return parenthesize ? "(" + text + ")" : text;
  }
}
