package integration.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import integration.core.IntegrationResult;
import integration.expr.Call;
import integration.expr.Differentiator;
import integration.expr.Expr;
import integration.expr.Num;
import integration.expr.Power;
import integration.expr.Product;
import integration.expr.Sum;
import integration.expr.Symbol;

/**
 * Evaluates real expressions in double precision. Used for results with radicals, which the
 * exact derivative check cannot convert into a tower.
 */
public final class NumericEvaluation {

  private NumericEvaluation() {}

  public static double evaluate(Expr expr, Symbol variable, double at) {
    if (expr instanceof Num n) {
      return n.value().doubleValue();
    }
    if (expr instanceof Symbol s) {
      if (!s.equals(variable)) {
        throw new IllegalArgumentException("Free symbol " + s);
      }
      return at;
    }
    if (expr instanceof Sum s) {
      double sum = 0;
      for (Expr term : s.terms()) {
        sum += evaluate(term, variable, at);
      }
      return sum;
    }
    if (expr instanceof Product p) {
      double product = 1;
      for (Expr factor : p.factors()) {
        product *= evaluate(factor, variable, at);
      }
      return product;
    }
    if (expr instanceof Power p) {
      return Math.pow(evaluate(p.base(), variable, at), evaluate(p.exponent(), variable, at));
    }
    if (expr instanceof Call c) {
      double u = evaluate(c.argument(), variable, at);
      return switch (c.function()) {
        case EXP -> Math.exp(u);
        case LOG -> Math.log(Math.abs(u));
        case SIN -> Math.sin(u);
        case COS -> Math.cos(u);
        case TAN -> Math.tan(u);
        case ATAN -> Math.atan(u);
        case SQRT -> Math.sqrt(u);
        case SINH -> Math.sinh(u);
        case COSH -> Math.cosh(u);
        case TANH -> Math.tanh(u);
        default -> throw new IllegalArgumentException("Cannot evaluate " + c);
      };
    }
    throw new IllegalArgumentException("Cannot evaluate " + expr);
  }

  /** Asserts a closed result whose derivative agrees with the integrand at every point. */
  public static void assertDerivativeAgrees(IntegrationResult result, double... points) {
    IntegrationResult.Closed closed = assertInstanceOf(IntegrationResult.Closed.class, result);
    Symbol x = closed.variable();
    Expr derivative = Differentiator.differentiate(closed.antiderivative(), x);
    for (double at : points) {
      double expected = evaluate(closed.integrand(), x, at);
      double actual = evaluate(derivative, x, at);
      assertEquals(
          expected,
          actual,
          1e-9 * Math.max(1, Math.abs(expected)),
          () -> "D(" + closed.antiderivative() + ") at " + at);
    }
  }
}
