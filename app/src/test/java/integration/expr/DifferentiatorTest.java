package integration.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class DifferentiatorTest {
  private static final Symbol X = new Symbol("x");

  private static void assertDerivative(String expected, String source) {
    assertEquals(
        ExprParser.parse(expected),
        Differentiator.differentiate(ExprParser.parse(source), X),
        () -> "D(" + source + ")");
  }

  @Test
  void powerAndChainRules() {
    assertDerivative("3*x^2", "x^3");
    assertDerivative("2*x*exp(x^2)", "exp(x^2)");
    assertDerivative("1/x", "log(x)");
    assertDerivative("cos(x)", "sin(x)");
  }

  @Test
  void constantsDifferentiateToZero() {
    assertEquals(Num.ZERO, Differentiator.differentiate(ExprParser.parse("exp(2) + 7"), X));
    assertEquals(
        Num.ZERO, Differentiator.differentiate(ExprParser.parse("y^2"), X), "Other symbols");
  }

  @Test
  void integralOfVariableDifferentiatesToIntegrand() {
    Expr integrand = ExprParser.parse("exp(x^2)");
    assertEquals(integrand, Differentiator.differentiate(new Integral(integrand, X), X));
  }
}
