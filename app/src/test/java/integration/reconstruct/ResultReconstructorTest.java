package integration.reconstruct;

import static org.junit.jupiter.api.Assertions.assertEquals;

import integration.expr.Expr;
import integration.expr.ExprParser;
import org.junit.jupiter.api.Test;

final class ResultReconstructorTest {

  private static Expr trigonometric(String residual, String integrand) {
    return ResultReconstructor.trigonometric(
        ExprParser.parse(residual), ExprParser.parse(integrand));
  }

  @Test
  void halfAngleTangentReturnsToTheOriginalAngle() {
    assertEquals(
        ExprParser.parse("sin(x)/(1 + cos(x))"), trigonometric("tan(x/2)", "sin(x)/x"));
  }

  @Test
  void complexExponentialBecomesCosinePlusISine() {
    assertEquals(
        ExprParser.parse("x*(cos(x) + I*sin(x))"), trigonometric("x*exp(I*x)", "cos(x)/x"));
  }

  @Test
  void integerPowersOfComplexExponentialsAreFolded() {
    assertEquals(
        ExprParser.parse("cos(2*x) + I*sin(2*x)"), trigonometric("exp(I*x)^2", "sin(x)^2/x"));
  }

  @Test
  void applicationsOfTheIntegrandAreKept() {
    assertEquals(ExprParser.parse("tan(x)/x"), trigonometric("tan(x)/x", "tan(x)/x + x"));
  }
}
