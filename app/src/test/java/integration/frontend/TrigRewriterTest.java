package integration.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import integration.core.UnsupportedConstructException;
import integration.expr.Call;
import integration.expr.Expr;
import integration.expr.ExprParser;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.expr.Symbol;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TrigRewriterTest {
  private static final Symbol X = new Symbol("x");

  private static RewriteResult rewrite(String source, TrigStrategy strategy) {
    return TrigRewriter.rewrite(ExprParser.parse(source), X, strategy);
  }

  private static List<FunctionName> functions(Expr expr) {
    return Exprs.calls(expr).stream().map(Call::function).distinct().toList();
  }

  @Test
  void hyperbolicFunctionsBecomeExponentials() {
    RewriteResult result = rewrite("cosh(x) + tanh(x)", TrigStrategy.HALF_ANGLE);
    assertFalse(result.requiresAlgebraicNumbers(), "No trigonometric functions involved");
    assertEquals(List.of(FunctionName.EXP), functions(result.expression()));
  }

  @Test
  void commensurableAnglesUseHalfAngleTangent() {
    RewriteResult result = rewrite("sin(x)/(1+cos(x)^2)", TrigStrategy.HALF_ANGLE);
    assertFalse(result.requiresAlgebraicNumbers(), "Half-angle stays over Q");
    List<Call> calls = Exprs.calls(result.expression());
    assertEquals(1, calls.size(), () -> "One tangent expected in " + result.expression());
    assertEquals(FunctionName.TAN, calls.get(0).function());
    assertEquals(ExprParser.parse("x/2"), calls.get(0).argument(), "tau = tan(x/2)");
  }

  @Test
  void multipleAnglesShareTheGcdTangent() {
    RewriteResult result = rewrite("sin(2*x) + cos(3*x)", TrigStrategy.HALF_ANGLE);
    List<Call> calls = Exprs.calls(result.expression());
    assertEquals(1, calls.size(), () -> "One tangent expected in " + result.expression());
    assertEquals(ExprParser.parse("x/2"), calls.get(0).argument(), "gcd of 2 and 3 is 1");
  }

  @Test
  void tangentOfHalfTheAngleBecomesTheGenerator() {
    RewriteResult result = rewrite("tan(x/2) + cos(x)", TrigStrategy.HALF_ANGLE);
    List<Call> calls = Exprs.calls(result.expression());
    assertEquals(1, calls.size(), () -> "One tangent expected in " + result.expression());
    assertEquals(ExprParser.parse("x/2"), calls.get(0).argument(), "tan(x/2) is tau itself");
  }

  @Test
  void tangentMultiplesUseTheAdditionFormula() {
    RewriteResult result = rewrite("tan(2*x) + sin(2*x)", TrigStrategy.HALF_ANGLE);
    List<Call> calls = Exprs.calls(result.expression());
    assertEquals(1, calls.size(), () -> "One tangent expected in " + result.expression());
    assertEquals(X, calls.get(0).argument(), "tau = tan(x)");
  }

  @Test
  void singleTangentIsKept() {
    Expr tan = ExprParser.parse("tan(x)^2 + 1");
    RewriteResult result = TrigRewriter.rewrite(tan, X, TrigStrategy.HALF_ANGLE);
    assertEquals(tan, result.expression(), "tan(x) is already a generator");
    assertFalse(result.requiresAlgebraicNumbers());
  }

  @Test
  void incommensurableAnglesNeedComplexExponentials() {
    RewriteResult result = rewrite("sin(x)*cos(x^2)", TrigStrategy.HALF_ANGLE);
    assertTrue(result.requiresAlgebraicNumbers(), "exp(I*u) needs Q(I)");
    assertEquals(List.of(FunctionName.EXP), functions(result.expression()));
  }

  @Test
  void complexStrategyIsHonoured() {
    assertTrue(rewrite("sin(x)", TrigStrategy.COMPLEX_EXPONENTIAL).requiresAlgebraicNumbers());
  }

  @Test
  void integralMultiplesOfLogarithmsLeaveExponentials() {
    assertEquals(
        ExprParser.parse("x^2"), rewrite("exp(2*log(x))", TrigStrategy.HALF_ANGLE).expression());
    assertEquals(
        ExprParser.parse("exp(x*log(x))"), rewrite("x^x", TrigStrategy.HALF_ANGLE).expression());
  }

  @Test
  void fractionalMultiplesOfLogarithmsAreAlgebraic() {
    assertThrows(
        UnsupportedConstructException.class,
        () -> rewrite("exp(log(x)/2)", TrigStrategy.HALF_ANGLE));
  }
}
