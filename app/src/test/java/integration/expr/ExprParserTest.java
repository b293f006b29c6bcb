package integration.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class ExprParserTest {
  private static final Symbol X = new Symbol("x");

  @Test
  void collectsLikeTermsAndFactors() {
    assertEquals(ExprParser.parse("2*x"), ExprParser.parse("x + x"), "x + x = 2x");
    assertEquals(Exprs.power(X, 2), ExprParser.parse("x*x"), "x*x = x^2");
    assertEquals(Num.ZERO, ExprParser.parse("x - x"), "x - x = 0");
  }

  @Test
  void literalsAreExactRationals() {
    assertEquals(new Num(new BigFraction(1, 2)), ExprParser.parse("2/4"));
    assertEquals(new Num(new BigFraction(1, 4)), ExprParser.parse("0.25"));
    assertEquals(Num.of(-8), ExprParser.parse("-2^3"), "Unary minus binds looser than ^");
  }

  @Test
  void functionAliasesMapToCanonicalNames() {
    assertEquals(Exprs.call(FunctionName.LOG, X), ExprParser.parse("ln(x)"));
    assertEquals(Exprs.call(FunctionName.ATAN, X), ExprParser.parse("arctan(x)"));
  }

  @Test
  void imaginaryUnitSquaresToMinusOne() {
    assertEquals(Num.MINUS_ONE, ExprParser.parse("I*I"));
  }

  @Test
  void squareRootsOfNumbersAreSimplified() {
    assertEquals(ExprParser.parse("2*sqrt(2)"), ExprParser.parse("sqrt(8)"));
    assertEquals(ExprParser.parse("sqrt(2)/4"), ExprParser.parse("sqrt(1/8)"));
    assertEquals(Num.of(3), ExprParser.parse("sqrt(9)"));
    assertEquals(Num.of(2), ExprParser.parse("2^(1/2)*2^(1/2)"));
    assertEquals("sqrt(2)", ExprPrinter.print(ExprParser.parse("8^(1/2)/2")));
  }

  @Test
  void printedFormParsesBack() {
    for (String source :
        new String[] {"(x^3+x^2+x+2)/(x^4+3*x^2+2)", "sin(x)/(1+cos(x)^2)", "exp(-x^2)/3"}) {
      Expr expr = ExprParser.parse(source);
      assertEquals(expr, ExprParser.parse(ExprPrinter.print(expr)), () -> "Round trip " + source);
    }
  }

  @Test
  void malformedInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ExprParser.parse("(x + 1"));
    assertThrows(IllegalArgumentException.class, () -> ExprParser.parse("x +"));
    assertThrows(IllegalArgumentException.class, () -> ExprParser.parse("  "));
    assertThrows(IllegalArgumentException.class, () -> ExprParser.parse("foo(x)"));
  }
}
