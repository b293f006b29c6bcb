package integration.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class PolynomialTest {

  static Polynomial<BigFraction> q(long... coefficients) {
    return Polynomial.of(
        RationalField.INSTANCE,
        Arrays.stream(coefficients).mapToObj(BigFraction::new).toList());
  }

  @Test
  void trailingZerosAreDropped() {
    Polynomial<BigFraction> p = q(1, 2, 0, 0);
    assertEquals(1, p.degree(), "Degree ignores zero leading coefficients");
    assertTrue(q(0, 0).isZero(), "All-zero coefficients give the zero polynomial");
    assertEquals(BigFraction.ZERO, p.coefficient(5), "Coefficients past the degree are zero");
  }

  @Test
  void divisionReconstructsDividend() {
    Polynomial<BigFraction> a = q(-1, 0, 0, 1);
    Polynomial<BigFraction> b = q(1, 1);
    Polynomial.DivisionResult<BigFraction> division = a.divideAndRemainder(b);
    assertEquals(q(1, -1, 1), division.quotient(), "x^3 - 1 = (x + 1)(x^2 - x + 1) - 2");
    assertEquals(q(-2), division.remainder(), "Remainder of x^3 - 1 by x + 1");
    assertEquals(a, division.quotient().multiply(b).add(division.remainder()));
  }

  @Test
  void gcdIsMonic() {
    Polynomial<BigFraction> a = q(-2, 0, 2);
    Polynomial<BigFraction> b = q(3, 3);
    assertEquals(q(1, 1), a.gcd(b), "gcd(2x^2 - 2, 3x + 3) = x + 1");
  }

  @Test
  void extendedGcdSatisfiesBezoutIdentity() {
    Polynomial<BigFraction> a = q(1, 0, 1);
    Polynomial<BigFraction> b = q(0, 1);
    Polynomial.ExtendedGcd<BigFraction> xgcd = a.extendedGcd(b);
    assertTrue(xgcd.gcd().isOne(), "x^2 + 1 and x are coprime");
    assertEquals(
        xgcd.gcd(), xgcd.s().multiply(a).add(xgcd.t().multiply(b)), "s a + t b = gcd");
  }

  @Test
  void derivativeComposeAndEvaluate() {
    Polynomial<BigFraction> p = q(1, 2, 3);
    assertEquals(q(2, 6), p.derivative(), "D(3x^2 + 2x + 1)");
    assertEquals(new BigFraction(17), p.evaluate(new BigFraction(2)), "p(2)");
    assertEquals(q(2, -4, 3), p.compose(q(-1, 1)), "p(x - 1) = 3x^2 - 4x + 2");
  }

  @Test
  void exactQuotientRejectsRemainders() {
    assertThrows(ArithmeticException.class, () -> q(1, 0, 1).exactQuotient(q(1, 1)));
  }
}
