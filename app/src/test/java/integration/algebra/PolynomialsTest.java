package integration.algebra;

import static integration.algebra.PolynomialTest.q;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class PolynomialsTest {

  @Test
  void resultantOfCoprimePolynomials() {
    assertEquals(
        new BigFraction(2),
        Polynomials.resultant(q(1, 0, 1), q(-1, 1)),
        "res(x^2 + 1, x - 1) = (i - 1)(-i - 1) = 2");
  }

  @Test
  void resultantVanishesOnCommonFactor() {
    assertEquals(
        BigFraction.ZERO,
        Polynomials.resultant(q(-1, 0, 1), q(1, 1)),
        "x^2 - 1 and x + 1 share a root");
  }

  @Test
  void squareFreeDecompositionOrdersByMultiplicity() {
    // (x - 1)^2 (x + 2)
    List<Polynomial<BigFraction>> parts = Polynomials.squareFree(q(2, -3, 0, 1));
    assertEquals(List.of(q(2, 1), q(-1, 1)), parts, "[x + 2, x - 1]");
  }

  @Test
  void squareFreeOfConstantIsEmpty() {
    assertEquals(List.of(), Polynomials.squareFree(q(5)), "Constants have no factors");
  }

  @Test
  void diophantineRespectsDegreeBound() {
    Polynomials.Bezout<BigFraction> bezout = Polynomials.diophantine(q(0, 1), q(1, 1), q(1));
    assertEquals(q(-1), bezout.s(), "s for s x + t (x + 1) = 1");
    assertEquals(q(1), bezout.t(), "t for s x + t (x + 1) = 1");
  }

  @Test
  void diophantineRejectsRightHandSideOutsideIdeal() {
    assertThrows(
        ArithmeticException.class, () -> Polynomials.diophantine(q(0, 1), q(0, 0, 1), q(1)));
  }

  @Test
  void interpolationRecoversPolynomial() {
    RationalField field = RationalField.INSTANCE;
    Polynomial<BigFraction> p =
        Polynomials.interpolate(
            field,
            List.of(new BigFraction(0), new BigFraction(1), new BigFraction(2)),
            List.of(new BigFraction(1), new BigFraction(2), new BigFraction(5)));
    assertEquals(q(1, 0, 1), p, "Points of x^2 + 1");
  }
}
