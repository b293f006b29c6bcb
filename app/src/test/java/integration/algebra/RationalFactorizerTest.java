package integration.algebra;

import static integration.algebra.PolynomialTest.q;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class RationalFactorizerTest {
  private final RationalFactorizer factorizer = new RationalFactorizer(1_000_000L);

  @Test
  void splitsLinearFactorsFirst() {
    List<Polynomial<BigFraction>> factors = factorizer.factor(q(-1, 0, 0, 0, 1));
    assertEquals(
        Set.of(q(-1, 1), q(1, 1), q(1, 0, 1)),
        new HashSet<>(factors),
        "x^4 - 1 = (x - 1)(x + 1)(x^2 + 1)");
  }

  @Test
  void findsQuadraticFactorsWithoutRationalRoots() {
    Polynomial<BigFraction> p = q(2, 0, 3, 0, 1);
    List<Polynomial<BigFraction>> factors = factorizer.factor(p);
    assertEquals(2, factors.size(), "x^4 + 3x^2 + 2 = (x^2 + 1)(x^2 + 2)");
    assertTrue(factors.contains(q(1, 0, 1)), "x^2 + 1 is a factor");
    assertTrue(factors.contains(q(2, 0, 1)), "x^2 + 2 is a factor");
  }

  @Test
  void keepsIrreducibleCubicWhole() {
    List<Polynomial<BigFraction>> factors = factorizer.factor(q(-2, 0, 0, 1));
    assertEquals(List.of(q(-2, 0, 0, 1)), factors, "x^3 - 2 is irreducible over Q");
  }

  @Test
  void rationalRootsOfNonMonicPolynomial() {
    List<BigFraction> roots = factorizer.rationalRoots(q(1, -5, 6));
    assertEquals(
        Set.of(new BigFraction(1, 2), new BigFraction(1, 3)),
        new HashSet<>(roots),
        "6x^2 - 5x + 1 = (2x - 1)(3x - 1)");
  }

  @Test
  void rejectsNonPositiveSearchBound() {
    assertThrows(IllegalArgumentException.class, () -> new RationalFactorizer(0));
  }
}
