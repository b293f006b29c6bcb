package integration.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class CoefficientFactorizationTest {
  private static final AlgebraicClosureField FIELD = AlgebraicClosureField.INSTANCE;
  private static final RationalFactorizer FACTORIZER = new RationalFactorizer(1_000_000L);

  private static ComplexRational c(long real, long imaginary) {
    return new ComplexRational(new BigFraction(real), new BigFraction(imaginary));
  }

  @Test
  void nonRealPolynomialFactorsThroughItsNorm() {
    // (x - i)(x + 2) = x^2 + (2 - i) x - 2i
    Polynomial<ComplexRational> p = Polynomial.of(FIELD, c(0, -2), c(2, -1), c(1, 0));
    List<Polynomial<ComplexRational>> factors =
        CoefficientFactorization.factor(FIELD, p, FACTORIZER);
    assertEquals(2, factors.size(), "Two linear factors");
    assertTrue(factors.contains(Polynomial.of(FIELD, c(0, -1), c(1, 0))), "x - i");
    assertTrue(factors.contains(Polynomial.of(FIELD, c(2, 0), c(1, 0))), "x + 2");
  }

  @Test
  void positiveIntegerRootsIgnoreOtherRoots() {
    // (z - 3)(z + 1)(2z - 1)
    Polynomial<BigFraction> p = PolynomialTest.q(3, -4, -5, 2);
    assertEquals(
        List.of(3),
        CoefficientFactorization.positiveIntegerRoots(RationalField.INSTANCE, p, FACTORIZER));
  }

  @Test
  void toRationalRejectsImaginaryCoefficients() {
    assertTrue(
        CoefficientFactorization.toRational(FIELD, Polynomial.of(FIELD, c(0, 1), c(1, 0)))
            .isEmpty(),
        "x + i has a non-rational coefficient");
  }
}
