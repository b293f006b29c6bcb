package integration.risch;

import static integration.risch.RischTestSupport.element;
import static integration.risch.RischTestSupport.tower;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import integration.algebra.Polynomials;
import integration.tower.ExtensionLevel;
import integration.tower.Tower;
import integration.tower.TowerElement;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class HermiteReductionTest {

  private static HermiteReduction.Result<BigFraction> reduce(
      ExtensionLevel<BigFraction> level, TowerElement<BigFraction> f) {
    return HermiteReduction.reduce(level, level.numerator(f), level.denominator(f));
  }

  private static void assertDecomposition(
      ExtensionLevel<BigFraction> level,
      TowerElement<BigFraction> f,
      HermiteReduction.Result<BigFraction> result) {
    TowerElement<BigFraction> rebuilt =
        level.add(
            level.add(level.derive(result.g()), level.polynomial(result.polynomial())),
            level.fraction(result.numerator(), result.denominator()));
    assertTrue(level.isZero(level.subtract(rebuilt, f)), "f = D(g) + p + r/d*");
    assertEquals(
        1,
        Polynomials.squareFree(result.denominator()).size(),
        "The remaining denominator is square-free");
  }

  @Test
  void reducesSquaredQuadratic() {
    Tower<BigFraction> tower = tower("1/(x^2+1)^2");
    ExtensionLevel<BigFraction> level = tower.top();
    TowerElement<BigFraction> f = element(tower, "1/(x^2+1)^2");
    HermiteReduction.Result<BigFraction> result = reduce(level, f);
    assertEquals(1, result.steps(), "One power of x^2 + 1 is removed");
    assertEquals(2, result.denominator().degree(), "d* = x^2 + 1");
    assertTrue(
        level.isZero(level.subtract(result.g(), element(tower, "x/(2*x^2+2)"))),
        () -> "g = x/(2(x^2 + 1)), got " + result.g());
    assertDecomposition(level, f, result);
  }

  @Test
  void reducesMixedMultiplicities() {
    String source = "(x^2+3)/((x-1)^3*(x+2)^2*x)";
    Tower<BigFraction> tower = tower(source);
    ExtensionLevel<BigFraction> level = tower.top();
    TowerElement<BigFraction> f = element(tower, source);
    HermiteReduction.Result<BigFraction> result = reduce(level, f);
    assertEquals(3, result.steps(), "(3 - 1) + (2 - 1) reduction steps");
    assertDecomposition(level, f, result);
  }

  @Test
  void squareFreeDenominatorsAreLeftAlone() {
    Tower<BigFraction> tower = tower("1/(x^2-2)");
    ExtensionLevel<BigFraction> level = tower.top();
    TowerElement<BigFraction> f = element(tower, "1/(x^2-2)");
    HermiteReduction.Result<BigFraction> result = reduce(level, f);
    assertEquals(0, result.steps());
    assertTrue(level.isZero(result.g()), "Nothing to reduce");
  }
}
