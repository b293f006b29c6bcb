package integration.risch;

import static integration.risch.RischTestSupport.element;
import static integration.risch.RischTestSupport.integrator;
import static integration.risch.RischTestSupport.tower;
import static org.junit.jupiter.api.Assertions.assertTrue;

import integration.tower.ExtensionLevel;
import integration.tower.Tower;
import integration.tower.TowerElement;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class RischDifferentialEquationTest {

  private static Optional<TowerElement<BigFraction>> solve(
      Tower<BigFraction> tower, String f, String g) {
    RischIntegrator<BigFraction> integrator = integrator(tower);
    RischDifferentialEquation<BigFraction> rde =
        new RischDifferentialEquation<>(integrator::integrate, RischTestSupport.FACTORIZER);
    return rde.solve(tower.top(), element(tower, f), element(tower, g));
  }

  @Test
  void polynomialSolutionOverRationalFunctions() {
    Tower<BigFraction> tower = tower("x");
    Optional<TowerElement<BigFraction>> y = solve(tower, "1", "x");
    assertTrue(y.isPresent(), "D(y) + y = x has y = x - 1");
    ExtensionLevel<BigFraction> top = tower.top();
    assertTrue(top.isZero(top.subtract(y.get(), element(tower, "x - 1"))), () -> "y = " + y);
  }

  @Test
  void rationalSolutionWithPoles() {
    Tower<BigFraction> tower = tower("x");
    // y = 1/x^2
    Optional<TowerElement<BigFraction>> y = solve(tower, "1/x", "-1/x^3");
    assertTrue(y.isPresent(), "A solution with a pole at 0 exists");
  }

  @Test
  void gaussianEquationHasNoRationalSolution() {
    Tower<BigFraction> tower = tower("x");
    assertTrue(solve(tower, "2*x", "1").isEmpty(), "D(y) + 2x y = 1 is the erf equation");
  }

  @Test
  void zeroRightHandSideHasTheZeroSolution() {
    Tower<BigFraction> tower = tower("x");
    Optional<TowerElement<BigFraction>> y = solve(tower, "x", "0");
    assertTrue(y.isPresent() && tower.top().isZero(y.get()));
  }

  @Test
  void polynomialRightHandSideOverALogarithm() {
    Tower<BigFraction> tower = tower("log(x)");
    // y = log(x): D(y) + y = 1/x + log(x)
    Optional<TowerElement<BigFraction>> y = solve(tower, "1", "1/x + log(x)");
    assertTrue(y.isPresent(), "y = log(x) solves D(y) + y = 1/x + log(x)");
    ExtensionLevel<BigFraction> top = tower.top();
    assertTrue(top.isZero(top.subtract(y.get(), element(tower, "log(x)"))), () -> "y = " + y);
  }
}
