package integration.risch;

import static integration.risch.RischTestSupport.element;
import static integration.risch.RischTestSupport.integrator;
import static integration.risch.RischTestSupport.tower;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import integration.core.diagnostics.DiagnosticCollector;
import integration.core.diagnostics.IntegrationDiagnosticReason;
import integration.tower.ExtensionLevel;
import integration.tower.Tower;
import integration.tower.TowerElement;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

final class RischIntegratorTest {

  private static Antiderivative<BigFraction> integrate(String source) {
    Tower<BigFraction> tower = tower(source);
    return integrator(tower).integrate(element(tower, source));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "x^3 - 2*x + 5",
        "1/(x^2+1)^2",
        "(x^3+x^2+x+2)/(x^4+3*x^2+2)",
        "x*exp(x)",
        "exp(x)/(1+exp(x))",
        "log(x)^2",
        "1/(x*log(x))",
        "log(x)/x",
        "(2*x+1)*exp(x^2+x)"
      })
  void elementaryIntegrandsIntegrateCompletely(String source) {
    Tower<BigFraction> tower = tower(source);
    ExtensionLevel<BigFraction> top = tower.top();
    TowerElement<BigFraction> f = element(tower, source);
    Antiderivative<BigFraction> result = integrator(tower).integrate(f);
    assertTrue(result.isElementary(top), () -> source + " left " + result.residual());
    Optional<TowerElement<BigFraction>> derivative = result.derivative(top);
    derivative.ifPresent(
        d -> assertTrue(top.isZero(top.subtract(d, f)), () -> "D(result) != " + source));
  }

  @ParameterizedTest
  @ValueSource(strings = {"exp(x^2)", "1/log(x)", "exp(x)/x"})
  void nonElementaryIntegrandsLeaveAResidual(String source) {
    Tower<BigFraction> tower = tower(source);
    Antiderivative<BigFraction> result = integrate(source);
    assertFalse(result.isElementary(tower.top()), () -> source + " has no elementary integral");
  }

  @Test
  void residualIsReportedToTheObserver() {
    Tower<BigFraction> tower = tower("exp(x^2)");
    DiagnosticCollector collector = new DiagnosticCollector();
    new RischIntegrator<>(tower, RischTestSupport.FACTORIZER, collector)
        .integrate(element(tower, "exp(x^2)"));
    assertTrue(collector.contains(IntegrationDiagnosticReason.LEVEL_DISPATCHED));
    assertTrue(collector.contains(IntegrationDiagnosticReason.NON_ELEMENTARY));
  }
}
