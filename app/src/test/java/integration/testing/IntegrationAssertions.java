package integration.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;

import integration.core.IntegrationOptions;
import integration.core.IntegrationResult;
import integration.expr.ExprParser;
import integration.expr.Symbol;
import integration.pipeline.DerivativeCheck;
import integration.pipeline.IntegrationPipeline;

/** Integrates test inputs and checks results by differentiating them back. */
public final class IntegrationAssertions {
  public static final Symbol X = new Symbol("x");

  private IntegrationAssertions() {}

  public static IntegrationResult integrate(String integrand) {
    return integrate(integrand, IntegrationOptions.defaults());
  }

  public static IntegrationResult integrate(String integrand, IntegrationOptions options) {
    return new IntegrationPipeline().integrate(ExprParser.parse(integrand), X, options);
  }

  /** Integrates and asserts a closed result whose derivative is the integrand. */
  public static IntegrationResult assertClosed(String integrand) {
    IntegrationResult result = integrate(integrand);
    assertEquals(
        IntegrationResult.Outcome.CLOSED,
        result.outcome(),
        () -> integrand + " gave " + result.expression());
    assertRoundTrip(result);
    return result;
  }

  /** Integrates and asserts a partial result whose parts differentiate back to the integrand. */
  public static IntegrationResult.Partial assertPartial(String integrand) {
    IntegrationResult result = integrate(integrand);
    assertEquals(
        IntegrationResult.Outcome.PARTIAL,
        result.outcome(),
        () -> integrand + " gave " + result.expression());
    assertRoundTrip(result);
    return (IntegrationResult.Partial) result;
  }

  public static void assertRoundTrip(IntegrationResult result) {
    assertEquals(
        DerivativeCheck.Verdict.VERIFIED,
        DerivativeCheck.verify(result),
        () -> "D(" + result.expression() + ") should be " + result.integrand());
  }
}
