package integration.pipeline;

import static integration.testing.IntegrationAssertions.X;
import static org.junit.jupiter.api.Assertions.assertEquals;

import integration.core.ErrorKind;
import integration.core.IntegrationResult;
import integration.expr.ExprParser;
import org.junit.jupiter.api.Test;

final class DerivativeCheckTest {

  private static IntegrationResult closed(String integrand, String antiderivative) {
    return new IntegrationResult.Closed(
        ExprParser.parse(integrand), X, ExprParser.parse(antiderivative));
  }

  @Test
  void acceptsCorrectAntiderivatives() {
    assertEquals(DerivativeCheck.Verdict.VERIFIED, DerivativeCheck.verify(closed("1/x", "log(x)")));
    assertEquals(
        DerivativeCheck.Verdict.VERIFIED,
        DerivativeCheck.verify(closed("1/(x^2+1)", "atan(x)")));
  }

  @Test
  void rejectsWrongAntiderivatives() {
    assertEquals(
        DerivativeCheck.Verdict.MISMATCH, DerivativeCheck.verify(closed("x", "x^3/3")));
  }

  @Test
  void failuresCannotBeChecked() {
    IntegrationResult failed =
        new IntegrationResult.Failed(
            ExprParser.parse("sqrt(x)"), X, ErrorKind.UNSUPPORTED_CONSTRUCT, "sqrt");
    assertEquals(DerivativeCheck.Verdict.UNVERIFIABLE, DerivativeCheck.verify(failed));
  }

  @Test
  void algebraicFunctionsCannotBeChecked() {
    assertEquals(
        DerivativeCheck.Verdict.UNVERIFIABLE,
        DerivativeCheck.verify(closed("sqrt(x)", "x*sqrt(x)")));
  }
}
