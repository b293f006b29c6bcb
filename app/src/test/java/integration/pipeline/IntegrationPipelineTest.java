package integration.pipeline;

import static integration.testing.IntegrationAssertions.X;
import static integration.testing.IntegrationAssertions.assertClosed;
import static integration.testing.IntegrationAssertions.assertPartial;
import static integration.testing.IntegrationAssertions.integrate;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import integration.algebra.CoefficientFieldKind;
import integration.core.AlgorithmFailureException;
import integration.core.ErrorKind;
import integration.core.IntegrationOptions;
import integration.core.IntegrationResult;
import integration.core.IntegrationRun;
import integration.core.UnsupportedConstructException;
import integration.core.diagnostics.DiagnosticCollector;
import integration.core.diagnostics.IntegrationDiagnosticReason;
import integration.core.diagnostics.IntegrationObserver;
import integration.expr.Call;
import integration.expr.ExprParser;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.expr.Integral;
import integration.frontend.TrigStrategy;
import integration.testing.NumericEvaluation;
import org.junit.jupiter.api.Test;

final class IntegrationPipelineTest {

  private static boolean uses(IntegrationResult result, FunctionName function) {
    return Exprs.calls(result.expression()).stream()
        .map(Call::function)
        .anyMatch(function::equals);
  }

  @Test
  void rationalFunctionWithLogAndArctangent() {
    IntegrationResult result = assertClosed("(x^3+x^2+x+2)/(x^4+3*x^2+2)");
    assertTrue(uses(result, FunctionName.LOG), () -> "log(x^2 + 2) in " + result.expression());
    assertTrue(uses(result, FunctionName.ATAN), () -> "atan(x) in " + result.expression());
  }

  @Test
  void arctangentStaysOverTheRationals() {
    IntegrationRun run =
        new IntegrationPipeline()
            .run(ExprParser.parse("1/(x^2+1)"), X, IntegrationOptions.defaults());
    assertEquals(IntegrationResult.Outcome.CLOSED, run.outcome());
    assertEquals(CoefficientFieldKind.RATIONAL, run.field(), "No algebraic numbers needed");
    assertFalse(run.restarted());
    assertTrue(uses(run.result(), FunctionName.ATAN), () -> "Got " + run.result().expression());
    assertTrue(run.elapsedMillis() >= 0, "Run time is measured");
  }

  @Test
  void nestedLogarithm() {
    IntegrationResult result = assertClosed("1/(x*log(x))");
    assertEquals(ExprParser.parse("log(log(x))"), result.expression());
  }

  @Test
  void logarithmOfExponentialSum() {
    IntegrationResult result = assertClosed("exp(x)/(1+exp(x))");
    assertEquals(ExprParser.parse("log(1+exp(x))"), result.expression());
  }

  @Test
  void gaussianIsLeftUnevaluated() {
    IntegrationResult result = integrate("exp(x^2)");
    assertEquals(IntegrationResult.Outcome.PARTIAL, result.outcome());
    assertEquals(new Integral(ExprParser.parse("exp(x^2)"), X), result.expression());
  }

  @Test
  void trigonometricIntegrandThroughHalfAngleTangent() {
    IntegrationResult result = assertClosed("sin(x)/(1+cos(x)^2)");
    assertTrue(uses(result, FunctionName.ATAN), () -> "Got " + result.expression());
  }

  @Test
  void partialResultKeepsTheIntegratedPart() {
    IntegrationResult.Partial partial = assertPartial("x + exp(x^2)");
    assertEquals(ExprParser.parse("x^2/2"), partial.integratedPart());
    assertEquals(ExprParser.parse("exp(x^2)"), partial.residual());
  }

  @Test
  void hyperbolicAndPolynomialTimesExponential() {
    assertClosed("cosh(x)");
    assertClosed("x*exp(x)");
    assertClosed("log(x)^2");
    assertClosed("1/(x^2+1)^2");
  }

  @Test
  void unsupportedConstructsDegradeByDefault() {
    IntegrationResult result = integrate("sqrt(x)");
    IntegrationResult.Failed failed = assertInstanceOf(IntegrationResult.Failed.class, result);
    assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, failed.kind());
    assertEquals(new Integral(ExprParser.parse("sqrt(x)"), X), result.expression());
  }

  @Test
  void unsupportedConstructsPropagateWhenNotCaught() {
    IntegrationOptions strict = IntegrationOptions.builder().catchUnsupported(false).build();
    assertThrows(UnsupportedConstructException.class, () -> integrate("sqrt(x)", strict));
  }

  @Test
  void irrationalResiduesRestartOverTheAlgebraicClosure() {
    DiagnosticCollector collector = new DiagnosticCollector();
    IntegrationRun run =
        new IntegrationPipeline(collector)
            .run(ExprParser.parse("1/(x^2-2)"), X, IntegrationOptions.defaults());
    assertTrue(run.restarted(), "sqrt(2) is not rational");
    assertEquals(CoefficientFieldKind.ALGEBRAIC_CLOSURE, run.field());
    assertTrue(collector.contains(IntegrationDiagnosticReason.FIELD_EXTENSION_RESTART));
    assertEquals(IntegrationResult.Outcome.CLOSED, run.outcome());
  }

  @Test
  void algebraicStartNeverRestarts() {
    IntegrationRun run =
        new IntegrationPipeline()
            .run(
                ExprParser.parse("1/(x^2-2)"),
                X,
                IntegrationOptions.defaults().withAlgebraicNumbers(true));
    assertFalse(run.restarted(), "Already in the algebraic closure");
    assertTrue(
        run.diagnostics().stream()
            .noneMatch(d -> d.reason() == IntegrationDiagnosticReason.FIELD_EXTENSION_RESTART));
  }

  @Test
  void towerIsReportedToTheObserver() {
    DiagnosticCollector collector = new DiagnosticCollector();
    new IntegrationPipeline(collector)
        .integrate(ExprParser.parse("log(x)"), X, IntegrationOptions.defaults());
    assertTrue(collector.contains(IntegrationDiagnosticReason.TOWER_BUILT));
  }

  @Test
  void exponentialTimesSineThroughTheCoupledSystem() {
    assertClosed("exp(x)*sin(x)");
    assertClosed("x*exp(x)*sin(x)");
  }

  @Test
  void squaredCosine() {
    assertClosed("cos(x)^2");
  }

  @Test
  void complexExponentialStrategy() {
    IntegrationRun run =
        new IntegrationPipeline()
            .run(
                ExprParser.parse("exp(x)*sin(x)"),
                X,
                IntegrationOptions.builder()
                    .trigStrategy(TrigStrategy.COMPLEX_EXPONENTIAL)
                    .build());
    assertEquals(IntegrationResult.Outcome.CLOSED, run.outcome());
    assertEquals(CoefficientFieldKind.ALGEBRAIC_CLOSURE, run.field());
    assertFalse(uses(run.result(), FunctionName.TAN), () -> "Got " + run.result().expression());
  }

  @Test
  void cubicAndQuarticResiduesInRadicals() {
    for (String integrand : new String[] {"1/(x^3-2)", "1/(x^4+1)"}) {
      IntegrationResult result = integrate(integrand);
      assertFalse(
          result.expression().toString().contains("RootSum"),
          () -> "Radicals expected in " + result.expression());
      assertTrue(uses(result, FunctionName.LOG), () -> "Got " + result.expression());
      assertTrue(uses(result, FunctionName.ATAN), () -> "Got " + result.expression());
      NumericEvaluation.assertDerivativeAgrees(result, 0.5, 3.0);
    }
  }

  @Test
  void squareRootsArePrintedSimplified() {
    IntegrationResult result = assertClosed("1/(x^2-2)");
    String printed = result.expression().toString();
    assertTrue(printed.contains("sqrt(2)"), () -> "Got " + printed);
    assertFalse(printed.contains("sqrt(1/"), () -> "Got " + printed);
  }

  @Test
  void partialResidualIsWrittenWithTheOriginalFunctions() {
    IntegrationResult.Partial partial = assertPartial("sin(x)/x");
    assertTrue(
        Exprs.calls(partial.residual()).stream().noneMatch(c -> c.function() == FunctionName.TAN),
        () -> "Got " + partial.residual());
  }

  @Test
  void algorithmFailuresDegradeByDefault() {
    IntegrationRun run =
        new IntegrationPipeline(failingOnTowers())
            .run(ExprParser.parse("log(x)"), X, IntegrationOptions.defaults());
    IntegrationResult.Failed failed =
        assertInstanceOf(IntegrationResult.Failed.class, run.result());
    assertEquals(ErrorKind.ALGORITHM_FAILURE, failed.kind());
    assertTrue(run.restarted(), "Retried over the algebraic closure first");
  }

  @Test
  void algorithmFailuresPropagateWhenNotCaught() {
    IntegrationOptions strict = IntegrationOptions.builder().catchAlgorithmFailure(false).build();
    IntegrationPipeline pipeline = new IntegrationPipeline(failingOnTowers());
    assertThrows(
        AlgorithmFailureException.class,
        () -> pipeline.run(ExprParser.parse("log(x)"), X, strict));
  }

  private static IntegrationObserver failingOnTowers() {
    return diagnostic -> {
      if (diagnostic.reason() == IntegrationDiagnosticReason.TOWER_BUILT) {
        throw new AlgorithmFailureException("No tower accepted");
      }
    };
  }
}
