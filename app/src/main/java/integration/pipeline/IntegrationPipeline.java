package integration.pipeline;

import com.google.common.base.Stopwatch;
import integration.algebra.AlgebraicClosureField;
import integration.algebra.CoefficientField;
import integration.algebra.CoefficientFieldKind;
import integration.algebra.RationalFactorizer;
import integration.algebra.RationalField;
import integration.core.AlgorithmFailureException;
import integration.core.ErrorKind;
import integration.core.FieldExtensionRequiredException;
import integration.core.IntegrationException;
import integration.core.IntegrationOptions;
import integration.core.IntegrationResult;
import integration.core.IntegrationRun;
import integration.core.UnsupportedConstructException;
import integration.core.diagnostics.DiagnosticCollector;
import integration.core.diagnostics.IntegrationDiagnostic;
import integration.core.diagnostics.IntegrationObserver;
import integration.expr.Expr;
import integration.expr.Symbol;
import integration.frontend.RewriteResult;
import integration.frontend.TermClassifier;
import integration.frontend.TrigRewriter;
import integration.reconstruct.ResultReconstructor;
import integration.risch.Antiderivative;
import integration.risch.RischIntegrator;
import integration.tower.Term;
import integration.tower.Tower;
import integration.tower.TowerBuilder;
import integration.tower.TowerElement;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one integration: trigonometric rewrite, term classification, tower construction,
 * Risch integration and reconstruction. Starts over the rationals unless asked otherwise and
 * restarts once over the algebraic closure when the rationals do not suffice. Failures are
 * degraded to an unevaluated integral according to the options.
 */
public final class IntegrationPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(IntegrationPipeline.class);

  private final IntegrationObserver observer;

  public IntegrationPipeline() {
    this(IntegrationObserver.none());
  }

  public IntegrationPipeline(IntegrationObserver observer) {
    this.observer = observer == null ? IntegrationObserver.none() : observer;
  }

  public IntegrationResult integrate(Expr integrand, Symbol variable, IntegrationOptions options) {
    return run(integrand, variable, options).result();
  }

  /**
   * Integrates and reports how the result was obtained.
   *
   * @throws UnsupportedConstructException when {@code catchUnsupported} is off
   * @throws AlgorithmFailureException when {@code catchAlgorithmFailure} is off
   * @throws integration.core.MalformedTowerException always propagated
   */
  public IntegrationRun run(Expr integrand, Symbol variable, IntegrationOptions options) {
    Objects.requireNonNull(integrand, "integrand");
    Objects.requireNonNull(variable, "variable");
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final IntegrationOptions opts = IntegrationOptions.normalize(options);
    DiagnosticCollector collector = new DiagnosticCollector();
    IntegrationObserver sink = collector.andThen(observer);
    LOG.info("Integrating {} with respect to {}", integrand, variable);

    boolean algebraic = opts.useAlgebraicNumbers();
    boolean restarted = false;
    while (true) {
      CoefficientFieldKind field =
          algebraic ? CoefficientFieldKind.ALGEBRAIC_CLOSURE : CoefficientFieldKind.RATIONAL;
      try {
        Attempt attempt =
            algebraic
                ? attempt(integrand, variable, opts, AlgebraicClosureField.INSTANCE, sink)
                : attempt(integrand, variable, opts, RationalField.INSTANCE, sink);
        LOG.info(
            "Integration of {} finished as {} in {} ms",
            integrand,
            attempt.result().outcome(),
            stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return new IntegrationRun(
            attempt.result(),
            field,
            attempt.generators(),
            collector.diagnostics(),
            stopwatch.elapsed(TimeUnit.MILLISECONDS),
            restarted);
      } catch (FieldExtensionRequiredException ex) {
        if (algebraic) {
          AlgorithmFailureException failure =
              new AlgorithmFailureException(
                  "Algebraic numbers did not suffice: " + ex.getMessage(), ex);
          return degrade(
              integrand, variable, opts, failure, field, collector, stopwatch, restarted);
        }
        restart(ex, sink);
      } catch (AlgorithmFailureException ex) {
        if (algebraic) {
          return degrade(integrand, variable, opts, ex, field, collector, stopwatch, restarted);
        }
        restart(ex, sink);
      } catch (UnsupportedConstructException ex) {
        return degrade(integrand, variable, opts, ex, field, collector, stopwatch, restarted);
      }
      algebraic = true;
      restarted = true;
    }
  }

  private <C> Attempt attempt(
      Expr integrand,
      Symbol variable,
      IntegrationOptions options,
      CoefficientField<C> field,
      IntegrationObserver sink) {
    RewriteResult rewritten = TrigRewriter.rewrite(integrand, variable, options.trigStrategy());
    if (rewritten.requiresAlgebraicNumbers() && field.kind() == CoefficientFieldKind.RATIONAL) {
      throw new FieldExtensionRequiredException(
          "Trigonometric functions of " + integrand + " need exp(I*u)");
    }
    List<Term> terms = TermClassifier.classify(rewritten.expression(), variable);
    Tower<C> tower = TowerBuilder.build(terms, field, variable);
    sink.onDiagnostic(IntegrationDiagnostic.towerBuilt(field.toString(), tower.describe()));
    TowerElement<C> f = tower.toElement(rewritten.expression());
    RischIntegrator<C> integrator =
        new RischIntegrator<>(tower, new RationalFactorizer(options.maxKroneckerValue()), sink);
    Antiderivative<C> antiderivative;
    try {
      antiderivative = integrator.integrate(f);
    } catch (ArithmeticException ex) {
      throw new AlgorithmFailureException("Arithmetic failed: " + ex.getMessage(), ex);
    }
    ResultReconstructor<C> reconstructor = integrator.reconstructor();
    IntegrationResult result =
        reconstructor.result(
            integrand,
            f,
            antiderivative.integratedPart(reconstructor),
            antiderivative.residual(),
            tower.top());
    return new Attempt(result, tower.describe());
  }

  private void restart(IntegrationException cause, IntegrationObserver sink) {
    LOG.warn("Restarting over the algebraic closure: {}", cause.getMessage());
    sink.onDiagnostic(IntegrationDiagnostic.fieldExtensionRestart(cause.getMessage()));
  }

  private IntegrationRun degrade(
      Expr integrand,
      Symbol variable,
      IntegrationOptions options,
      IntegrationException cause,
      CoefficientFieldKind field,
      DiagnosticCollector collector,
      Stopwatch stopwatch,
      boolean restarted) {
    ErrorKind kind = cause.kind();
    boolean caught =
        kind == ErrorKind.UNSUPPORTED_CONSTRUCT
            ? options.catchUnsupported()
            : options.catchAlgorithmFailure();
    if (!caught) {
      throw cause;
    }
    LOG.warn("Leaving {} unevaluated ({}): {}", integrand, kind, cause.getMessage());
    collector.onDiagnostic(IntegrationDiagnostic.degraded(kind.name(), cause.getMessage()));
    observer.onDiagnostic(IntegrationDiagnostic.degraded(kind.name(), cause.getMessage()));
    IntegrationResult result =
        new IntegrationResult.Failed(integrand, variable, kind, cause.getMessage());
    return new IntegrationRun(
        result,
        field,
        List.of(),
        collector.diagnostics(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS),
        restarted);
  }

  private record Attempt(IntegrationResult result, List<String> generators) {}
}
