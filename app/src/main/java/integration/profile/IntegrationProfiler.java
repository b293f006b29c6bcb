package integration.profile;

import integration.algebra.CoefficientFieldKind;
import integration.core.IntegrationOptions;
import integration.core.IntegrationResult;
import integration.core.IntegrationRun;
import integration.expr.Expr;
import integration.expr.ExprParser;
import integration.expr.Symbol;
import integration.pipeline.IntegrationPipeline;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Utility for profiling the integration pipeline across multiple integrands. */
public final class IntegrationProfiler {
  private static final Symbol X = new Symbol("x");

  /** Named integrand for profiling runs. */
  public record NamedIntegrand(String name, Expr integrand, Symbol variable) {
    public NamedIntegrand {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(integrand, "integrand");
      variable = variable == null ? X : variable;
    }

    public static NamedIntegrand of(String name, String source) {
      return new NamedIntegrand(name, ExprParser.parse(source), X);
    }
  }

  /** Per-integrand profiling outcome. */
  public record ProfileRun(
      String name,
      long elapsedMillis,
      IntegrationResult.Outcome outcome,
      CoefficientFieldKind field,
      boolean restarted,
      int generatorCount,
      String expression) {}

  /** Aggregated profiling report. */
  public record IntegrationProfile(List<ProfileRun> runs) {
    public IntegrationProfile {
      runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public long totalElapsedMillis() {
      return runs.stream().mapToLong(ProfileRun::elapsedMillis).sum();
    }

    public long count(IntegrationResult.Outcome outcome) {
      return runs.stream().filter(run -> run.outcome() == outcome).count();
    }
  }

  public IntegrationProfile profile(List<NamedIntegrand> integrands, IntegrationOptions options) {
    Objects.requireNonNull(integrands, "integrands");
    if (integrands.isEmpty()) {
      throw new IllegalArgumentException("Profiling requires at least one integrand.");
    }
    IntegrationOptions effective = IntegrationOptions.normalize(options);

    List<ProfileRun> runs = new ArrayList<>(integrands.size());
    IntegrationPipeline pipeline = new IntegrationPipeline();
    for (NamedIntegrand integrand : integrands) {
      IntegrationRun run = pipeline.run(integrand.integrand(), integrand.variable(), effective);
      runs.add(
          new ProfileRun(
              integrand.name(),
              run.elapsedMillis(),
              run.outcome(),
              run.field(),
              run.restarted(),
              run.generators().size(),
              run.result().expression().toString()));
    }
    return new IntegrationProfile(runs);
  }

  public static List<NamedIntegrand> defaultExamples() {
    return List.of(
        NamedIntegrand.of("rational-log-atan", "(x^3+x^2+x+2)/(x^4+3*x^2+2)"),
        NamedIntegrand.of("arctangent", "1/(x^2+1)"),
        NamedIntegrand.of("nested-log", "1/(x*log(x))"),
        NamedIntegrand.of("exp-log", "exp(x)/(1+exp(x))"),
        NamedIntegrand.of("gaussian", "exp(x^2)"),
        NamedIntegrand.of("half-angle", "sin(x)/(1+cos(x)^2)"),
        NamedIntegrand.of("hermite", "1/(x^2+1)^2"),
        NamedIntegrand.of("log-polynomial", "log(x)^2"),
        NamedIntegrand.of("exp-polynomial", "x*exp(x)"),
        NamedIntegrand.of("hyperbolic", "cosh(x)"));
  }
}
