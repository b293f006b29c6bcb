package integration.cli;

import integration.core.IntegrationRun;
import integration.core.diagnostics.IntegrationObserver;
import integration.expr.Expr;
import integration.expr.ExprParser;
import integration.expr.Symbol;
import integration.pipeline.DerivativeCheck;
import integration.pipeline.IntegrationPipeline;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary `run` command: integrates one expression. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  private final PrintStream out;

  RunCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    CliOptions options = CliParsers.parseOptions(CliParsers.stripCommand(args, Set.of("run")));
    if (!options.hasExpression()) {
      throw new IllegalArgumentException("Missing --expr");
    }
    if (options.hasFile()) {
      throw new IllegalArgumentException("--file belongs to the batch command");
    }
    Expr integrand = ExprParser.parse(options.expression());
    IntegrationRun run = integrate(integrand, options, out);
    DerivativeCheck.Verdict verdict = options.check() ? DerivativeCheck.verify(run.result()) : null;

    if (options.json()) {
      out.println(new JsonReportBuilder().build(run, verdict));
    } else {
      printSummary(run, verdict);
    }
    return CliParsers.exitCode(run.outcome());
  }

  static IntegrationRun integrate(Expr integrand, CliOptions options, PrintStream out) {
    IntegrationObserver observer = IntegrationObserver.log();
    if (options.trace()) {
      observer =
          observer.andThen(
              diagnostic ->
                  out.printf(
                      "  [%s]%s %s%n",
                      diagnostic.reason().name().toLowerCase(Locale.ROOT),
                      diagnostic.height() == null ? "" : " height=" + diagnostic.height(),
                      diagnostic.attributes()));
    }
    IntegrationPipeline pipeline = new IntegrationPipeline(observer);
    return pipeline.run(
        integrand, new Symbol(options.variable()), options.integrationOptions());
  }

  private void printSummary(IntegrationRun run, DerivativeCheck.Verdict verdict) {
    out.println(run.result().expression());
    LOG.info(
        "Outcome {} over {} in {} ms{}",
        run.outcome(),
        run.field(),
        run.elapsedMillis(),
        run.restarted() ? " (restarted)" : "");
    if (verdict != null) {
      out.println("check: " + verdict.name().toLowerCase(Locale.ROOT));
    }
  }
}
