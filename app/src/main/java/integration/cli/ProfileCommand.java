package integration.cli;

import integration.profile.IntegrationProfiler;
import integration.profile.IntegrationProfiler.IntegrationProfile;
import integration.profile.IntegrationProfiler.ProfileRun;
import java.io.PrintStream;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `profile` command: integrates the built-in examples and reports timings. */
final class ProfileCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ProfileCommand.class);

  private final PrintStream out;

  ProfileCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    CliOptions options =
        CliParsers.parseOptions(CliParsers.stripCommand(args, Set.of("profile")));
    if (options.hasExpression() || options.hasFile()) {
      throw new IllegalArgumentException("profile runs the built-in examples only");
    }
    IntegrationProfile report =
        new IntegrationProfiler()
            .profile(IntegrationProfiler.defaultExamples(), options.integrationOptions());
    if (options.json()) {
      out.println(new JsonReportBuilder().buildProfile(report));
    } else {
      logProfileReport(report);
    }
    return CliParsers.EXIT_CLOSED;
  }

  private void logProfileReport(IntegrationProfile report) {
    out.printf("%-18s %-8s %8s %-18s %s%n", "Name", "Outcome", "Time(ms)", "Field", "Result");
    out.println("-".repeat(72));
    for (ProfileRun run : report.runs()) {
      out.printf(
          "%-18s %-8s %8d %-18s %s%n",
          run.name(),
          run.outcome(),
          run.elapsedMillis(),
          run.field() + (run.restarted() ? "*" : ""),
          run.expression());
    }
    LOG.info(
        "Profiled {} integrands in {} ms", report.runs().size(), report.totalElapsedMillis());
  }
}
