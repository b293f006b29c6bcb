package integration.cli;

import com.google.common.base.Splitter;
import integration.core.IntegrationException;
import integration.core.IntegrationRun;
import integration.expr.ExprParser;
import integration.pipeline.DerivativeCheck;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Integrates every expression of a file, one per line. Blank lines and lines starting with
 * {@code #} are skipped. The exit code is the worst outcome seen.
 */
final class BatchCommand {
  private static final Logger LOG = LoggerFactory.getLogger(BatchCommand.class);
  private static final Splitter LINES = Splitter.on('\n').trimResults().omitEmptyStrings();

  private final PrintStream out;

  BatchCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parseOptions(CliParsers.stripCommand(args, Set.of("batch")));
    if (!options.hasFile()) {
      throw new IllegalArgumentException("Missing --file");
    }
    if (!Files.exists(options.file())) {
      throw new IllegalArgumentException("Batch file not found: " + options.file());
    }
    List<String> integrands = integrands(Files.readString(options.file(), StandardCharsets.UTF_8));
    LOG.info("Integrating {} expressions from {}", integrands.size(), options.file());

    JsonReportBuilder json = new JsonReportBuilder();
    List<Map<String, Object>> reports = new ArrayList<>();
    int exitCode = CliParsers.EXIT_CLOSED;
    for (String source : integrands) {
      int code;
      try {
        IntegrationRun run = RunCommand.integrate(ExprParser.parse(source), options, out);
        DerivativeCheck.Verdict verdict =
            options.check() ? DerivativeCheck.verify(run.result()) : null;
        if (options.json()) {
          reports.add(json.report(run, verdict));
        } else {
          String suffix = verdict == null ? "" : "  [" + verdict + "]";
          out.println(source + " => " + run.result().expression() + suffix);
        }
        code = CliParsers.exitCode(run.outcome());
      } catch (IllegalArgumentException ex) {
        LOG.error("Cannot parse {}: {}", source, ex.getMessage());
        out.println(source + " => error: " + ex.getMessage());
        code = CliParsers.EXIT_FAILED;
      } catch (IntegrationException ex) {
        LOG.error("Integration of {} failed: {}", source, ex.getMessage());
        out.println(source + " => " + ex.kind() + ": " + ex.getMessage());
        code = CliParsers.EXIT_FAILED;
      }
      exitCode = Math.max(exitCode, code);
    }
    if (options.json()) {
      out.println(json.buildBatch(reports));
    }
    return exitCode;
  }

  static List<String> integrands(String content) {
    List<String> result = new ArrayList<>();
    for (String line : LINES.split(content.replace("\r", ""))) {
      if (!line.startsWith("#")) {
        result.add(line);
      }
    }
    return result;
  }
}
