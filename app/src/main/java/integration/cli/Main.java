package integration.cli;

import integration.core.IntegrationException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code run --expr "1/(x^2+1)" [--var x] [--algebraic] [--strict] [--json] [--check]}
 *   <li>{@code batch --file integrands.txt}
 *   <li>{@code profile}
 * </ul>
 *
 * <p>Exit codes: 0 closed form, 2 partial result, 3 failed or unevaluated, 1 usage error.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage:",
          "  run --expr <f> [--var x] [--algebraic] [--strict] [--strict-unsupported]",
          "      [--strict-failures] [--trig half-angle|complex] [--max-kronecker n]",
          "      [--json] [--check] [--trace]",
          "  batch --file <path> [run options]",
          "  profile [--json] [--algebraic]");

  private Main() {}

  public static void main(String[] args) {
    System.exit(execute(args, System.out));
  }

  static int execute(String[] args, PrintStream out) {
    String command = args.length == 0 ? "help" : args[0].toLowerCase(Locale.ROOT);
    try {
      return switch (command) {
        case "help", "--help", "-h" -> {
          out.println(USAGE);
          yield args.length == 0 ? CliParsers.EXIT_USAGE : CliParsers.EXIT_CLOSED;
        }
        case "batch" -> new BatchCommand(out).execute(args);
        case "profile" -> new ProfileCommand(out).execute(args);
        default -> new RunCommand(out).execute(args);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      out.println("error: " + ex.getMessage());
      out.println(USAGE);
      return CliParsers.EXIT_USAGE;
    } catch (IntegrationException ex) {
      LOG.error("Integration failed ({}): {}", ex.kind(), ex.getMessage());
      out.println("error: " + ex.kind().name().toLowerCase(Locale.ROOT) + ": " + ex.getMessage());
      return CliParsers.EXIT_FAILED;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return CliParsers.EXIT_USAGE;
    }
  }
}
