package integration.cli;

import integration.core.IntegrationOptions;
import integration.core.IntegrationResult;
import integration.frontend.TrigStrategy;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  static final int EXIT_CLOSED = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_PARTIAL = 2;
  static final int EXIT_FAILED = 3;

  private CliParsers() {}

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static TrigStrategy parseTrigStrategy(String raw) {
    if (raw == null || raw.isBlank()) {
      return TrigStrategy.HALF_ANGLE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "half-angle", "tan", "tangent" -> TrigStrategy.HALF_ANGLE;
      case "complex", "complex-exponential", "exp" -> TrigStrategy.COMPLEX_EXPONENTIAL;
      default -> throw new IllegalArgumentException("Invalid trig strategy: " + raw);
    };
  }

  static int exitCode(IntegrationResult.Outcome outcome) {
    return switch (outcome) {
      case CLOSED -> EXIT_CLOSED;
      case PARTIAL -> EXIT_PARTIAL;
      case FAILED -> EXIT_FAILED;
    };
  }

  /** Drops the leading command word when it is one of {@code names}. */
  static String[] stripCommand(String[] args, Set<String> names) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (names.contains(args[0].toLowerCase(Locale.ROOT))) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  static CliOptions parseOptions(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = args[++i];
        }
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--expr", OptionSpec.withValue(CliOptions.Builder::expression));
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.file(Path.of(raw))));
    specs.put("--var", OptionSpec.withValue(CliOptions.Builder::variable));
    specs.put("--algebraic", OptionSpec.flag(b -> b.algebraic(true)));
    specs.put("--strict", OptionSpec.flag(b -> b.strictUnsupported(true).strictFailures(true)));
    specs.put("--strict-unsupported", OptionSpec.flag(b -> b.strictUnsupported(true)));
    specs.put("--strict-failures", OptionSpec.flag(b -> b.strictFailures(true)));
    specs.put("--trig", OptionSpec.withValue((b, raw) -> b.trigStrategy(parseTrigStrategy(raw))));
    specs.put(
        "--max-kronecker",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxKroneckerValue(
                    parseLong(
                        raw, IntegrationOptions.DEFAULT_MAX_KRONECKER_VALUE, "--max-kronecker"))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put("--check", OptionSpec.flag(b -> b.check(true)));
    specs.put("--trace", OptionSpec.flag(b -> b.trace(true)));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
