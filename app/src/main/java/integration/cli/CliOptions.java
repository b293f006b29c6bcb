package integration.cli;

import integration.core.IntegrationOptions;
import integration.frontend.TrigStrategy;
import java.nio.file.Path;

record CliOptions(
    String expression,
    Path file,
    String variable,
    boolean algebraic,
    boolean strictUnsupported,
    boolean strictFailures,
    TrigStrategy trigStrategy,
    long maxKroneckerValue,
    boolean json,
    boolean check,
    boolean trace) {

  CliOptions {
    variable = variable == null || variable.isBlank() ? "x" : variable.trim();
    if (!variable.chars().allMatch(Character::isLetter)) {
      throw new IllegalArgumentException("Invalid variable name: " + variable);
    }
    trigStrategy = trigStrategy == null ? TrigStrategy.HALF_ANGLE : trigStrategy;
    if (maxKroneckerValue < 1) {
      throw new IllegalArgumentException("max kronecker value must be at least 1");
    }
  }

  boolean hasExpression() {
    return expression != null && !expression.isBlank();
  }

  boolean hasFile() {
    return file != null;
  }

  IntegrationOptions integrationOptions() {
    return IntegrationOptions.builder()
        .useAlgebraicNumbers(algebraic)
        .catchUnsupported(!strictUnsupported)
        .catchAlgorithmFailure(!strictFailures)
        .trigStrategy(trigStrategy)
        .maxKroneckerValue(maxKroneckerValue)
        .build();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String expression;
    private Path file;
    private String variable = "x";
    private boolean algebraic;
    private boolean strictUnsupported;
    private boolean strictFailures;
    private TrigStrategy trigStrategy = TrigStrategy.HALF_ANGLE;
    private long maxKroneckerValue = IntegrationOptions.DEFAULT_MAX_KRONECKER_VALUE;
    private boolean json;
    private boolean check;
    private boolean trace;

    Builder expression(String value) {
      this.expression = value;
      return this;
    }

    Builder file(Path value) {
      this.file = value;
      return this;
    }

    Builder variable(String value) {
      this.variable = value;
      return this;
    }

    Builder algebraic(boolean value) {
      this.algebraic = value;
      return this;
    }

    Builder strictUnsupported(boolean value) {
      this.strictUnsupported = value;
      return this;
    }

    Builder strictFailures(boolean value) {
      this.strictFailures = value;
      return this;
    }

    Builder trigStrategy(TrigStrategy value) {
      this.trigStrategy = value;
      return this;
    }

    Builder maxKroneckerValue(long value) {
      this.maxKroneckerValue = value;
      return this;
    }

    Builder json(boolean value) {
      this.json = value;
      return this;
    }

    Builder check(boolean value) {
      this.check = value;
      return this;
    }

    Builder trace(boolean value) {
      this.trace = value;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          expression,
          file,
          variable,
          algebraic,
          strictUnsupported,
          strictFailures,
          trigStrategy,
          maxKroneckerValue,
          json,
          check,
          trace);
    }
  }
}
