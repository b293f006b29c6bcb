package integration.core;

import integration.algebra.CoefficientFieldKind;
import integration.core.diagnostics.IntegrationDiagnostic;
import java.util.List;
import java.util.Objects;

/**
 * One integration together with how it was obtained.
 *
 * @param result the outcome reported to callers
 * @param field constant field of the last attempt
 * @param generators description of the tower of the successful attempt, empty on failure
 * @param diagnostics algorithmic trace of every attempt
 * @param elapsedMillis wall time of the whole run
 * @param restarted whether the run switched to the algebraic closure
 */
public record IntegrationRun(
    IntegrationResult result,
    CoefficientFieldKind field,
    List<String> generators,
    List<IntegrationDiagnostic> diagnostics,
    long elapsedMillis,
    boolean restarted) {

  public IntegrationRun {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(field, "field");
    generators = generators == null ? List.of() : List.copyOf(generators);
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
  }

  public IntegrationResult.Outcome outcome() {
    return result.outcome();
  }
}
