package integration.core.diagnostics;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Structured trace entry emitted while integrating. */
public record IntegrationDiagnostic(
    IntegrationDiagnosticReason reason, Integer height, Map<String, Object> attributes) {

  public static final String ATTR_GENERATORS = "generators";
  public static final String ATTR_FIELD = "field";
  public static final String ATTR_KIND = "kind";
  public static final String ATTR_STEPS = "steps";
  public static final String ATTR_RESIDUAL = "residual";
  public static final String ATTR_MESSAGE = "message";

  public IntegrationDiagnostic {
    Objects.requireNonNull(reason, "reason");
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static IntegrationDiagnostic towerBuilt(String field, List<String> generators) {
    return new IntegrationDiagnostic(
        IntegrationDiagnosticReason.TOWER_BUILT,
        null,
        Map.of(ATTR_FIELD, field, ATTR_GENERATORS, List.copyOf(generators)));
  }

  public static IntegrationDiagnostic levelDispatched(int height, String kind) {
    return new IntegrationDiagnostic(
        IntegrationDiagnosticReason.LEVEL_DISPATCHED, height, Map.of(ATTR_KIND, kind));
  }

  public static IntegrationDiagnostic hermiteReduced(int height, int steps) {
    return new IntegrationDiagnostic(
        IntegrationDiagnosticReason.HERMITE_REDUCED, height, Map.of(ATTR_STEPS, steps));
  }

  public static IntegrationDiagnostic nonElementary(int height, String residual) {
    return new IntegrationDiagnostic(
        IntegrationDiagnosticReason.NON_ELEMENTARY, height, Map.of(ATTR_RESIDUAL, residual));
  }

  public static IntegrationDiagnostic fieldExtensionRestart(String message) {
    return new IntegrationDiagnostic(
        IntegrationDiagnosticReason.FIELD_EXTENSION_RESTART,
        null,
        Map.of(ATTR_MESSAGE, message == null ? "" : message));
  }

  public static IntegrationDiagnostic degraded(String kind, String message) {
    return new IntegrationDiagnostic(
        IntegrationDiagnosticReason.DEGRADED,
        null,
        Map.of(ATTR_KIND, kind, ATTR_MESSAGE, message == null ? "" : message));
  }
}
