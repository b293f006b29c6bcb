package integration.core.diagnostics;

/** Enumerates the notable steps reported while integrating. */
public enum IntegrationDiagnosticReason {
  TOWER_BUILT,
  LEVEL_DISPATCHED,
  HERMITE_REDUCED,
  NON_ELEMENTARY,
  FIELD_EXTENSION_RESTART,
  DEGRADED
}
