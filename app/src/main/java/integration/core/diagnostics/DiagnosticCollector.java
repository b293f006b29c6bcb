package integration.core.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Observer that keeps every diagnostic in arrival order. */
public final class DiagnosticCollector implements IntegrationObserver {
  private final List<IntegrationDiagnostic> diagnostics = new ArrayList<>();

  @Override
  public void onDiagnostic(IntegrationDiagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public List<IntegrationDiagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  public boolean contains(IntegrationDiagnosticReason reason) {
    return diagnostics.stream().anyMatch(d -> d.reason() == reason);
  }
}
