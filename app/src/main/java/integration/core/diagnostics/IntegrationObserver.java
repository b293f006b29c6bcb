package integration.core.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives the algorithmic trace of an integration. Passed explicitly through the pipeline. */
@FunctionalInterface
public interface IntegrationObserver {

  void onDiagnostic(IntegrationDiagnostic diagnostic);

  static IntegrationObserver none() {
    return diagnostic -> {};
  }

  /** Writes every diagnostic to the debug log. */
  static IntegrationObserver log() {
    Logger log = LoggerFactory.getLogger(IntegrationObserver.class);
    return diagnostic ->
        log.debug(
            "{} height={} {}", diagnostic.reason(), diagnostic.height(), diagnostic.attributes());
  }

  default IntegrationObserver andThen(IntegrationObserver next) {
    return diagnostic -> {
      onDiagnostic(diagnostic);
      next.onDiagnostic(diagnostic);
    };
  }
}
