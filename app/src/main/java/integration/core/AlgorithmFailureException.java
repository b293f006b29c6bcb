package integration.core;

/** An internal step produced an inconsistent intermediate result. */
public final class AlgorithmFailureException extends IntegrationException {
  private static final long serialVersionUID = 1L;

  public AlgorithmFailureException(String message) {
    super(message);
  }

  public AlgorithmFailureException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.ALGORITHM_FAILURE;
  }
}
