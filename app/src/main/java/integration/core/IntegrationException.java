package integration.core;

/** Base class for failures raised while integrating. */
public abstract class IntegrationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  protected IntegrationException(String message) {
    super(message);
  }

  protected IntegrationException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind kind();
}
