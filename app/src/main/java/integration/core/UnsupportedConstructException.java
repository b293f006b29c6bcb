package integration.core;

/** The integrand uses something outside the elementary transcendental class handled here. */
public final class UnsupportedConstructException extends IntegrationException {
  private static final long serialVersionUID = 1L;

  public UnsupportedConstructException(String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.UNSUPPORTED_CONSTRUCT;
  }
}
