package integration.core;

/**
 * Raised while working over the rationals when a residue or a rewrite needs algebraic numbers.
 * The pipeline answers it by restarting over the algebraic closure; it never reaches callers.
 */
public final class FieldExtensionRequiredException extends IntegrationException {
  private static final long serialVersionUID = 1L;

  public FieldExtensionRequiredException(String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.ALGORITHM_FAILURE;
  }
}
