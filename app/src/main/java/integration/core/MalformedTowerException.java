package integration.core;

/** A tower violated its ordering invariant. Indicates a bug, so it is never degraded. */
public final class MalformedTowerException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public MalformedTowerException(String message) {
    super(message);
  }
}
