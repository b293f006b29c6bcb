package integration.core;

/** Why an integration ended without a result. */
public enum ErrorKind {
  UNSUPPORTED_CONSTRUCT,
  ALGORITHM_FAILURE
}
