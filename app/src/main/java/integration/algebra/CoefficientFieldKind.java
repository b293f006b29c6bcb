package integration.algebra;

/** Which constant field a tower is built over. */
public enum CoefficientFieldKind {
  RATIONAL,
  ALGEBRAIC_CLOSURE
}
