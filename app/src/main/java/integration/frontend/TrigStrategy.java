package integration.frontend;

/** How trigonometric functions are brought into a differential tower. */
public enum TrigStrategy {
  /**
   * Tangent of half the base angle when all angles are rational multiples of one another, the
   * complex-exponential rewrite otherwise.
   */
  HALF_ANGLE,
  /** Always rewrite through {@code exp(I*u)}; needs algebraic numbers. */
  COMPLEX_EXPONENTIAL
}
