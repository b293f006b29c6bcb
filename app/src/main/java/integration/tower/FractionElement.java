package integration.tower;

import integration.algebra.Polynomial;
import java.util.Objects;

/**
 * Reduced fraction {@code numerator / denominator} in the generator of level {@code height}. The
 * denominator is monic and coprime to the numerator.
 */
public record FractionElement<C>(
    int height,
    Polynomial<TowerElement<C>> numerator,
    Polynomial<TowerElement<C>> denominator)
    implements TowerElement<C> {

  public FractionElement {
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
  }

  @Override
  public String toString() {
    if (denominator.isOne()) {
      return numerator.toString();
    }
    return "(" + numerator + ")/(" + denominator + ")";
  }
}
