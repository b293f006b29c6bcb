package integration.algebra;

import integration.expr.Expr;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Field of constants at the bottom of a differential tower.
 *
 * @param <C> constant type
 */
public interface CoefficientField<C> extends Field<C> {

  CoefficientFieldKind kind();

  /** Returns the value as a rational number when it is one. */
  Optional<BigFraction> toRational(C value);

  C conjugate(C value);

  /** The square root of minus one, when the field contains it. */
  Optional<C> imaginaryUnit();

  Expr toExpression(C value);

  default boolean isRational(C value) {
    return toRational(value).isPresent();
  }
}
