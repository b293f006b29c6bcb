package integration.tower;

import integration.algebra.CoefficientField;
import integration.algebra.Field;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * One differential field of a tower: the constants, or the previous level extended by a
 * monomial. Every level is a {@link Field} over {@link TowerElement}s of its own height.
 *
 * @param <C> constant type
 */
public abstract class TowerLevel<C> implements Field<TowerElement<C>> {

  /** Height of the generator adjoined here, {@code -1} for the constants. */
  public abstract int height();

  public abstract CoefficientField<C> coefficients();

  /** The derivation {@code D = d/dx} restricted to this level. */
  public abstract TowerElement<C> derive(TowerElement<C> a);

  public abstract boolean isConstant(TowerElement<C> a);

  /**
   * Returns the constant an element represents.
   *
   * @throws IllegalArgumentException when the element is not constant
   */
  public abstract C toConstant(TowerElement<C> a);

  public abstract TowerElement<C> fromConstant(C value);

  /** Embeds an element of this level or of any level below it. */
  public abstract TowerElement<C> lift(TowerElement<C> a);

  /** The generator of the given height as an element of this level. */
  public abstract TowerElement<C> generatorElement(int height);

  /** Generators adjoined up to and including this level. */
  public abstract List<Generator> generators();

  /**
   * Conjugates every constant coefficient of {@code a} while keeping the generators. This is the
   * complex conjugation of the field when every generator is real.
   */
  public abstract TowerElement<C> conjugateCoefficients(TowerElement<C> a);

  @Override
  public TowerElement<C> fromRational(BigFraction value) {
    return fromConstant(coefficients().fromRational(value));
  }

  public Optional<BigFraction> rationalValue(TowerElement<C> a) {
    if (!isConstant(a)) {
      return Optional.empty();
    }
    return coefficients().toRational(toConstant(a));
  }
}
