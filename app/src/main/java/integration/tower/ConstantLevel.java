package integration.tower;

import integration.algebra.CoefficientField;
import integration.core.MalformedTowerException;
import java.util.List;
import java.util.Objects;

/** Bottom of every tower: the constant field, on which the derivation vanishes. */
public final class ConstantLevel<C> extends TowerLevel<C> {
  private final CoefficientField<C> field;
  private final ConstantElement<C> zero;
  private final ConstantElement<C> one;

  public ConstantLevel(CoefficientField<C> field) {
    this.field = Objects.requireNonNull(field, "field");
    this.zero = new ConstantElement<>(field.zero());
    this.one = new ConstantElement<>(field.one());
  }

  @Override
  public int height() {
    return -1;
  }

  @Override
  public CoefficientField<C> coefficients() {
    return field;
  }

  @Override
  public TowerElement<C> zero() {
    return zero;
  }

  @Override
  public TowerElement<C> one() {
    return one;
  }

  @Override
  public TowerElement<C> add(TowerElement<C> a, TowerElement<C> b) {
    return wrap(field.add(value(a), value(b)));
  }

  @Override
  public TowerElement<C> negate(TowerElement<C> a) {
    return wrap(field.negate(value(a)));
  }

  @Override
  public TowerElement<C> multiply(TowerElement<C> a, TowerElement<C> b) {
    return wrap(field.multiply(value(a), value(b)));
  }

  @Override
  public TowerElement<C> inverse(TowerElement<C> a) {
    return wrap(field.inverse(value(a)));
  }

  @Override
  public boolean isZero(TowerElement<C> a) {
    return field.isZero(value(a));
  }

  @Override
  public TowerElement<C> derive(TowerElement<C> a) {
    value(a);
    return zero;
  }

  @Override
  public boolean isConstant(TowerElement<C> a) {
    value(a);
    return true;
  }

  @Override
  public C toConstant(TowerElement<C> a) {
    return value(a);
  }

  @Override
  public TowerElement<C> fromConstant(C value) {
    return wrap(value);
  }

  @Override
  public TowerElement<C> lift(TowerElement<C> a) {
    value(a);
    return a;
  }

  @Override
  public TowerElement<C> generatorElement(int height) {
    throw new MalformedTowerException("The constant level has no generator " + height);
  }

  @Override
  public TowerElement<C> conjugateCoefficients(TowerElement<C> a) {
    return wrap(field.conjugate(value(a)));
  }

  @Override
  public List<Generator> generators() {
    return List.of();
  }

  private TowerElement<C> wrap(C value) {
    return new ConstantElement<>(value);
  }

  private C value(TowerElement<C> a) {
    if (a instanceof ConstantElement<C> constant) {
      return constant.value();
    }
    throw new MalformedTowerException(
        "Expected a constant but got an element of height " + a.height());
  }
}
