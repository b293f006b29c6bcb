package integration.tower;

import java.util.Objects;

/** Element of the constant field. */
public record ConstantElement<C>(C value) implements TowerElement<C> {
  public ConstantElement {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public int height() {
    return -1;
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
