package integration.expr;

import java.util.Objects;

/** Named symbol: the integration variable, the imaginary unit {@code I} or a bound variable. */
public record Symbol(String name) implements Expr {
  public static final Symbol IMAGINARY_UNIT = new Symbol("I");

  public Symbol {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Symbol name must not be blank");
    }
  }

  public boolean isImaginaryUnit() {
    return IMAGINARY_UNIT.equals(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
