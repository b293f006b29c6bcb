package integration.tower;

import integration.expr.Symbol;
import java.util.Objects;

/** The integration variable. */
public record IdentityTerm(Symbol variable) implements Term {
  public IdentityTerm {
    Objects.requireNonNull(variable, "variable");
  }
}
