package integration.expr;

import java.util.List;

/** Product of at least two factors; a rational coefficient, when present, comes first. */
public record Product(List<Expr> factors) implements Expr {
  public Product {
    factors = List.copyOf(factors);
    if (factors.size() < 2) {
      throw new IllegalArgumentException("A product needs at least two factors");
    }
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
