package integration.expr;

import java.util.List;

/** Sum of at least two terms. */
public record Sum(List<Expr> terms) implements Expr {
  public Sum {
    terms = List.copyOf(terms);
    if (terms.size() < 2) {
      throw new IllegalArgumentException("A sum needs at least two terms");
    }
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
