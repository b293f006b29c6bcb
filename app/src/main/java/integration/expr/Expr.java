package integration.expr;

/**
 * Immutable symbolic expression. Instances built through {@link Exprs} are normalized, so two
 * equal normalized expressions are also structurally equal.
 */
public sealed interface Expr permits Num, Symbol, Sum, Product, Power, Call, Integral, RootSum {

  default boolean isFreeOf(Symbol symbol) {
    return Exprs.isFreeOf(this, symbol);
  }
}
