package integration.reconstruct;

import integration.algebra.CoefficientField;
import integration.algebra.Polynomial;
import integration.core.IntegrationResult;
import integration.expr.Call;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.expr.Num;
import integration.expr.Power;
import integration.expr.Symbol;
import integration.tower.ConstantElement;
import integration.tower.FractionElement;
import integration.tower.Generator;
import integration.tower.Tower;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns tower elements back into expressions by substituting every generator with its symbolic
 * definition, and assembles integration results.
 *
 * @param <C> constant type
 */
public final class ResultReconstructor<C> {
  private final CoefficientField<C> field;
  private final List<Generator> generators;
  private final Symbol variable;

  public ResultReconstructor(Tower<C> tower) {
    Objects.requireNonNull(tower, "tower");
    this.field = tower.field();
    this.generators = tower.generators();
    this.variable = tower.variable();
  }

  public Expr expression(TowerElement<C> element) {
    if (element instanceof ConstantElement<C> constant) {
      return field.toExpression(constant.value());
    }
    FractionElement<C> fraction = (FractionElement<C>) element;
    Expr numerator = polynomial(fraction.numerator(), fraction.height());
    if (fraction.denominator().isOne()) {
      return numerator;
    }
    return Exprs.divide(numerator, polynomial(fraction.denominator(), fraction.height()));
  }

  /** The symbolic definition of the generator of {@code height}. */
  public Expr generator(int height) {
    return generators.get(height).expression();
  }

  /** A polynomial in the generator of {@code height} whose coefficients lie below it. */
  public Expr polynomial(Polynomial<TowerElement<C>> p, int height) {
    Expr t = generators.get(height).expression();
    List<Expr> terms = new ArrayList<>(p.coefficients().size());
    for (int i = 0; i < p.coefficients().size(); i++) {
      TowerElement<C> c = p.coefficients().get(i);
      if (!p.field().isZero(c)) {
        terms.add(Exprs.multiply(expression(c), Exprs.power(t, i)));
      }
    }
    return Exprs.sum(terms);
  }

  /** A polynomial with constant coefficients in the symbol {@code z}. */
  public Expr constantPolynomial(Polynomial<C> p, Symbol z) {
    List<Expr> terms = new ArrayList<>(p.coefficients().size());
    for (int i = 0; i < p.coefficients().size(); i++) {
      C c = p.coefficients().get(i);
      if (!field.isZero(c)) {
        terms.add(Exprs.multiply(field.toExpression(c), Exprs.power(z, i)));
      }
    }
    return Exprs.sum(terms);
  }

  /**
   * A polynomial in the generator of {@code height} whose coefficients are polynomials in {@code
   * z} over the level below.
   */
  public Expr algebraicPolynomial(
      Polynomial<Polynomial<TowerElement<C>>> p, Symbol z, int height) {
    Expr t = generators.get(height).expression();
    List<Expr> terms = new ArrayList<>(p.coefficients().size());
    for (int i = 0; i < p.coefficients().size(); i++) {
      Polynomial<TowerElement<C>> c = p.coefficients().get(i);
      List<Expr> inner = new ArrayList<>(c.coefficients().size());
      for (int j = 0; j < c.coefficients().size(); j++) {
        inner.add(Exprs.multiply(expression(c.coefficients().get(j)), Exprs.power(z, j)));
      }
      terms.add(Exprs.multiply(Exprs.sum(inner), Exprs.power(t, i)));
    }
    return Exprs.sum(terms);
  }

  /**
   * Builds the result for {@code integrand}: closed when nothing is left unintegrated, partial
   * otherwise. A residual equal to the whole rewritten integrand {@code f} is reported as {@code
   * integrand} itself; any other residual gets the tangents and complex exponentials that the
   * trigonometric rewrite introduced turned back into sines and cosines.
   */
  public IntegrationResult result(
      Expr integrand,
      TowerElement<C> f,
      Expr integratedPart,
      TowerElement<C> residual,
      TowerLevel<C> level) {
    if (level.isZero(residual)) {
      return new IntegrationResult.Closed(integrand, variable, integratedPart);
    }
    Expr rest =
        level.isZero(level.subtract(level.lift(residual), level.lift(f)))
            ? integrand
            : trigonometric(expression(residual), integrand);
    return new IntegrationResult.Partial(integrand, variable, integratedPart, rest);
  }

  /**
   * Replaces {@code tan(a)} by {@code sin(2a)/(1 + cos(2a))} and {@code exp(I*u)} by {@code cos(u)
   * + I*sin(u)}, leaving alone the applications that already occur in {@code integrand}.
   */
  static Expr trigonometric(Expr residual, Expr integrand) {
    Set<Call> original = new HashSet<>(Exprs.calls(integrand));
    Expr folded =
        Exprs.transform(
            residual,
            node -> {
              if (node instanceof Power p
                  && p.base() instanceof Call c
                  && c.function() == FunctionName.EXP
                  && !original.contains(c)
                  && Exprs.isInteger(p.exponent())) {
                return Exprs.call(FunctionName.EXP, Exprs.multiply(p.exponent(), c.argument()));
              }
              return node;
            });
    return Exprs.transform(
        folded,
        node -> {
          if (!(node instanceof Call c) || original.contains(c)) {
            return node;
          }
          if (c.function() == FunctionName.TAN) {
            Expr twice = Exprs.multiply(Num.of(2), c.argument());
            return Exprs.divide(
                Exprs.call(FunctionName.SIN, twice),
                Exprs.add(Num.ONE, Exprs.call(FunctionName.COS, twice)));
          }
          if (c.function() == FunctionName.EXP
              && !Exprs.isFreeOf(c.argument(), Symbol.IMAGINARY_UNIT)) {
            Expr u = Exprs.multiply(Exprs.negate(Symbol.IMAGINARY_UNIT), c.argument());
            if (Exprs.isFreeOf(u, Symbol.IMAGINARY_UNIT)) {
              return Exprs.add(
                  Exprs.call(FunctionName.COS, u),
                  Exprs.multiply(Symbol.IMAGINARY_UNIT, Exprs.call(FunctionName.SIN, u)));
            }
          }
          return node;
        });
  }
}
