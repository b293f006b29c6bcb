package integration.tower;

import integration.algebra.Rationals;
import integration.core.FieldExtensionRequiredException;
import integration.core.MalformedTowerException;
import integration.core.UnsupportedConstructException;
import integration.expr.Call;
import integration.expr.Expr;
import integration.expr.Num;
import integration.expr.Power;
import integration.expr.Product;
import integration.expr.Sum;
import integration.expr.Symbol;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/** Maps expressions onto elements of the top level of a (possibly partial) tower. */
final class ElementConverter<C> {
  private final List<ExtensionLevel<C>> levels;
  private final ExtensionLevel<C> top;
  private final Symbol variable;
  private final boolean building;

  /**
   * @param building whether the tower is still being built; a function missing from it is then a
   *     forward reference rather than an unsupported construct
   */
  ElementConverter(List<ExtensionLevel<C>> levels, Symbol variable, boolean building) {
    this.levels = levels;
    this.top = levels.get(levels.size() - 1);
    this.variable = variable;
    this.building = building;
  }

  TowerElement<C> convert(Expr expr) {
    if (expr instanceof Num n) {
      return top.fromRational(n.value());
    }
    if (expr instanceof Symbol s) {
      return symbol(s);
    }
    if (expr instanceof Sum s) {
      TowerElement<C> sum = top.zero();
      for (Expr term : s.terms()) {
        sum = top.add(sum, convert(term));
      }
      return sum;
    }
    if (expr instanceof Product p) {
      TowerElement<C> product = top.one();
      for (Expr factor : p.factors()) {
        product = top.multiply(product, convert(factor));
      }
      return product;
    }
    if (expr instanceof Power p) {
      return power(p);
    }
    if (expr instanceof Call c) {
      return call(c);
    }
    throw new UnsupportedConstructException("Cannot represent " + expr + " in the tower");
  }

  private TowerElement<C> symbol(Symbol s) {
    if (s.equals(variable)) {
      return top.generatorElement(0);
    }
    if (s.isImaginaryUnit()) {
      Optional<C> unit = top.coefficients().imaginaryUnit();
      if (unit.isEmpty()) {
        throw new FieldExtensionRequiredException("The imaginary unit needs algebraic numbers");
      }
      return top.fromConstant(unit.get());
    }
    throw new UnsupportedConstructException("Free symbol " + s + " besides " + variable);
  }

  private TowerElement<C> power(Power p) {
    if (!(p.exponent() instanceof Num e) || !e.isInteger()) {
      throw new UnsupportedConstructException("Non-integer power " + p);
    }
    TowerElement<C> base = convert(p.base());
    int exponent = e.value().getNumerator().intValueExact();
    if (exponent < 0 && top.isZero(base)) {
      throw new UnsupportedConstructException("Division by zero in " + p);
    }
    return top.pow(base, exponent);
  }

  private TowerElement<C> call(Call c) {
    TowerElement<C> argument = convert(c.argument());
    for (int h = 1; h < levels.size(); h++) {
      ExtensionLevel<C> level = levels.get(h);
      if (level.kind().function() != c.function()) {
        continue;
      }
      TowerElement<C> known = top.lift(level.argument());
      TowerElement<C> t = top.generatorElement(h);
      switch (level.kind()) {
        case LOG:
          if (argument.equals(known)) {
            return t;
          }
          break;
        case TAN:
          if (argument.equals(known)) {
            return t;
          }
          if (argument.equals(top.negate(known))) {
            return top.negate(t);
          }
          break;
        case EXP:
          Optional<BigFraction> ratio = top.rationalValue(top.divide(argument, known));
          if (ratio.isPresent() && Rationals.isInteger(ratio.get())) {
            return top.pow(t, ratio.get().getNumerator().intValueExact());
          }
          break;
        default:
          break;
      }
    }
    if (building) {
      throw new MalformedTowerException(c + " is used before its generator was adjoined");
    }
    throw new UnsupportedConstructException(c + " is not a generator of the tower");
  }
}
