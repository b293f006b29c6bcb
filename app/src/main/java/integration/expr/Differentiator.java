package integration.expr;

import java.util.ArrayList;
import java.util.List;

/** Symbolic differentiation with respect to a single variable. */
public final class Differentiator {

  private Differentiator() {}

  public static Expr differentiate(Expr expr, Symbol variable) {
    if (expr.isFreeOf(variable)) {
      return Num.ZERO;
    }
    if (expr instanceof Symbol) {
      return Num.ONE;
    }
    if (expr instanceof Sum s) {
      List<Expr> terms = new ArrayList<>(s.terms().size());
      for (Expr term : s.terms()) {
        terms.add(differentiate(term, variable));
      }
      return Exprs.sum(terms);
    }
    if (expr instanceof Product p) {
      List<Expr> terms = new ArrayList<>(p.factors().size());
      for (int i = 0; i < p.factors().size(); i++) {
        List<Expr> factors = new ArrayList<>(p.factors());
        factors.set(i, differentiate(factors.get(i), variable));
        terms.add(Exprs.product(factors));
      }
      return Exprs.sum(terms);
    }
    if (expr instanceof Power p) {
      return power(p, variable);
    }
    if (expr instanceof Call c) {
      Expr inner = differentiate(c.argument(), variable);
      return Exprs.multiply(outer(c), inner);
    }
    if (expr instanceof Integral i) {
      if (!i.variable().equals(variable)) {
        throw new IllegalArgumentException(
            "Cannot differentiate an integral over " + i.variable() + " by " + variable);
      }
      return i.integrand();
    }
    RootSum r = (RootSum) expr;
    return new RootSum(r.polynomial(), r.variable(), differentiate(r.body(), variable));
  }

  private static Expr power(Power power, Symbol variable) {
    Expr base = power.base();
    Expr exponent = power.exponent();
    Expr dBase = differentiate(base, variable);
    if (exponent.isFreeOf(variable)) {
      return Exprs.multiply(
          exponent, Exprs.power(base, Exprs.subtract(exponent, Num.ONE)), dBase);
    }
    Expr dExponent = differentiate(exponent, variable);
    return Exprs.multiply(
        power,
        Exprs.add(
            Exprs.multiply(dExponent, Exprs.call(FunctionName.LOG, base)),
            Exprs.multiply(exponent, dBase, Exprs.power(base, -1))));
  }

  private static Expr outer(Call call) {
    Expr u = call.argument();
    return switch (call.function()) {
      case EXP -> call;
      case LOG -> Exprs.power(u, -1);
      case SIN -> Exprs.call(FunctionName.COS, u);
      case COS -> Exprs.negate(Exprs.call(FunctionName.SIN, u));
      case TAN -> Exprs.add(Num.ONE, Exprs.power(call, 2));
      case COT -> Exprs.negate(Exprs.add(Num.ONE, Exprs.power(call, 2)));
      case SEC -> Exprs.multiply(call, Exprs.call(FunctionName.TAN, u));
      case CSC -> Exprs.negate(Exprs.multiply(call, Exprs.call(FunctionName.COT, u)));
      case SINH -> Exprs.call(FunctionName.COSH, u);
      case COSH -> Exprs.call(FunctionName.SINH, u);
      case TANH -> Exprs.subtract(Num.ONE, Exprs.power(call, 2));
      case COTH -> Exprs.subtract(Num.ONE, Exprs.power(call, 2));
      case SECH -> Exprs.negate(Exprs.multiply(call, Exprs.call(FunctionName.TANH, u)));
      case CSCH -> Exprs.negate(Exprs.multiply(call, Exprs.call(FunctionName.COTH, u)));
      case ATAN -> Exprs.power(Exprs.add(Num.ONE, Exprs.power(u, 2)), -1);
      case SQRT -> Exprs.divide(Num.ONE, Exprs.multiply(Num.of(2), call));
    };
  }
}
