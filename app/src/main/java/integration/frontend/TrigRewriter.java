package integration.frontend;

import integration.algebra.Rationals;
import integration.core.UnsupportedConstructException;
import integration.expr.Call;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.expr.Num;
import integration.expr.Power;
import integration.expr.Scaled;
import integration.expr.Sum;
import integration.expr.Symbol;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Brings an integrand into a form whose transcendental functions are {@code exp}, {@code log} and
 * {@code tan} only.
 *
 * <p>Hyperbolic functions become exponentials. {@code sec}, {@code csc} and {@code cot} become
 * reciprocals. Powers with a non-constant exponent become exponentials of logarithms, and
 * integral multiples of logarithms inside {@code exp} are pulled out as powers.
 *
 * <p>Sines, cosines and tangents are then handled in one of two ways. When every angle is a
 * rational multiple {@code c*w} of the same {@code w}, they are expressed through {@code tau =
 * tan(h*w)}, where {@code h} is the rational gcd of half the sine and cosine multiples and of the
 * tangent multiples. Integrands whose only trigonometric function is {@code tan} of a single
 * argument are left alone. Otherwise each function is written through {@code E = exp(I*u)}, which
 * needs the algebraic closure.
 */
public final class TrigRewriter {

  private TrigRewriter() {}

  public static RewriteResult rewrite(Expr integrand, Symbol variable, TrigStrategy strategy) {
    Objects.requireNonNull(strategy, "strategy");
    Expr expr = Exprs.transform(integrand, node -> elementary(node, variable));
    List<Call> trig = new ArrayList<>();
    for (Call call : Exprs.calls(expr)) {
      if (call.function().isTrigonometric()) {
        trig.add(call);
      }
    }
    if (trig.isEmpty()) {
      return new RewriteResult(expr, false);
    }
    Set<Expr> rests = new LinkedHashSet<>();
    Set<Expr> tangentArguments = new LinkedHashSet<>();
    boolean onlyTangents = true;
    BigFraction sineContent = BigFraction.ZERO;
    BigFraction tangentContent = BigFraction.ZERO;
    for (Call call : trig) {
      Scaled angle = Exprs.split(call.argument());
      rests.add(angle.rest());
      if (call.function() == FunctionName.TAN) {
        tangentArguments.add(call.argument());
        tangentContent = Rationals.gcd(tangentContent, angle.coefficient());
      } else {
        onlyTangents = false;
        sineContent = Rationals.gcd(sineContent, angle.coefficient());
      }
    }
    if (strategy == TrigStrategy.HALF_ANGLE && rests.size() == 1) {
      if (onlyTangents && tangentArguments.size() == 1) {
        return new RewriteResult(expr, false);
      }
      Expr w = rests.iterator().next();
      BigFraction h = Rationals.gcd(sineContent.divide(2), tangentContent);
      return new RewriteResult(halfAngle(expr, h, w), false);
    }
    return new RewriteResult(Exprs.transform(expr, TrigRewriter::complexExponential), true);
  }

  private static Expr elementary(Expr node, Symbol variable) {
    if (node instanceof Power p && !p.exponent().isFreeOf(variable)) {
      return exp(Exprs.multiply(p.exponent(), log(p.base())));
    }
    if (!(node instanceof Call c)) {
      return node;
    }
    Expr u = c.argument();
    Expr two = Num.of(2);
    return switch (c.function()) {
      case EXP -> exp(u);
      case LOG -> log(u);
      case SEC -> Exprs.power(Exprs.call(FunctionName.COS, u), -1);
      case CSC -> Exprs.power(Exprs.call(FunctionName.SIN, u), -1);
      case COT -> Exprs.power(Exprs.call(FunctionName.TAN, u), -1);
      case SINH -> Exprs.divide(Exprs.subtract(exp(u), exp(Exprs.negate(u))), two);
      case COSH -> Exprs.divide(Exprs.add(exp(u), exp(Exprs.negate(u))), two);
      case TANH -> tanh(u);
      case COTH -> Exprs.power(tanh(u), -1);
      case SECH -> Exprs.divide(two, Exprs.add(exp(u), exp(Exprs.negate(u))));
      case CSCH -> Exprs.divide(two, Exprs.subtract(exp(u), exp(Exprs.negate(u))));
      default -> node;
    };
  }

  private static Expr tanh(Expr u) {
    Expr e2 = exp(Exprs.multiply(Num.of(2), u));
    return Exprs.divide(Exprs.subtract(e2, Num.ONE), Exprs.add(e2, Num.ONE));
  }

  /** {@code log(b^n) = n log(b)} for integral {@code n}. */
  private static Expr log(Expr u) {
    if (u instanceof Power p && Exprs.isInteger(p.exponent())) {
      return Exprs.multiply(p.exponent(), log(p.base()));
    }
    return Exprs.call(FunctionName.LOG, u);
  }

  /** {@code exp(n log(b) + v) = b^n exp(v)} for integral {@code n}. */
  private static Expr exp(Expr argument) {
    List<Expr> terms = argument instanceof Sum s ? s.terms() : List.of(argument);
    List<Expr> kept = new ArrayList<>();
    List<Expr> factors = new ArrayList<>();
    for (Expr term : terms) {
      Scaled scaled = Exprs.split(term);
      if (scaled.rest() instanceof Call c && c.function() == FunctionName.LOG) {
        if (!Rationals.isInteger(scaled.coefficient())) {
          throw new UnsupportedConstructException(
              "exp(" + term + ") is an algebraic function");
        }
        factors.add(Exprs.power(c.argument(), new Num(scaled.coefficient())));
      } else {
        kept.add(term);
      }
    }
    factors.add(Exprs.call(FunctionName.EXP, Exprs.sum(kept)));
    return Exprs.product(factors);
  }

  /**
   * Rewrites through {@code tau = tan(h*w)}: sines and cosines of {@code 2kh*w} by the
   * angle-addition recurrence on {@code sin(2h*w)} and {@code cos(2h*w)}, tangents of {@code kh*w}
   * by the tangent addition formula.
   */
  private static Expr halfAngle(Expr expr, BigFraction h, Expr w) {
    Expr tau = Exprs.call(FunctionName.TAN, Exprs.multiply(new Num(h), w));
    Expr tauSquared = Exprs.power(tau, 2);
    Expr denominator = Exprs.power(Exprs.add(Num.ONE, tauSquared), -1);
    Expr sin = Exprs.multiply(Num.of(2), tau, denominator);
    Expr cos = Exprs.multiply(Exprs.subtract(Num.ONE, tauSquared), denominator);
    BigFraction full = h.multiply(2);
    return Exprs.transform(
        expr,
        node -> {
          if (!(node instanceof Call c) || !c.function().isTrigonometric()) {
            return node;
          }
          Scaled angle = Exprs.split(c.argument());
          if (!angle.rest().equals(w)) {
            return node;
          }
          if (c.function() == FunctionName.TAN) {
            BigFraction multiple = angle.coefficient().divide(h);
            return Rationals.isInteger(multiple)
                ? multipleTangent(tau, multiple.getNumerator().intValueExact())
                : node;
          }
          BigFraction multiple = angle.coefficient().divide(full);
          if (!Rationals.isInteger(multiple)) {
            return node;
          }
          Expr[] sc = multipleAngle(sin, cos, multiple.getNumerator().intValueExact());
          return switch (c.function()) {
            case SIN -> sc[0];
            case COS -> sc[1];
            default -> node;
          };
        });
  }

  /** {@code tan(n a)} from {@code tan(a)}. */
  private static Expr multipleTangent(Expr tan, int n) {
    Expr t = tan;
    for (int i = 1; i < Math.abs(n); i++) {
      t =
          Exprs.divide(
              Exprs.add(t, tan), Exprs.subtract(Num.ONE, Exprs.multiply(t, tan)));
    }
    return n < 0 ? Exprs.negate(t) : t;
  }

  /** {@code [sin(n a), cos(n a)]} from {@code sin(a)} and {@code cos(a)}. */
  private static Expr[] multipleAngle(Expr sin, Expr cos, int n) {
    Expr s = Num.ZERO;
    Expr c = Num.ONE;
    for (int i = 0; i < Math.abs(n); i++) {
      Expr nextS = Exprs.add(Exprs.multiply(s, cos), Exprs.multiply(c, sin));
      Expr nextC = Exprs.subtract(Exprs.multiply(c, cos), Exprs.multiply(s, sin));
      s = nextS;
      c = nextC;
    }
    return new Expr[] {n < 0 ? Exprs.negate(s) : s, c};
  }

  private static Expr complexExponential(Expr node) {
    if (!(node instanceof Call c) || !c.function().isTrigonometric()) {
      return node;
    }
    Expr i = Symbol.IMAGINARY_UNIT;
    Expr e = Exprs.call(FunctionName.EXP, Exprs.multiply(i, c.argument()));
    Expr inverse = Exprs.power(e, -1);
    return switch (c.function()) {
      case SIN -> Exprs.multiply(
          new Num(new BigFraction(-1, 2)), i, Exprs.subtract(e, inverse));
      case COS -> Exprs.multiply(new Num(new BigFraction(1, 2)), Exprs.add(e, inverse));
      case TAN -> {
        Expr e2 = Exprs.power(e, 2);
        yield Exprs.multiply(
            Exprs.negate(i),
            Exprs.subtract(e2, Num.ONE),
            Exprs.power(Exprs.add(e2, Num.ONE), -1));
      }
      default -> node;
    };
  }
}
