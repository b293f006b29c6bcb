package integration.frontend;

import integration.algebra.Rationals;
import integration.core.UnsupportedConstructException;
import integration.expr.Call;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.FunctionName;
import integration.expr.Integral;
import integration.expr.Num;
import integration.expr.Power;
import integration.expr.Product;
import integration.expr.RootSum;
import integration.expr.Scaled;
import integration.expr.Sum;
import integration.expr.Symbol;
import integration.tower.FunctionTerm;
import integration.tower.IdentityTerm;
import integration.tower.Term;
import integration.tower.TermKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.fraction.BigFraction;

/**
 * Lists the transcendental terms of a rewritten integrand in dependency order: the integration
 * variable first, then every function application after the ones occurring in its argument, with
 * tangents as late as that order permits.
 * Exponentials whose arguments are rational multiples of one another are merged into one term
 * whose coefficient is the gcd of the multiples.
 */
public final class TermClassifier {

  private TermClassifier() {}

  /**
   * @throws UnsupportedConstructException for algebraic functions, non-integer powers, functions
   *     other than {@code exp}, {@code log}, {@code tan} and {@code atan}, unevaluated integrals
   *     and symbols other than the variable and {@code I}
   */
  public static List<Term> classify(Expr integrand, Symbol variable) {
    validate(integrand, variable);
    List<Call> calls = tangentsLast(Exprs.calls(integrand));
    Map<Expr, BigFraction> exponentContent = new LinkedHashMap<>();
    for (Call call : calls) {
      if (kindOf(call) == TermKind.EXP) {
        Scaled split = Exprs.split(call.argument());
        exponentContent.merge(split.rest(), split.coefficient().abs(), Rationals::gcd);
      }
    }
    List<Term> terms = new ArrayList<>();
    terms.add(new IdentityTerm(variable));
    Set<Expr> emittedExponentials = new HashSet<>();
    for (Call call : calls) {
      TermKind kind = kindOf(call);
      if (kind == TermKind.EXP) {
        Expr rest = Exprs.split(call.argument()).rest();
        if (emittedExponentials.add(rest)) {
          terms.add(new FunctionTerm(TermKind.EXP, exponentContent.get(rest), rest));
        }
      } else {
        terms.add(FunctionTerm.of(kind, call.argument()));
      }
    }
    return terms;
  }

  /**
   * Moves every tangent after the other applications its position allows, so that a tangent
   * monomial sits on top of the exponentials and logarithms it multiplies.
   */
  private static List<Call> tangentsLast(List<Call> calls) {
    List<Call> pending = new ArrayList<>(calls);
    List<Call> ordered = new ArrayList<>(calls.size());
    Set<Call> emitted = new HashSet<>();
    while (!pending.isEmpty()) {
      Call next =
          pending.stream()
              .filter(call -> call.function() != FunctionName.TAN)
              .filter(call -> emitted.containsAll(Exprs.calls(call.argument())))
              .findFirst()
              .orElse(pending.get(0));
      pending.remove(next);
      ordered.add(next);
      emitted.add(next);
    }
    return ordered;
  }

  private static TermKind kindOf(Call call) {
    return switch (call.function()) {
      case EXP -> TermKind.EXP;
      case LOG -> TermKind.LOG;
      case TAN -> TermKind.TAN;
      case ATAN -> TermKind.ATAN;
      case SQRT -> throw new UnsupportedConstructException(
          "Algebraic function " + call + " is not supported");
      default -> throw new UnsupportedConstructException(
          call.function().symbol() + " must be rewritten before classification");
    };
  }

  private static void validate(Expr expr, Symbol variable) {
    if (expr instanceof Num) {
      return;
    }
    if (expr instanceof Symbol s) {
      if (!s.equals(variable) && !s.isImaginaryUnit()) {
        throw new UnsupportedConstructException(
            "Symbol " + s + " is neither " + variable + " nor I");
      }
      return;
    }
    if (expr instanceof Sum s) {
      s.terms().forEach(term -> validate(term, variable));
      return;
    }
    if (expr instanceof Product p) {
      p.factors().forEach(factor -> validate(factor, variable));
      return;
    }
    if (expr instanceof Power p) {
      if (!Exprs.isInteger(p.exponent())) {
        throw new UnsupportedConstructException("Non-integer power " + p);
      }
      validate(p.base(), variable);
      return;
    }
    if (expr instanceof Call c) {
      kindOf(c);
      validate(c.argument(), variable);
      return;
    }
    if (expr instanceof Integral || expr instanceof RootSum) {
      throw new UnsupportedConstructException("Cannot integrate " + expr);
    }
  }
}
