package integration.tower;

import integration.algebra.CoefficientField;
import integration.algebra.Rationals;
import integration.core.MalformedTowerException;
import integration.core.UnsupportedConstructException;
import integration.expr.Differentiator;
import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.Num;
import integration.expr.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the differential field tower for an ordered list of terms. Each function term becomes a
 * new monomial unless it coincides with an existing generator up to field equality; terms whose
 * generator would be algebraic over the tower built so far are rejected.
 */
public final class TowerBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(TowerBuilder.class);

  private TowerBuilder() {}

  /**
   * @param terms classified terms, the identity term first and every argument expressible in the
   *     generators adjoined before it
   * @throws UnsupportedConstructException for {@code atan} terms, transcendental constants and
   *     algebraically dependent generators
   * @throws MalformedTowerException when a term references a later generator
   */
  public static <C> Tower<C> build(List<Term> terms, CoefficientField<C> field, Symbol variable) {
    if (terms.isEmpty() || !(terms.get(0) instanceof IdentityTerm identity)) {
      throw new MalformedTowerException("The first term must be the integration variable");
    }
    if (!identity.variable().equals(variable)) {
      throw new MalformedTowerException(
          "Identity term " + identity.variable() + " does not match variable " + variable);
    }
    ConstantLevel<C> constants = new ConstantLevel<>(field);
    List<ExtensionLevel<C>> levels = new ArrayList<>();
    levels.add(
        ExtensionLevel.identity(
            constants, new Generator(0, GeneratorKind.IDENTITY, variable, variable, Num.ONE)));

    for (Term term : terms.subList(1, terms.size())) {
      if (!(term instanceof FunctionTerm function)) {
        throw new MalformedTowerException("The integration variable may only appear first");
      }
      adjoin(levels, function, variable).ifPresent(levels::add);
    }
    Tower<C> tower = new Tower<>(constants, levels, variable);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Built tower over {}: {}", field, tower.describe());
    }
    return tower;
  }

  private static <C> Optional<ExtensionLevel<C>> adjoin(
      List<ExtensionLevel<C>> levels, FunctionTerm term, Symbol variable) {
    GeneratorKind kind = kindOf(term.kind());
    Expr argument = term.fullArgument();
    ExtensionLevel<C> top = levels.get(levels.size() - 1);
    TowerElement<C> u = new ElementConverter<>(levels, variable, true).convert(argument);
    if (top.isConstant(u)) {
      throw new UnsupportedConstructException(
          kind.function().symbol() + "(" + argument + ") is a transcendental constant");
    }
    TowerElement<C> du = top.derive(u);
    for (ExtensionLevel<C> existing : levels) {
      if (existing.kind() != kind) {
        continue;
      }
      TowerElement<C> w = top.lift(existing.argument());
      TowerElement<C> dw = top.lift(existing.argumentDerivative());
      if (duplicates(top, kind, u, w)) {
        LOG.debug("Reusing generator t{} for {}({})", existing.height(), kind, argument);
        return Optional.empty();
      }
      checkIndependent(top, kind, u, du, w, dw, argument, existing);
    }
    int height = levels.size();
    Expr expression = Exprs.call(kind.function(), argument);
    Generator generator =
        new Generator(height, kind, argument, expression, derivative(kind, argument, variable));
    return Optional.of(ExtensionLevel.of(top, generator, u));
  }

  private static <C> boolean duplicates(
      ExtensionLevel<C> top, GeneratorKind kind, TowerElement<C> u, TowerElement<C> w) {
    if (kind != GeneratorKind.EXP) {
      return u.equals(w);
    }
    Optional<BigFraction> ratio = top.rationalValue(top.divide(u, w));
    return ratio.isPresent() && Rationals.isInteger(ratio.get());
  }

  /**
   * Rejects a generator that is algebraic over the existing one of the same kind. For exponentials
   * and tangents that happens exactly when the argument derivatives have a rational ratio.
   */
  private static <C> void checkIndependent(
      ExtensionLevel<C> top,
      GeneratorKind kind,
      TowerElement<C> u,
      TowerElement<C> du,
      TowerElement<C> w,
      TowerElement<C> dw,
      Expr argument,
      ExtensionLevel<C> existing) {
    switch (kind) {
      case EXP -> {
        // exp(u) = exp(r w) * exp(u - r w) for rational r; only then is the second factor constant
        // and exp(u) algebraic. A ratio such as I keeps exp(I x) independent of exp(x).
        if (top.rationalValue(top.divide(du, dw)).isPresent()) {
          throw new UnsupportedConstructException(
              "exp(" + argument + ") is algebraic over " + existing.generator().expression());
        }
      }
      case LOG -> {
        TowerElement<C> ratio = top.divide(top.divide(du, u), top.divide(dw, w));
        if (top.isConstant(ratio)) {
          throw new UnsupportedConstructException(
              "log(" + argument + ") differs from a multiple of "
                  + existing.generator().expression()
                  + " by a constant");
        }
      }
      case TAN -> {
        if (top.rationalValue(top.divide(du, dw)).isPresent()) {
          throw new UnsupportedConstructException(
              "tan(" + argument + ") is algebraic over " + existing.generator().expression());
        }
      }
      case IDENTITY -> throw new MalformedTowerException("Second integration variable");
    }
  }

  private static Expr derivative(GeneratorKind kind, Expr argument, Symbol variable) {
    Expr du = Differentiator.differentiate(argument, variable);
    Expr t = Exprs.call(kind.function(), argument);
    return switch (kind) {
      case LOG -> Exprs.divide(du, argument);
      case EXP -> Exprs.multiply(du, t);
      case TAN -> Exprs.multiply(du, Exprs.add(Num.ONE, Exprs.power(t, 2)));
      case IDENTITY -> Num.ONE;
    };
  }

  private static GeneratorKind kindOf(TermKind kind) {
    return switch (kind) {
      case LOG -> GeneratorKind.LOG;
      case EXP -> GeneratorKind.EXP;
      case TAN -> GeneratorKind.TAN;
      case ATAN -> throw new UnsupportedConstructException(
          "atan terms are produced by integration, not accepted as generators");
    };
  }
}
