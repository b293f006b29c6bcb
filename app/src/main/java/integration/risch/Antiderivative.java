package integration.risch;

import integration.expr.Expr;
import integration.expr.Exprs;
import integration.reconstruct.ResultReconstructor;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of integrating an element {@code f} of one tower level: {@code f = D(rational) + sum of
 * the log term derivatives + residual}, where {@code residual} has no elementary integral in the
 * tower.
 */
public record Antiderivative<C>(
    TowerElement<C> rational, List<LogTerm<C>> logs, TowerElement<C> residual) {

  public Antiderivative {
    Objects.requireNonNull(rational, "rational");
    Objects.requireNonNull(residual, "residual");
    logs = List.copyOf(logs);
  }

  public static <C> Antiderivative<C> zero(TowerLevel<C> level) {
    return new Antiderivative<>(level.zero(), List.of(), level.zero());
  }

  public static <C> Antiderivative<C> rational(TowerLevel<C> level, TowerElement<C> value) {
    return new Antiderivative<>(value, List.of(), level.zero());
  }

  public static <C> Antiderivative<C> residual(TowerLevel<C> level, TowerElement<C> value) {
    return new Antiderivative<>(level.zero(), List.of(), value);
  }

  public Antiderivative<C> plus(TowerLevel<C> level, Antiderivative<C> other) {
    List<LogTerm<C>> merged = new ArrayList<>(logs);
    merged.addAll(other.logs);
    return new Antiderivative<>(
        level.add(rational, other.rational), merged, level.add(residual, other.residual));
  }

  public Antiderivative<C> plusRational(TowerLevel<C> level, TowerElement<C> value) {
    return new Antiderivative<>(level.add(rational, value), logs, residual);
  }

  public Antiderivative<C> plusResidual(TowerLevel<C> level, TowerElement<C> value) {
    return new Antiderivative<>(rational, logs, level.add(residual, value));
  }

  public Antiderivative<C> plusLogs(List<LogTerm<C>> terms) {
    List<LogTerm<C>> merged = new ArrayList<>(logs);
    merged.addAll(terms);
    return new Antiderivative<>(rational, merged, residual);
  }

  /** Re-expresses this antiderivative at a higher level. */
  public Antiderivative<C> lift(TowerLevel<C> level) {
    List<LogTerm<C>> lifted = new ArrayList<>(logs.size());
    for (LogTerm<C> term : logs) {
      lifted.add(term.lift(level));
    }
    return new Antiderivative<>(level.lift(rational), lifted, level.lift(residual));
  }

  public boolean isElementary(TowerLevel<C> level) {
    return level.isZero(residual);
  }

  /** Sum of the log term derivatives, or empty when one of them is not in the tower. */
  public Optional<TowerElement<C>> logDerivative(TowerLevel<C> level) {
    TowerElement<C> sum = level.zero();
    for (LogTerm<C> term : logs) {
      if (!term.hasDerivative()) {
        return Optional.empty();
      }
      sum = level.add(sum, term.derivative());
    }
    return Optional.of(sum);
  }

  /** {@code D(rational) + logs + residual}, when every log term has a derivative. */
  public Optional<TowerElement<C>> derivative(TowerLevel<C> level) {
    return logDerivative(level)
        .map(logPart -> level.add(level.add(level.derive(rational), logPart), residual));
  }

  /** The integrated part, rational and logarithmic terms, as an expression. */
  public Expr integratedPart(ResultReconstructor<C> reconstructor) {
    List<Expr> terms = new ArrayList<>(logs.size() + 1);
    terms.add(reconstructor.expression(rational));
    for (LogTerm<C> term : logs) {
      terms.add(term.expression());
    }
    return Exprs.sum(terms);
  }
}
