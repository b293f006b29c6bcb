package integration.core;

import integration.expr.Expr;
import integration.expr.Exprs;
import integration.expr.Integral;
import integration.expr.Symbol;
import java.util.Objects;

/** Outcome of integrating one expression. */
public sealed interface IntegrationResult
    permits IntegrationResult.Closed, IntegrationResult.Partial, IntegrationResult.Failed {

  Expr integrand();

  Symbol variable();

  /** The symbolic value reported to callers. */
  Expr expression();

  Outcome outcome();

  /** Coarse classification of a result. */
  enum Outcome {
    CLOSED,
    PARTIAL,
    FAILED
  }

  /** An elementary antiderivative was found. */
  record Closed(Expr integrand, Symbol variable, Expr antiderivative) implements IntegrationResult {
    public Closed {
      Objects.requireNonNull(integrand, "integrand");
      Objects.requireNonNull(variable, "variable");
      Objects.requireNonNull(antiderivative, "antiderivative");
    }

    @Override
    public Expr expression() {
      return antiderivative;
    }

    @Override
    public Outcome outcome() {
      return Outcome.CLOSED;
    }
  }

  /**
   * Part of the integrand was integrated; {@code residual} has no elementary antiderivative in
   * the tower and is kept as an unevaluated integral.
   */
  record Partial(Expr integrand, Symbol variable, Expr integratedPart, Expr residual)
      implements IntegrationResult {
    public Partial {
      Objects.requireNonNull(integrand, "integrand");
      Objects.requireNonNull(variable, "variable");
      Objects.requireNonNull(integratedPart, "integratedPart");
      Objects.requireNonNull(residual, "residual");
    }

    @Override
    public Expr expression() {
      return Exprs.add(integratedPart, new Integral(residual, variable));
    }

    @Override
    public Outcome outcome() {
      return Outcome.PARTIAL;
    }
  }

  /** The integration was abandoned and degraded to an unevaluated integral. */
  record Failed(Expr integrand, Symbol variable, ErrorKind kind, String message)
      implements IntegrationResult {
    public Failed {
      Objects.requireNonNull(integrand, "integrand");
      Objects.requireNonNull(variable, "variable");
      Objects.requireNonNull(kind, "kind");
      message = message == null ? "" : message;
    }

    @Override
    public Expr expression() {
      return new Integral(integrand, variable);
    }

    @Override
    public Outcome outcome() {
      return Outcome.FAILED;
    }
  }
}
