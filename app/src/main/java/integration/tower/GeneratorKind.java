package integration.tower;

import integration.expr.FunctionName;

/** Kind of monomial adjoined at one level of a tower. */
public enum GeneratorKind {
  /** The integration variable, {@code D(x) = 1}. */
  IDENTITY,
  /** Primitive {@code t = log(u)}, {@code D(t) = D(u)/u}. */
  LOG,
  /** Hyperexponential {@code t = exp(u)}, {@code D(t) = D(u) t}. */
  EXP,
  /** Hypertangent {@code t = tan(u)}, {@code D(t) = D(u) (1 + t^2)}. */
  TAN;

  public FunctionName function() {
    return switch (this) {
      case LOG -> FunctionName.LOG;
      case EXP -> FunctionName.EXP;
      case TAN -> FunctionName.TAN;
      case IDENTITY -> throw new IllegalStateException("The identity generator is not a function");
    };
  }
}
