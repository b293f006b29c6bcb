package integration.expr;

import java.util.Objects;

/** Application of a named elementary function. */
public record Call(FunctionName function, Expr argument) implements Expr {
  public Call {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(argument, "argument");
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }
}
