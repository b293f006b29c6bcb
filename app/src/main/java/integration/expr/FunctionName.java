package integration.expr;

import java.util.Locale;
import java.util.Optional;

/** Elementary functions understood by the parser and the front-end. */
public enum FunctionName {
  EXP("exp"),
  LOG("log"),
  SIN("sin"),
  COS("cos"),
  TAN("tan"),
  COT("cot"),
  SEC("sec"),
  CSC("csc"),
  SINH("sinh"),
  COSH("cosh"),
  TANH("tanh"),
  COTH("coth"),
  SECH("sech"),
  CSCH("csch"),
  ATAN("atan"),
  SQRT("sqrt");

  private final String symbol;

  FunctionName(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isTrigonometric() {
    return switch (this) {
      case SIN, COS, TAN, COT, SEC, CSC -> true;
      default -> false;
    };
  }

  public boolean isHyperbolic() {
    return switch (this) {
      case SINH, COSH, TANH, COTH, SECH, CSCH -> true;
      default -> false;
    };
  }

  public static Optional<FunctionName> fromName(String name) {
    String normalized = name.toLowerCase(Locale.ROOT);
    if ("ln".equals(normalized)) {
      return Optional.of(LOG);
    }
    if ("arctan".equals(normalized)) {
      return Optional.of(ATAN);
    }
    for (FunctionName function : values()) {
      if (function.symbol.equals(normalized)) {
        return Optional.of(function);
      }
    }
    return Optional.empty();
  }
}
