package integration.expr;

import integration.algebra.Rationals;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for infix expressions such as {@code sin(x)/(1 + cos(x)^2)}.
 *
 * <p>Supports {@code + - * / ^}, parentheses, decimal and integer literals, the elementary
 * functions of {@link FunctionName} and the imaginary unit {@code I}. Any other identifier is
 * parsed as a symbol.
 */
public final class ExprParser {
  private final String source;
  private final List<Token> tokens;
  private int position;

  private ExprParser(String source) {
    this.source = source;
    this.tokens = tokenize(source);
  }

  /**
   * Parses an expression.
   *
   * @throws IllegalArgumentException on malformed input
   */
  public static Expr parse(String source) {
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("Expression must not be blank");
    }
    ExprParser parser = new ExprParser(source);
    Expr expr = parser.expression();
    if (parser.peek().kind() != TokenKind.END) {
      throw parser.error("Unexpected '" + parser.peek().text() + "'");
    }
    return expr;
  }

  private Expr expression() {
    List<Expr> terms = new ArrayList<>();
    terms.add(term());
    while (true) {
      Token next = peek();
      if (next.is('+')) {
        position++;
        terms.add(term());
      } else if (next.is('-')) {
        position++;
        terms.add(Exprs.negate(term()));
      } else {
        return Exprs.sum(terms);
      }
    }
  }

  private Expr term() {
    Expr result = unary();
    while (true) {
      Token next = peek();
      if (next.is('*')) {
        position++;
        result = Exprs.multiply(result, unary());
      } else if (next.is('/')) {
        position++;
        Expr divisor = unary();
        if (Exprs.isZero(divisor)) {
          throw error("Division by zero");
        }
        result = Exprs.divide(result, divisor);
      } else {
        return result;
      }
    }
  }

  private Expr unary() {
    if (peek().is('-')) {
      position++;
      return Exprs.negate(unary());
    }
    if (peek().is('+')) {
      position++;
      return unary();
    }
    return power();
  }

  private Expr power() {
    Expr base = primary();
    if (peek().is('^')) {
      position++;
      Expr exponent = unary();
      if (Exprs.isZero(base) && exponent instanceof Num n && n.isNegative()) {
        throw error("Division by zero");
      }
      return Exprs.power(base, exponent);
    }
    return base;
  }

  private Expr primary() {
    Token token = next();
    switch (token.kind()) {
      case NUMBER:
        return new Num(Rationals.parse(token.text()));
      case IDENTIFIER:
        if (peek().is('(')) {
          Optional<FunctionName> function = FunctionName.fromName(token.text());
          if (function.isEmpty()) {
            throw error("Unknown function '" + token.text() + "'");
          }
          position++;
          Expr argument = expression();
          expect(')');
          return Exprs.call(function.get(), argument);
        }
        return new Symbol(token.text());
      case OPERATOR:
        if (token.is('(')) {
          Expr inner = expression();
          expect(')');
          return inner;
        }
        throw error("Unexpected '" + token.text() + "'");
      default:
        throw error("Unexpected end of input");
    }
  }

  private void expect(char symbol) {
    Token token = next();
    if (!token.is(symbol)) {
      throw error("Expected '" + symbol + "'");
    }
  }

  private Token peek() {
    return tokens.get(position);
  }

  private Token next() {
    Token token = tokens.get(position);
    if (token.kind() != TokenKind.END) {
      position++;
    }
    return token;
  }

  private IllegalArgumentException error(String message) {
    int offset = tokens.get(Math.max(0, Math.min(position, tokens.size() - 1))).offset();
    return new IllegalArgumentException(
        message + " at offset " + offset + " in '" + source + "'");
  }

  private static List<Token> tokenize(String source) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isDigit(c) || c == '.') {
        int start = i;
        while (i < source.length()
            && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
          i++;
        }
        tokens.add(new Token(TokenKind.NUMBER, source.substring(start, i), start));
      } else if (Character.isLetter(c) || c == '_') {
        int start = i;
        while (i < source.length()
            && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
          i++;
        }
        tokens.add(new Token(TokenKind.IDENTIFIER, source.substring(start, i), start));
      } else if ("+-*/^()".indexOf(c) >= 0) {
        tokens.add(new Token(TokenKind.OPERATOR, String.valueOf(c), i));
        i++;
      } else {
        throw new IllegalArgumentException(
            "Unexpected character '" + c + "' at offset " + i + " in '" + source + "'");
      }
    }
    tokens.add(new Token(TokenKind.END, "", source.length()));
    return tokens;
  }

  private enum TokenKind {
    NUMBER,
    IDENTIFIER,
    OPERATOR,
    END
  }

  private record Token(TokenKind kind, String text, int offset) {
    boolean is(char symbol) {
      return kind == TokenKind.OPERATOR && text.charAt(0) == symbol;
    }
  }
}
