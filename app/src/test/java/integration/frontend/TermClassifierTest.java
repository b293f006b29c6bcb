package integration.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import integration.core.UnsupportedConstructException;
import integration.expr.ExprParser;
import integration.expr.Symbol;
import integration.tower.FunctionTerm;
import integration.tower.IdentityTerm;
import integration.tower.Term;
import integration.tower.TermKind;
import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class TermClassifierTest {
  private static final Symbol X = new Symbol("x");

  private static List<Term> classify(String source) {
    return TermClassifier.classify(ExprParser.parse(source), X);
  }

  @Test
  void variableComesFirstAndArgumentsBeforeFunctions() {
    List<Term> terms = classify("1/(x*log(log(x)))");
    assertEquals(
        List.of(
            new IdentityTerm(X),
            new FunctionTerm(TermKind.LOG, BigFraction.ONE, X),
            FunctionTerm.of(TermKind.LOG, ExprParser.parse("log(x)"))),
        terms);
  }

  @Test
  void exponentialsOfRationalMultiplesAreMerged() {
    List<Term> terms = classify("exp(x/2) + exp(x/3)");
    assertEquals(2, terms.size(), () -> "One exponential term expected: " + terms);
    assertEquals(new FunctionTerm(TermKind.EXP, new BigFraction(1, 6), X), terms.get(1));
  }

  @Test
  void tangentsFollowTheTermsTheyMultiply() {
    assertEquals(
        List.of(
            new IdentityTerm(X),
            new FunctionTerm(TermKind.EXP, BigFraction.ONE, X),
            FunctionTerm.of(TermKind.TAN, X)),
        classify("tan(x)^2*exp(x)"));
  }

  @Test
  void tangentsInsideArgumentsStayFirst() {
    List<Term> terms = classify("exp(tan(x))");
    assertEquals(FunctionTerm.of(TermKind.TAN, X), terms.get(1));
    assertEquals(TermKind.EXP, ((FunctionTerm) terms.get(2)).kind());
  }

  @Test
  void rationalFunctionsOnlyNeedTheVariable() {
    assertEquals(List.of(new IdentityTerm(X)), classify("(x^2+1)/(x-3)"));
  }

  @Test
  void algebraicConstructsAreRejected() {
    assertThrows(UnsupportedConstructException.class, () -> classify("sqrt(x)"));
    assertThrows(UnsupportedConstructException.class, () -> classify("x^(1/2)"));
    assertThrows(UnsupportedConstructException.class, () -> classify("y*x"));
    assertThrows(UnsupportedConstructException.class, () -> classify("sin(x)"));
  }
}
