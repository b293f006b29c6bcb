package integration.tower;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import integration.algebra.AlgebraicClosureField;
import integration.algebra.ComplexRational;
import integration.algebra.RationalField;
import integration.core.MalformedTowerException;
import integration.core.UnsupportedConstructException;
import integration.expr.Expr;
import integration.expr.ExprParser;
import integration.expr.Symbol;
import integration.frontend.TermClassifier;
import java.util.List;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class TowerBuilderTest {
  private static final Symbol X = new Symbol("x");
  private static final IdentityTerm IDENTITY = new IdentityTerm(X);

  private static Tower<BigFraction> tower(String integrand) {
    return TowerBuilder.build(
        TermClassifier.classify(ExprParser.parse(integrand), X), RationalField.INSTANCE, X);
  }

  private static Tower<BigFraction> tower(List<Term> terms) {
    return TowerBuilder.build(terms, RationalField.INSTANCE, X);
  }

  private static FunctionTerm term(TermKind kind, String argument) {
    return FunctionTerm.of(kind, ExprParser.parse(argument));
  }

  @Test
  void generatorsFollowTermOrder() {
    Tower<BigFraction> tower = tower("x*log(exp(x)+1)");
    assertEquals(3, tower.size(), () -> "x, exp(x), log(exp(x) + 1): " + tower.describe());
    assertEquals(GeneratorKind.IDENTITY, tower.level(0).kind());
    assertEquals(GeneratorKind.EXP, tower.level(1).kind());
    assertEquals(GeneratorKind.LOG, tower.level(2).kind());
  }

  @Test
  void constructionIsDeterministic() {
    String integrand = "log(x)*exp(x^2) + 1/log(x)";
    assertEquals(tower(integrand).describe(), tower(integrand).describe());
  }

  @Test
  void duplicateTermsReuseTheGenerator() {
    Tower<BigFraction> tower =
        tower(List.of(IDENTITY, term(TermKind.LOG, "x+1"), term(TermKind.LOG, "x+1")));
    assertEquals(2, tower.size(), "log(x + 1) is adjoined once");
  }

  @Test
  void integralMultiplesOfAnExponentialArePowers() {
    Tower<BigFraction> tower =
        tower(List.of(IDENTITY, term(TermKind.EXP, "x"), term(TermKind.EXP, "2*x")));
    assertEquals(2, tower.size(), "exp(2x) reuses exp(x)");
    ExtensionLevel<BigFraction> top = tower.top();
    TowerElement<BigFraction> t = top.generatorElement(1);
    TowerElement<BigFraction> square = tower.toElement(ExprParser.parse("exp(2*x)"));
    assertTrue(top.isZero(top.subtract(square, top.multiply(t, t))), "exp(2x) = t^2");
  }

  @Test
  void derivationFollowsTheGeneratorRelations() {
    Tower<BigFraction> tower = tower("log(x)*exp(x^2)");
    ExtensionLevel<BigFraction> top = tower.top();
    assertDerivative(tower, "log(x)*exp(x^2)", "exp(x^2)/x + 2*x*log(x)*exp(x^2)");
    assertTrue(top.isConstant(top.fromRational(new BigFraction(3))), "Rationals are constants");
  }

  private static void assertDerivative(Tower<BigFraction> tower, String f, String df) {
    ExtensionLevel<BigFraction> top = tower.top();
    Expr expected = ExprParser.parse(df);
    TowerElement<BigFraction> difference =
        top.subtract(top.derive(tower.toElement(ExprParser.parse(f))), tower.toElement(expected));
    assertTrue(top.isZero(difference), () -> "D(" + f + ") should be " + df);
  }

  @Test
  void exponentialsDifferingByAConstantAreRejected() {
    assertThrows(
        UnsupportedConstructException.class,
        () -> tower(List.of(IDENTITY, term(TermKind.EXP, "x"), term(TermKind.EXP, "x+1"))));
  }

  @Test
  void logarithmsDifferingByAConstantAreRejected() {
    assertThrows(
        UnsupportedConstructException.class,
        () -> tower(List.of(IDENTITY, term(TermKind.LOG, "x"), term(TermKind.LOG, "3*x"))));
  }

  @Test
  void complexMultiplesOfAnExponentAreIndependent() {
    Tower<ComplexRational> tower =
        TowerBuilder.build(
            List.of(IDENTITY, term(TermKind.EXP, "x"), term(TermKind.EXP, "I*x")),
            AlgebraicClosureField.INSTANCE,
            X);
    assertEquals(3, tower.size(), () -> "exp(x) and exp(I*x) both adjoined: " + tower.describe());
  }

  @Test
  void tangentsOfRationalMultiplesAreRejected() {
    assertThrows(
        UnsupportedConstructException.class,
        () -> tower(List.of(IDENTITY, term(TermKind.TAN, "x"), term(TermKind.TAN, "3*x"))));
  }

  @Test
  void transcendentalConstantsAreRejected() {
    assertThrows(UnsupportedConstructException.class, () -> tower("x*log(2)"));
  }

  @Test
  void arctangentTermsAreNotGenerators() {
    assertThrows(
        UnsupportedConstructException.class,
        () -> tower(List.of(IDENTITY, term(TermKind.ATAN, "x"))));
  }

  @Test
  void towerMustStartWithTheVariable() {
    assertThrows(
        MalformedTowerException.class, () -> tower(List.of(term(TermKind.LOG, "x"))));
    assertThrows(
        MalformedTowerException.class,
        () ->
            TowerBuilder.build(
                List.of(new IdentityTerm(new Symbol("y"))), RationalField.INSTANCE, X));
  }
}
