package integration.tower;

import integration.algebra.CoefficientField;
import integration.algebra.Polynomial;
import integration.core.MalformedTowerException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The field {@code F(t)} obtained by adjoining a monomial {@code t} to the level {@code F} below.
 * Elements are reduced fractions with monic denominators, and the derivation extends the one of
 * {@code F} through {@code D(t)}.
 */
public final class ExtensionLevel<C> extends TowerLevel<C> {
  private final TowerLevel<C> lower;
  private final Generator generator;
  private final int height;
  private final TowerElement<C> argument;
  private final TowerElement<C> argumentDerivative;
  private final Polynomial<TowerElement<C>> generatorDerivative;
  private final FractionElement<C> zero;
  private final FractionElement<C> one;

  private ExtensionLevel(
      TowerLevel<C> lower,
      Generator generator,
      TowerElement<C> argument,
      TowerElement<C> argumentDerivative,
      Polynomial<TowerElement<C>> generatorDerivative) {
    this.lower = lower;
    this.generator = generator;
    this.height = generator.height();
    this.argument = argument;
    this.argumentDerivative = argumentDerivative;
    this.generatorDerivative = generatorDerivative;
    this.zero = new FractionElement<>(height, Polynomial.zero(lower), Polynomial.one(lower));
    this.one = new FractionElement<>(height, Polynomial.one(lower), Polynomial.one(lower));
    if (height != lower.height() + 1) {
      throw new MalformedTowerException(
          "Generator of height " + height + " placed above level " + lower.height());
    }
  }

  /** Adjoins the integration variable to the constants. */
  public static <C> ExtensionLevel<C> identity(ConstantLevel<C> constants, Generator generator) {
    if (generator.kind() != GeneratorKind.IDENTITY) {
      throw new MalformedTowerException("The base generator must be the integration variable");
    }
    return new ExtensionLevel<>(
        constants, generator, constants.zero(), constants.one(), Polynomial.one(constants));
  }

  /**
   * Adjoins {@code log(u)}, {@code exp(u)} or {@code tan(u)} where {@code u} is an element of
   * {@code lower}.
   */
  public static <C> ExtensionLevel<C> of(
      TowerLevel<C> lower, Generator generator, TowerElement<C> argument) {
    Objects.requireNonNull(argument, "argument");
    TowerElement<C> u = lower.lift(argument);
    TowerElement<C> du = lower.derive(u);
    Polynomial<TowerElement<C>> derivative =
        switch (generator.kind()) {
          case LOG -> Polynomial.constant(lower, lower.divide(du, u));
          case EXP -> Polynomial.monomial(lower, du, 1);
          case TAN -> Polynomial.of(lower, du, lower.zero(), du);
          case IDENTITY -> throw new MalformedTowerException(
              "The integration variable can only be adjoined to the constants");
        };
    return new ExtensionLevel<>(lower, generator, u, du, derivative);
  }

  public TowerLevel<C> lower() {
    return lower;
  }

  public Generator generator() {
    return generator;
  }

  public GeneratorKind kind() {
    return generator.kind();
  }

  /** {@code u} for {@code log(u)}, {@code exp(u)} and {@code tan(u)}, as an element below. */
  public TowerElement<C> argument() {
    return argument;
  }

  /** {@code D(u)}, or {@code 1} for the integration variable. */
  public TowerElement<C> argumentDerivative() {
    return argumentDerivative;
  }

  /** {@code D(t)} as a polynomial in {@code t}. */
  public Polynomial<TowerElement<C>> generatorDerivative() {
    return generatorDerivative;
  }

  @Override
  public int height() {
    return height;
  }

  @Override
  public CoefficientField<C> coefficients() {
    return lower.coefficients();
  }

  @Override
  public List<Generator> generators() {
    List<Generator> generators = new ArrayList<>(lower.generators());
    generators.add(generator);
    return generators;
  }

  @Override
  public TowerElement<C> conjugateCoefficients(TowerElement<C> a) {
    FractionElement<C> f = element(a);
    return new FractionElement<>(
        height,
        f.numerator().map(lower, lower::conjugateCoefficients),
        f.denominator().map(lower, lower::conjugateCoefficients));
  }

  public Polynomial<TowerElement<C>> numerator(TowerElement<C> a) {
    return element(a).numerator();
  }

  public Polynomial<TowerElement<C>> denominator(TowerElement<C> a) {
    return element(a).denominator();
  }

  /** Whether {@code a} is a polynomial in {@code t}. */
  public boolean isPolynomial(TowerElement<C> a) {
    return element(a).denominator().isOne();
  }

  /** The indeterminate {@code t} as a polynomial over the level below. */
  public Polynomial<TowerElement<C>> variable() {
    return Polynomial.variable(lower);
  }

  public TowerElement<C> polynomial(Polynomial<TowerElement<C>> p) {
    return new FractionElement<>(height, p, Polynomial.one(lower));
  }

  /** Builds the reduced fraction {@code numerator / denominator}. */
  public TowerElement<C> fraction(
      Polynomial<TowerElement<C>> numerator, Polynomial<TowerElement<C>> denominator) {
    if (denominator.isZero()) {
      throw new ArithmeticException("Zero denominator");
    }
    if (numerator.isZero()) {
      return zero;
    }
    Polynomial<TowerElement<C>> n = numerator;
    Polynomial<TowerElement<C>> d = denominator;
    Polynomial<TowerElement<C>> common =
        denominator.isConstant() ? Polynomial.one(lower) : numerator.gcd(denominator);
    if (!common.isOne()) {
      n = n.exactQuotient(common);
      d = d.exactQuotient(common);
    }
    TowerElement<C> lead = d.leadingCoefficient();
    if (!lower.isOne(lead)) {
      TowerElement<C> inverse = lower.inverse(lead);
      n = n.scale(inverse);
      d = d.scale(inverse);
    }
    return new FractionElement<>(height, n, d);
  }

  /** Embeds an element of the level directly below. */
  public TowerElement<C> embed(TowerElement<C> value) {
    if (value.height() != lower.height()) {
      throw new MalformedTowerException(
          "Cannot embed height " + value.height() + " into level " + height);
    }
    if (lower.isZero(value)) {
      return zero;
    }
    return new FractionElement<>(height, Polynomial.constant(lower, value), Polynomial.one(lower));
  }

  /** Extends the derivation of the level below to polynomials in {@code t}. */
  public Polynomial<TowerElement<C>> derive(Polynomial<TowerElement<C>> p) {
    List<TowerElement<C>> coefficients = new ArrayList<>(p.coefficients().size());
    for (TowerElement<C> c : p.coefficients()) {
      coefficients.add(lower.derive(c));
    }
    Polynomial<TowerElement<C>> coefficientPart = Polynomial.of(lower, coefficients);
    return coefficientPart.add(p.derivative().multiply(generatorDerivative));
  }

  @Override
  public TowerElement<C> derive(TowerElement<C> a) {
    FractionElement<C> f = element(a);
    Polynomial<TowerElement<C>> dn = derive(f.numerator());
    if (f.denominator().isOne()) {
      return polynomial(dn);
    }
    Polynomial<TowerElement<C>> dd = derive(f.denominator());
    return fraction(
        dn.multiply(f.denominator()).subtract(f.numerator().multiply(dd)),
        f.denominator().multiply(f.denominator()));
  }

  @Override
  public boolean isConstant(TowerElement<C> a) {
    FractionElement<C> f = element(a);
    return f.denominator().isOne()
        && f.numerator().degree() <= 0
        && lower.isConstant(f.numerator().constantTerm());
  }

  @Override
  public C toConstant(TowerElement<C> a) {
    FractionElement<C> f = element(a);
    if (!f.denominator().isOne() || f.numerator().degree() > 0) {
      throw new IllegalArgumentException("Not a constant: " + a);
    }
    return lower.toConstant(f.numerator().constantTerm());
  }

  @Override
  public TowerElement<C> fromConstant(C value) {
    return embed(lower.fromConstant(value));
  }

  @Override
  public TowerElement<C> lift(TowerElement<C> a) {
    if (a.height() == height) {
      return element(a);
    }
    if (a.height() > height) {
      throw new MalformedTowerException(
          "Element of height " + a.height() + " used at level " + height);
    }
    return embed(lower.lift(a));
  }

  @Override
  public TowerElement<C> generatorElement(int index) {
    if (index == height) {
      return polynomial(variable());
    }
    if (index > height) {
      throw new MalformedTowerException("Generator " + index + " is above level " + height);
    }
    return embed(lower.generatorElement(index));
  }

  @Override
  public TowerElement<C> zero() {
    return zero;
  }

  @Override
  public TowerElement<C> one() {
    return one;
  }

  @Override
  public TowerElement<C> add(TowerElement<C> a, TowerElement<C> b) {
    FractionElement<C> x = element(a);
    FractionElement<C> y = element(b);
    if (x.denominator().equals(y.denominator())) {
      return fraction(x.numerator().add(y.numerator()), x.denominator());
    }
    return fraction(
        x.numerator().multiply(y.denominator()).add(y.numerator().multiply(x.denominator())),
        x.denominator().multiply(y.denominator()));
  }

  @Override
  public TowerElement<C> negate(TowerElement<C> a) {
    FractionElement<C> x = element(a);
    return new FractionElement<>(height, x.numerator().negate(), x.denominator());
  }

  @Override
  public TowerElement<C> multiply(TowerElement<C> a, TowerElement<C> b) {
    FractionElement<C> x = element(a);
    FractionElement<C> y = element(b);
    if (x.denominator().isOne() && y.denominator().isOne()) {
      return polynomial(x.numerator().multiply(y.numerator()));
    }
    return fraction(
        x.numerator().multiply(y.numerator()), x.denominator().multiply(y.denominator()));
  }

  @Override
  public TowerElement<C> inverse(TowerElement<C> a) {
    FractionElement<C> x = element(a);
    if (x.numerator().isZero()) {
      throw new ArithmeticException("Inverse of zero");
    }
    return fraction(x.denominator(), x.numerator());
  }

  @Override
  public boolean isZero(TowerElement<C> a) {
    return element(a).numerator().isZero();
  }

  private FractionElement<C> element(TowerElement<C> a) {
    if (a instanceof FractionElement<C> f && f.height() == height) {
      return f;
    }
    throw new MalformedTowerException(
        "Expected an element of height " + height + " but got height " + a.height());
  }

  @Override
  public String toString() {
    return "level " + height + " (" + generator.expression() + ")";
  }
}
