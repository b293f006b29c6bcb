package integration.tower;

import integration.algebra.CoefficientField;
import integration.core.MalformedTowerException;
import integration.expr.Expr;
import integration.expr.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Differential field tower {@code C(x)(t1)...(tn)} built for one integrand. Level {@code h} holds
 * the generator of height {@code h}; level 0 is the integration variable.
 *
 * @param <C> constant type
 */
public final class Tower<C> {
  private final ConstantLevel<C> constants;
  private final List<ExtensionLevel<C>> levels;
  private final Symbol variable;

  Tower(ConstantLevel<C> constants, List<ExtensionLevel<C>> levels, Symbol variable) {
    this.constants = Objects.requireNonNull(constants, "constants");
    this.levels = List.copyOf(levels);
    this.variable = Objects.requireNonNull(variable, "variable");
    if (this.levels.isEmpty()) {
      throw new MalformedTowerException("A tower needs at least the integration variable");
    }
    for (int h = 0; h < this.levels.size(); h++) {
      if (this.levels.get(h).height() != h) {
        throw new MalformedTowerException("Level " + h + " has height " + levels.get(h).height());
      }
    }
  }

  public CoefficientField<C> field() {
    return constants.coefficients();
  }

  public ConstantLevel<C> constants() {
    return constants;
  }

  public Symbol variable() {
    return variable;
  }

  public ExtensionLevel<C> top() {
    return levels.get(levels.size() - 1);
  }

  public ExtensionLevel<C> level(int height) {
    if (height < 0 || height >= levels.size()) {
      throw new MalformedTowerException("No level of height " + height);
    }
    return levels.get(height);
  }

  public List<ExtensionLevel<C>> levels() {
    return levels;
  }

  public List<Generator> generators() {
    return top().generators();
  }

  public int size() {
    return levels.size();
  }

  /**
   * Converts an expression written in the tower's generators into an element of the top level.
   *
   * @throws integration.core.UnsupportedConstructException when the expression uses a function
   *     or symbol the tower does not contain
   */
  public TowerElement<C> toElement(Expr expr) {
    return new ElementConverter<>(levels, variable, false).convert(expr);
  }

  /** One line per generator, innermost first. */
  public List<String> describe() {
    List<String> lines = new ArrayList<>(levels.size());
    for (Generator generator : generators()) {
      lines.add(generator.describe());
    }
    return lines;
  }

  @Override
  public String toString() {
    return "Tower" + describe() + " over " + field();
  }
}
