package integration.risch;

import integration.algebra.CoefficientField;
import integration.algebra.LinearSystem;
import integration.algebra.Polynomial;
import integration.tower.ExtensionLevel;
import integration.tower.TowerElement;
import integration.tower.TowerLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds constants {@code c_j} with {@code sum c_j v_j = target} for vectors of rational
 * functions in the integration variable. Denominators are cleared componentwise and the
 * coefficients of each power of {@code x} become one linear equation over the constants.
 */
final class LinearCombination<C> {
  private final ExtensionLevel<C> level;
  private final TowerLevel<C> constants;
  private final CoefficientField<C> field;

  LinearCombination(ExtensionLevel<C> level) {
    this.level = level;
    this.constants = level.lower();
    this.field = level.coefficients();
  }

  /**
   * @param columns the vectors {@code v_j}, all of the same length as {@code target}
   * @return the constants, or empty when {@code target} is not in the span
   */
  Optional<List<C>> solve(List<List<TowerElement<C>>> columns, List<TowerElement<C>> target) {
    int unknowns = columns.size();
    LinearSystem<C> system = new LinearSystem<>(field, unknowns);
    for (int component = 0; component < target.size(); component++) {
      Polynomial<TowerElement<C>> common = level.denominator(target.get(component));
      for (List<TowerElement<C>> column : columns) {
        common = lcm(common, level.denominator(column.get(component)));
      }
      Polynomial<TowerElement<C>> rhs = cleared(target.get(component), common);
      List<Polynomial<TowerElement<C>>> cleared = new ArrayList<>(unknowns);
      int degree = rhs.degree();
      for (List<TowerElement<C>> column : columns) {
        Polynomial<TowerElement<C>> p = cleared(column.get(component), common);
        cleared.add(p);
        degree = Math.max(degree, p.degree());
      }
      for (int power = 0; power <= degree; power++) {
        List<C> row = new ArrayList<>(unknowns);
        for (Polynomial<TowerElement<C>> p : cleared) {
          row.add(constants.toConstant(p.coefficient(power)));
        }
        system.addEquation(row, constants.toConstant(rhs.coefficient(power)));
      }
    }
    return system.solve();
  }

  /** {@code sum c_j b_j} for constants {@code c_j}. */
  TowerElement<C> combine(List<C> coefficients, List<TowerElement<C>> basis) {
    TowerElement<C> sum = level.zero();
    for (int j = 0; j < coefficients.size(); j++) {
      if (!field.isZero(coefficients.get(j))) {
        sum = level.add(sum, level.multiply(level.fromConstant(coefficients.get(j)), basis.get(j)));
      }
    }
    return sum;
  }

  private Polynomial<TowerElement<C>> cleared(
      TowerElement<C> value, Polynomial<TowerElement<C>> common) {
    return level.numerator(value).multiply(common.exactQuotient(level.denominator(value)));
  }

  private static <E> Polynomial<E> lcm(Polynomial<E> a, Polynomial<E> b) {
    return a.multiply(b).exactQuotient(a.gcd(b)).monic();
  }
}
