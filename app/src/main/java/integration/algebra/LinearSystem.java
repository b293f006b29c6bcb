package integration.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exact linear system {@code A x = b} over a field, solved by Gauss-Jordan elimination. Free
 * unknowns are set to zero.
 *
 * @param <E> element type
 */
public final class LinearSystem<E> {
  private final Field<E> field;
  private final int unknowns;
  private final List<List<E>> rows = new ArrayList<>();

  public LinearSystem(Field<E> field, int unknowns) {
    if (unknowns < 0) {
      throw new IllegalArgumentException("Negative number of unknowns: " + unknowns);
    }
    this.field = field;
    this.unknowns = unknowns;
  }

  public int unknowns() {
    return unknowns;
  }

  public int equations() {
    return rows.size();
  }

  public void addEquation(List<E> coefficients, E rhs) {
    if (coefficients.size() != unknowns) {
      throw new IllegalArgumentException(
          "Expected " + unknowns + " coefficients but got " + coefficients.size());
    }
    List<E> row = new ArrayList<>(coefficients);
    row.add(rhs);
    rows.add(row);
  }

  /** Returns a solution, or empty when the system is inconsistent. */
  public Optional<List<E>> solve() {
    List<List<E>> matrix = new ArrayList<>(rows.size());
    for (List<E> row : rows) {
      matrix.add(new ArrayList<>(row));
    }
    int[] pivotColumns = new int[matrix.size()];
    int rank = 0;
    for (int column = 0; column < unknowns && rank < matrix.size(); column++) {
      int pivot = -1;
      for (int r = rank; r < matrix.size(); r++) {
        if (!field.isZero(matrix.get(r).get(column))) {
          pivot = r;
          break;
        }
      }
      if (pivot < 0) {
        continue;
      }
      List<E> pivotRow = matrix.get(pivot);
      matrix.set(pivot, matrix.get(rank));
      matrix.set(rank, pivotRow);
      E inverse = field.inverse(pivotRow.get(column));
      for (int c = column; c <= unknowns; c++) {
        pivotRow.set(c, field.multiply(pivotRow.get(c), inverse));
      }
      for (int r = 0; r < matrix.size(); r++) {
        if (r == rank) {
          continue;
        }
        List<E> row = matrix.get(r);
        E factor = row.get(column);
        if (field.isZero(factor)) {
          continue;
        }
        for (int c = column; c <= unknowns; c++) {
          row.set(c, field.subtract(row.get(c), field.multiply(factor, pivotRow.get(c))));
        }
      }
      pivotColumns[rank] = column;
      rank++;
    }
    for (int r = rank; r < matrix.size(); r++) {
      if (!field.isZero(matrix.get(r).get(unknowns))) {
        return Optional.empty();
      }
    }
    List<E> solution = new ArrayList<>(unknowns);
    for (int i = 0; i < unknowns; i++) {
      solution.add(field.zero());
    }
    for (int r = 0; r < rank; r++) {
      solution.set(pivotColumns[r], matrix.get(r).get(unknowns));
    }
    return Optional.of(solution);
  }
}
