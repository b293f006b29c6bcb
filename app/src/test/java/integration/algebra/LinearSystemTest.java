package integration.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

final class LinearSystemTest {
  private static final BigFraction ONE = BigFraction.ONE;
  private static final BigFraction MINUS_ONE = BigFraction.MINUS_ONE;

  @Test
  void solvesRegularSystem() {
    LinearSystem<BigFraction> system = new LinearSystem<>(RationalField.INSTANCE, 2);
    system.addEquation(List.of(ONE, ONE), new BigFraction(3));
    system.addEquation(List.of(ONE, MINUS_ONE), ONE);
    Optional<List<BigFraction>> solution = system.solve();
    assertTrue(solution.isPresent(), "x + y = 3, x - y = 1 is consistent");
    assertEquals(List.of(new BigFraction(2), ONE), solution.get());
  }

  @Test
  void overdeterminedConsistentSystem() {
    LinearSystem<BigFraction> system = new LinearSystem<>(RationalField.INSTANCE, 1);
    system.addEquation(List.of(new BigFraction(2)), new BigFraction(4));
    system.addEquation(List.of(new BigFraction(3)), new BigFraction(6));
    assertEquals(Optional.of(List.of(new BigFraction(2))), system.solve());
  }

  @Test
  void inconsistentSystemHasNoSolution() {
    LinearSystem<BigFraction> system = new LinearSystem<>(RationalField.INSTANCE, 2);
    system.addEquation(List.of(ONE, ONE), ONE);
    system.addEquation(List.of(ONE, ONE), new BigFraction(2));
    assertTrue(system.solve().isEmpty(), "x + y cannot be both 1 and 2");
  }

  @Test
  void rejectsRowsOfWrongWidth() {
    LinearSystem<BigFraction> system = new LinearSystem<>(RationalField.INSTANCE, 2);
    assertThrows(IllegalArgumentException.class, () -> system.addEquation(List.of(ONE), ONE));
  }
}
