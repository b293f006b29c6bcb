package integration.algebra;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * Exact arithmetic over a field whose elements have a canonical representation, so that {@link
 * Object#equals(Object)} coincides with field equality.
 *
 * @param <E> element type
 */
public interface Field<E> {

  E zero();

  E one();

  E add(E a, E b);

  E negate(E a);

  E multiply(E a, E b);

  /**
   * Returns the multiplicative inverse of {@code a}.
   *
   * @throws ArithmeticException when {@code a} is zero
   */
  E inverse(E a);

  /** Embeds a rational number. */
  E fromRational(BigFraction value);

  boolean isZero(E a);

  default E subtract(E a, E b) {
    return add(a, negate(b));
  }

  default E divide(E a, E b) {
    return multiply(a, inverse(b));
  }

  default boolean isOne(E a) {
    return one().equals(a);
  }

  default E fromInteger(long value) {
    return fromRational(new BigFraction(value));
  }

  default E scale(E a, long factor) {
    return multiply(a, fromInteger(factor));
  }

  /** Raises {@code a} to an integer power; negative exponents invert first. */
  default E pow(E a, int exponent) {
    if (exponent < 0) {
      return pow(inverse(a), -exponent);
    }
    E result = one();
    E base = a;
    int e = exponent;
    while (e > 0) {
      if ((e & 1) == 1) {
        result = multiply(result, base);
      }
      e >>= 1;
      if (e > 0) {
        base = multiply(base, base);
      }
    }
    return result;
  }
}
