package integration.algebra;

import com.google.common.math.BigIntegerMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;
import org.apache.commons.math3.fraction.BigFraction;

/** Helpers for exact rational numbers. */
public final class Rationals {

  private Rationals() {}

  public static BigFraction of(long value) {
    return new BigFraction(value);
  }

  public static BigFraction of(long numerator, long denominator) {
    return new BigFraction(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static int signum(BigFraction value) {
    return value.getNumerator().signum();
  }

  public static boolean isZero(BigFraction value) {
    return value.getNumerator().signum() == 0;
  }

  public static boolean isInteger(BigFraction value) {
    return value.getDenominator().equals(BigInteger.ONE);
  }

  /** Returns the exact square root when {@code value} is the square of a rational. */
  public static Optional<BigFraction> sqrt(BigFraction value) {
    if (signum(value) < 0) {
      return Optional.empty();
    }
    Optional<BigInteger> numerator = sqrt(value.getNumerator());
    Optional<BigInteger> denominator = sqrt(value.getDenominator());
    if (numerator.isEmpty() || denominator.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new BigFraction(numerator.get(), denominator.get()));
  }

  private static Optional<BigInteger> sqrt(BigInteger value) {
    BigInteger root = BigIntegerMath.sqrt(value, RoundingMode.FLOOR);
    return root.multiply(root).equals(value) ? Optional.of(root) : Optional.empty();
  }

  /** Positive rational gcd: the largest {@code g} with every input an integer multiple of it. */
  public static BigFraction gcd(BigFraction a, BigFraction b) {
    if (isZero(a)) {
      return b.abs();
    }
    if (isZero(b)) {
      return a.abs();
    }
    BigInteger numerator = a.getNumerator().gcd(b.getNumerator());
    BigInteger da = a.getDenominator();
    BigInteger db = b.getDenominator();
    BigInteger denominator = da.divide(da.gcd(db)).multiply(db);
    return new BigFraction(numerator, denominator);
  }

  /** Formats as {@code p} or {@code p/q}. */
  public static String format(BigFraction value) {
    if (isInteger(value)) {
      return value.getNumerator().toString();
    }
    return value.getNumerator() + "/" + value.getDenominator();
  }

  /**
   * Parses decimal literals such as {@code 3}, {@code 0.25} or {@code 2/3}.
   *
   * @throws IllegalArgumentException when the text is not a rational literal
   */
  public static BigFraction parse(String text) {
    String trimmed = text.trim();
    try {
      int slash = trimmed.indexOf('/');
      if (slash > 0) {
        return new BigFraction(
            new BigInteger(trimmed.substring(0, slash).trim()),
            new BigInteger(trimmed.substring(slash + 1).trim()));
      }
      int dot = trimmed.indexOf('.');
      if (dot >= 0) {
        String digits = trimmed.substring(0, dot) + trimmed.substring(dot + 1);
        BigInteger scale = BigInteger.TEN.pow(trimmed.length() - dot - 1);
        return new BigFraction(new BigInteger(digits.isEmpty() ? "0" : digits), scale);
      }
      return new BigFraction(new BigInteger(trimmed));
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new IllegalArgumentException("Invalid rational literal: " + text, ex);
    }
  }
}
