package integration.core;

import integration.frontend.TrigStrategy;

/** Configuration for the integration pipeline. */
public record IntegrationOptions(
    boolean useAlgebraicNumbers,
    boolean catchUnsupported,
    boolean catchAlgorithmFailure,
    TrigStrategy trigStrategy,
    long maxKroneckerValue) {

  public static final long DEFAULT_MAX_KRONECKER_VALUE = 1_000_000L;

  public static IntegrationOptions defaults() {
    return new IntegrationOptions(
        false, true, true, TrigStrategy.HALF_ANGLE, DEFAULT_MAX_KRONECKER_VALUE);
  }

  public static IntegrationOptions normalize(IntegrationOptions options) {
    if (options == null) {
      return defaults();
    }
    TrigStrategy trigStrategy =
        options.trigStrategy() != null ? options.trigStrategy() : TrigStrategy.HALF_ANGLE;
    long maxKroneckerValue =
        options.maxKroneckerValue() > 0
            ? options.maxKroneckerValue()
            : DEFAULT_MAX_KRONECKER_VALUE;
    return new IntegrationOptions(
        options.useAlgebraicNumbers(),
        options.catchUnsupported(),
        options.catchAlgorithmFailure(),
        trigStrategy,
        maxKroneckerValue);
  }

  public IntegrationOptions withAlgebraicNumbers(boolean enabled) {
    return new IntegrationOptions(
        enabled, catchUnsupported, catchAlgorithmFailure, trigStrategy, maxKroneckerValue);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Mutable builder starting from {@link #defaults()}. */
  public static final class Builder {
    private boolean useAlgebraicNumbers;
    private boolean catchUnsupported = true;
    private boolean catchAlgorithmFailure = true;
    private TrigStrategy trigStrategy = TrigStrategy.HALF_ANGLE;
    private long maxKroneckerValue = DEFAULT_MAX_KRONECKER_VALUE;

    private Builder() {}

    public Builder useAlgebraicNumbers(boolean value) {
      this.useAlgebraicNumbers = value;
      return this;
    }

    public Builder catchUnsupported(boolean value) {
      this.catchUnsupported = value;
      return this;
    }

    public Builder catchAlgorithmFailure(boolean value) {
      this.catchAlgorithmFailure = value;
      return this;
    }

    public Builder trigStrategy(TrigStrategy value) {
      this.trigStrategy = value;
      return this;
    }

    public Builder maxKroneckerValue(long value) {
      this.maxKroneckerValue = value;
      return this;
    }

    public IntegrationOptions build() {
      return new IntegrationOptions(
          useAlgebraicNumbers,
          catchUnsupported,
          catchAlgorithmFailure,
          trigStrategy,
          maxKroneckerValue);
    }
  }
}
