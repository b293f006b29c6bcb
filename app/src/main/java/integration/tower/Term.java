package integration.tower;

/** Transcendental building block found in an integrand, in dependency order. */
public sealed interface Term permits IdentityTerm, FunctionTerm {}
