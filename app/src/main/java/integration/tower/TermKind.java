package integration.tower;

/** Function kinds a classified term can carry. */
public enum TermKind {
  LOG,
  EXP,
  TAN,
  ATAN
}
