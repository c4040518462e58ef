package arrlit;

/** The kind of a diagnostic, independent of its message text. */
public enum ErrorKind {
  SYNTAX,
  SYNTAX_MISPLACED_FILL,

  UNDEFINED_NAME,
  DUPLICATE_DEFINITION,
  TYPE_MISMATCH,
  ELEMENT_TYPE_MISMATCH,
  UNKNOWN_ELEMENT_TYPE,
  NON_ARRAY_EXPANSION_OPERAND,
  UNDER_CONSTRAINED_LENGTH,
  OVER_CONSTRAINED_LENGTH,
  CYCLIC_LENGTH_DEPENDENCY,
  CYCLIC_VALUE_DEPENDENCY,
  NON_DUPLICABLE_REPEAT,

  // Raised when a definition depends on one that already failed and was reported.
  UNRESOLVED_DEPENDENCY,

  EVALUATION;

  public boolean isSyntax() {
    return this == SYNTAX || this == SYNTAX_MISPLACED_FILL;
  }
}
