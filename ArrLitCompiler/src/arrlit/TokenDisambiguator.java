package arrlit;

import java.util.List;

/**
 * Decides whether a {@code ..} token introduces an array item marker or is the range operator.
 *
 * <p>The marker reading applies only to the first token of an item written directly between an
 * array literal's brackets, and only when that token is followed by something that can start an
 * expression. Inside parentheses, at the top level of an initializer, or anywhere after the first
 * token of an item, {@code ..} is always the range operator; this includes {@code [.. ..5]}, whose
 * second {@code ..} is the range operand of the marker.
 */
public final class TokenDisambiguator {

  /** The syntactic position a sequence of atoms was parsed from. */
  public enum Context {
    TOP_LEVEL,
    PARENTHESIZED,
    ARRAY_ITEM;
  }

  public enum Reading {
    MARKER,
    RANGE;
  }

  /**
   * Classifies the {@code ..} atom at {@code index}.
   *
   * @throws CompilerException if the token sits in marker position without an operand, as in
   *     {@code [1, ..]} or {@code [.. * 2]}
   */
  public static Reading classify(Context context, List<? extends Expression> atoms, int index)
      throws CompilerException {
    Expression atom = atoms.get(index);
    if (atom.type() != Expression.Type.RANGE_OPERATOR) {
      throw new IllegalArgumentException("not a '..' token: " + atom);
    }

    if (context != Context.ARRAY_ITEM || index != 0) return Reading.RANGE;

    if (index + 1 >= atoms.size() || !atoms.get(index + 1).canStartExpression()) {
      throw new CompilerException(
          atom.pos(),
          ErrorKind.SYNTAX,
          "expected an expression after '..' in array item; write '(..)' for a full range");
    }
    return Reading.MARKER;
  }

  private TokenDisambiguator() {}
}
