package arrlit;

import com.google.common.collect.ImmutableList;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final ErrorKind kind;
  private final String errorMsg;

  public CompilerException(Tokenizer.Pos pos, ErrorKind kind, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.kind = kind;
    this.errorMsg = errorMsg;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public ErrorKind kind() {
    return kind;
  }

  public void print() {
    System.out.println(
        String.format(
            "ERROR: %s@%d:%d %s", pos.file(), pos.lineNumber() + 1, pos.column() + 1, errorMsg));
  }

  /** An array literal whose length disagrees with the length its context requires. */
  public static final class LengthMismatch extends CompilerException {
    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int found;

    public LengthMismatch(Tokenizer.Pos pos, int expected, int found) {
      super(
          pos,
          ErrorKind.OVER_CONSTRAINED_LENGTH,
          String.format(
              "mismatched types: expected an array with a fixed size of %d elements, found %s%d",
              expected, found > expected ? "at least " : "", found));
      this.expected = expected;
      this.found = found;
    }

    public int expected() {
      return expected;
    }

    public int found() {
      return found;
    }
  }

  /** A set of definitions whose types or values can only be computed from each other. */
  public static final class CyclicDependency extends CompilerException {
    private static final long serialVersionUID = 1L;

    private final ImmutableList<String> chain;

    public CyclicDependency(Tokenizer.Pos pos, ErrorKind kind, Iterable<String> chain) {
      this(pos, kind, ImmutableList.copyOf(chain));
    }

    private CyclicDependency(Tokenizer.Pos pos, ErrorKind kind, ImmutableList<String> chain) {
      super(
          pos,
          kind,
          String.format(
              "cycle detected when computing the %s of '%s': %s",
              kind == ErrorKind.CYCLIC_VALUE_DEPENDENCY ? "value" : "type",
              chain.get(0),
              String.join(" -> ", chain)));
      this.chain = chain;
    }

    // The first and last entries are the same definition.
    public ImmutableList<String> chain() {
      return chain;
    }
  }
}
