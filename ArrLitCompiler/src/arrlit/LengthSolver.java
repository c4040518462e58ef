package arrlit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/**
 * Solves a {@link LengthExpression} against the length its context expects, if any.
 *
 * <p>The known operand lengths are substituted first. The remaining variables, an operand whose
 * length depends on the literal's own length or the fill, are free. Without an expected length a
 * free variable cannot be solved. With an expected length {@code E}, a single free variable
 * absorbs {@code E - known}, and several free variables can only share a residual of zero. The
 * expected length always wins; a fill never fixes the length by itself.
 *
 * <p>Solving has no side effects, so solving the same expression twice gives the same result.
 */
public final class LengthSolver {

  /** Yields the lengths of expansion operands whose types are already known. */
  @FunctionalInterface
  public interface LengthOracle {
    // Returns empty if the operand's length depends on the length being solved for.
    Optional<Integer> lengthOf(int operand);
  }

  @AutoValue
  public abstract static class Solution {
    public abstract int length();

    // The number of elements each variable of the expression contributes, by item index.
    public abstract ImmutableMap<Integer, Integer> counts();

    public final int count(int item) {
      return counts().get(item);
    }

    static Solution create(int length, Map<Integer, Integer> counts) {
      return new AutoValue_LengthSolver_Solution(length, ImmutableMap.copyOf(counts));
    }
  }

  public static Solution solve(
      LengthExpression expression, Optional<Integer> expected, LengthOracle oracle)
      throws CompilerException {
    long known = expression.constant();
    Map<Integer, Integer> counts = new LinkedHashMap<>();
    List<Integer> free = new ArrayList<>();
    for (int operand : expression.operands()) {
      Optional<Integer> length = oracle.lengthOf(operand);
      if (length.isPresent()) {
        known += length.get();
        counts.put(operand, length.get());
      } else {
        free.add(operand);
      }
    }
    expression.fill().ifPresent(free::add);

    if (known > Integer.MAX_VALUE) {
      throw new CompilerException(
          expression.pos(), ErrorKind.OVER_CONSTRAINED_LENGTH, "array literal is too long");
    }

    if (!expected.isPresent()) {
      if (!free.isEmpty()) throw underConstrained(expression);
      return Solution.create((int) known, counts);
    }

    int target = expected.get();
    if (known > target || (free.isEmpty() && known != target)) {
      throw new CompilerException.LengthMismatch(expression.pos(), target, (int) known);
    }

    int residual = target - (int) known;
    if (free.size() == 1) {
      counts.put(free.get(0), residual);
    } else if (!free.isEmpty()) {
      if (residual != 0) {
        throw new CompilerException(
            expression.pos(),
            ErrorKind.UNDER_CONSTRAINED_LENGTH,
            String.format(
                "cannot infer how %d remaining elements are split between %d inferred operands",
                residual, free.size()));
      }
      free.forEach(v -> counts.put(v, 0));
    }
    return Solution.create(target, counts);
  }

  static CompilerException underConstrained(LengthExpression expression) {
    return new CompilerException(
        expression.pos(),
        ErrorKind.UNDER_CONSTRAINED_LENGTH,
        String.format(
            "cannot infer the length of this array literal (%s): it needs a fixed-size type from"
                + " its context",
            expression));
  }

  private LengthSolver() {}
}
