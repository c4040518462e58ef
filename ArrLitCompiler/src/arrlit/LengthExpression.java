package arrlit;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The length of an array literal as {@code constant + len(#i) + ... + fill}.
 *
 * <p>Each plain item adds one to the constant. Each expansion item {@code i} adds the variable
 * {@code len(#i)}, the length of its operand, and a trailing fill item adds the slack variable.
 * Variables are identified by the index of their item in the literal.
 */
@AutoValue
public abstract class LengthExpression {
  public abstract Tokenizer.Pos pos();

  public abstract int constant();

  public abstract ImmutableList<Integer> operands();

  public abstract Optional<Integer> fill();

  public static LengthExpression create(
      Tokenizer.Pos pos, int constant, Iterable<Integer> operands, Optional<Integer> fill) {
    return new AutoValue_LengthExpression(pos, constant, ImmutableList.copyOf(operands), fill);
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder().append(constant());
    for (int operand : operands()) {
      sb.append(" + len(#").append(operand).append(")");
    }
    fill().ifPresent(f -> sb.append(" + fill(#").append(f).append(")"));
    return sb.toString();
  }
}
