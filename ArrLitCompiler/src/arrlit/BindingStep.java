package arrlit;

import java.util.Collections;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** One step of a {@link BindingPlan}: evaluates an operand once and binds it to fresh names. */
@AutoValue
public abstract class BindingStep {
  public enum Kind {
    // let t = e
    SINGLE,
    // let [t0, ..., tk-1] = e
    DESTRUCTURE,
    // let t = e, read k times
    REPEAT;
  }

  public enum Mode {
    MOVE,
    COPY;

    static Mode forType(ValueType type) {
      return type.isDuplicable() ? COPY : MOVE;
    }
  }

  public abstract Kind kind();

  // A single name, except for DESTRUCTURE which has one per element.
  public abstract ImmutableList<String> names();

  public abstract Expression operand();

  public abstract ValueType operandType();

  // The number of slots this step populates.
  public abstract int count();

  public abstract Mode mode();

  public final String name() {
    Preconditions.checkState(kind() != Kind.DESTRUCTURE, "destructuring binds several names");
    return names().get(0);
  }

  // The slots this step fills, in order.
  public final ImmutableList<String> slots() {
    return kind() == Kind.REPEAT
        ? ImmutableList.copyOf(Collections.nCopies(count(), name()))
        : names();
  }

  static BindingStep single(String name, Expression operand, ValueType type) {
    return new AutoValue_BindingStep(
        Kind.SINGLE, ImmutableList.of(name), operand, type, 1, Mode.forType(type));
  }

  static BindingStep destructure(
      Iterable<String> names, Expression operand, ValueType.ArrayValueType type) {
    ImmutableList<String> bound = ImmutableList.copyOf(names);
    Preconditions.checkArgument(bound.size() == type.length(), "%s names for %s", bound, type);
    return new AutoValue_BindingStep(
        Kind.DESTRUCTURE, bound, operand, type, bound.size(), Mode.forType(type));
  }

  static BindingStep repeat(String name, Expression operand, ValueType type, int count) {
    return new AutoValue_BindingStep(
        Kind.REPEAT, ImmutableList.of(name), operand, type, count, Mode.forType(type));
  }

  @Override
  public final String toString() {
    switch (kind()) {
      case SINGLE:
        return String.format("let %s = %s", name(), operand());
      case DESTRUCTURE:
        return String.format("let [%s] = %s", String.join(", ", names()), operand());
      case REPEAT:
        return String.format("let %s = %s x%d", name(), operand(), count());
      default:
        throw new AssertionError(kind());
    }
  }
}
