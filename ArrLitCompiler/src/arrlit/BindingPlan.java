package arrlit;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;

/**
 * The lowering of an array literal: bind every operand once, in item order, then build the array
 * from the bound names listed in {@link #slots()}.
 *
 * <p>A pass-through plan has one step and no slots; the array is the step's operand itself.
 */
@AutoValue
public abstract class BindingPlan {
  public abstract ValueType.ArrayValueType arrayType();

  public abstract ImmutableList<BindingStep> steps();

  // One binding name per element of the array.
  public abstract ImmutableList<String> slots();

  public abstract boolean passthrough();

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    steps().forEach(s -> sb.append(s).append("; "));
    return sb.append(passthrough() ? steps().get(0).name() : "[" + String.join(", ", slots()) + "]")
        .toString();
  }

  public static Builder builder(ValueType.ArrayValueType arrayType) {
    return new AutoValue_BindingPlan.Builder().setArrayType(arrayType).setPassthrough(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {

    private final List<BindingStep> stepsBuilder = new ArrayList<>();
    private final List<String> slotsBuilder = new ArrayList<>();

    abstract Builder setArrayType(ValueType.ArrayValueType arrayType);

    @ForOverride
    abstract Builder setSteps(List<BindingStep> steps);

    @ForOverride
    abstract Builder setSlots(List<String> slots);

    abstract Builder setPassthrough(boolean passthrough);

    public Builder addStep(BindingStep step) {
      stepsBuilder.add(step);
      slotsBuilder.addAll(step.slots());
      return this;
    }

    public Builder setPassthroughStep(BindingStep step) {
      Preconditions.checkState(stepsBuilder.isEmpty(), "pass-through plans have a single step");
      Preconditions.checkArgument(step.kind() == BindingStep.Kind.SINGLE, step);
      stepsBuilder.add(step);
      return setPassthrough(true);
    }

    @ForOverride
    abstract BindingPlan autoBuild();

    public final BindingPlan build() {
      BindingPlan plan = setSteps(stepsBuilder).setSlots(slotsBuilder).autoBuild();
      Preconditions.checkState(
          plan.passthrough() || plan.slots().size() == plan.arrayType().length(),
          "%s slots for %s",
          plan.slots().size(),
          plan.arrayType());
      return plan;
    }
  }
}
