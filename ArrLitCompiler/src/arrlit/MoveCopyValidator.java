package arrlit;

import arrlit.Expression.ArrayLiteral;

// A fill read more than once copies its value, which requires a duplicable type.
public class MoveCopyValidator extends ErrorCollectingValidator {
  private final Desugarer desugarer;

  public MoveCopyValidator(Desugarer desugarer) {
    this.desugarer = desugarer;
  }

  @Override
  public void visitImpl(ArrayLiteral literal) {
    desugarer.plan(literal).ifPresent(this::checkPlan);
    literal.visitChildren(this, null);
  }

  private void checkPlan(BindingPlan plan) {
    for (BindingStep step : plan.steps()) {
      if (step.kind() == BindingStep.Kind.REPEAT
          && step.count() > 1
          && !step.operandType().isDuplicable()) {
        logError(
            step.operand().pos(),
            ErrorKind.NON_DUPLICABLE_REPEAT,
            String.format(
                "cannot repeat a value of type %s %d times: the type cannot be copied",
                step.operandType(), step.count()));
      }
    }
  }
}
