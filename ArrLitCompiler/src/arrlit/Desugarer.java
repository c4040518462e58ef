package arrlit;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.google.common.base.Verify;

import arrlit.Expression.ArrayLiteral;

/**
 * Lowers resolved array literals into {@link BindingPlan}s.
 *
 * <p>Items are walked left to right. A plain item binds one name, an expansion destructures its
 * operand into one name per element, and a fill binds its operand once and repeats the name for
 * the remaining slots. Every operand gets a step, even one that fills no slots. Fresh names are
 * numbered per definition.
 */
public class Desugarer extends VoidDefaultASTVisitor {
  private final LiteralResolver literals;
  private final Map<ArrayLiteral, BindingPlan> plans = new IdentityHashMap<>();
  private int nextName = 0;

  public Desugarer(LiteralResolver literals) {
    this.literals = literals;
  }

  public Optional<BindingPlan> plan(ArrayLiteral literal) {
    return Optional.ofNullable(plans.get(literal));
  }

  @Override
  public void visitImpl(AST.Definition definition) {
    nextName = 0;
    definition.visitChildren(this, null);
  }

  @Override
  public void visitImpl(ArrayLiteral literal) {
    Optional<ResolvedLiteral> resolved = literals.resolved(literal);
    Verify.verify(resolved.isPresent(), "unresolved literal %s", literal);

    plans.put(literal, desugar(resolved.get(), () -> String.format("%%t%d", nextName++)));
    literal.visitChildren(this, null);
  }

  public static BindingPlan desugar(ResolvedLiteral literal, Supplier<String> freshNames) {
    BindingPlan.Builder plan = BindingPlan.builder(literal.type());
    if (literal.isPassthrough()) {
      ResolvedLiteral.ResolvedItem item = literal.items().get(0);
      return plan.setPassthroughStep(
              BindingStep.single(freshNames.get(), item.operand(), item.operandType()))
          .build();
    }

    for (ResolvedLiteral.ResolvedItem item : literal.items()) {
      switch (item.kind()) {
        case PLAIN:
          plan.addStep(BindingStep.single(freshNames.get(), item.operand(), item.operandType()));
          break;
        case EXPANSION:
          {
            ValueType.ArrayValueType type = item.operandType().asArray();
            List<String> names = new ArrayList<>();
            for (int i = 0; i < type.length(); i++) {
              names.add(freshNames.get());
            }
            plan.addStep(BindingStep.destructure(names, item.operand(), type));
            break;
          }
        case FILL:
          plan.addStep(
              BindingStep.repeat(
                  freshNames.get(), item.operand(), item.operandType(), item.count()));
          break;
        default:
          throw new AssertionError(item.kind());
      }
    }
    return plan.build();
  }
}
