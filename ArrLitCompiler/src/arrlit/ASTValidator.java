package arrlit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class ASTValidator extends ErrorCollectingValidator {

  private final AST ast;

  private final DefinitionRegistry registry = new DefinitionRegistry();
  private TypeResolver types = null;
  private Desugarer desugarer = null;
  private ImmutableList<String> evaluationOrder = ImmutableList.of();
  private boolean computed = false;

  public ASTValidator(AST ast) {
    this.ast = ast;
  }

  public DefinitionRegistry registry() {
    return registry;
  }

  public TypeResolver types() {
    return types;
  }

  public Desugarer desugarer() {
    return desugarer;
  }

  // Definitions that can be evaluated, dependencies first.
  public ImmutableList<String> evaluationOrder() {
    return evaluationOrder;
  }

  public ImmutableList<CompilerException> computeErrors() {
    if (computed) return errors();

    computed = true;
    if (!acceptAll(registry)) return errors();

    LengthCycleDetector cycleDetector = new LengthCycleDetector(registry);
    acceptAll(cycleDetector);
    ImmutableSet<String> cyclic = cycleDetector.detect();
    takeErrors(cycleDetector);

    types = new TypeResolver(registry, cyclic);
    acceptAll(types);

    // The remaining passes only see definitions whose types are known.
    desugarer = new Desugarer(types.literals());
    acceptResolved(desugarer);

    MoveCopyValidator moveCopyValidator = new MoveCopyValidator(desugarer);
    acceptResolved(moveCopyValidator);
    takeErrors(moveCopyValidator);

    EvaluationOrder order = new EvaluationOrder(registry, types);
    acceptResolved(order);
    evaluationOrder = order.order();
    takeErrors(order);

    return errors();
  }

  private boolean acceptAll(ErrorCollectingValidator visitor) {
    ast.accept(visitor, null);
    takeErrors(visitor);
    return !visitor.hasErrors();
  }

  private void acceptResolved(VoidDefaultASTVisitor visitor) {
    ast.definitions()
        .stream()
        .filter(d -> types.isResolved(d.name()))
        .forEach(d -> d.accept(visitor, null));
  }
}
