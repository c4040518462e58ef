package arrlit;

import java.util.Set;

// Collects the names of the definitions an expression references.
final class DependencyCollector extends DefaultASTVisitor<Set<String>> {
  private static final DependencyCollector INSTANCE = new DependencyCollector();

  public static DependencyCollector instance() {
    return INSTANCE;
  }

  @Override
  public Set<String> visit(Expression.Variable variable, Set<String> value) {
    value.add(variable.name());
    return value;
  }

  private DependencyCollector() {}
}
