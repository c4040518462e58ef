package arrlit;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/**
 * Finds definitions whose types can only be inferred from each other.
 *
 * <p>There is an edge {@code x -> y} when the initializer of {@code x} references {@code y} and
 * {@code y} has no declared type, so inferring the type of {@code x}, including its array length,
 * requires inferring the type of {@code y} first. Each strongly-connected component of this graph
 * is reported once.
 */
public class LengthCycleDetector extends ErrorCollectingValidator {
  private final DefinitionRegistry registry;
  private final MutableGraph<String> dependencies =
      GraphBuilder.directed().allowsSelfLoops(true).build();
  private final Set<String> cyclic = new HashSet<>();

  public LengthCycleDetector(DefinitionRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void visitImpl(AST.Definition definition) {
    String node = definition.name();
    dependencies.addNode(node);

    for (String dependency : DependencyCollector.instance().visit(definition, new HashSet<>())) {
      Optional<AST.Definition> target = registry.definition(dependency);
      if (target.isPresent() && !target.get().declaredType().isPresent()) {
        dependencies.putEdge(node, dependency);
      }
    }
  }

  // Returns the definitions on a cycle, after reporting each cycle.
  public ImmutableSet<String> detect() {
    detectCycles(
        dependencies,
        Comparator.comparing((String n) -> registry.definition(n).get().namePos()),
        (component, chain) -> {
          cyclic.addAll(component);
          logError(
              new CompilerException.CyclicDependency(
                  registry.definition(chain.get(0)).get().namePos(),
                  ErrorKind.CYCLIC_LENGTH_DEPENDENCY,
                  chain));
        });
    return ImmutableSet.copyOf(cyclic);
  }
}
