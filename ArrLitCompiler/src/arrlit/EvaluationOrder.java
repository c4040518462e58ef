package arrlit;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/**
 * Orders definitions so that each is evaluated after every definition it references.
 *
 * <p>Only definitions whose types were resolved take part. Those can still reference each other
 * in a cycle when all of them declare their types; each such cycle is reported once, and the
 * definitions on it, or depending on it, never become ready and are left out of the order.
 */
public class EvaluationOrder extends ErrorCollectingValidator {
  private final DefinitionRegistry registry;
  private final TypeResolver types;
  // Edges point from a dependency to its dependents.
  private final MutableGraph<String> dependencies =
      GraphBuilder.directed().allowsSelfLoops(true).build();

  public EvaluationOrder(DefinitionRegistry registry, TypeResolver types) {
    this.registry = registry;
    this.types = types;
  }

  @Override
  public void visitImpl(AST.Definition definition) {
    String node = definition.name();
    if (!types.isResolved(node)) return;
    dependencies.addNode(node);

    for (String dependency : DependencyCollector.instance().visit(definition, new HashSet<>())) {
      if (types.isResolved(dependency)) dependencies.putEdge(dependency, node);
    }
  }

  public ImmutableList<String> order() {
    detectCycles(
        dependencies,
        Comparator.comparing((String n) -> registry.definition(n).get().namePos()),
        (component, chain) -> {
          // The chain follows dependency edges backwards from the first definition.
          logError(
              new CompilerException.CyclicDependency(
                  registry.definition(chain.get(0)).get().namePos(),
                  ErrorKind.CYCLIC_VALUE_DEPENDENCY,
                  chain.reverse()));
        });

    /// Do a topological sort.
    Multiset<String> depCounts = HashMultiset.create();
    Deque<String> sources = new ArrayDeque<>();
    for (String node : dependencies.nodes()) {
      int deps = dependencies.inDegree(node);
      if (deps == 0) {
        sources.add(node);
      } else {
        depCounts.add(node, deps);
      }
    }

    ImmutableList.Builder<String> order = ImmutableList.builder();
    while (!sources.isEmpty()) {
      String next = sources.pollFirst();
      dependencies
          .successors(next)
          .stream()
          .filter(n -> depCounts.remove(n, 1) == 1)
          .forEach(sources::add);

      order.add(next);
    }
    return order.build();
  }
}
