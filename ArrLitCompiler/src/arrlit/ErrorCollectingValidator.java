package arrlit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompilerException> errors = new ArrayList<>();

  protected ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Tokenizer.Pos pos, ErrorKind kind, String msg) {
    logError(new CompilerException(pos, kind, msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  // Calls 'logCycle' once per strongly-connected component of 'graph' that contains a cycle, with
  // the component's nodes and one cycle through its first node, such as [a, b, a]. Components and
  // cycles start from the smallest node under 'order'. Returns true if cycles were detected.
  protected <T> boolean detectCycles(
      Graph<T> graph, Comparator<T> order, BiConsumer<ImmutableSet<T>, ImmutableList<T>> logCycle) {
    Graph<T> closure = Graphs.transitiveClosure(graph);
    List<T> nodes = new ArrayList<>(graph.nodes());
    nodes.sort(order);

    Set<T> logged = new HashSet<>();
    for (T node : nodes) {
      if (logged.contains(node)) continue;

      Set<T> component = new LinkedHashSet<>();
      if (graph.successors(node).contains(node)) component.add(node);
      for (T node2 : nodes) {
        if (!node2.equals(node)
            && closure.successors(node).contains(node2)
            && closure.successors(node2).contains(node)) {
          component.add(node);
          component.add(node2);
        }
      }
      if (component.isEmpty()) continue;

      logged.addAll(component);
      logCycle.accept(ImmutableSet.copyOf(component), shortestCycle(graph, node, component));
    }

    return !logged.isEmpty();
  }

  // Breadth-first search for the shortest path from 'start' back to itself within 'component'.
  private static <T> ImmutableList<T> shortestCycle(Graph<T> graph, T start, Set<T> component) {
    Map<T, T> parents = new HashMap<>();
    Deque<T> queue = new ArrayDeque<>();
    queue.add(start);
    while (!queue.isEmpty()) {
      T next = queue.pollFirst();
      for (T successor : graph.successors(next)) {
        if (!component.contains(successor)) continue;

        if (successor.equals(start)) {
          List<T> chain = Lists.newArrayList(start);
          for (T n = next; !n.equals(start); n = parents.get(n)) {
            chain.add(n);
          }
          chain.add(start);
          return ImmutableList.copyOf(Lists.reverse(chain));
        }
        if (parents.putIfAbsent(successor, next) == null) {
          queue.add(successor);
        }
      }
    }
    throw new IllegalStateException("no cycle through " + start);
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public void printErrors() {
    errors.stream().forEach(CompilerException::print);
  }
}
