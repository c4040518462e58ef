package arrlit;

import java.util.Optional;

/** Child traversal helpers called by the generated {@code *_ASTNode} interfaces. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface node, ASTVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> nodes, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface node : nodes) {
      value = node.accept(visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> node, ASTVisitor<V> visitor, V value) {
    return node.isPresent() ? node.get().accept(visitor, value) : value;
  }

  private ASTNodeUtils() {}
}
