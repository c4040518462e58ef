package arrlit;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

import arrlit.Expression.ArrayLiteral.Item;

/** An array literal with every marker classified and every item's element count known. */
@AutoValue
public abstract class ResolvedLiteral {

  @AutoValue
  public abstract static class ResolvedItem {
    public abstract Item item();

    // PLAIN, FILL or EXPANSION; never MARKER.
    public abstract Item.Kind kind();

    // The element type for PLAIN and FILL items, an array of it for EXPANSION items.
    public abstract ValueType operandType();

    // The number of slots this item populates; zero is valid for FILL and EXPANSION.
    public abstract int count();

    public final Expression operand() {
      return item().operand();
    }

    static ResolvedItem create(Item item, Item.Kind kind, ValueType operandType, int count) {
      return new AutoValue_ResolvedLiteral_ResolvedItem(item, kind, operandType, count);
    }
  }

  public abstract Expression.ArrayLiteral literal();

  public abstract ValueType elementType();

  public abstract ImmutableList<ResolvedItem> items();

  @Memoized
  public ValueType.ArrayValueType type() {
    return ValueType.arrayOf(elementType(), items().stream().mapToInt(ResolvedItem::count).sum());
  }

  public final int length() {
    return type().length();
  }

  // A literal consisting of exactly one expansion is its operand's value.
  public final boolean isPassthrough() {
    return items().size() == 1 && items().get(0).kind() == Item.Kind.EXPANSION;
  }

  static ResolvedLiteral create(
      Expression.ArrayLiteral literal, ValueType elementType, Iterable<ResolvedItem> items) {
    return new AutoValue_ResolvedLiteral(literal, elementType, ImmutableList.copyOf(items));
  }
}
