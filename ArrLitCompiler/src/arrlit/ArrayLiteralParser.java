package arrlit;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import arrlit.Expression.ArrayLiteral.Item;

/** Parses the atoms between a pair of brackets into an {@link Expression.ArrayLiteral}. */
final class ArrayLiteralParser {

  // 'atoms' excludes the brackets themselves; nested groups are already parsed.
  static Expression.ArrayLiteral parse(List<Expression> atoms, Tokenizer.Pos pos)
      throws CompilerException {
    ImmutableList.Builder<Item> items = ImmutableList.builder();

    // Separate by comma; one trailing comma is allowed.
    List<Expression> item = new ArrayList<>();
    for (Expression atom : atoms) {
      if (atom.type() == Expression.Type.COMMA) {
        if (item.isEmpty())
          throw new CompilerException(atom.pos(), ErrorKind.SYNTAX, "unexpected ','");

        items.add(parseItem(item));
        item = new ArrayList<>();
      } else {
        item.add(atom);
      }
    }
    if (!item.isEmpty()) items.add(parseItem(item));

    ImmutableList<Item> built = items.build();
    checkFillIsLast(built);
    return new Expression.ArrayLiteral(built, pos);
  }

  private static Item parseItem(List<Expression> atoms) throws CompilerException {
    Expression expr = Expression.parseNoSeparators(atoms, TokenDisambiguator.Context.ARRAY_ITEM);
    if (expr.type() != Expression.Type.MARKED_OPERAND) {
      return new Item(Item.Kind.PLAIN, expr.pos(), expr);
    }

    Expression operand = expr.<Expression.MarkedOperand>cast().operand();
    Item.Kind kind = operand.type().isElementSyntax() ? Item.Kind.FILL : Item.Kind.MARKER;
    return new Item(kind, expr.pos(), operand);
  }

  private static void checkFillIsLast(List<Item> items) throws CompilerException {
    for (int i = 0; i < items.size() - 1; i++) {
      Item item = items.get(i);
      if (item.kind() == Item.Kind.FILL) {
        throw new CompilerException(
            item.pos(),
            ErrorKind.SYNTAX_MISPLACED_FILL,
            String.format(
                "fill item '%s' must be the last item of an array literal, found '%s' after it",
                item,
                items.get(i + 1)));
      }
    }
  }

  private ArrayLiteralParser() {}
}
