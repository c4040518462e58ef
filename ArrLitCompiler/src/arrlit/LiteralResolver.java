package arrlit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;

import arrlit.Expression.ArrayLiteral;
import arrlit.Expression.ArrayLiteral.Item;

/**
 * Types the items of array literals, classifies each marker as a fill or an expansion, and solves
 * the literal's length.
 *
 * <p>The element type comes from the expected type if there is one. Otherwise it is the type of
 * the first plain item that is not itself an array literal, then of the first nested literal
 * whose type is known on its own, then of the first marker operand: an array operand contributes
 * its element type, anything else its own type.
 *
 * <p>A marker whose operand has the element type is a fill; one whose operand is an array of the
 * element type is an expansion. Only the last item may be a fill. A nested literal used as an
 * expansion may leave its own length open, in which case it is solved from the enclosing
 * literal's length.
 */
public final class LiteralResolver {

  // A literal whose items are classified and whose length is not solved yet.
  private static final class Shape {
    private final ArrayLiteral literal;
    private final ValueType elementType;
    private final List<Item.Kind> kinds = new ArrayList<>();
    private final Map<Integer, Integer> knownLengths = new HashMap<>();
    private final Map<Integer, Shape> nestedExpansions = new HashMap<>();
    private final List<Integer> operands = new ArrayList<>();
    private int constant = 0;
    private Optional<Integer> fill = Optional.empty();

    private Shape(ArrayLiteral literal, ValueType elementType) {
      this.literal = literal;
      this.elementType = elementType;
    }

    private Optional<Integer> knownLength(int operand) {
      return Optional.ofNullable(knownLengths.get(operand));
    }

    private LengthExpression length() {
      return LengthExpression.create(literal.pos(), constant, operands, fill);
    }

    // The length this literal has without any context, if it can be found.
    private Optional<Integer> standaloneLength() throws CompilerException {
      if (fill.isPresent()) return Optional.empty();

      long length = constant;
      for (int operand : operands) {
        Optional<Integer> operandLength = knownLength(operand);
        if (!operandLength.isPresent()) return Optional.empty();
        length += operandLength.get();
      }
      if (length > Integer.MAX_VALUE) {
        throw new CompilerException(
            literal.pos(), ErrorKind.OVER_CONSTRAINED_LENGTH, "array literal is too long");
      }
      return Optional.of((int) length);
    }
  }

  private final TypeResolver types;
  private final Map<ArrayLiteral, ResolvedLiteral> resolved = new IdentityHashMap<>();

  LiteralResolver(TypeResolver types) {
    this.types = types;
  }

  public Optional<ResolvedLiteral> resolved(ArrayLiteral literal) {
    return Optional.ofNullable(resolved.get(literal));
  }

  public ResolvedLiteral resolve(ArrayLiteral literal, Optional<ValueType> expected)
      throws CompilerException {
    Optional<ValueType> expectedElement = Optional.empty();
    Optional<Integer> expectedLength = Optional.empty();
    if (expected.isPresent()) {
      if (!expected.get().isArray()) {
        throw new CompilerException(
            literal.pos(),
            ErrorKind.TYPE_MISMATCH,
            String.format("mismatched types: expected %s, found an array literal", expected.get()));
      }
      expectedElement = Optional.of(expected.get().asArray().elementType());
      expectedLength = Optional.of(expected.get().asArray().length());
    }

    Optional<Shape> shape = shape(literal, expectedElement);
    if (!shape.isPresent()) {
      throw new CompilerException(
          literal.pos(),
          ErrorKind.UNKNOWN_ELEMENT_TYPE,
          "cannot infer the element type of this array literal; add a type annotation");
    }
    return solve(shape.get(), expectedLength);
  }

  private ResolvedLiteral solve(Shape shape, Optional<Integer> expectedLength)
      throws CompilerException {
    LengthSolver.Solution solution =
        LengthSolver.solve(shape.length(), expectedLength, shape::knownLength);

    List<ResolvedLiteral.ResolvedItem> items = new ArrayList<>();
    for (int i = 0; i < shape.kinds.size(); i++) {
      Item item = shape.literal.items().get(i);
      switch (shape.kinds.get(i)) {
        case PLAIN:
          items.add(
              ResolvedLiteral.ResolvedItem.create(item, Item.Kind.PLAIN, shape.elementType, 1));
          break;
        case FILL:
          items.add(
              ResolvedLiteral.ResolvedItem.create(
                  item, Item.Kind.FILL, shape.elementType, solution.count(i)));
          break;
        case EXPANSION:
          {
            int count = solution.count(i);
            Shape nested = shape.nestedExpansions.get(i);
            if (nested != null) solve(nested, Optional.of(count));

            items.add(
                ResolvedLiteral.ResolvedItem.create(
                    item,
                    Item.Kind.EXPANSION,
                    ValueType.arrayOf(shape.elementType, count),
                    count));
            break;
          }
        default:
          throw new AssertionError(shape.kinds.get(i));
      }
    }

    ResolvedLiteral result = ResolvedLiteral.create(shape.literal, shape.elementType, items);
    resolved.put(shape.literal, result);
    return result;
  }

  // Returns empty if the element type cannot be determined.
  private Optional<Shape> shape(ArrayLiteral literal, Optional<ValueType> expectedElement)
      throws CompilerException {
    Optional<ValueType> elementType = expectedElement;
    if (!elementType.isPresent()) elementType = inferElementType(literal);
    if (!elementType.isPresent()) return Optional.empty();

    ValueType element = elementType.get();
    Shape shape = new Shape(literal, element);
    for (int i = 0; i < literal.items().size(); i++) {
      Item item = literal.items().get(i);
      switch (item.kind()) {
        case PLAIN:
          checkElement(item.operand(), element);
          shape.kinds.add(Item.Kind.PLAIN);
          shape.constant++;
          break;
        case FILL:
          checkElement(item.operand(), element);
          shape.kinds.add(Item.Kind.FILL);
          shape.fill = Optional.of(i);
          break;
        case MARKER:
          classifyMarker(shape, i, i == literal.items().size() - 1);
          break;
        default:
          throw new AssertionError(item.kind());
      }
    }
    return Optional.of(shape);
  }

  private Optional<ValueType> inferElementType(ArrayLiteral literal) throws CompilerException {
    for (Item item : literal.items()) {
      if (item.kind() == Item.Kind.PLAIN
          && item.operand().type() != Expression.Type.ARRAY_LITERAL) {
        return Optional.of(item.operand().valueType(types));
      }
    }

    for (Item item : literal.items()) {
      if (item.kind() == Item.Kind.PLAIN) {
        Optional<ValueType> standalone = standaloneType(item.operand().cast());
        if (standalone.isPresent()) return standalone;
      }
    }

    for (Item item : literal.items()) {
      if (!item.isMarked()) continue;

      Expression operand = item.operand();
      if (operand.type() == Expression.Type.ARRAY_LITERAL) {
        Optional<Shape> nested = shape(operand.cast(), Optional.empty());
        if (nested.isPresent()) return Optional.of(nested.get().elementType);
      } else {
        ValueType operandType = operand.valueType(types);
        return Optional.of(
            operandType.isArray() ? operandType.asArray().elementType() : operandType);
      }
    }

    // A nested element whose own element type is known still leaves its length open.
    for (Item item : literal.items()) {
      if (item.kind() == Item.Kind.PLAIN) {
        Optional<Shape> nested = shape(item.operand().cast(), Optional.empty());
        if (nested.isPresent()) throw LengthSolver.underConstrained(nested.get().length());
      }
    }
    return Optional.empty();
  }

  // The type of a nested literal that needs no context, if it has one.
  private Optional<ValueType> standaloneType(ArrayLiteral literal) throws CompilerException {
    Optional<Shape> shape = shape(literal, Optional.empty());
    if (!shape.isPresent()) return Optional.empty();

    Optional<Integer> length = shape.get().standaloneLength();
    if (!length.isPresent()) return Optional.empty();
    return Optional.of(ValueType.arrayOf(shape.get().elementType, length.get()));
  }

  private void checkElement(Expression operand, ValueType element) throws CompilerException {
    ValueType found = operand.valueType(types, Optional.of(element));
    if (!found.equals(element)) throw elementMismatch(operand, element, found.toString());
  }

  private void classifyMarker(Shape shape, int index, boolean last) throws CompilerException {
    Expression operand = shape.literal.items().get(index).operand();
    ValueType element = shape.elementType;

    if (operand.type() == Expression.Type.ARRAY_LITERAL) {
      ArrayLiteral nested = operand.cast();
      Optional<Shape> nestedShape = shape(nested, Optional.empty());
      if (!nestedShape.isPresent()) nestedShape = shape(nested, Optional.of(element));
      Preconditions.checkState(nestedShape.isPresent());

      ValueType nestedElement = nestedShape.get().elementType;
      if (nestedElement.equals(element)) {
        shape.kinds.add(Item.Kind.EXPANSION);
        shape.operands.add(index);
        shape.nestedExpansions.put(index, nestedShape.get());
        Optional<Integer> nestedLength = nestedShape.get().standaloneLength();
        if (nestedLength.isPresent()) shape.knownLengths.put(index, nestedLength.get());
        return;
      }

      if (last
          && element.isArray()
          && nestedElement.equals(element.asArray().elementType())) {
        // A fill whose value is itself an array.
        resolve(nested, Optional.of(element));
        shape.kinds.add(Item.Kind.FILL);
        shape.fill = Optional.of(index);
        return;
      }

      throw elementMismatch(operand, element, String.format("[%s; _]", nestedElement));
    }

    ValueType found = operand.valueType(types);
    if (found.isArray() && found.asArray().elementType().equals(element)) {
      shape.kinds.add(Item.Kind.EXPANSION);
      shape.operands.add(index);
      shape.knownLengths.put(index, found.asArray().length());
    } else if (last && found.equals(element)) {
      shape.kinds.add(Item.Kind.FILL);
      shape.fill = Optional.of(index);
    } else if (!last && !found.isArray()) {
      throw new CompilerException(
          operand.pos(),
          ErrorKind.NON_ARRAY_EXPANSION_OPERAND,
          String.format(
              "expected an array of %s to expand, found %s; only the last item can repeat a value",
              element, found));
    } else {
      throw elementMismatch(operand, element, found.toString());
    }
  }

  private static CompilerException elementMismatch(
      Expression operand, ValueType element, String found) {
    return new CompilerException(
        operand.pos(),
        ErrorKind.ELEMENT_TYPE_MISMATCH,
        String.format("mismatched types: expected element type %s, found %s", element, found));
  }
}
