package arrlit;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import arrlit.Expression.ArrayLiteral;
import arrlit.Expression.ArrayLiteral.Item;

public class ParserTest {

  private static AST parseFile(String content) throws CompilerException {
    return DeclarationParser.parse("/test/file.al", content);
  }

  private static Expression parse(String expr) throws CompilerException {
    return Expression.parseExpression(
        new Tokenizer("/test/file.al", expr).tokenize(), new Tokenizer.Pos("/test/file.al", 0, 0));
  }

  private static ArrayLiteral parseLiteral(String expr) throws CompilerException {
    Expression parsed = parse(expr);
    assertThat(parsed.type()).isEqualTo(Expression.Type.ARRAY_LITERAL);
    return parsed.cast();
  }

  private static ImmutableList<Item.Kind> kinds(String expr) throws CompilerException {
    return parseLiteral(expr)
        .items()
        .stream()
        .map(Item::kind)
        .collect(ImmutableList.toImmutableList());
  }

  private static CompilerException assertErrors(ErrorKind kind, String errorSubstr, String expr) {
    CompilerException ex = assertThrows(CompilerException.class, () -> parse(expr));
    assertThat(ex.kind()).isEqualTo(kind);
    assertThat(ex).hasMessageThat().contains(errorSubstr);
    return ex;
  }

  @Test
  public void plainItems() throws CompilerException {
    assertThat(kinds("[]")).isEmpty();
    assertThat(kinds("[1]")).containsExactly(Item.Kind.PLAIN);
    assertThat(kinds("[1, 2, 3]"))
        .containsExactly(Item.Kind.PLAIN, Item.Kind.PLAIN, Item.Kind.PLAIN);
    assertThat(kinds("[1, 2,]")).containsExactly(Item.Kind.PLAIN, Item.Kind.PLAIN);
    assertThat(kinds("[[1], []]")).containsExactly(Item.Kind.PLAIN, Item.Kind.PLAIN);
  }

  @Test
  public void markerItems() throws CompilerException {
    // Variables, calls and nested literals are classified once their types are known.
    assertThat(kinds("[..xs]")).containsExactly(Item.Kind.MARKER);
    assertThat(kinds("[..f()]")).containsExactly(Item.Kind.MARKER);
    assertThat(kinds("[..[1, 2]]")).containsExactly(Item.Kind.MARKER);
    assertThat(kinds("[..xs, 1, ..ys]"))
        .containsExactly(Item.Kind.MARKER, Item.Kind.PLAIN, Item.Kind.MARKER)
        .inOrder();
    assertThat(kinds("[..(xs)]")).containsExactly(Item.Kind.MARKER);
  }

  @Test
  public void fillItems() throws CompilerException {
    assertThat(kinds("[..0]")).containsExactly(Item.Kind.FILL);
    assertThat(kinds("[..true]")).containsExactly(Item.Kind.FILL);
    assertThat(kinds("[..\"s\"]")).containsExactly(Item.Kind.FILL);
    assertThat(kinds("[..-1]")).containsExactly(Item.Kind.FILL);
    assertThat(kinds("[..n * 2]")).containsExactly(Item.Kind.FILL);
    assertThat(kinds("[1, 2, ..0]"))
        .containsExactly(Item.Kind.PLAIN, Item.Kind.PLAIN, Item.Kind.FILL)
        .inOrder();
    assertThat(kinds("[..xs, ..0,]")).containsExactly(Item.Kind.MARKER, Item.Kind.FILL).inOrder();

    Item item = parseLiteral("[..-1]").items().get(0);
    assertThat(item.operand().type()).isEqualTo(Expression.Type.INTEGER_CONSTANT);
    assertThat(item.operand().<Expression.IntegerConstant>cast().value()).isEqualTo(-1);
  }

  @Test
  public void misplacedFill() {
    CompilerException ex =
        assertErrors(ErrorKind.SYNTAX_MISPLACED_FILL, "must be the last item", "[..0, 1]");
    assertThat(ex).hasMessageThat().contains("'..0'");
    assertThat(ex).hasMessageThat().contains("'1'");
    assertErrors(ErrorKind.SYNTAX_MISPLACED_FILL, "must be the last item", "[1, ..true, ..xs]");
    assertErrors(ErrorKind.SYNTAX_MISPLACED_FILL, "must be the last item", "[[..0, 1]]");
  }

  @Test
  public void markerWithoutOperand() {
    assertErrors(ErrorKind.SYNTAX, "expected an expression after '..'", "[1, ..]");
    assertErrors(ErrorKind.SYNTAX, "expected an expression after '..'", "[..]");
    assertErrors(ErrorKind.SYNTAX, "expected an expression after '..'", "[.. * 2]");
    assertErrors(ErrorKind.SYNTAX, "expected an expression after '..'", "[.. + xs, 1]");
  }

  @Test
  public void markerOperandIsASingleExpression() throws CompilerException {
    ArrayLiteral literal = parseLiteral("[1, 2, 3, ..d]");
    assertThat(literal.items()).hasSize(4);
    assertThat(literal.items().get(3).operand().toString()).isEqualTo("d");

    assertErrors(ErrorKind.SYNTAX, "expected end of expression", "[..a b]");
    assertErrors(ErrorKind.SYNTAX, "expected end of expression", "[1, ..x y]");
    assertErrors(ErrorKind.SYNTAX, "expected end of expression", "[..f() 2, 3]");
  }

  @Test
  public void markerOperandIsRange() throws CompilerException {
    ArrayLiteral literal = parseLiteral("[.. ..5]");
    assertThat(literal.items()).hasSize(1);

    Item item = literal.items().get(0);
    assertThat(item.kind()).isEqualTo(Item.Kind.FILL);
    assertThat(item.operand().type()).isEqualTo(Expression.Type.RANGE);

    Expression.Range range = item.operand().cast();
    assertThat(range.start()).isEmpty();
    assertThat(range.end().get().raw()).isEqualTo("5");
  }

  @Test
  public void markerOperandCannotBeRangeBound() {
    assertErrors(ErrorKind.SYNTAX, "cannot be a range bound", "[..a..b]");
    assertErrors(ErrorKind.SYNTAX, "cannot be a range bound", "[..1..]");
  }

  @Test
  public void parenthesizedRangeIsPlain() throws CompilerException {
    ArrayLiteral literal = parseLiteral("[(..), (..5), (a..)]");
    for (Item item : literal.items()) {
      assertThat(item.kind()).isEqualTo(Item.Kind.PLAIN);
      assertThat(item.operand().type()).isEqualTo(Expression.Type.RANGE);
    }

    Expression.Range full = literal.items().get(0).operand().cast();
    assertThat(full.start()).isEmpty();
    assertThat(full.end()).isEmpty();
  }

  @Test
  public void rangeOutsideMarkerPosition() throws CompilerException {
    assertThat(parse("1..5").type()).isEqualTo(Expression.Type.RANGE);
    assertThat(parse("..5").type()).isEqualTo(Expression.Type.RANGE);
    assertThat(parse("(..xs)").type()).isEqualTo(Expression.Type.RANGE);

    // Only the first atom of an item can be a marker.
    assertThat(kinds("[1..5]")).containsExactly(Item.Kind.PLAIN);
    assertThat(kinds("[a.., 2]")).containsExactly(Item.Kind.PLAIN, Item.Kind.PLAIN);

    // A nested literal has its own item positions.
    ArrayLiteral outer = parseLiteral("[[..0]]");
    assertThat(outer.items().get(0).kind()).isEqualTo(Item.Kind.PLAIN);
    ArrayLiteral inner = outer.items().get(0).operand().cast();
    assertThat(inner.items().get(0).kind()).isEqualTo(Item.Kind.FILL);
  }

  @Test
  public void chainedRanges() {
    assertErrors(ErrorKind.SYNTAX, "cannot be chained", "1..2..3");
    assertErrors(ErrorKind.SYNTAX, "cannot be chained", "[(1..2..3)]");
  }

  @Test
  public void arithmetic() throws CompilerException {
    Expression expr = parse("1 + 2 * x - -3");
    assertThat(expr.type()).isEqualTo(Expression.Type.BINARY);
    assertThat(expr.<Expression.Binary>cast().op()).isEqualTo(Expression.BinaryOperator.SUBTRACT);
    assertThat(expr.raw()).isEqualTo("1 + 2 * x - -3");

    assertErrors(ErrorKind.SYNTAX, "missing left or right", "1 +");
    assertErrors(ErrorKind.SYNTAX, "'-' has no argument", "-");
  }

  @Test
  public void calls() throws CompilerException {
    assertThat(parse("f()").type()).isEqualTo(Expression.Type.CALL);
    assertThat(parse("f()").<Expression.Call>cast().function()).isEqualTo("f");

    assertErrors(ErrorKind.SYNTAX, "do not take arguments", "f(1)");
    assertErrors(ErrorKind.SYNTAX, "can be called", "1()");
    assertErrors(ErrorKind.SYNTAX, "expected an expression inside '()'", "()");
  }

  @Test
  public void bracketStructure() {
    assertErrors(ErrorKind.SYNTAX, "unclosed '['", "[1, 2");
    assertErrors(ErrorKind.SYNTAX, "unmatched ']'", "1]");
    assertErrors(ErrorKind.SYNTAX, "mismatched ')'", "[1)");
    assertErrors(ErrorKind.SYNTAX, "unexpected ','", "[1,, 2]");
    assertErrors(ErrorKind.SYNTAX, "unexpected ','", "[,]");
    assertErrors(ErrorKind.SYNTAX, "unexpected ','", "1, 2");
    assertErrors(ErrorKind.SYNTAX, "expected end of expression", "[1 2]");
  }

  @Test
  public void declarations() throws CompilerException {
    AST ast =
        parseFile(
            String.join(
                "\n",
                "extern fn next(): int;",
                "let a: [int; 3] = [1, ..0];",
                "let b = [[1, 2], [..a]];",
                "let c: [[bool; 2]; 1] = [[true, false]];"));

    assertThat(ast.declarations()).hasSize(4);
    assertThat(ast.definitions()).hasSize(3);

    AST.ExternDeclaration extern = (AST.ExternDeclaration) ast.declarations().get(0);
    assertThat(extern.name()).isEqualTo("next");
    assertThat(extern.returnType()).isEqualTo(ValueType.integerType());

    assertThat(ast.definitions().get(0).declaredType())
        .hasValue(ValueType.arrayOf(ValueType.integerType(), 3));
    assertThat(ast.definitions().get(1).declaredType()).isEmpty();
    assertThat(ast.definitions().get(2).declaredType().get().toString())
        .isEqualTo("[[bool; 2]; 1]");
  }

  @Test
  public void declarationErrors() {
    assertThrows(CompilerException.class, () -> parseFile("let x = 1"));
    assertThrows(CompilerException.class, () -> parseFile("let = 1;"));
    assertThrows(CompilerException.class, () -> parseFile("x = 1;"));
    assertThrows(CompilerException.class, () -> parseFile("let x = ;"));
    assertThrows(CompilerException.class, () -> parseFile("extern fn f: int;"));

    CompilerException ex =
        assertThrows(CompilerException.class, () -> parseFile("let x: [float; 2] = [];"));
    assertThat(ex).hasMessageThat().contains("unknown type 'float'");
  }
}
