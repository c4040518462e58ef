package arrlit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.io.ByteArrayDataOutput;

import arrlit.processor.ASTChild;
import arrlit.processor.ASTNode;

// AST and infix parser for initializer expressions
public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    // Intermediary nodes.
    // These don't exist in the final node hierarchy when parsing is complete.
    PARENTHESIS,
    BRACKET,
    COMMA,
    TUPLE,
    BINARY_OPERATOR,
    RANGE_OPERATOR,
    MARKER,
    MARKED_OPERAND,

    // Value atoms
    BOOLEAN_CONSTANT,
    INTEGER_CONSTANT,
    STRING_LITERAL,
    VARIABLE,
    CALL,

    // Compounds
    NEGATION,
    BINARY,
    RANGE,
    ARRAY_LITERAL;

    public boolean isOperator() {
      return this == BINARY_OPERATOR || this == RANGE_OPERATOR || this == MARKER;
    }

    // Operands of these shapes can only denote a single element, never an array.
    public boolean isElementSyntax() {
      switch (this) {
        case BOOLEAN_CONSTANT:
        case INTEGER_CONSTANT:
        case STRING_LITERAL:
        case NEGATION:
        case BINARY:
        case RANGE:
          return true;
        default:
          return false;
      }
    }
  }

  public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*");

    private final String repr;

    BinaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    private static final ImmutableMap<String, BinaryOperator> REPR_MAP =
        Maps.uniqueIndex(Arrays.asList(values()), BinaryOperator::repr);

    public static Optional<BinaryOperator> parse(String atom) {
      return Optional.ofNullable(REPR_MAP.get(atom));
    }

    private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
        ImmutableList.of(ImmutableSet.of(MULTIPLY), ImmutableSet.of(ADD, SUBTRACT));

    static {
      // Ensure each operator is listed exactly once.
      Verify.verify(
          Arrays.asList(values())
              .stream()
              .allMatch(b -> ORDER_OF_OPERATIONS.stream().filter(s -> s.contains(b)).count() == 1));
    }

    public static ImmutableList<ImmutableSet<BinaryOperator>> orderOfOperations() {
      return ORDER_OF_OPERATIONS;
    }
  }

  // Parses a single token into an atom.
  private static Expression parseAtom(Tokenizer.Token token) throws CompilerException {
    Tokenizer.Pos pos = token.pos();
    switch (token.type()) {
      case INTEGER:
        return IntegerConstant.parse(token.text(), pos);
      case STRING:
        return new StringLiteral(token.text(), pos);
      case TRUE:
        return new BooleanConstant(true, pos);
      case FALSE:
        return new BooleanConstant(false, pos);
      case IDENTIFIER:
        return new Variable(token.text(), pos);
      case L_PAREN:
      case R_PAREN:
        return new Parenthesis(token.type() == Tokenizer.TokenType.L_PAREN, pos);
      case L_BRACKET:
      case R_BRACKET:
        return new Bracket(token.type() == Tokenizer.TokenType.L_BRACKET, pos);
      case COMMA:
        return new Comma(pos);
      case PLUS:
      case MINUS:
      case STAR:
        return new BinaryOperatorAtom(BinaryOperator.parse(token.text()).get(), pos);
      case DOT_DOT:
        return new RangeOperatorAtom(pos);
      default:
        throw new CompilerException(
            pos, ErrorKind.SYNTAX, String.format("unexpected '%s' in expression", token));
    }
  }

  public static Expression parseExpression(List<Tokenizer.Token> tokens, Tokenizer.Pos pos)
      throws CompilerException {
    if (tokens.isEmpty())
      throw new CompilerException(pos, ErrorKind.SYNTAX, "expected an expression");

    List<Expression> atoms = new ArrayList<>();
    for (Tokenizer.Token token : tokens) {
      atoms.add(parseAtom(token));
    }

    // Parse parentheses and brackets, innermost first.
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.PARENTHESIS && expr.type() != Type.BRACKET) continue;

      Delimiter delimiter = expr.cast();
      if (delimiter.isOpen()) {
        stack.push(i);
        continue;
      }

      if (stack.isEmpty())
        throw new CompilerException(
            delimiter.pos(), ErrorKind.SYNTAX, String.format("unmatched '%s'", delimiter.raw()));

      int start = stack.pop();
      Delimiter opener = atoms.get(start).cast();
      if (opener.type() != delimiter.type()) {
        throw new CompilerException(
            delimiter.pos(),
            ErrorKind.SYNTAX,
            String.format("mismatched '%s': expected '%s'", delimiter.raw(), opener.closer()));
      }

      List<Expression> inner = new ArrayList<>(atoms.subList(start + 1, i));
      Expression group =
          opener.type() == Type.PARENTHESIS
              ? Tuple.parse(inner, opener.pos())
              : ArrayLiteralParser.parse(inner, opener.pos());

      // Replace.
      atoms.subList(start + 1, i + 1).clear();
      atoms.set(start, group);
      i = start;
    }

    if (!stack.isEmpty()) {
      Delimiter opener = atoms.get(stack.pop()).cast();
      throw new CompilerException(
          opener.pos(), ErrorKind.SYNTAX, String.format("unclosed '%s'", opener.raw()));
    }

    for (Expression atom : atoms)
      if (atom.type() == Type.COMMA)
        throw new CompilerException(atom.pos(), ErrorKind.SYNTAX, "unexpected ','");

    return parseNoSeparators(atoms, TokenDisambiguator.Context.TOP_LEVEL);
  }

  private static void parseBinaryOperators(ImmutableSet<BinaryOperator> ops, List<Expression> atoms)
      throws CompilerException {
    for (int i = 0; i < atoms.size(); i++) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.BINARY_OPERATOR) continue;

      BinaryOperatorAtom binary = expr.cast();
      if (!ops.contains(binary.op())) continue;

      // Consume the previous and subsequent arguments.
      if (i - 1 < 0
          || i + 1 >= atoms.size()
          || atoms.get(i - 1).type().isOperator()
          || atoms.get(i + 1).type().isOperator()) {
        throw new CompilerException(
            binary.pos(),
            ErrorKind.SYNTAX,
            String.format("operator '%s' is missing left or right arguments", binary.raw()));
      }

      // Removal of 'i - 1' shifts 'i + 1' to 'i'
      atoms.set(i - 1, new Binary(atoms.remove(i - 1), binary, atoms.remove(i)));
      i--;
    }
  }

  // Parses a list of atoms with all parentheses, brackets and commas already consumed.
  static Expression parseNoSeparators(List<Expression> atoms, TokenDisambiguator.Context context)
      throws CompilerException {
    Preconditions.checkArgument(!atoms.isEmpty());

    // Pass 1: decide which '..' tokens are item markers.
    for (int i = 0; i < atoms.size(); i++) {
      if (atoms.get(i).type() != Type.RANGE_OPERATOR) continue;
      if (TokenDisambiguator.classify(context, atoms, i) == TokenDisambiguator.Reading.MARKER) {
        atoms.set(i, new MarkerAtom(atoms.get(i).pos()));
      }
    }

    // Pass 2: call operations
    for (int i = atoms.size() - 1; i > 0; i--) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.TUPLE) continue;

      Expression invokee = atoms.get(i - 1);
      if (invokee.type().isOperator()) continue;
      if (invokee.type() != Type.VARIABLE) {
        throw new CompilerException(
            expr.pos(), ErrorKind.SYNTAX, "only functions declared with 'extern fn' can be called");
      }

      Tuple args = expr.cast();
      if (!args.elements().isEmpty()) {
        throw new CompilerException(
            args.pos(), ErrorKind.SYNTAX, "extern functions do not take arguments");
      }

      atoms.remove(i);
      atoms.set(i - 1, new Call(invokee.cast()));
    }

    // Pass 3: anything left in parentheses is a grouping.
    for (int i = 0; i < atoms.size(); i++) {
      if (atoms.get(i).type() != Type.TUPLE) continue;

      Tuple tuple = atoms.get(i).cast();
      if (tuple.elements().isEmpty()) {
        throw new CompilerException(
            tuple.pos(), ErrorKind.SYNTAX, "expected an expression inside '()'");
      } else if (tuple.elements().size() > 1) {
        throw new CompilerException(
            tuple.elements().get(1).pos(),
            ErrorKind.SYNTAX,
            "unexpected ',': parentheses group a single expression");
      }
      atoms.set(i, tuple.elements().get(0));
    }

    // Pass 4: prefix negation operators
    for (int i = atoms.size() - 1; i >= 0; i--) {
      Expression expr = atoms.get(i);
      if (expr.type() != Type.BINARY_OPERATOR) continue;

      BinaryOperatorAtom atom = expr.cast();
      if (atom.op() != BinaryOperator.SUBTRACT) continue;

      if (i == 0 || atoms.get(i - 1).type().isOperator()) {
        if (i + 1 >= atoms.size() || atoms.get(i + 1).type().isOperator())
          throw new CompilerException(expr.pos(), ErrorKind.SYNTAX, "'-' has no argument");

        Negation neg = new Negation(expr.pos(), atoms.remove(i + 1));
        atoms.set(i, neg.fold());
      }
    }

    // Pass 5: binary operators
    for (ImmutableSet<BinaryOperator> ops : BinaryOperator.orderOfOperations()) {
      parseBinaryOperators(ops, atoms);
    }

    // Pass 6: the item marker, which binds tighter than range.
    if (atoms.get(0).type() == Type.MARKER) {
      Expression marker = atoms.get(0);
      if (atoms.size() < 2)
        throw new CompilerException(marker.pos(), ErrorKind.SYNTAX, "'..' has no operand");

      Expression operand;
      if (atoms.get(1).type() == Type.RANGE_OPERATOR) {
        operand = parseRange(atoms.subList(1, atoms.size()));
      } else {
        if (atoms.size() > 2 && atoms.get(2).type() == Type.RANGE_OPERATOR) {
          throw new CompilerException(
              atoms.get(2).pos(),
              ErrorKind.SYNTAX,
              "an item marker's operand cannot be a range bound; parenthesize the range");
        }
        atoms.remove(0);
        checkFullyConsumed(atoms);
        operand = atoms.get(0);
      }
      return new MarkedOperand(marker.pos(), operand);
    }

    // Pass 7: ranges
    return parseRange(atoms);
  }

  private static Expression parseRange(List<Expression> atoms) throws CompilerException {
    int index = -1;
    for (int i = 0; i < atoms.size(); i++) {
      if (atoms.get(i).type() != Type.RANGE_OPERATOR) continue;
      if (index != -1) {
        throw new CompilerException(
            atoms.get(i).pos(), ErrorKind.SYNTAX, "range operators cannot be chained");
      }
      index = i;
    }

    if (index != -1) {
      Expression op = atoms.get(index);
      Optional<Expression> end = Optional.empty();
      if (index + 1 < atoms.size()) {
        end = Optional.of(atoms.remove(index + 1));
      }
      Optional<Expression> start = Optional.empty();
      if (index > 0) {
        start = Optional.of(atoms.remove(index - 1));
        index--;
      }
      for (Optional<Expression> bound : ImmutableList.of(start, end)) {
        if (bound.isPresent() && bound.get().type().isOperator()) {
          throw new CompilerException(
              bound.get().pos(),
              ErrorKind.SYNTAX,
              String.format("unexpected '%s' next to '..'", bound.get().raw()));
        }
      }
      atoms.set(index, new Range(start, op.pos(), end));
    }

    checkFullyConsumed(atoms);
    return atoms.get(0);
  }

  // In the end, we should be left with a single expression.
  private static void checkFullyConsumed(List<Expression> atoms) throws CompilerException {
    if (atoms.size() > 1) {
      throw new CompilerException(
          atoms.get(1).pos(), ErrorKind.SYNTAX, "unexpected token: expected end of expression");
    }
    if (atoms.get(0).type().isOperator()) {
      throw new CompilerException(
          atoms.get(0).pos(),
          ErrorKind.SYNTAX,
          String.format("operator '%s' has no arguments", atoms.get(0).raw()));
    }
  }

  private final Type type;
  private final String raw;
  private final Tokenizer.Pos pos;

  private Expression(Type type, String raw, Tokenizer.Pos pos) {
    this.type = type;
    this.raw = raw;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  public String raw() {
    return raw;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  @Override
  public String toString() {
    return raw;
  }

  // Whether this atom can be the first atom of an expression.
  boolean canStartExpression() {
    return !type.isOperator();
  }

  // Returns the value type this expression computes.
  public abstract ValueType valueType(TypeResolver types) throws CompilerException;

  // As above, with the type the surrounding context expects, if any. Only array literals use it.
  public ValueType valueType(TypeResolver types, Optional<ValueType> expected)
      throws CompilerException {
    return valueType(types);
  }

  public abstract Object evaluate(Evaluator evaluator) throws CompilerException;

  public abstract void compile(Compiler.Registry registry, ByteArrayDataOutput out)
      throws CompilerException;

  public final Compiler.Writer writer(Compiler.Registry registry) {
    return out -> compile(registry, out);
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  CompilerException typeMismatch(ValueType expected, ValueType found) {
    return new CompilerException(
        pos(),
        ErrorKind.TYPE_MISMATCH,
        String.format("mismatched types: expected %s, found %s", expected, found));
  }

  private abstract static class IntermediaryExpression extends Expression {
    protected IntermediaryExpression(Expression.Type type, String raw, Tokenizer.Pos pos) {
      super(type, raw, pos);
    }

    @Override
    public final <V> V accept(ASTVisitor<V> visitor, V value) {
      throw new UnsupportedOperationException();
    }

    @Override
    public final <V> V visitChildren(ASTVisitor<V> visitor, V value) {
      throw new UnsupportedOperationException();
    }

    @Override
    public final ValueType valueType(TypeResolver types) {
      throw new UnsupportedOperationException();
    }

    @Override
    public final Object evaluate(Evaluator evaluator) {
      throw new UnsupportedOperationException();
    }

    @Override
    public final void compile(Compiler.Registry registry, ByteArrayDataOutput out) {
      throw new UnsupportedOperationException();
    }
  }

  private abstract static class Delimiter extends IntermediaryExpression {
    private final boolean open;
    private final String closer;

    private Delimiter(Type type, boolean open, String opener, String closer, Tokenizer.Pos pos) {
      super(type, open ? opener : closer, pos);
      this.open = open;
      this.closer = closer;
    }

    public boolean isOpen() {
      return open;
    }

    public String closer() {
      return closer;
    }
  }

  private static class Parenthesis extends Delimiter {
    private Parenthesis(boolean open, Tokenizer.Pos pos) {
      super(Type.PARENTHESIS, open, "(", ")", pos);
    }
  }

  private static class Bracket extends Delimiter {
    private Bracket(boolean open, Tokenizer.Pos pos) {
      super(Type.BRACKET, open, "[", "]", pos);
    }
  }

  static class Comma extends IntermediaryExpression {
    private Comma(Tokenizer.Pos pos) {
      super(Type.COMMA, ",", pos);
    }
  }

  private static class Tuple extends IntermediaryExpression {
    private final ImmutableList<Expression> elements;

    private Tuple(ImmutableList<Expression> elements, Tokenizer.Pos pos) {
      super(
          Type.TUPLE,
          elements.stream().map(Expression::raw).collect(Collectors.joining(", ", "(", ")")),
          pos);
      this.elements = elements;
    }

    public ImmutableList<Expression> elements() {
      return elements;
    }

    private static Tuple parse(List<Expression> atoms, Tokenizer.Pos pos) throws CompilerException {
      if (atoms.isEmpty()) return new Tuple(ImmutableList.of(), pos);

      // Separate by comma
      ImmutableList.Builder<Expression> builder = ImmutableList.builder();
      List<Expression> arg = new ArrayList<>();
      for (Expression atom : atoms) {
        if (atom.type() == Type.COMMA) {
          if (arg.isEmpty())
            throw new CompilerException(atom.pos(), ErrorKind.SYNTAX, "unexpected ','");

          builder.add(parseNoSeparators(arg, TokenDisambiguator.Context.PARENTHESIZED));
          arg = new ArrayList<>();
        } else {
          arg.add(atom);
        }
      }

      if (arg.isEmpty())
        throw new CompilerException(
            atoms.get(atoms.size() - 1).pos(), ErrorKind.SYNTAX, "unexpected ','");
      else builder.add(parseNoSeparators(arg, TokenDisambiguator.Context.PARENTHESIZED));

      return new Tuple(builder.build(), pos);
    }
  }

  private static class BinaryOperatorAtom extends IntermediaryExpression {
    private final BinaryOperator op;

    private BinaryOperatorAtom(BinaryOperator op, Tokenizer.Pos pos) {
      super(Type.BINARY_OPERATOR, op.repr(), pos);
      this.op = op;
    }

    public BinaryOperator op() {
      return op;
    }

    @Override
    boolean canStartExpression() {
      return op == BinaryOperator.SUBTRACT;
    }
  }

  private static class RangeOperatorAtom extends IntermediaryExpression {
    private RangeOperatorAtom(Tokenizer.Pos pos) {
      super(Type.RANGE_OPERATOR, "..", pos);
    }

    @Override
    boolean canStartExpression() {
      return true;
    }
  }

  private static class MarkerAtom extends IntermediaryExpression {
    private MarkerAtom(Tokenizer.Pos pos) {
      super(Type.MARKER, "..", pos);
    }
  }

  // An array item introduced by the '..' marker, before it becomes an ArrayLiteral.Item.
  static class MarkedOperand extends IntermediaryExpression {
    private final Expression operand;

    private MarkedOperand(Tokenizer.Pos markerPos, Expression operand) {
      super(Type.MARKED_OPERAND, ".." + operand.raw(), markerPos);
      this.operand = operand;
    }

    public Expression operand() {
      return operand;
    }
  }

  @ASTNode
  public static class BooleanConstant extends Expression
      implements Expression_BooleanConstant_ASTNode {
    private final boolean value;

    private BooleanConstant(boolean value, Tokenizer.Pos pos) {
      super(Type.BOOLEAN_CONSTANT, Boolean.toString(value), pos);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public ValueType valueType(TypeResolver types) {
      return ValueType.booleanType();
    }

    @Override
    public Object evaluate(Evaluator evaluator) {
      return value;
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out) {
      Compiler.ExprOpCodes.writeBooleanLiteral(value(), out);
    }
  }

  @ASTNode
  public static class IntegerConstant extends Expression
      implements Expression_IntegerConstant_ASTNode {
    private final int value;

    private IntegerConstant(int value, Tokenizer.Pos pos) {
      super(Type.INTEGER_CONSTANT, Integer.toString(value), pos);
      this.value = value;
    }

    public int value() {
      return value;
    }

    @Override
    public ValueType valueType(TypeResolver types) {
      return ValueType.integerType();
    }

    @Override
    public Object evaluate(Evaluator evaluator) {
      return value;
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out) {
      Compiler.ExprOpCodes.writeIntegerLiteral(value(), out);
    }

    public static IntegerConstant parse(String in, Tokenizer.Pos pos) throws CompilerException {
      try {
        return new IntegerConstant(Integer.parseInt(in), pos);
      } catch (NumberFormatException ex) {
        throw new CompilerException(pos, ErrorKind.SYNTAX, "could not parse as integer");
      }
    }
  }

  @ASTNode
  public static class StringLiteral extends Expression implements Expression_StringLiteral_ASTNode {
    private final String value;

    private StringLiteral(String value, Tokenizer.Pos pos) {
      super(Type.STRING_LITERAL, Tokenizer.QUOTE + value + Tokenizer.QUOTE, pos);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public ValueType valueType(TypeResolver types) {
      return ValueType.stringType();
    }

    @Override
    public Object evaluate(Evaluator evaluator) {
      return value;
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out) {
      Compiler.ExprOpCodes.writeStringLiteral(value(), out);
    }
  }

  // A reference to a 'let' definition.
  @ASTNode
  public static class Variable extends Expression implements Expression_Variable_ASTNode {
    private Variable(String name, Tokenizer.Pos pos) {
      super(Type.VARIABLE, name, pos);
    }

    public String name() {
      return raw();
    }

    @Override
    public ValueType valueType(TypeResolver types) throws CompilerException {
      return types.definitionType(this);
    }

    @Override
    public Object evaluate(Evaluator evaluator) throws CompilerException {
      return evaluator.definitionValue(this);
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out) {
      Compiler.ExprOpCodes.writeDefinitionReference(registry.definitionId(name()), out);
    }
  }

  // A call of a zero-argument 'extern fn'.
  @ASTNode
  public static class Call extends Expression implements Expression_Call_ASTNode {
    private final String function;

    private Call(Variable function) {
      super(Type.CALL, function.name() + "()", function.pos());
      this.function = function.name();
    }

    public String function() {
      return function;
    }

    @Override
    public ValueType valueType(TypeResolver types) throws CompilerException {
      return types.callType(this);
    }

    @Override
    public Object evaluate(Evaluator evaluator) throws CompilerException {
      return evaluator.call(this);
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out) {
      Compiler.ExprOpCodes.writeCall(registry.externId(function), out);
    }
  }

  @ASTNode
  public static class Negation extends Expression implements Expression_Negation_ASTNode {
    private final Expression expr;

    private Negation(Tokenizer.Pos negationPos, Expression expr) {
      super(Type.NEGATION, "-" + expr.raw(), negationPos);
      this.expr = expr;
    }

    @ASTChild
    @Override
    public Expression expr() {
      return expr;
    }

    private Expression fold() {
      if (expr.type() == Type.INTEGER_CONSTANT) {
        IntegerConstant x = expr.cast();
        if (x.value() != Integer.MIN_VALUE) return new IntegerConstant(-x.value(), pos());
      }
      return this;
    }

    @Override
    public ValueType valueType(TypeResolver types) throws CompilerException {
      ValueType exprType = expr.valueType(types);
      if (!exprType.isInteger()) {
        throw new CompilerException(
            expr.pos(),
            ErrorKind.TYPE_MISMATCH,
            String.format("operator '-' requires int, but was %s", exprType));
      }
      return exprType;
    }

    @Override
    public Object evaluate(Evaluator evaluator) throws CompilerException {
      int value = (Integer) expr.evaluate(evaluator);
      try {
        return Math.negateExact(value);
      } catch (ArithmeticException ex) {
        throw evaluator.overflow(this);
      }
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out)
        throws CompilerException {
      Compiler.ExprOpCodes.writeNegation(expr.writer(registry), out);
    }
  }

  @ASTNode
  public static class Binary extends Expression implements Expression_Binary_ASTNode {
    private final Expression lhs;
    private final BinaryOperator op;
    private final Expression rhs;

    private Binary(Expression lhs, BinaryOperatorAtom op, Expression rhs) {
      super(Type.BINARY, lhs.raw() + " " + op.raw() + " " + rhs.raw(), op.pos());
      this.lhs = lhs;
      this.op = op.op();
      this.rhs = rhs;
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression rhs() {
      return rhs;
    }

    @Override
    public ValueType valueType(TypeResolver types) throws CompilerException {
      ValueType lValue = lhs.valueType(types);
      ValueType rValue = rhs.valueType(types);
      if (!lValue.isInteger() || !rValue.isInteger()) {
        throw new CompilerException(
            pos(),
            ErrorKind.TYPE_MISMATCH,
            String.format("operator '%s %s %s' is not defined", lValue, op.repr(), rValue));
      }
      return ValueType.integerType();
    }

    @Override
    public Object evaluate(Evaluator evaluator) throws CompilerException {
      int l = (Integer) lhs.evaluate(evaluator);
      int r = (Integer) rhs.evaluate(evaluator);
      try {
        switch (op) {
          case ADD:
            return Math.addExact(l, r);
          case SUBTRACT:
            return Math.subtractExact(l, r);
          case MULTIPLY:
            return Math.multiplyExact(l, r);
          default:
            throw new AssertionError(op);
        }
      } catch (ArithmeticException ex) {
        throw evaluator.overflow(this);
      }
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out)
        throws CompilerException {
      switch (op) {
        case ADD:
          Compiler.ExprOpCodes.writeAddition(lhs.writer(registry), rhs.writer(registry), out);
          break;
        case SUBTRACT:
          Compiler.ExprOpCodes.writeSubtraction(lhs.writer(registry), rhs.writer(registry), out);
          break;
        case MULTIPLY:
          Compiler.ExprOpCodes.writeMultiplication(lhs.writer(registry), rhs.writer(registry), out);
          break;
        default:
          throw new AssertionError(op);
      }
    }
  }

  // An integer range; either bound may be omitted.
  @ASTNode
  public static class Range extends Expression implements Expression_Range_ASTNode {
    private final Optional<Expression> start;
    private final Optional<Expression> end;

    private Range(Optional<Expression> start, Tokenizer.Pos opPos, Optional<Expression> end) {
      super(
          Type.RANGE,
          start.map(Expression::raw).orElse("") + ".." + end.map(Expression::raw).orElse(""),
          start.map(Expression::pos).orElse(opPos));
      this.start = start;
      this.end = end;
    }

    @ASTChild
    @Override
    public Optional<Expression> start() {
      return start;
    }

    @ASTChild
    @Override
    public Optional<Expression> end() {
      return end;
    }

    @Override
    public ValueType valueType(TypeResolver types) throws CompilerException {
      for (Optional<Expression> bound : ImmutableList.of(start, end)) {
        if (!bound.isPresent()) continue;

        ValueType boundType = bound.get().valueType(types);
        if (!boundType.isInteger()) {
          throw new CompilerException(
              bound.get().pos(),
              ErrorKind.TYPE_MISMATCH,
              String.format("range bounds must be int, but was %s", boundType));
        }
      }
      return ValueType.rangeType();
    }

    @Override
    public Object evaluate(Evaluator evaluator) throws CompilerException {
      Optional<Integer> startValue = Optional.empty();
      if (start.isPresent()) startValue = Optional.of((Integer) start.get().evaluate(evaluator));
      Optional<Integer> endValue = Optional.empty();
      if (end.isPresent()) endValue = Optional.of((Integer) end.get().evaluate(evaluator));
      return RangeValue.create(startValue, endValue);
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out)
        throws CompilerException {
      Compiler.ExprOpCodes.writeRange(
          start.map(e -> e.writer(registry)), end.map(e -> e.writer(registry)), out);
    }
  }

  @ASTNode
  public static class ArrayLiteral extends Expression implements Expression_ArrayLiteral_ASTNode {

    @ASTNode
    public static class Item implements Expression_ArrayLiteral_Item_ASTNode {
      public enum Kind {
        PLAIN,
        // A marker whose operand's type decides between FILL and EXPANSION.
        MARKER,
        FILL,
        EXPANSION;
      }

      private final Kind kind;
      private final Tokenizer.Pos pos;
      private final Expression operand;

      Item(Kind kind, Tokenizer.Pos pos, Expression operand) {
        Preconditions.checkArgument(kind != Kind.EXPANSION, "expansion is not a syntactic kind");
        this.kind = kind;
        this.pos = pos;
        this.operand = operand;
      }

      // The syntactic kind; never EXPANSION.
      public Kind kind() {
        return kind;
      }

      public boolean isMarked() {
        return kind != Kind.PLAIN;
      }

      public Tokenizer.Pos pos() {
        return pos;
      }

      @ASTChild
      @Override
      public Expression operand() {
        return operand;
      }

      @Override
      public String toString() {
        return isMarked() ? ".." + operand.raw() : operand.raw();
      }
    }

    private final ImmutableList<Item> items;

    ArrayLiteral(ImmutableList<Item> items, Tokenizer.Pos pos) {
      super(
          Type.ARRAY_LITERAL,
          items.stream().map(Item::toString).collect(Collectors.joining(", ", "[", "]")),
          pos);
      this.items = items;
    }

    @ASTChild
    @Override
    public ImmutableList<Item> items() {
      return items;
    }

    @Override
    public ValueType valueType(TypeResolver types) throws CompilerException {
      return valueType(types, Optional.empty());
    }

    @Override
    public ValueType valueType(TypeResolver types, Optional<ValueType> expected)
        throws CompilerException {
      return types.literals().resolve(this, expected).type();
    }

    @Override
    public Object evaluate(Evaluator evaluator) throws CompilerException {
      return evaluator.construct(this);
    }

    @Override
    public void compile(Compiler.Registry registry, ByteArrayDataOutput out)
        throws CompilerException {
      Compiler.ExprOpCodes.writeArrayConstruction(registry, registry.plan(this), out);
    }
  }
}
