package arrlit;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

// Opcode values are declared in the nested 'OpCodes' classes.
public class Compiler {

  public interface Writer {
    void write(ByteArrayDataOutput out) throws CompilerException;
  }

  // Op Codes
  public static class ExprOpCodes {
    private ExprOpCodes() {}

    private static final int DEFINITION_REFERENCE = 1; // varint id

    public static void writeDefinitionReference(int definitionId, ByteArrayDataOutput out) {
      writeVarint(DEFINITION_REFERENCE, out);
      writeVarint(definitionId, out);
    }

    private static final int EXTERN_CALL = 2; // varint id

    public static void writeCall(int externId, ByteArrayDataOutput out) {
      writeVarint(EXTERN_CALL, out);
      writeVarint(externId, out);
    }

    private static final int BOOLEAN_LITERAL = 10; // 0 = false, 1 = true

    public static void writeBooleanLiteral(boolean value, ByteArrayDataOutput out) {
      writeVarint(BOOLEAN_LITERAL, out);
      out.writeByte(value ? 1 : 0);
    }

    private static final int INTEGER_LITERAL = 11; // 32-bit signed

    public static void writeIntegerLiteral(int value, ByteArrayDataOutput out) {
      writeVarint(INTEGER_LITERAL, out);
      out.writeInt(value);
    }

    private static final int STRING_LITERAL = 12; // Varint size N, UTF 8 bytes

    public static void writeStringLiteral(String value, ByteArrayDataOutput out) {
      writeVarint(STRING_LITERAL, out);
      writeUTF8(value, out);
    }

    private static final int RANGE = 13; // flags (1 = start, 2 = end), present bounds

    public static void writeRange(
        Optional<Writer> startWriter, Optional<Writer> endWriter, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(RANGE, out);
      out.writeByte((startWriter.isPresent() ? 1 : 0) | (endWriter.isPresent() ? 2 : 0));
      if (startWriter.isPresent()) startWriter.get().write(out);
      if (endWriter.isPresent()) endWriter.get().write(out);
    }

    // Unary operations: argument follows
    private static void writeUnaryOp(int opCode, Writer argumentWriter, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(opCode, out);
      argumentWriter.write(out);
    }

    private static final int NEGATION = 20;

    public static void writeNegation(Writer argumentWriter, ByteArrayDataOutput out)
        throws CompilerException {
      writeUnaryOp(NEGATION, argumentWriter, out);
    }

    // Binary operations: lhs argument, then rhs argument follow
    private static void writeBinaryOp(
        int opCode, Writer lhsWriter, Writer rhsWriter, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(opCode, out);
      lhsWriter.write(out);
      rhsWriter.write(out);
    }

    private static final int ADDITION = 30;

    public static void writeAddition(Writer lhsWriter, Writer rhsWriter, ByteArrayDataOutput out)
        throws CompilerException {
      writeBinaryOp(ADDITION, lhsWriter, rhsWriter, out);
    }

    private static final int SUBTRACTION = 31;

    public static void writeSubtraction(Writer lhsWriter, Writer rhsWriter, ByteArrayDataOutput out)
        throws CompilerException {
      writeBinaryOp(SUBTRACTION, lhsWriter, rhsWriter, out);
    }

    private static final int MULTIPLICATION = 32;

    public static void writeMultiplication(
        Writer lhsWriter, Writer rhsWriter, ByteArrayDataOutput out) throws CompilerException {
      writeBinaryOp(MULTIPLICATION, lhsWriter, rhsWriter, out);
    }

    // Array construction: varint num steps, steps*, then BUILD_ARRAY. Bound names become locals
    // numbered from 0 in binding order, scoped to the construction.
    private static final int ARRAY_CONSTRUCTION = 40;

    public static void writeArrayConstruction(
        Registry registry, BindingPlan plan, ByteArrayDataOutput out) throws CompilerException {
      if (plan.passthrough()) {
        plan.steps().get(0).operand().compile(registry, out);
        return;
      }

      Map<String, Integer> locals = new HashMap<>();
      for (BindingStep step : plan.steps()) {
        step.names().forEach(n -> locals.put(n, locals.size()));
      }

      writeVarint(ARRAY_CONSTRUCTION, out);
      writeVarint(plan.steps().size(), out);
      for (BindingStep step : plan.steps()) {
        Writer operand = step.operand().writer(registry);
        switch (step.kind()) {
          case SINGLE:
            ConstructionOpCodes.writeBind(locals.get(step.name()), operand, out);
            break;
          case DESTRUCTURE:
            ConstructionOpCodes.writeBindDestructure(
                step.names().isEmpty() ? 0 : locals.get(step.names().get(0)),
                step.count(),
                operand,
                out);
            break;
          case REPEAT:
            if (step.count() == 0) {
              ConstructionOpCodes.writeDiscard(operand, out);
            } else {
              ConstructionOpCodes.writeBindRepeat(locals.get(step.name()), operand, out);
            }
            break;
          default:
            throw new AssertionError(step.kind());
        }
      }
      ConstructionOpCodes.writeBuildArray(
          plan.slots().stream().map(locals::get).collect(ImmutableList.toImmutableList()), out);
    }
  }

  public static class ConstructionOpCodes {
    private ConstructionOpCodes() {}

    private static final int BIND = 1; // varint local, Expression

    public static void writeBind(int local, Writer operand, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(BIND, out);
      writeVarint(local, out);
      operand.write(out);
    }

    private static final int BIND_DESTRUCTURE = 2; // varint first local, varint count, Expression

    public static void writeBindDestructure(
        int firstLocal, int count, Writer operand, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(BIND_DESTRUCTURE, out);
      writeVarint(firstLocal, out);
      writeVarint(count, out);
      operand.write(out);
    }

    private static final int BIND_REPEAT = 3; // varint local, Expression; copied on each LOAD

    public static void writeBindRepeat(int local, Writer operand, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(BIND_REPEAT, out);
      writeVarint(local, out);
      operand.write(out);
    }

    private static final int DISCARD = 4; // Expression, evaluated and dropped

    public static void writeDiscard(Writer operand, ByteArrayDataOutput out)
        throws CompilerException {
      writeVarint(DISCARD, out);
      operand.write(out);
    }

    private static final int LOAD = 5; // varint local

    public static void writeLoad(int local, ByteArrayDataOutput out) {
      writeVarint(LOAD, out);
      writeVarint(local, out);
    }

    private static final int BUILD_ARRAY = 6; // varint num elements, LOAD*

    public static void writeBuildArray(Iterable<Integer> locals, ByteArrayDataOutput out) {
      writeVarint(BUILD_ARRAY, out);
      writeVarint(ImmutableList.copyOf(locals).size(), out);
      for (int local : locals) {
        writeLoad(local, out);
      }
    }
  }

  public static class IndexOpCodes {
    private IndexOpCodes() {}

    private static final int EXTERN_DECLARATION = 1; // varint id, name

    public static void writeExternDeclaration(int id, String name, ByteArrayDataOutput out) {
      writeVarint(EXTERN_DECLARATION, out);
      writeVarint(id, out);
      writeUTF8(name, out);
    }

    private static final int DEFINITION_ENTRY = 2; // varint id, name, varint offset, varint length

    public static void writeDefinitionEntry(
        int id, String name, int offset, int length, ByteArrayDataOutput out) {
      writeVarint(DEFINITION_ENTRY, out);
      writeVarint(id, out);
      writeUTF8(name, out);
      writeVarint(offset, out);
      writeVarint(length, out);
    }
  }

  @AutoValue
  public abstract static class Registry {
    abstract ImmutableMap<String, Integer> definitionIds();

    abstract ImmutableMap<String, Integer> externIds();

    abstract Desugarer desugarer();

    public final int definitionId(String name) {
      return definitionIds().get(name);
    }

    public final int externId(String name) {
      return externIds().get(name);
    }

    public final BindingPlan plan(Expression.ArrayLiteral literal) {
      Optional<BindingPlan> plan = desugarer().plan(literal);
      Verify.verify(plan.isPresent(), "no binding plan for %s", literal);
      return plan.get();
    }

    static Builder builder(Desugarer desugarer) {
      return new AutoValue_Compiler_Registry.Builder().setDesugarer(desugarer);
    }

    @AutoValue.Builder
    abstract static class Builder {
      private int nextDefinitionId = 1;
      private int nextExternId = 1;

      abstract Builder setDesugarer(Desugarer desugarer);

      abstract ImmutableMap.Builder<String, Integer> definitionIdsBuilder();

      abstract ImmutableMap.Builder<String, Integer> externIdsBuilder();

      public final void registerDefinition(String name) {
        definitionIdsBuilder().put(name, nextDefinitionId++);
      }

      public final void registerExtern(String name) {
        externIdsBuilder().put(name, nextExternId++);
      }

      public abstract Registry build();
    }
  }

  private final ASTValidator validator;

  private byte[] indexFile;
  private byte[] outFile;

  public Compiler(ASTValidator validator) {
    Preconditions.checkArgument(validator.desugarer() != null, "validator has not run");
    this.validator = validator;
  }

  private Registry buildRegistry() {
    Registry.Builder builder = Registry.builder(validator.desugarer());
    validator.registry().externs().forEach(e -> builder.registerExtern(e.name()));
    validator.evaluationOrder().forEach(builder::registerDefinition);
    return builder.build();
  }

  public static byte[] capture(Writer writer) throws CompilerException {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    writer.write(out);
    return out.toByteArray();
  }

  public static void writeVarint(int value, ByteArrayDataOutput out) {
    while (value >= 128) {
      out.writeByte((value % 128) | 128);
      value /= 128;
    }
    out.writeByte(value);
  }

  public static void writeVarintBytes(byte[] bytes, ByteArrayDataOutput out) {
    writeVarint(bytes.length, out);
    out.write(bytes);
  }

  public static void writeUTF8(String value, ByteArrayDataOutput out) {
    writeVarintBytes(value.getBytes(StandardCharsets.UTF_8), out);
  }

  public void compile() throws CompilerException {
    Registry registry = buildRegistry();

    ByteArrayDataOutput indexOut = ByteStreams.newDataOutput();
    ByteArrayDataOutput outOut = ByteStreams.newDataOutput();
    int outIndex = 0;

    // 1) Index extern declarations
    for (AST.ExternDeclaration extern : validator.registry().externs()) {
      IndexOpCodes.writeExternDeclaration(
          registry.externId(extern.name()), extern.name(), indexOut);
    }

    // 2) Compile and index definitions, dependencies first
    for (String name : validator.evaluationOrder()) {
      AST.Definition definition = validator.registry().definition(name).get();
      byte[] definitionBytes = capture(out -> definition.initializer().compile(registry, out));
      IndexOpCodes.writeDefinitionEntry(
          registry.definitionId(name), name, outIndex, definitionBytes.length, indexOut);
      outOut.write(definitionBytes);
      outIndex += definitionBytes.length;
    }

    indexFile = indexOut.toByteArray();
    outFile = outOut.toByteArray();
  }

  public byte[] indexFile() {
    return indexFile;
  }

  public byte[] outFile() {
    return outFile;
  }
}
