package arrlit;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Evaluates every definition once, dependencies first.
 *
 * <p>Values are {@code Integer}, {@code Boolean}, {@code String}, {@link RangeValue} and
 * {@link ImmutableList} for arrays. Array literals run their {@link BindingPlan}, so each operand
 * is evaluated exactly once regardless of how many elements it populates.
 */
public class Evaluator {
  private final ASTValidator validator;
  private final ImmutableMap<String, ExternFunction> externs;
  private final Map<String, Object> values = new LinkedHashMap<>();

  public Evaluator(ASTValidator validator, Map<String, ExternFunction> externs) {
    Preconditions.checkArgument(validator.types() != null, "validator has not run");
    this.validator = validator;
    this.externs = ImmutableMap.copyOf(externs);
  }

  // Returns the value of every evaluated definition, in evaluation order.
  public ImmutableMap<String, Object> evaluate() throws CompilerException {
    for (String name : validator.evaluationOrder()) {
      if (values.containsKey(name)) continue;

      AST.Definition definition = validator.registry().definition(name).get();
      values.put(name, definition.initializer().evaluate(this));
    }
    return ImmutableMap.copyOf(values);
  }

  Object definitionValue(Expression.Variable reference) throws CompilerException {
    Object value = values.get(reference.name());
    if (value == null) {
      throw new CompilerException(
          reference.pos(),
          ErrorKind.EVALUATION,
          String.format("'%s' has not been evaluated", reference.name()));
    }
    return value;
  }

  Object call(Expression.Call call) throws CompilerException {
    String name = call.function();
    ExternFunction function = externs.get(name);
    if (function == null) {
      throw new CompilerException(
          call.pos(),
          ErrorKind.EVALUATION,
          String.format("no implementation was provided for extern fn '%s'", name));
    }

    Object value = function.call();
    ValueType returnType = validator.registry().extern(name).get().returnType();
    if (!conforms(value, returnType)) {
      throw new CompilerException(
          call.pos(),
          ErrorKind.EVALUATION,
          String.format("extern fn '%s' returned '%s', expected %s", name, value, returnType));
    }
    return value;
  }

  Object construct(Expression.ArrayLiteral literal) throws CompilerException {
    Optional<BindingPlan> plan = validator.desugarer().plan(literal);
    Verify.verify(plan.isPresent(), "no binding plan for %s", literal);

    Map<String, Object> bindings = new HashMap<>();
    for (BindingStep step : plan.get().steps()) {
      Object value = step.operand().evaluate(this);
      switch (step.kind()) {
        case SINGLE:
        case REPEAT:
          // A zero-count repeat is evaluated and then dropped.
          bindings.put(step.name(), value);
          break;
        case DESTRUCTURE:
          {
            List<?> elements = (List<?>) value;
            Verify.verify(elements.size() == step.names().size());
            for (int i = 0; i < elements.size(); i++) {
              bindings.put(step.names().get(i), elements.get(i));
            }
            break;
          }
        default:
          throw new AssertionError(step.kind());
      }
    }

    if (plan.get().passthrough()) return bindings.get(plan.get().steps().get(0).name());
    return plan.get()
        .slots()
        .stream()
        .map(bindings::get)
        .collect(ImmutableList.toImmutableList());
  }

  CompilerException overflow(Expression expr) {
    return new CompilerException(
        expr.pos(),
        ErrorKind.EVALUATION,
        String.format("integer overflow evaluating '%s'", expr.raw()));
  }

  private static boolean conforms(Object value, ValueType type) {
    switch (type.type()) {
      case INTEGER:
        return value instanceof Integer;
      case BOOLEAN:
        return value instanceof Boolean;
      case STRING:
        return value instanceof String;
      case RANGE:
        return value instanceof RangeValue;
      case ARRAY:
        {
          if (!(value instanceof List)) return false;
          List<?> elements = (List<?>) value;
          ValueType.ArrayValueType arrayType = type.asArray();
          return elements.size() == arrayType.length()
              && elements.stream().allMatch(e -> conforms(e, arrayType.elementType()));
        }
      default:
        throw new AssertionError(type);
    }
  }
}
