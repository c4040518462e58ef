package arrlit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSet;

/**
 * Infers the type of every definition, resolving the definitions it references first.
 *
 * <p>A definition's errors are reported once, at the definition. Definitions that depend on a
 * definition whose type could not be inferred are skipped without further errors.
 */
public class TypeResolver extends ErrorCollectingValidator {
  private final DefinitionRegistry registry;
  private final LiteralResolver literals;
  private final Map<String, ValueType> resolvedTypes = new HashMap<>();
  private final Set<String> failed = new HashSet<>();
  private final Set<String> inProgress = new LinkedHashSet<>();

  // 'cyclic' definitions were already reported and are never resolved.
  public TypeResolver(DefinitionRegistry registry, ImmutableSet<String> cyclic) {
    this.registry = registry;
    this.literals = new LiteralResolver(this);
    this.failed.addAll(cyclic);
  }

  public LiteralResolver literals() {
    return literals;
  }

  public Optional<ValueType> type(String definition) {
    return Optional.ofNullable(resolvedTypes.get(definition));
  }

  public boolean isResolved(String definition) {
    return resolvedTypes.containsKey(definition);
  }

  @Override
  public void visitImpl(AST.Definition definition) {
    String name = definition.name();
    if (failed.contains(name) || resolvedTypes.containsKey(name)) return;

    try {
      resolve(definition, definition.namePos());
    } catch (CompilerException ex) {
      // Already reported at the definition that failed.
      Verify.verify(ex.kind() == ErrorKind.UNRESOLVED_DEPENDENCY, "unexpected error: %s", ex);
    }
  }

  public ValueType definitionType(Expression.Variable reference) throws CompilerException {
    String name = reference.name();
    Optional<AST.Definition> definition = registry.definition(name);
    if (!definition.isPresent()) {
      if (registry.extern(name).isPresent()) {
        throw new CompilerException(
            reference.pos(),
            ErrorKind.TYPE_MISMATCH,
            String.format("'%s' is an extern function; call it as '%s()'", name, name));
      }
      throw new CompilerException(
          reference.pos(),
          ErrorKind.UNDEFINED_NAME,
          String.format("cannot find value '%s' in this scope", name));
    }

    // A declared type is trusted even if the initializer turns out not to match it.
    if (definition.get().declaredType().isPresent()) return definition.get().declaredType().get();
    return resolve(definition.get(), reference.pos());
  }

  public ValueType callType(Expression.Call call) throws CompilerException {
    String name = call.function();
    Optional<AST.ExternDeclaration> extern = registry.extern(name);
    if (extern.isPresent()) return extern.get().returnType();

    if (registry.definition(name).isPresent()) {
      throw new CompilerException(
          call.pos(),
          ErrorKind.TYPE_MISMATCH,
          String.format("'%s' is not a function", name));
    }
    throw new CompilerException(
        call.pos(),
        ErrorKind.UNDEFINED_NAME,
        String.format("cannot find function '%s' in this scope", name));
  }

  private ValueType resolve(AST.Definition definition, Tokenizer.Pos usePos)
      throws CompilerException {
    String name = definition.name();
    ValueType resolved = resolvedTypes.get(name);
    if (resolved != null) return resolved;
    if (failed.contains(name)) throw unresolved(usePos, name);

    if (!inProgress.add(name)) {
      List<String> chain = new ArrayList<>();
      boolean onCycle = false;
      for (String n : inProgress) {
        onCycle |= n.equals(name);
        if (onCycle) chain.add(n);
      }
      chain.add(name);
      throw new CompilerException.CyclicDependency(
          definition.namePos(), ErrorKind.CYCLIC_LENGTH_DEPENDENCY, chain);
    }

    try {
      ValueType type = checkInitializer(definition);
      resolvedTypes.put(name, type);
      return type;
    } catch (CompilerException ex) {
      failed.add(name);
      if (ex.kind() != ErrorKind.UNRESOLVED_DEPENDENCY) logError(ex);
      throw unresolved(usePos, name);
    } finally {
      inProgress.remove(name);
    }
  }

  private ValueType checkInitializer(AST.Definition definition) throws CompilerException {
    Expression initializer = definition.initializer();
    Optional<ValueType> declared = definition.declaredType();
    ValueType found = initializer.valueType(this, declared);
    if (declared.isPresent() && !found.equals(declared.get())) {
      throw initializer.typeMismatch(declared.get(), found);
    }
    return found;
  }

  private static CompilerException unresolved(Tokenizer.Pos pos, String name) {
    return new CompilerException(
        pos,
        ErrorKind.UNRESOLVED_DEPENDENCY,
        String.format("the type of '%s' could not be inferred", name));
  }
}
