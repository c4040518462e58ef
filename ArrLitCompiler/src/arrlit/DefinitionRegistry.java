package arrlit;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

/** The global table of {@code let} definitions and {@code extern fn} declarations. */
public final class DefinitionRegistry extends ErrorCollectingValidator {
  private static final ImmutableSet<String> RESERVED_WORDS = ValueType.keywords();

  private final Map<String, AST.Definition> definitionsByName = new LinkedHashMap<>();
  private final Map<String, AST.ExternDeclaration> externsByName = new LinkedHashMap<>();

  public Optional<AST.Definition> definition(String name) {
    return Optional.ofNullable(definitionsByName.get(name));
  }

  public Optional<AST.ExternDeclaration> extern(String name) {
    return Optional.ofNullable(externsByName.get(name));
  }

  // In declaration order.
  public Collection<AST.Definition> definitions() {
    return Collections.unmodifiableCollection(definitionsByName.values());
  }

  public Collection<AST.ExternDeclaration> externs() {
    return Collections.unmodifiableCollection(externsByName.values());
  }

  private Optional<AST.Declaration> declaration(String name) {
    if (definitionsByName.containsKey(name)) return Optional.of(definitionsByName.get(name));
    if (externsByName.containsKey(name)) return Optional.of(externsByName.get(name));
    return Optional.empty();
  }

  @Override
  public void visitImpl(AST.Definition definition) {
    if (checkDeclaration(definition)) {
      definitionsByName.put(definition.name(), definition);
    }
  }

  @Override
  public void visitImpl(AST.ExternDeclaration extern) {
    if (checkDeclaration(extern)) {
      externsByName.put(extern.name(), extern);
    }
  }

  // Returns false if the name cannot be registered.
  private boolean checkDeclaration(AST.Declaration declaration) {
    String name = declaration.name();
    if (RESERVED_WORDS.contains(name)) {
      logError(
          declaration.namePos(), ErrorKind.SYNTAX, String.format("'%s' is a reserved word", name));
      return false;
    }

    Optional<AST.Declaration> previous = declaration(name);
    if (previous.isPresent()) {
      logError(
          declaration.namePos(),
          ErrorKind.DUPLICATE_DEFINITION,
          String.format("duplicate definition for '%s'", name));
      logError(
          previous.get().namePos(), ErrorKind.DUPLICATE_DEFINITION, "previous definition here");
      return false;
    }
    return true;
  }
}
