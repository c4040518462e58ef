package arrlit;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

import arrlit.processor.ASTChild;
import arrlit.processor.ASTNode;

@ASTNode
public class AST implements AST_ASTNode {

  public abstract static class Declaration implements ASTNodeInterface {
    private final String name;
    private final Tokenizer.Pos namePos;

    private Declaration(String name, Tokenizer.Pos namePos) {
      this.name = name;
      this.namePos = namePos;
    }

    public final String name() {
      return name;
    }

    public final Tokenizer.Pos namePos() {
      return namePos;
    }

    public abstract boolean isDefinition();
  }

  // let NAME (: TYPE)? = EXPR;
  @ASTNode
  public static class Definition extends Declaration implements AST_Definition_ASTNode {
    private final Optional<ValueType> declaredType;
    private final Expression initializer;

    public Definition(
        String name,
        Tokenizer.Pos namePos,
        Optional<ValueType> declaredType,
        Expression initializer) {
      super(name, namePos);
      this.declaredType = declaredType;
      this.initializer = initializer;
    }

    public Optional<ValueType> declaredType() {
      return declaredType;
    }

    @ASTChild
    @Override
    public Expression initializer() {
      return initializer;
    }

    @Override
    public boolean isDefinition() {
      return true;
    }
  }

  // extern fn NAME(): TYPE;
  @ASTNode
  public static class ExternDeclaration extends Declaration
      implements AST_ExternDeclaration_ASTNode {
    private final ValueType returnType;

    public ExternDeclaration(String name, Tokenizer.Pos namePos, ValueType returnType) {
      super(name, namePos);
      this.returnType = returnType;
    }

    public ValueType returnType() {
      return returnType;
    }

    @Override
    public boolean isDefinition() {
      return false;
    }
  }

  private final String file;
  private final ImmutableList<Declaration> declarations;

  public AST(String file, ImmutableList<Declaration> declarations) {
    this.file = file;
    this.declarations = declarations;
  }

  public String file() {
    return file;
  }

  @ASTChild
  @Override
  public ImmutableList<Declaration> declarations() {
    return declarations;
  }

  public ImmutableList<Definition> definitions() {
    return declarations
        .stream()
        .filter(Declaration::isDefinition)
        .map(d -> (Definition) d)
        .collect(ImmutableList.toImmutableList());
  }
}
